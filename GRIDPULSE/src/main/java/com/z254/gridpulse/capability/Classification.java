package com.z254.gridpulse.capability;

import com.z254.gridpulse.domain.model.StepTemplate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of classifying a user query.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Classification {

    private StepTemplate template;

    /**
     * Region as mentioned in the query, unresolved. Null when none was mentioned.
     */
    private String regionMention;

    /**
     * Requested forecast horizon in days, null for the default.
     */
    private Integer horizon;

    /**
     * Requested history length in days, null for the default.
     */
    private Integer historyDays;

    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    /**
     * False when the query is outside the service's domain; {@link #reply} is then used as the answer.
     */
    @Builder.Default
    private boolean inScope = true;

    private String reply;

    private String reason;
}
