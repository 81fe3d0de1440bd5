package com.z254.gridpulse.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A passage returned from the report retrieval index.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrievalRecord {

    private String documentId;

    private String title;

    private String content;

    private Integer page;

    private double score;
}
