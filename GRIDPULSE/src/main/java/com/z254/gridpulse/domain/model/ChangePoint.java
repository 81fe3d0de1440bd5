package com.z254.gridpulse.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * An index where the local mean of a series shifts significantly.
 * Enrichment produces a new instance through {@link #withEnrichment(String, List)}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ChangePoint {

    private LocalDate date;

    private int index;

    private Direction direction;

    /**
     * Shift size in units of the global standard deviation.
     */
    private double magnitude;

    /**
     * Raw difference between the mean after and the mean before the index.
     */
    private double delta;

    private double confidence;

    /**
     * Set when the point was reported by the fallback policy instead of clearing the threshold.
     */
    private boolean fallback;

    private boolean forecast;

    private String note;

    private List<String> relatedLinks;

    public enum Direction {
        RISE,
        DROP
    }

    @JsonIgnore
    public boolean isEnriched() {
        return note != null || relatedLinks != null;
    }

    public ChangePoint withEnrichment(String note, List<String> relatedLinks) {
        return toBuilder()
                .note(note)
                .relatedLinks(relatedLinks == null ? List.of() : List.copyOf(relatedLinks))
                .build();
    }
}
