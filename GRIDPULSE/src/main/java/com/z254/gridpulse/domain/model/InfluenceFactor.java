package com.z254.gridpulse.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Influence of one exogenous factor on the target series.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InfluenceFactor {

    private String name;

    /**
     * Pearson correlation with the target, in [-1, 1].
     */
    private double correlation;

    /**
     * Two-sided p-value of the correlation.
     */
    private double pvalue;

    /**
     * Influence score in [0, 1].
     */
    private double score;

    private List<Observation> series;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Observation {
        private LocalDate date;
        private double target;
        private double factor;
    }
}
