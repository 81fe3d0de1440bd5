package com.z254.gridpulse.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Factor ranking, correlation matrix and grounding window for one analysis.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InfluenceResult {

    /**
     * Factors in declaration order.
     */
    private List<InfluenceFactor> factors;

    /**
     * Factor names by descending score, ties kept in declaration order.
     */
    private List<String> ranking;

    /**
     * Labels of {@link #correlationMatrix}; the target comes first.
     */
    private List<String> matrixLabels;

    private double[][] correlationMatrix;

    private String summary;

    private double overallScore;

    private ChangeWindow mostChangedWindow;

    /**
     * Set when there were too few aligned points for stable statistics.
     */
    private boolean lowConfidence;

    /**
     * Sub-window in which the top factor and the target moved the most together.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChangeWindow {
        private String factor;
        private LocalDate startDate;
        private LocalDate endDate;
        private double factorStart;
        private double factorEnd;
        private double factorChangePct;
        private double targetStart;
        private double targetEnd;
        private double targetChangePct;
    }
}
