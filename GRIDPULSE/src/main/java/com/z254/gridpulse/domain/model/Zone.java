package com.z254.gridpulse.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * A contiguous interval flagged as significant by clustering.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Zone {

    public static final String METHOD_STATISTICAL_CLUSTER = "statistical_cluster";
    public static final String METHOD_CALM_FALLBACK = "calm_fallback";

    private LocalDate startDate;

    private LocalDate endDate;

    private int startIndex;

    private int endIndex;

    private double avgReturn;

    private double avgScore;

    private double impact;

    private Sentiment sentiment;

    private String method;

    private String summary;

    public enum Sentiment {
        POSITIVE,
        NEGATIVE,
        NEUTRAL;

        public static Sentiment of(double avgReturn) {
            if (avgReturn > 0) {
                return POSITIVE;
            }
            return avgReturn < 0 ? NEGATIVE : NEUTRAL;
        }
    }

    public int length() {
        return endIndex - startIndex + 1;
    }

    public Zone withSummary(String summary) {
        return toBuilder().summary(summary).build();
    }
}
