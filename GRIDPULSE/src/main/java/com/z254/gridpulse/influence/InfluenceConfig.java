package com.z254.gridpulse.influence;

/**
 * Parameters of one influence analysis.
 *
 * @param minPoints          aligned points below which the default result is returned
 * @param windowSize         length of the most-changed sub-window
 * @param windowStep         stride between candidate sub-windows
 * @param minFactorChangePct minimum absolute factor change (%) for a sub-window to qualify
 */
public record InfluenceConfig(
        int minPoints,
        int windowSize,
        int windowStep,
        double minFactorChangePct) {

    public static final double SIGNIFICANCE_LEVEL = 0.1;
    public static final double CORRELATION_SHARE = 0.7;
    public static final double SIGNIFICANCE_SHARE = 0.3;

    /**
     * |r| above which a correlation is called positive or negative in the summary.
     */
    public static final double DIRECTION_THRESHOLD = 0.3;

    /**
     * Score above which the runner-up factor is mentioned in the summary.
     */
    public static final double SECONDARY_MENTION_SCORE = 0.3;

    public InfluenceConfig {
        if (minPoints < 3) {
            throw new IllegalArgumentException("minPoints must be >= 3");
        }
        if (windowSize < 2) {
            throw new IllegalArgumentException("windowSize must be >= 2");
        }
        if (windowStep < 1) {
            throw new IllegalArgumentException("windowStep must be >= 1");
        }
    }

    public static InfluenceConfig defaults() {
        return new InfluenceConfig(10, 14, 7, 5.0);
    }
}
