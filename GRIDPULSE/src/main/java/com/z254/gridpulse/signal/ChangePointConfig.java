package com.z254.gridpulse.signal;

/**
 * Parameters of one change-point detection run.
 *
 * @param window          points averaged on each side of a candidate index
 * @param threshold       minimum score (mean shift over global standard deviation)
 * @param topN            maximum number of points reported
 * @param neighborhood    half-width of the local-maximum check
 * @param fallbackEnabled report the best index when nothing clears the threshold
 */
public record ChangePointConfig(
        int window,
        double threshold,
        int topN,
        int neighborhood,
        boolean fallbackEnabled) {

    /**
     * Threshold above which the fallback policy may apply.
     */
    public static final double FALLBACK_MIN_THRESHOLD = 0.5;

    public static final double FALLBACK_CONFIDENCE = 0.5;

    public ChangePointConfig {
        if (window < 1) {
            throw new IllegalArgumentException("window must be >= 1");
        }
        if (threshold < 0) {
            throw new IllegalArgumentException("threshold must be >= 0");
        }
        if (topN < 1) {
            throw new IllegalArgumentException("topN must be >= 1");
        }
        if (neighborhood < 0) {
            throw new IllegalArgumentException("neighborhood must be >= 0");
        }
    }

    public static ChangePointConfig defaults(double threshold) {
        return new ChangePointConfig(5, threshold, 5, 2, true);
    }

    public ChangePointConfig withThreshold(double newThreshold) {
        return new ChangePointConfig(window, newThreshold, topN, neighborhood, fallbackEnabled);
    }
}
