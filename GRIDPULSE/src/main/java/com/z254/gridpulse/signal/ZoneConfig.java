package com.z254.gridpulse.signal;

/**
 * Parameters of adaptive zone clustering.
 *
 * @param lookback        trailing scores used to derive the thresholds
 * @param maxZoneLength   maximum points in one zone
 * @param volumeWindow    rolling window of the volume ratio
 * @param fallbackTopK    single-point zones reported when no zone forms
 * @param maxZones        maximum zones returned
 * @param fallbackEnabled report top-K calm points when no zone forms
 */
public record ZoneConfig(
        int lookback,
        int maxZoneLength,
        int volumeWindow,
        int fallbackTopK,
        int maxZones,
        boolean fallbackEnabled) {

    public static final double RETURN_WEIGHT = 0.4;
    public static final double VOLUME_WEIGHT = 0.3;
    public static final double EVENT_WEIGHT = 0.3;

    public static final double HIGH_PERCENTILE = 95.0;
    public static final double LOW_PERCENTILE = 85.0;
    public static final double HIGH_FLOOR = 0.3;
    public static final double LOW_FLOOR = 0.2;

    /**
     * Thresholds used when fewer than {@link #MIN_SCORES_FOR_PERCENTILES} scores exist.
     */
    public static final double SPARSE_HIGH = 0.8;
    public static final double SPARSE_LOW = 0.6;
    public static final int MIN_SCORES_FOR_PERCENTILES = 10;

    public static final double MIN_IMPACT = 0.3;

    public ZoneConfig {
        if (lookback < 1 || maxZoneLength < 1 || volumeWindow < 1 || maxZones < 1 || fallbackTopK < 0) {
            throw new IllegalArgumentException("zone parameters must be positive");
        }
    }

    public static ZoneConfig defaults() {
        return new ZoneConfig(60, 10, 20, 2, 10, true);
    }
}
