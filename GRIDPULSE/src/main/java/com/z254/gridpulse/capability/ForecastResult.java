package com.z254.gridpulse.capability;

import com.z254.gridpulse.domain.model.TimeSeriesPoint;

import java.util.List;
import java.util.Map;

/**
 * Forecast points with the holdout error metrics of the model that produced them.
 */
public record ForecastResult(String model, List<TimeSeriesPoint> points, Map<String, Double> metrics) {

    public ForecastResult {
        points = List.copyOf(points);
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }
}
