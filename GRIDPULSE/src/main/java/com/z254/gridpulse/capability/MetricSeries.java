package com.z254.gridpulse.capability;

import com.z254.gridpulse.domain.model.TimeSeriesPoint;
import com.z254.gridpulse.domain.model.WeatherObservation;

import java.util.List;

/**
 * Observed target series together with the weather it was observed under.
 */
public record MetricSeries(List<TimeSeriesPoint> points, List<WeatherObservation> weather) {

    public MetricSeries {
        points = List.copyOf(points);
        weather = weather == null ? List.of() : List.copyOf(weather);
    }
}
