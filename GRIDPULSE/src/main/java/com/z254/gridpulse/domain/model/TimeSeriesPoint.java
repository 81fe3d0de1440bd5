package com.z254.gridpulse.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * One observation of the target metric (daily power demand in MW).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeSeriesPoint {

    private LocalDate date;

    private double value;

    /**
     * True for points produced by the forecaster.
     */
    private boolean forecast;

    public static TimeSeriesPoint observed(LocalDate date, double value) {
        return new TimeSeriesPoint(date, value, false);
    }

    public static TimeSeriesPoint predicted(LocalDate date, double value) {
        return new TimeSeriesPoint(date, value, true);
    }

    /**
     * Original points followed by forecast points, in the order given.
     */
    public static List<TimeSeriesPoint> concat(List<TimeSeriesPoint> original, List<TimeSeriesPoint> forecast) {
        List<TimeSeriesPoint> full = new ArrayList<>(original.size() + forecast.size());
        full.addAll(original);
        full.addAll(forecast);
        return full;
    }

    public static double[] values(List<TimeSeriesPoint> points) {
        return points.stream().mapToDouble(TimeSeriesPoint::getValue).toArray();
    }
}
