package com.z254.gridpulse.capability;

import com.z254.gridpulse.domain.model.TimeSeriesPoint;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Extends an observed series into the future.
 */
public interface Forecaster {

    /**
     * Name of the model, reported before training.
     */
    String modelName();

    /**
     * Forecast {@code horizon} days after the last observed point.
     * Returned points carry {@code forecast = true}.
     */
    Mono<ForecastResult> forecast(List<TimeSeriesPoint> history, int horizon);
}
