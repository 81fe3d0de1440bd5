package com.z254.gridpulse.capability.impl;

import com.z254.gridpulse.capability.ForecastResult;
import com.z254.gridpulse.capability.Forecaster;
import com.z254.gridpulse.domain.model.TimeSeriesPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weekly seasonal-naive forecaster with linear drift.
 *
 * <p>Each forecast day repeats the value observed on the same weekday in the last
 * observed week, shifted by the average daily drift between the first and the last
 * observed week. Error metrics come from refitting on all but a holdout tail and
 * forecasting that tail.
 */
@Component
@Slf4j
public class SeasonalNaiveForecaster implements Forecaster {

    static final String MODEL_NAME = "seasonal_naive_drift";
    static final int PERIOD = 7;
    static final int MIN_POINTS = 2 * PERIOD;
    static final int MAX_HOLDOUT = 14;

    @Override
    public String modelName() {
        return MODEL_NAME;
    }

    @Override
    public Mono<ForecastResult> forecast(List<TimeSeriesPoint> history, int horizon) {
        return Mono.fromCallable(() -> {
            if (horizon < 1) {
                throw new IllegalArgumentException("horizon must be >= 1");
            }
            if (history.size() < MIN_POINTS) {
                throw new IllegalArgumentException("at least " + MIN_POINTS + " observations are needed, got "
                        + history.size());
            }
            double[] values = TimeSeriesPoint.values(history);
            LocalDate lastDate = history.get(history.size() - 1).getDate();

            double[] predicted = project(values, horizon);
            List<TimeSeriesPoint> points = new ArrayList<>(horizon);
            for (int h = 0; h < horizon; h++) {
                points.add(TimeSeriesPoint.predicted(lastDate.plusDays(h + 1), predicted[h]));
            }

            Map<String, Double> metrics = holdoutMetrics(values);
            log.debug("Forecast {} days from {} observations (MAPE {})", horizon, values.length, metrics.get("mape"));
            return new ForecastResult(MODEL_NAME, points, metrics);
        });
    }

    static double[] project(double[] values, int horizon) {
        int n = values.length;
        double firstWeek = mean(values, 0, PERIOD);
        double lastWeek = mean(values, n - PERIOD, n);
        double drift = n > PERIOD ? (lastWeek - firstWeek) / (n - PERIOD) : 0.0;

        double[] forecast = new double[horizon];
        for (int h = 1; h <= horizon; h++) {
            double seasonal = values[n - PERIOD + ((h - 1) % PERIOD)];
            forecast[h - 1] = seasonal + drift * h;
        }
        return forecast;
    }

    /**
     * MAE, RMSE and MAPE (%) of forecasting the last {@code min(14, n/4)} points from the rest.
     */
    static Map<String, Double> holdoutMetrics(double[] values) {
        int holdout = Math.min(MAX_HOLDOUT, values.length / 4);
        Map<String, Double> metrics = new LinkedHashMap<>();
        if (holdout < 1 || values.length - holdout < MIN_POINTS) {
            return metrics;
        }
        double[] train = new double[values.length - holdout];
        System.arraycopy(values, 0, train, 0, train.length);
        double[] predicted = project(train, holdout);

        double absSum = 0.0;
        double squareSum = 0.0;
        double pctSum = 0.0;
        int pctCount = 0;
        for (int i = 0; i < holdout; i++) {
            double actual = values[train.length + i];
            double error = actual - predicted[i];
            absSum += Math.abs(error);
            squareSum += error * error;
            if (actual != 0.0) {
                pctSum += Math.abs(error / actual);
                pctCount++;
            }
        }
        metrics.put("mae", absSum / holdout);
        metrics.put("rmse", Math.sqrt(squareSum / holdout));
        metrics.put("mape", pctCount > 0 ? pctSum / pctCount * 100.0 : 0.0);
        return metrics;
    }

    private static double mean(double[] values, int from, int to) {
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }
}
