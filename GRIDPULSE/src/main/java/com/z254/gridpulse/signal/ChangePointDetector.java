package com.z254.gridpulse.signal;

import com.z254.gridpulse.domain.model.ChangePoint;
import com.z254.gridpulse.domain.model.TimeSeriesPoint;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Mean-shift change-point detector.
 *
 * <p>For every index {@code i} in {@code [w, n-w)} the score is the absolute
 * difference between the mean of the {@code w} points after and the {@code w}
 * points before {@code i}, divided by the population standard deviation of the
 * whole series. An index is reported when its score exceeds the threshold and is
 * not lower than any other score in its neighborhood.
 *
 * <p>Stateless; safe to call concurrently.
 */
@Component
@Slf4j
public class ChangePointDetector {

    // Scores at or below this are rounding noise, not a shift
    static final double MIN_FALLBACK_SCORE = 1e-9;

    public List<ChangePoint> detect(List<TimeSeriesPoint> points, ChangePointConfig config) {
        double[] values = TimeSeriesPoint.values(points);
        int n = values.length;
        int w = config.window();

        if (n <= 2 * w) {
            return List.of();
        }
        double std = new StandardDeviation(false).evaluate(values);
        if (std == 0.0 || Double.isNaN(std)) {
            return List.of();
        }

        double[] scores = new double[n];
        double[] deltas = new double[n];
        for (int i = w; i < n - w; i++) {
            double before = mean(values, i - w, i);
            double after = mean(values, i, i + w);
            deltas[i] = after - before;
            scores[i] = Math.abs(deltas[i]) / std;
        }

        List<ChangePoint> detected = new ArrayList<>();
        for (int i = w; i < n - w; i++) {
            if (scores[i] > config.threshold() && isLocalMax(scores, i, w, n, config.neighborhood())) {
                double confidence = Math.min(scores[i] / config.threshold() * 0.5 + 0.5, 0.99);
                detected.add(toChangePoint(points.get(i), i, deltas[i], scores[i], confidence, false));
            }
        }

        if (detected.isEmpty()) {
            return fallback(points, scores, deltas, w, n, config);
        }

        detected.sort(Comparator.comparingDouble(ChangePoint::getMagnitude).reversed());
        return detected.size() > config.topN() ? List.copyOf(detected.subList(0, config.topN())) : detected;
    }

    private List<ChangePoint> fallback(List<TimeSeriesPoint> points, double[] scores, double[] deltas,
                                       int w, int n, ChangePointConfig config) {
        if (!config.fallbackEnabled() || config.threshold() <= ChangePointConfig.FALLBACK_MIN_THRESHOLD) {
            return List.of();
        }
        int best = -1;
        double bestScore = MIN_FALLBACK_SCORE;
        for (int i = w; i < n - w; i++) {
            if (scores[i] > bestScore) {
                best = i;
                bestScore = scores[i];
            }
        }
        if (best < 0) {
            return List.of();
        }
        log.debug("No change point above threshold {}, reporting index {} as fallback", config.threshold(), best);
        return List.of(toChangePoint(points.get(best), best, deltas[best], scores[best],
                ChangePointConfig.FALLBACK_CONFIDENCE, true));
    }

    private static boolean isLocalMax(double[] scores, int i, int w, int n, int neighborhood) {
        int from = Math.max(w, i - neighborhood);
        int to = Math.min(n - w, i + neighborhood + 1);
        for (int j = from; j < to; j++) {
            if (j != i && scores[j] > scores[i]) {
                return false;
            }
        }
        return true;
    }

    private static ChangePoint toChangePoint(TimeSeriesPoint point, int index, double delta, double score,
                                             double confidence, boolean fallback) {
        return ChangePoint.builder()
                .date(point.getDate())
                .index(index)
                .direction(delta > 0 ? ChangePoint.Direction.RISE : ChangePoint.Direction.DROP)
                .magnitude(score)
                .delta(delta)
                .confidence(confidence)
                .fallback(fallback)
                .forecast(point.isForecast())
                .build();
    }

    private static double mean(double[] values, int from, int to) {
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }
}
