package com.z254.gridpulse.signal;

import com.z254.gridpulse.domain.model.Zone;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Adaptive clustering of significant intervals.
 *
 * <p>Each point gets a composite score from its absolute return, its volume ratio
 * and its external event density. Zones seed on scores above a high threshold and
 * grow in both directions while scores stay above a low threshold. Both
 * thresholds come from percentiles of the trailing scores.
 *
 * <p>Deterministic and stateless.
 */
@Component
@Slf4j
public class ZoneClusterer {

    public List<Zone> cluster(ZoneInput input, ZoneConfig config) {
        int n = input.size();
        if (n == 0) {
            return List.of();
        }

        double[] returns = returns(input.values());
        double[] scores = scores(input, config);
        Thresholds thresholds = thresholds(scores, config);

        List<Zone> zones = new ArrayList<>();
        int previousEnd = -1;
        int i = 0;
        while (i < n) {
            if (scores[i] <= thresholds.high()) {
                i++;
                continue;
            }
            int start = i;
            int end = i;
            for (int j = i + 1; j < n && scores[j] > thresholds.low() && (j - start) < config.maxZoneLength(); j++) {
                end = j;
            }
            for (int j = start - 1; j > previousEnd && scores[j] > thresholds.low()
                    && (end - j) < config.maxZoneLength(); j--) {
                start = j;
            }
            zones.add(buildZone(input, returns, scores, start, end, Zone.METHOD_STATISTICAL_CLUSTER));
            previousEnd = end;
            i = end + 1;
        }

        if (zones.isEmpty() && config.fallbackEnabled()) {
            zones = calmFallback(input, returns, scores, config);
        }

        double maxScore = Arrays.stream(scores).max().orElse(0.0);
        List<Zone> ranked = new ArrayList<>(zones.size());
        for (Zone zone : zones) {
            ranked.add(zone.toBuilder().impact(impact(zone.getAvgScore(), maxScore)).build());
        }
        // List.sort is stable: equal impacts keep chronological order
        ranked.sort(Comparator.comparingDouble(Zone::getImpact).reversed());

        log.debug("Clustered {} zones (t_high={}, t_low={})", ranked.size(), thresholds.high(), thresholds.low());
        return ranked.size() > config.maxZones() ? List.copyOf(ranked.subList(0, config.maxZones())) : ranked;
    }

    /**
     * Composite score per point: {@code 0.4·|return| + 0.3·volumeRatio + 0.3·log1p(events)},
     * each component divided by its own maximum.
     */
    public double[] scores(ZoneInput input, ZoneConfig config) {
        int n = input.size();
        double[] absReturns = returns(input.values());
        for (int i = 0; i < n; i++) {
            absReturns[i] = Math.abs(absReturns[i]);
        }
        double[] volumeRatios = volumeRatios(input.volumes(), n, config.volumeWindow());
        double[] density = new double[n];
        if (input.eventCounts() != null) {
            for (int i = 0; i < n; i++) {
                density[i] = Math.log1p(Math.max(input.eventCounts()[i], 0));
            }
        }

        double[] r = normalize(absReturns);
        double[] v = normalize(volumeRatios);
        double[] e = normalize(density);

        double[] scores = new double[n];
        for (int i = 0; i < n; i++) {
            scores[i] = ZoneConfig.RETURN_WEIGHT * r[i]
                    + ZoneConfig.VOLUME_WEIGHT * v[i]
                    + ZoneConfig.EVENT_WEIGHT * e[i];
        }
        return scores;
    }

    Thresholds thresholds(double[] scores, ZoneConfig config) {
        if (scores.length < ZoneConfig.MIN_SCORES_FOR_PERCENTILES) {
            return new Thresholds(ZoneConfig.SPARSE_HIGH, ZoneConfig.SPARSE_LOW);
        }
        int from = Math.max(0, scores.length - config.lookback());
        double[] recent = Arrays.copyOfRange(scores, from, scores.length);
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        double high = Math.max(percentile.evaluate(recent, ZoneConfig.HIGH_PERCENTILE), ZoneConfig.HIGH_FLOOR);
        double low = Math.max(percentile.evaluate(recent, ZoneConfig.LOW_PERCENTILE), ZoneConfig.LOW_FLOOR);
        return new Thresholds(high, low);
    }

    private List<Zone> calmFallback(ZoneInput input, double[] returns, double[] scores, ZoneConfig config) {
        Integer[] order = new Integer[scores.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, (a, b) -> Double.compare(scores[b], scores[a]));

        List<Zone> zones = new ArrayList<>();
        for (int k = 0; k < Math.min(config.fallbackTopK(), order.length); k++) {
            int index = order[k];
            zones.add(buildZone(input, returns, scores, index, index, Zone.METHOD_CALM_FALLBACK));
        }
        return zones;
    }

    private static Zone buildZone(ZoneInput input, double[] returns, double[] scores,
                                  int start, int end, String method) {
        double returnSum = 0.0;
        double scoreSum = 0.0;
        for (int j = start; j <= end; j++) {
            returnSum += returns[j];
            scoreSum += scores[j];
        }
        int length = end - start + 1;
        double avgReturn = returnSum / length;
        return Zone.builder()
                .startDate(input.dates().get(start))
                .endDate(input.dates().get(end))
                .startIndex(start)
                .endIndex(end)
                .avgReturn(avgReturn)
                .avgScore(scoreSum / length)
                .sentiment(Zone.Sentiment.of(avgReturn))
                .method(method)
                .build();
    }

    private static double impact(double avgScore, double maxScore) {
        if (maxScore <= 0) {
            return 0.5;
        }
        return Math.max(Math.min(avgScore / maxScore, 1.0), ZoneConfig.MIN_IMPACT);
    }

    /**
     * Fractional change from the previous point; 0 for the first point or a zero base.
     */
    private static double[] returns(double[] values) {
        double[] returns = new double[values.length];
        for (int i = 1; i < values.length; i++) {
            double base = values[i - 1];
            returns[i] = base == 0.0 ? 0.0 : (values[i] - base) / base;
        }
        return returns;
    }

    private static double[] volumeRatios(double[] volumes, int n, int window) {
        double[] ratios = new double[n];
        if (volumes == null) {
            Arrays.fill(ratios, 1.0);
            return ratios;
        }
        int effectiveWindow = Math.min(window, n);
        double positiveSum = 0.0;
        int positiveCount = 0;
        for (int i = 0; i < n; i++) {
            int from = Math.max(0, i - effectiveWindow + 1);
            double sum = 0.0;
            for (int j = from; j <= i; j++) {
                sum += volumes[j];
            }
            double rollingMean = sum / (i - from + 1);
            ratios[i] = rollingMean > 0 ? volumes[i] / rollingMean : 0.0;
            if (ratios[i] > 0) {
                positiveSum += ratios[i];
                positiveCount++;
            }
        }
        double replacement = positiveCount > 0 ? positiveSum / positiveCount : 1.0;
        for (int i = 0; i < n; i++) {
            if (!(ratios[i] > 0)) {
                ratios[i] = replacement;
            }
        }
        return ratios;
    }

    private static double[] normalize(double[] values) {
        double max = Arrays.stream(values).max().orElse(0.0);
        double[] normalized = new double[values.length];
        if (max <= 0) {
            return normalized;
        }
        for (int i = 0; i < values.length; i++) {
            normalized[i] = values[i] / max;
        }
        return normalized;
    }

    record Thresholds(double high, double low) {
    }
}
