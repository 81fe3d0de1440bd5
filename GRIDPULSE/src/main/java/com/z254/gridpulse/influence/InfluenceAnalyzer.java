package com.z254.gridpulse.influence;

import com.z254.gridpulse.domain.model.InfluenceFactor;
import com.z254.gridpulse.domain.model.InfluenceResult;
import com.z254.gridpulse.domain.model.TimeSeriesPoint;
import com.z254.gridpulse.domain.model.WeatherObservation;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Ranks exogenous factors by their correlation-based influence on the target series.
 *
 * <p>Factors, in declaration order: temperature, humidity, season position
 * (day of year / 365) and industry structure (a constant per region, scored from
 * the secondary-industry share of GDP instead of a correlation).
 */
@Component
@Slf4j
public class InfluenceAnalyzer {

    public static final String TARGET = "target";
    public static final String TEMPERATURE = "temperature";
    public static final String HUMIDITY = "humidity";
    public static final String SEASON = "season";
    public static final String INDUSTRY_STRUCTURE = "industry_structure";

    public static final List<String> FACTORS = List.of(TEMPERATURE, HUMIDITY, SEASON, INDUSTRY_STRUCTURE);

    private static final Map<String, String> DISPLAY_NAMES = Map.of(
            TEMPERATURE, "Daily mean temperature",
            HUMIDITY, "Daily mean humidity",
            SEASON, "Season position",
            INDUSTRY_STRUCTURE, "Industry structure");

    /**
     * Analyze the influence of weather, season and industry structure on a target series.
     *
     * @param target         observed target points, chronological
     * @param weather        daily weather; aligned to the target by date
     * @param structureRatio secondary-industry share of regional GDP, in [0, 1]
     * @param config         analysis parameters
     * @return the result; a low-confidence default when there are too few points
     */
    public InfluenceResult analyze(List<TimeSeriesPoint> target,
                                   List<WeatherObservation> weather,
                                   double structureRatio,
                                   InfluenceConfig config) {
        int n = target.size();
        if (n < config.minPoints()) {
            log.debug("Only {} aligned points, returning default influence result", n);
            return defaultResult();
        }

        List<LocalDate> dates = target.stream().map(TimeSeriesPoint::getDate).toList();
        double[] targetValues = TimeSeriesPoint.values(target);

        Map<LocalDate, WeatherObservation> weatherByDate = new HashMap<>();
        for (WeatherObservation observation : weather) {
            weatherByDate.put(observation.getDate(), observation);
        }

        Map<String, double[]> factorValues = new HashMap<>();
        factorValues.put(TEMPERATURE, aligned(dates, weatherByDate, WeatherObservation::getTemperature));
        factorValues.put(HUMIDITY, aligned(dates, weatherByDate, WeatherObservation::getHumidity));
        factorValues.put(SEASON, dates.stream().mapToDouble(d -> d.getDayOfYear() / 365.0).toArray());
        double ratio = Math.max(0.0, Math.min(1.0, structureRatio));
        double[] structure = new double[n];
        Arrays.fill(structure, ratio);
        factorValues.put(INDUSTRY_STRUCTURE, structure);

        List<InfluenceFactor> factors = new ArrayList<>();
        for (String name : FACTORS) {
            double[] values = factorValues.get(name);
            double correlation;
            double pvalue;
            double score;
            if (INDUSTRY_STRUCTURE.equals(name)) {
                correlation = 0.0;
                pvalue = 1.0;
                score = Math.min(ratio * 2.0, 1.0);
            } else {
                correlation = pearson(targetValues, values);
                pvalue = pValue(correlation, n);
                double weight = 1.0 - Math.min(pvalue, InfluenceConfig.SIGNIFICANCE_LEVEL)
                        / InfluenceConfig.SIGNIFICANCE_LEVEL;
                score = Math.abs(correlation)
                        * (InfluenceConfig.CORRELATION_SHARE + InfluenceConfig.SIGNIFICANCE_SHARE * weight);
            }
            factors.add(InfluenceFactor.builder()
                    .name(name)
                    .correlation(finite(correlation))
                    .pvalue(Double.isNaN(pvalue) ? 1.0 : pvalue)
                    .score(finite(score))
                    .series(observations(dates, targetValues, values))
                    .build());
        }

        // Stable: equal scores keep declaration order
        List<InfluenceFactor> ranked = new ArrayList<>(factors);
        ranked.sort(Comparator.comparingDouble(InfluenceFactor::getScore).reversed());

        List<String> labels = new ArrayList<>();
        labels.add(TARGET);
        labels.addAll(FACTORS);
        List<double[]> columns = new ArrayList<>();
        columns.add(targetValues);
        FACTORS.forEach(name -> columns.add(factorValues.get(name)));

        InfluenceFactor top = ranked.get(0);
        return InfluenceResult.builder()
                .factors(factors)
                .ranking(ranked.stream().map(InfluenceFactor::getName).toList())
                .matrixLabels(labels)
                .correlationMatrix(correlationMatrix(columns))
                .summary(summary(ranked))
                .overallScore(factors.stream().mapToDouble(InfluenceFactor::getScore).average().orElse(0.0))
                .mostChangedWindow(mostChangedWindow(top.getName(), dates, factorValues.get(top.getName()),
                        targetValues, config))
                .lowConfidence(false)
                .build();
    }

    /**
     * Result used when the data cannot support the statistics.
     */
    public InfluenceResult defaultResult() {
        List<String> labels = new ArrayList<>();
        labels.add(TARGET);
        labels.addAll(FACTORS);
        int size = labels.size();
        double[][] identity = new double[size][size];
        for (int i = 0; i < size; i++) {
            identity[i][i] = 1.0;
        }
        List<InfluenceFactor> factors = FACTORS.stream()
                .map(name -> InfluenceFactor.builder()
                        .name(name)
                        .correlation(0.0)
                        .pvalue(1.0)
                        .score(0.0)
                        .series(List.of())
                        .build())
                .toList();
        return InfluenceResult.builder()
                .factors(factors)
                .ranking(List.of())
                .matrixLabels(labels)
                .correlationMatrix(identity)
                .summary("Not enough data for a reliable influence analysis.")
                .overallScore(0.0)
                .lowConfidence(true)
                .build();
    }

    // --------------------------------------------------------------------------------------------
    // Statistics
    // --------------------------------------------------------------------------------------------

    /**
     * Pearson correlation, 0 when either series is constant or the result is undefined.
     */
    static double pearson(double[] x, double[] y) {
        if (x.length < 2 || isConstant(x) || isConstant(y)) {
            return 0.0;
        }
        double r = new PearsonsCorrelation().correlation(x, y);
        return Double.isNaN(r) ? 0.0 : r;
    }

    /**
     * Two-sided p-value of a Pearson correlation from Student's t with n-2 degrees of freedom.
     */
    static double pValue(double r, int n) {
        if (n <= 2 || r == 0.0) {
            return 1.0;
        }
        if (Math.abs(r) >= 1.0) {
            return 0.0;
        }
        double t = Math.abs(r) * Math.sqrt((n - 2) / (1.0 - r * r));
        TDistribution distribution = new TDistribution(n - 2);
        return 2.0 * distribution.cumulativeProbability(-t);
    }

    private static double[][] correlationMatrix(List<double[]> columns) {
        int size = columns.size();
        double[][] matrix = new double[size][size];
        for (int i = 0; i < size; i++) {
            matrix[i][i] = 1.0;
            for (int j = i + 1; j < size; j++) {
                double r = pearson(columns.get(i), columns.get(j));
                matrix[i][j] = r;
                matrix[j][i] = r;
            }
        }
        return matrix;
    }

    private static boolean isConstant(double[] values) {
        return new StandardDeviation(false).evaluate(values) == 0.0;
    }

    // --------------------------------------------------------------------------------------------
    // Alignment and presentation
    // --------------------------------------------------------------------------------------------

    /**
     * Factor values on the target dates, missing values replaced by the mean of the present ones.
     */
    private static double[] aligned(List<LocalDate> dates,
                                    Map<LocalDate, WeatherObservation> weatherByDate,
                                    Function<WeatherObservation, Double> extractor) {
        Double[] raw = new Double[dates.size()];
        double sum = 0.0;
        int present = 0;
        for (int i = 0; i < dates.size(); i++) {
            WeatherObservation observation = weatherByDate.get(dates.get(i));
            Double value = observation == null ? null : extractor.apply(observation);
            if (value != null && !value.isNaN()) {
                raw[i] = value;
                sum += value;
                present++;
            }
        }
        double mean = present > 0 ? sum / present : 0.0;
        double[] values = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            values[i] = raw[i] != null ? raw[i] : mean;
        }
        return values;
    }

    private static List<InfluenceFactor.Observation> observations(List<LocalDate> dates,
                                                                  double[] target,
                                                                  double[] factor) {
        List<InfluenceFactor.Observation> series = new ArrayList<>(dates.size());
        for (int i = 0; i < dates.size(); i++) {
            series.add(new InfluenceFactor.Observation(dates.get(i), target[i], factor[i]));
        }
        return series;
    }

    private static InfluenceResult.ChangeWindow mostChangedWindow(String factor,
                                                                  List<LocalDate> dates,
                                                                  double[] factorValues,
                                                                  double[] targetValues,
                                                                  InfluenceConfig config) {
        InfluenceResult.ChangeWindow best = null;
        double bestProduct = -1.0;
        for (int start = 0; start + config.windowSize() <= dates.size(); start += config.windowStep()) {
            int end = start + config.windowSize() - 1;
            double factorChange = changePct(factorValues[start], factorValues[end]);
            double targetChange = changePct(targetValues[start], targetValues[end]);
            if (Double.isNaN(factorChange) || Double.isNaN(targetChange)
                    || Math.abs(factorChange) <= config.minFactorChangePct()) {
                continue;
            }
            double product = Math.abs(factorChange) * Math.abs(targetChange);
            if (product > bestProduct) {
                bestProduct = product;
                best = InfluenceResult.ChangeWindow.builder()
                        .factor(factor)
                        .startDate(dates.get(start))
                        .endDate(dates.get(end))
                        .factorStart(factorValues[start])
                        .factorEnd(factorValues[end])
                        .factorChangePct(factorChange)
                        .targetStart(targetValues[start])
                        .targetEnd(targetValues[end])
                        .targetChangePct(targetChange)
                        .build();
            }
        }
        return best;
    }

    private static double changePct(double from, double to) {
        if (from == 0.0) {
            return Double.NaN;
        }
        return (to - from) / Math.abs(from) * 100.0;
    }

    private static String summary(List<InfluenceFactor> ranked) {
        InfluenceFactor top = ranked.get(0);
        String direction;
        if (top.getCorrelation() > InfluenceConfig.DIRECTION_THRESHOLD) {
            direction = "a positive";
        } else if (top.getCorrelation() < -InfluenceConfig.DIRECTION_THRESHOLD) {
            direction = "a negative";
        } else {
            direction = "only a weak";
        }
        StringBuilder summary = new StringBuilder(String.format(Locale.ROOT,
                "Over the analysed period, %s has the strongest influence on demand (score %.2f), "
                        + "with %s correlation (r = %.3f).",
                displayName(top.getName()).toLowerCase(Locale.ROOT), top.getScore(), direction, top.getCorrelation()));
        if (ranked.size() > 1 && ranked.get(1).getScore() > InfluenceConfig.SECONDARY_MENTION_SCORE) {
            InfluenceFactor second = ranked.get(1);
            summary.append(String.format(Locale.ROOT, " %s follows (score %.2f).",
                    displayName(second.getName()), second.getScore()));
        }
        return summary.toString();
    }

    static String displayName(String factor) {
        return DISPLAY_NAMES.getOrDefault(factor, factor);
    }

    private static double finite(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }
}
