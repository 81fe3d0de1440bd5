package com.z254.gridpulse.capability.impl;

import com.z254.gridpulse.capability.MetricFetcher;
import com.z254.gridpulse.capability.MetricSeries;
import com.z254.gridpulse.client.WeatherClient;
import com.z254.gridpulse.domain.model.RegionInfo;
import com.z254.gridpulse.domain.model.TimeSeriesPoint;
import com.z254.gridpulse.domain.model.WeatherObservation;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.Well19937c;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Daily demand derived from observed weather.
 *
 * <pre>
 * demand = baseLoad · weekday · season · temperature · humidity · (1 + noise)
 * </pre>
 *
 * Temperature raises demand as it moves away from 22 °C, humidity outside the
 * 40-60 % band adds a little more, and the season term peaks in winter and
 * summer. Noise is small and seeded by date and base load, so a series is
 * reproducible.
 */
@Component
@Slf4j
public class WeatherDrivenDemandFetcher implements MetricFetcher {

    static final double COMFORT_TEMPERATURE = 22.0;
    static final double DEFAULT_HUMIDITY = 50.0;
    static final double WEEKEND_FACTOR = 0.90;
    static final double NOISE_SD = 0.008;

    private final WeatherClient weatherClient;

    public WeatherDrivenDemandFetcher(WeatherClient weatherClient) {
        this.weatherClient = weatherClient;
    }

    @Override
    public Mono<MetricSeries> fetch(RegionInfo region, LocalDate start, LocalDate end) {
        if (end.isBefore(start)) {
            return Mono.error(new IllegalArgumentException("end " + end + " is before start " + start));
        }
        return weatherClient.dailyWeather(region, start, end)
                .onErrorResume(e -> {
                    log.warn("Weather unavailable for {}, using neutral weather: {}", region.getCode(), e.getMessage());
                    return Mono.just(List.of());
                })
                .map(weather -> build(region, start, end, weather));
    }

    MetricSeries build(RegionInfo region, LocalDate start, LocalDate end, List<WeatherObservation> weather) {
        Map<LocalDate, WeatherObservation> byDate = new HashMap<>();
        weather.forEach(observation -> byDate.put(observation.getDate(), observation));

        List<TimeSeriesPoint> points = new ArrayList<>();
        for (LocalDate date = start; !date.isAfter(end); date = date.plusDays(1)) {
            WeatherObservation observation = byDate.get(date);
            Double temperature = observation != null ? observation.getTemperature() : null;
            Double humidity = observation != null ? observation.getHumidity() : null;
            points.add(TimeSeriesPoint.observed(date, demand(region.getBaseLoad(), date, temperature, humidity)));
        }
        return new MetricSeries(points, weather);
    }

    static double demand(double baseLoad, LocalDate date, Double temperature, Double humidity) {
        double t = temperature != null && !temperature.isNaN() ? temperature : COMFORT_TEMPERATURE;
        double h = humidity != null && !humidity.isNaN() ? humidity : DEFAULT_HUMIDITY;

        double temperatureFactor = 1.0 + 0.15 * Math.tanh(Math.abs(t - COMFORT_TEMPERATURE) / 20.0);

        double humidityDiff = h < 40 ? 40 - h : (h > 60 ? h - 60 : 0);
        double humidityFactor = 1.0 + 0.04 * Math.tanh(humidityDiff / 30.0);

        double yearPosition = date.getDayOfYear() / 365.0;
        double seasonFactor = 1.0 + 0.05 * Math.cos(4 * Math.PI * yearPosition)
                + 0.015 * Math.cos(2 * Math.PI * (yearPosition - 0.5));

        DayOfWeek dayOfWeek = date.getDayOfWeek();
        double weekdayFactor = dayOfWeek == DayOfWeek.SATURDAY || dayOfWeek == DayOfWeek.SUNDAY
                ? WEEKEND_FACTOR : 1.0;

        double noise = noise(date, baseLoad);
        return baseLoad * weekdayFactor * seasonFactor * temperatureFactor * humidityFactor * (1 + noise);
    }

    private static double noise(LocalDate date, double baseLoad) {
        int seed = Objects.hash(date.getYear(), date.getMonthValue(), date.getDayOfMonth(), Math.round(baseLoad));
        NormalDistribution distribution = new NormalDistribution(new Well19937c(seed), 0.0, NOISE_SD,
                NormalDistribution.DEFAULT_INVERSE_ABSOLUTE_ACCURACY);
        return distribution.sample();
    }
}
