package com.z254.gridpulse.client.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.gridpulse.client.WeatherClient;
import com.z254.gridpulse.config.GridPulseProperties;
import com.z254.gridpulse.domain.model.RegionInfo;
import com.z254.gridpulse.domain.model.WeatherObservation;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * WebClient-based implementation of WeatherClient over the Open-Meteo forecast API.
 * Past days are requested through {@code past_days}, which reaches back at most 92 days.
 */
@Component
@Slf4j
public class WebClientOpenMeteoClient implements WeatherClient {

    static final int MAX_PAST_DAYS = 92;

    private final WebClient webClient;
    private final GridPulseProperties.WeatherProperties config;

    public WebClientOpenMeteoClient(GridPulseProperties properties) {
        this.config = properties.getWeather();
        this.webClient = WebClient.builder()
                .baseUrl(config.getBaseUrl())
                .build();
    }

    @Override
    @CircuitBreaker(name = "weather")
    @Retry(name = "weather")
    public Mono<List<WeatherObservation>> dailyWeather(RegionInfo region, LocalDate start, LocalDate end) {
        LocalDate today = LocalDate.now(ZoneId.of(config.getTimezone()));
        int pastDays = (int) Math.min(MAX_PAST_DAYS, Math.max(0, ChronoUnit.DAYS.between(start, today)));
        int forecastDays = (int) Math.max(1, Math.min(16, ChronoUnit.DAYS.between(today, end) + 1));

        return webClient.get()
                .uri(uri -> uri.path("/forecast")
                        .queryParam("latitude", region.getLatitude())
                        .queryParam("longitude", region.getLongitude())
                        .queryParam("past_days", pastDays)
                        .queryParam("forecast_days", forecastDays)
                        .queryParam("daily", "temperature_2m_mean,relative_humidity_2m_mean")
                        .queryParam("timezone", config.getTimezone())
                        .build())
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(config.getTimeout())
                .map(json -> parseDaily(json, start, end))
                .doOnSuccess(observations -> log.debug("Fetched {} days of weather for {}",
                        observations.size(), region.getCode()))
                .doOnError(e -> log.error("Weather fetch for {} failed: {}", region.getCode(), e.getMessage()));
    }

    static List<WeatherObservation> parseDaily(JsonNode json, LocalDate start, LocalDate end) {
        List<WeatherObservation> observations = new ArrayList<>();
        JsonNode daily = json.get("daily");
        if (daily == null || !daily.has("time")) {
            return observations;
        }
        JsonNode times = daily.get("time");
        JsonNode temperatures = daily.get("temperature_2m_mean");
        JsonNode humidities = daily.get("relative_humidity_2m_mean");
        for (int i = 0; i < times.size(); i++) {
            LocalDate date = LocalDate.parse(times.get(i).asText());
            if (date.isBefore(start) || date.isAfter(end)) {
                continue;
            }
            observations.add(WeatherObservation.builder()
                    .date(date)
                    .temperature(numberAt(temperatures, i))
                    .humidity(numberAt(humidities, i))
                    .build());
        }
        return observations;
    }

    private static Double numberAt(JsonNode array, int index) {
        if (array == null || index >= array.size() || array.get(index).isNull()) {
            return null;
        }
        return array.get(index).asDouble();
    }
}
