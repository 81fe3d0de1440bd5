package com.z254.gridpulse.client;

import com.z254.gridpulse.domain.model.RegionInfo;
import com.z254.gridpulse.domain.model.WeatherObservation;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;

/**
 * Client for daily weather observations.
 */
public interface WeatherClient {

    /**
     * Daily mean temperature and humidity, inclusive of both ends, chronological.
     */
    Mono<List<WeatherObservation>> dailyWeather(RegionInfo region, LocalDate start, LocalDate end);
}
