package com.z254.gridpulse.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Daily weather for a region. Either value may be missing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WeatherObservation {

    private LocalDate date;

    /**
     * Daily mean temperature in °C.
     */
    private Double temperature;

    /**
     * Daily mean relative humidity in %.
     */
    private Double humidity;
}
