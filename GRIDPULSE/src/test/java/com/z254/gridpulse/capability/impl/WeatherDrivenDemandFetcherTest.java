package com.z254.gridpulse.capability.impl;

import com.z254.gridpulse.capability.MetricSeries;
import com.z254.gridpulse.client.WeatherClient;
import com.z254.gridpulse.domain.model.RegionInfo;
import com.z254.gridpulse.domain.model.TimeSeriesPoint;
import com.z254.gridpulse.domain.model.WeatherObservation;
import com.z254.gridpulse.region.RegionMatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link WeatherDrivenDemandFetcher}.
 */
@ExtendWith(MockitoExtension.class)
class WeatherDrivenDemandFetcherTest {

    // A Monday
    private static final LocalDate START = LocalDate.of(2024, 7, 1);

    @Mock
    private WeatherClient weatherClient;

    private WeatherDrivenDemandFetcher fetcher;
    private RegionInfo beijing;

    @BeforeEach
    void setUp() {
        fetcher = new WeatherDrivenDemandFetcher(weatherClient);
        beijing = new RegionMatcher().byCode("BJ").orElseThrow();
    }

    @Test
    @DisplayName("returns one observed point per day together with the weather")
    void onePointPerDay() {
        // Given
        List<WeatherObservation> weather = new ArrayList<>();
        for (int i = 0; i < 14; i++) {
            weather.add(new WeatherObservation(START.plusDays(i), 30.0, 70.0));
        }
        when(weatherClient.dailyWeather(any(), any(), any())).thenReturn(Mono.just(weather));

        // When / Then
        StepVerifier.create(fetcher.fetch(beijing, START, START.plusDays(13)))
                .assertNext(series -> {
                    assertThat(series.points()).hasSize(14)
                            .noneMatch(TimeSeriesPoint::isForecast);
                    assertThat(series.points().get(0).getDate()).isEqualTo(START);
                    assertThat(series.points().get(13).getDate()).isEqualTo(START.plusDays(13));
                    assertThat(series.weather()).hasSize(14);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("a weather failure degrades to neutral weather")
    void weatherFailureDegrades() {
        when(weatherClient.dailyWeather(any(), any(), any()))
                .thenReturn(Mono.error(new IllegalStateException("upstream down")));

        MetricSeries series = fetcher.fetch(beijing, START, START.plusDays(6)).block();

        assertThat(series).isNotNull();
        assertThat(series.weather()).isEmpty();
        assertThat(series.points()).hasSize(7).allSatisfy(point -> assertThat(point.getValue())
                .isEqualTo(WeatherDrivenDemandFetcher.demand(beijing.getBaseLoad(), point.getDate(), null, null)));
    }

    @Test
    @DisplayName("rejects an inverted range without calling the weather service")
    void invertedRange() {
        StepVerifier.create(fetcher.fetch(beijing, START, START.minusDays(1)))
                .expectError(IllegalArgumentException.class)
                .verify();
        verifyNoInteractions(weatherClient);
    }

    @Test
    @DisplayName("hot and humid days draw more than comfortable ones, weekends less")
    void demandShape() {
        double base = 10_000.0;
        LocalDate wednesday = START.plusDays(2);
        LocalDate saturday = START.plusDays(5);

        double comfortable = WeatherDrivenDemandFetcher.demand(base, wednesday, 22.0, 50.0);
        double hot = WeatherDrivenDemandFetcher.demand(base, wednesday, 36.0, 50.0);
        double hotAndHumid = WeatherDrivenDemandFetcher.demand(base, wednesday, 36.0, 90.0);

        assertThat(hot).isGreaterThan(comfortable);
        assertThat(hotAndHumid).isGreaterThan(hot);
        assertThat(WeatherDrivenDemandFetcher.demand(base, saturday, 22.0, 50.0))
                .isLessThan(WeatherDrivenDemandFetcher.demand(base, saturday.minusDays(1), 22.0, 50.0));
    }

    @Test
    @DisplayName("is reproducible for the same date and base load")
    void reproducible() {
        double first = WeatherDrivenDemandFetcher.demand(8_000.0, START, 25.0, 55.0);
        double second = WeatherDrivenDemandFetcher.demand(8_000.0, START, 25.0, 55.0);

        assertThat(first).isEqualTo(second);
        assertThat(first).isCloseTo(8_000.0, within(8_000.0 * 0.25));
    }
}
