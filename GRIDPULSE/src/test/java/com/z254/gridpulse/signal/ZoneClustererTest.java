package com.z254.gridpulse.signal;

import com.z254.gridpulse.domain.model.Zone;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ZoneClustererTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    private final ZoneClusterer clusterer = new ZoneClusterer();

    @Test
    @DisplayName("a spike and its reversal form one zone")
    void spikeFormsZone() {
        // Given: flat 100 MW with a one-day spike to 130 MW at index 20
        double[] values = flat(30, 100.0);
        values[20] = 130.0;

        // When
        List<Zone> zones = clusterer.cluster(input(values, null), ZoneConfig.defaults());

        // Then
        assertThat(zones).singleElement().satisfies(zone -> {
            assertThat(zone.getStartIndex()).isEqualTo(20);
            assertThat(zone.getEndIndex()).isEqualTo(21);
            assertThat(zone.getStartDate()).isEqualTo(START.plusDays(20));
            assertThat(zone.getEndDate()).isEqualTo(START.plusDays(21));
            assertThat(zone.getMethod()).isEqualTo(Zone.METHOD_STATISTICAL_CLUSTER);
            assertThat(zone.getSentiment()).isEqualTo(Zone.Sentiment.POSITIVE);
            assertThat(zone.getImpact()).isBetween(ZoneConfig.MIN_IMPACT, 1.0);
        });
    }

    @Test
    @DisplayName("scores weight returns, volume and events")
    void compositeScores() {
        // Given
        double[] values = flat(12, 100.0);
        values[5] = 110.0;
        int[] events = new int[12];
        events[8] = 3;

        // When
        double[] scores = clusterer.scores(input(values, events), ZoneConfig.defaults());

        // Then: constant volume contributes its full weight everywhere
        assertThat(scores[0]).isCloseTo(ZoneConfig.VOLUME_WEIGHT, within(1e-12));
        assertThat(scores[5]).isCloseTo(ZoneConfig.RETURN_WEIGHT + ZoneConfig.VOLUME_WEIGHT, within(1e-12));
        assertThat(scores[8]).isCloseTo(ZoneConfig.VOLUME_WEIGHT + ZoneConfig.EVENT_WEIGHT, within(1e-12));
    }

    @Test
    @DisplayName("a calm series falls back to the top-scoring single points")
    void calmFallback() {
        List<Zone> zones = clusterer.cluster(input(flat(30, 100.0), null), ZoneConfig.defaults());

        assertThat(zones).hasSize(2)
                .allSatisfy(zone -> {
                    assertThat(zone.getMethod()).isEqualTo(Zone.METHOD_CALM_FALLBACK);
                    assertThat(zone.length()).isEqualTo(1);
                    assertThat(zone.getSentiment()).isEqualTo(Zone.Sentiment.NEUTRAL);
                });
    }

    @Test
    @DisplayName("no zones for a calm series when the fallback is off")
    void calmWithoutFallback() {
        ZoneConfig config = new ZoneConfig(60, 10, 20, 2, 10, false);

        assertThat(clusterer.cluster(input(flat(30, 100.0), null), config)).isEmpty();
    }

    @Test
    @DisplayName("ranks zones by impact and caps their number")
    void ranksAndCaps() {
        // Given: a small spike early and a large one late
        double[] values = flat(60, 100.0);
        values[10] = 125.0;
        values[30] = 140.0;
        ZoneConfig config = new ZoneConfig(60, 10, 20, 2, 1, true);

        // When
        List<Zone> zones = clusterer.cluster(input(values, null), config);

        // Then
        assertThat(zones).singleElement()
                .satisfies(zone -> assertThat(zone.getStartIndex()).isEqualTo(30));
        assertThat(clusterer.cluster(input(values, null), ZoneConfig.defaults()))
                .extracting(Zone::getStartIndex)
                .containsExactly(30, 10);
    }

    @Test
    @DisplayName("zone length never exceeds the configured maximum")
    void boundedZoneLength() {
        // Given: a long volatile stretch
        double[] values = flat(60, 100.0);
        for (int i = 20; i < 45; i++) {
            values[i] = i % 2 == 0 ? 130.0 : 90.0;
        }
        ZoneConfig config = new ZoneConfig(60, 5, 20, 2, 10, true);

        // When
        List<Zone> zones = clusterer.cluster(input(values, null), config);

        // Then
        assertThat(zones).isNotEmpty().allSatisfy(zone -> assertThat(zone.length()).isLessThanOrEqualTo(5));
        assertThat(zones).extracting(Zone::getStartIndex).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("sparse series use fixed thresholds")
    void sparseThresholds() {
        ZoneClusterer.Thresholds thresholds = clusterer.thresholds(new double[]{0.1, 0.9, 0.2}, ZoneConfig.defaults());

        assertThat(thresholds.high()).isEqualTo(ZoneConfig.SPARSE_HIGH);
        assertThat(thresholds.low()).isEqualTo(ZoneConfig.SPARSE_LOW);
    }

    @Test
    @DisplayName("empty input yields no zones")
    void emptyInput() {
        assertThat(clusterer.cluster(new ZoneInput(List.of(), new double[0], null, null), ZoneConfig.defaults()))
                .isEmpty();
    }

    private static double[] flat(int n, double value) {
        double[] values = new double[n];
        Arrays.fill(values, value);
        return values;
    }

    private static ZoneInput input(double[] values, int[] events) {
        List<LocalDate> dates = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            dates.add(START.plusDays(i));
        }
        return new ZoneInput(dates, values, null, events);
    }
}
