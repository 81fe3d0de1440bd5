package com.z254.gridpulse.influence;

import com.z254.gridpulse.domain.model.InfluenceFactor;
import com.z254.gridpulse.domain.model.InfluenceResult;
import com.z254.gridpulse.domain.model.TimeSeriesPoint;
import com.z254.gridpulse.domain.model.WeatherObservation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link InfluenceAnalyzer}.
 */
class InfluenceAnalyzerTest {

    private static final LocalDate START = LocalDate.of(2024, 5, 1);

    private InfluenceAnalyzer analyzer;
    private List<TimeSeriesPoint> target;
    private List<WeatherObservation> weather;

    @BeforeEach
    void setUp() {
        analyzer = new InfluenceAnalyzer();
        target = new ArrayList<>();
        weather = new ArrayList<>();
        // Demand follows temperature exactly; humidity is constant
        for (int i = 0; i < 42; i++) {
            double temperature = 15.0 + (i % 7) * 2.0;
            LocalDate date = START.plusDays(i);
            target.add(TimeSeriesPoint.observed(date, 1000.0 + 20.0 * temperature));
            weather.add(new WeatherObservation(date, temperature, 60.0));
        }
    }

    @Nested
    @DisplayName("With enough data")
    class EnoughData {

        @Test
        @DisplayName("ranks the driving factor first")
        void ranksDrivingFactorFirst() {
            // When
            InfluenceResult result = analyzer.analyze(target, weather, 0.3, InfluenceConfig.defaults());

            // Then
            assertThat(result.isLowConfidence()).isFalse();
            assertThat(result.getRanking()).first().isEqualTo(InfluenceAnalyzer.TEMPERATURE);
            assertThat(result.getRanking()).containsExactlyInAnyOrderElementsOf(InfluenceAnalyzer.FACTORS);

            InfluenceFactor temperature = result.getFactors().get(0);
            assertThat(temperature.getName()).isEqualTo(InfluenceAnalyzer.TEMPERATURE);
            assertThat(temperature.getCorrelation()).isCloseTo(1.0, within(1e-9));
            assertThat(temperature.getPvalue()).isLessThan(1e-6);
            assertThat(temperature.getScore()).isCloseTo(1.0, within(1e-6));
            assertThat(temperature.getSeries()).hasSize(42);
        }

        @Test
        @DisplayName("keeps factors in declaration order")
        void factorsInDeclarationOrder() {
            InfluenceResult result = analyzer.analyze(target, weather, 0.3, InfluenceConfig.defaults());

            assertThat(result.getFactors()).extracting(InfluenceFactor::getName)
                    .containsExactlyElementsOf(InfluenceAnalyzer.FACTORS);
        }

        @Test
        @DisplayName("scores a constant factor as zero and industry structure from its ratio")
        void constantAndStructureFactors() {
            InfluenceResult result = analyzer.analyze(target, weather, 0.3, InfluenceConfig.defaults());

            InfluenceFactor humidity = result.getFactors().get(1);
            InfluenceFactor structure = result.getFactors().get(3);
            assertThat(humidity.getCorrelation()).isZero();
            assertThat(humidity.getPvalue()).isEqualTo(1.0);
            assertThat(humidity.getScore()).isZero();
            assertThat(structure.getScore()).isCloseTo(0.6, within(1e-12));
            assertThat(result.getRanking().get(1)).isEqualTo(InfluenceAnalyzer.INDUSTRY_STRUCTURE);
        }

        @Test
        @DisplayName("keeps declaration order between equally scored factors")
        void tiesKeepDeclarationOrder() {
            // When: humidity is constant and there is no industry share, both score 0
            InfluenceResult result = analyzer.analyze(target, weather, 0.0, InfluenceConfig.defaults());

            // Then
            assertThat(result.getFactors().get(1).getScore()).isZero();
            assertThat(result.getFactors().get(3).getScore()).isZero();
            assertThat(result.getFactors().get(2).getScore()).isPositive();
            assertThat(result.getRanking()).containsExactly(
                    InfluenceAnalyzer.TEMPERATURE,
                    InfluenceAnalyzer.SEASON,
                    InfluenceAnalyzer.HUMIDITY,
                    InfluenceAnalyzer.INDUSTRY_STRUCTURE);
        }

        @Test
        @DisplayName("builds a symmetric correlation matrix with the target first")
        void correlationMatrix() {
            InfluenceResult result = analyzer.analyze(target, weather, 0.3, InfluenceConfig.defaults());

            double[][] matrix = result.getCorrelationMatrix();
            assertThat(result.getMatrixLabels()).first().isEqualTo(InfluenceAnalyzer.TARGET);
            assertThat(matrix).hasDimensions(5, 5);
            for (int i = 0; i < 5; i++) {
                assertThat(matrix[i][i]).isEqualTo(1.0);
                for (int j = 0; j < 5; j++) {
                    assertThat(matrix[i][j]).isEqualTo(matrix[j][i]);
                }
            }
            assertThat(matrix[0][1]).isCloseTo(1.0, within(1e-9));
        }

        @Test
        @DisplayName("summarizes the strongest factor and its runner-up")
        void summary() {
            InfluenceResult result = analyzer.analyze(target, weather, 0.3, InfluenceConfig.defaults());

            assertThat(result.getSummary())
                    .contains("daily mean temperature has the strongest influence")
                    .contains("a positive correlation")
                    .contains("Industry structure follows (score 0.60)");
        }

        @Test
        @DisplayName("finds the first window where the top factor moved the most")
        void mostChangedWindow() {
            InfluenceResult result = analyzer.analyze(target, weather, 0.3, InfluenceConfig.defaults());

            InfluenceResult.ChangeWindow window = result.getMostChangedWindow();
            assertThat(window).isNotNull();
            assertThat(window.getFactor()).isEqualTo(InfluenceAnalyzer.TEMPERATURE);
            assertThat(window.getStartDate()).isEqualTo(START);
            assertThat(window.getEndDate()).isEqualTo(START.plusDays(13));
            assertThat(window.getFactorChangePct()).isCloseTo(80.0, within(1e-9));
        }

        @Test
        @DisplayName("fills missing weather with the mean of the present values")
        void missingWeatherFilled() {
            // Given
            weather.set(3, new WeatherObservation(START.plusDays(3), null, null));
            weather.remove(10);

            // When
            InfluenceResult result = analyzer.analyze(target, weather, 0.3, InfluenceConfig.defaults());

            // Then
            assertThat(result.getFactors().get(0).getSeries()).hasSize(42)
                    .allSatisfy(observation -> assertThat(observation.getFactor()).isBetween(15.0, 27.0));
            assertThat(result.getRanking()).first().isEqualTo(InfluenceAnalyzer.TEMPERATURE);
        }
    }

    @Test
    @DisplayName("returns a low-confidence default for too few points")
    void tooFewPoints() {
        InfluenceResult result = analyzer.analyze(target.subList(0, 9), weather, 0.3, InfluenceConfig.defaults());

        assertThat(result.isLowConfidence()).isTrue();
        assertThat(result.getRanking()).isEmpty();
        assertThat(result.getFactors()).allSatisfy(f -> assertThat(f.getScore()).isZero());
        assertThat(result.getCorrelationMatrix()[2][2]).isEqualTo(1.0);
        assertThat(result.getCorrelationMatrix()[0][2]).isZero();
    }

    @Test
    @DisplayName("p-value follows Student's t distribution")
    void pValue() {
        assertThat(InfluenceAnalyzer.pValue(0.5, 30)).isBetween(0.004, 0.006);
        assertThat(InfluenceAnalyzer.pValue(0.0, 30)).isEqualTo(1.0);
        assertThat(InfluenceAnalyzer.pValue(1.0, 30)).isZero();
        assertThat(InfluenceAnalyzer.pValue(0.9, 2)).isEqualTo(1.0);
    }
}
