package com.z254.gridpulse.capability.impl;

import com.z254.gridpulse.capability.Classification;
import com.z254.gridpulse.domain.model.ConversationTurn;
import com.z254.gridpulse.domain.model.StepTemplate;
import com.z254.gridpulse.exception.ClassificationException;
import com.z254.gridpulse.region.RegionMatcher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link KeywordClassifier}.
 */
class KeywordClassifierTest {

    private final KeywordClassifier classifier = new KeywordClassifier(new RegionMatcher());
    private final List<String> reasoning = new ArrayList<>();

    private Classification classify(String query) {
        return classify(query, List.of());
    }

    private Classification classify(String query, List<ConversationTurn> history) {
        return classifier.classify(query, history, reasoning::add);
    }

    @Nested
    @DisplayName("Template choice")
    class TemplateChoice {

        @Test
        @DisplayName("forecast query with region and horizon")
        void forecastQuery() {
            // When
            Classification result = classify("Forecast Beijing's power demand for the next 30 days");

            // Then
            assertThat(result.getTemplate()).isEqualTo(StepTemplate.FORECAST);
            assertThat(result.getRegionMention()).isEqualTo("Beijing");
            assertThat(result.getHorizon()).isEqualTo(30);
            assertThat(result.isInScope()).isTrue();
            assertThat(result.getReason()).startsWith("keyword match:").contains("forecast");
            assertThat(reasoning).isNotEmpty().anyMatch(line -> line.contains("forecast"));
        }

        @Test
        @DisplayName("report questions win over forecasts")
        void retrievalWins() {
            Classification result = classify("According to the latest report, what is the demand forecast?");

            assertThat(result.getTemplate()).isEqualTo(StepTemplate.RETRIEVAL);
        }

        @Test
        @DisplayName("news questions win over forecasts")
        void newsWins() {
            Classification result = classify("Latest news on the Shanghai grid and its demand outlook");

            assertThat(result.getTemplate()).isEqualTo(StepTemplate.NEWS);
            assertThat(result.getRegionMention()).isEqualTo("Shanghai");
        }

        @Test
        @DisplayName("Chinese queries are recognized")
        void chineseQuery() {
            Classification result = classify("预测广州未来7天的用电负荷");

            assertThat(result.getTemplate()).isEqualTo(StepTemplate.FORECAST);
            assertThat(result.getRegionMention()).isEqualTo("Guangzhou");
            assertThat(result.getHorizon()).isEqualTo(7);
        }

        @Test
        @DisplayName("power questions without analysis keywords are chats")
        void plainPowerQuestion() {
            Classification result = classify("Why does electricity demand peak in summer?");

            assertThat(result.getTemplate()).isEqualTo(StepTemplate.CHAT);
            assertThat(result.isInScope()).isTrue();
            assertThat(result.getReply()).isNull();
        }

        @Test
        @DisplayName("greetings stay in scope")
        void greeting() {
            Classification result = classify("Hello there");

            assertThat(result.getTemplate()).isEqualTo(StepTemplate.CHAT);
            assertThat(result.isInScope()).isTrue();
        }

        @Test
        @DisplayName("unrelated questions get the out-of-scope reply")
        void outOfScope() {
            Classification result = classify("What's a good pizza recipe?");

            assertThat(result.getTemplate()).isEqualTo(StepTemplate.CHAT);
            assertThat(result.isInScope()).isFalse();
            assertThat(result.getReply()).isEqualTo(KeywordClassifier.OUT_OF_SCOPE_REPLY);
        }
    }

    @Nested
    @DisplayName("Region mentions")
    class RegionMentions {

        @Test
        @DisplayName("an unsupported place is passed on as mentioned")
        void unsupportedPlace() {
            Classification result = classify("Forecast power demand in Atlantis for next month");

            assertThat(result.getTemplate()).isEqualTo(StepTemplate.FORECAST);
            assertThat(result.getRegionMention()).isEqualTo("Atlantis");
        }

        @Test
        @DisplayName("a forecast follow-up reuses the last region of the conversation")
        void followUpReusesRegion() {
            // Given
            List<ConversationTurn> history = List.of(
                    ConversationTurn.user("Forecast Beijing's power demand for the next 30 days"),
                    ConversationTurn.assistant("Demand is expected to rise."),
                    ConversationTurn.user("Thanks, how about Tianjin's load trend?"),
                    ConversationTurn.assistant("Tianjin load is stable."));

            // When
            Classification result = classify("What about the next 14 days forecast?", history);

            // Then
            assertThat(result.getRegionMention()).isEqualTo("Tianjin");
            assertThat(result.getHorizon()).isEqualTo(14);
        }

        @Test
        @DisplayName("no region is borrowed for non-forecast templates")
        void noRegionForChat() {
            List<ConversationTurn> history = List.of(ConversationTurn.user("Forecast Beijing demand"));

            Classification result = classify("Why is demand higher on weekdays?", history);

            assertThat(result.getTemplate()).isEqualTo(StepTemplate.CHAT);
            assertThat(result.getRegionMention()).isNull();
        }
    }

    @ParameterizedTest(name = "\"{0}\" -> horizon {1}, history {2}")
    @CsvSource(value = {
            "forecast the next 2 weeks of power demand based on the past 3 months | 14 | 90",
            "predict demand for the coming 45 days | 45 | ",
            "power load trend over the last 60 days | | 60",
            "未来2周 用电预测, 过去30天 | 14 | 30"
    }, delimiter = '|')
    @DisplayName("parses horizon and history spans")
    void parsesSpans(String query, Integer horizon, Integer historyDays) {
        Classification result = classify(query);

        assertThat(result.getHorizon()).isEqualTo(horizon);
        assertThat(result.getHistoryDays()).isEqualTo(historyDays);
    }

    @Test
    @DisplayName("rejects an empty query")
    void emptyQuery() {
        assertThatThrownBy(() -> classify("   "))
                .isInstanceOf(ClassificationException.class)
                .hasMessageContaining("empty");
    }
}
