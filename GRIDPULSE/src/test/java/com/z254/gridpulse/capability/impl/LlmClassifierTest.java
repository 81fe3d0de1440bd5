package com.z254.gridpulse.capability.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.gridpulse.capability.Classification;
import com.z254.gridpulse.client.ChatCompletionClient;
import com.z254.gridpulse.domain.model.ConversationTurn;
import com.z254.gridpulse.domain.model.StepTemplate;
import com.z254.gridpulse.exception.ClassificationException;
import com.z254.gridpulse.region.RegionMatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link LlmClassifier}.
 */
@ExtendWith(MockitoExtension.class)
class LlmClassifierTest {

    private static final String MARKER = LlmClassifier.JSON_MARKER;

    @Mock
    private ChatCompletionClient chatClient;

    private LlmClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new LlmClassifier(chatClient, new ObjectMapper(), new RegionMatcher());
    }

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        @DisplayName("reads template, region and spans from the JSON object")
        void parsesForecast() {
            // Given
            String output = "The user wants a forecast.\n" + MARKER + "\n"
                    + "{\"intent\": \"forecast\", \"region\": \"Shanghai\", \"horizon_days\": 14,"
                    + " \"history_days\": null, \"keywords\": [\"load\", \"forecast\"], \"in_scope\": true}";

            // When
            Classification result = classifier.parse(output);

            // Then
            assertThat(result.getTemplate()).isEqualTo(StepTemplate.FORECAST);
            assertThat(result.getRegionMention()).isEqualTo("Shanghai");
            assertThat(result.getHorizon()).isEqualTo(14);
            assertThat(result.getHistoryDays()).isNull();
            assertThat(result.getKeywords()).containsExactly("load", "forecast");
            assertThat(result.isInScope()).isTrue();
        }

        @Test
        @DisplayName("out-of-scope answers become chats with the model's reply")
        void outOfScope() {
            String output = MARKER + "{\"intent\": \"news\", \"in_scope\": false,"
                    + " \"reply\": \"I can only help with power demand.\", \"region\": \"null\"}";

            Classification result = classifier.parse(output);

            assertThat(result.getTemplate()).isEqualTo(StepTemplate.CHAT);
            assertThat(result.isInScope()).isFalse();
            assertThat(result.getReply()).isEqualTo("I can only help with power demand.");
            assertThat(result.getRegionMention()).isNull();
        }

        @Test
        @DisplayName("rejects output without a JSON object")
        void noJson() {
            assertThatThrownBy(() -> classifier.parse("I am not sure what you mean."))
                    .isInstanceOf(ClassificationException.class)
                    .hasMessageContaining("no JSON");
        }

        @Test
        @DisplayName("rejects malformed JSON and unknown intents")
        void malformed() {
            assertThatThrownBy(() -> classifier.parse(MARKER + "{\"intent\": forecast}"))
                    .isInstanceOf(ClassificationException.class)
                    .hasMessageContaining("malformed");
            assertThatThrownBy(() -> classifier.parse(MARKER + "{\"intent\": \"poetry\"}"))
                    .isInstanceOf(ClassificationException.class)
                    .hasMessageContaining("poetry");
        }
    }

    @Test
    @DisplayName("streams reasoning up to the marker and sends the history to the model")
    @SuppressWarnings("unchecked")
    void streamsReasoning() {
        // Given
        when(chatClient.streamChat(anyList(), any())).thenAnswer(invocation -> {
            Consumer<String> onDelta = invocation.getArgument(1);
            List<String> deltas = List.of("Looking at ", "the query.", "\n###", "JSON\n{\"intent\":", " \"chat\"}");
            deltas.forEach(onDelta);
            return String.join("", deltas);
        });
        List<ConversationTurn> history = List.of(
                ConversationTurn.user("Hello"),
                ConversationTurn.assistant("Hi, how can I help?"));
        List<String> reasoning = new ArrayList<>();

        // When
        Classification result = classifier.classify("Why is demand higher in July?", history, reasoning::add);

        // Then
        assertThat(result.getTemplate()).isEqualTo(StepTemplate.CHAT);
        assertThat(String.join("", reasoning)).isEqualTo("Looking at the query.\n");

        ArgumentCaptor<List<ChatCompletionClient.ChatMessage>> messages = ArgumentCaptor.forClass(List.class);
        verify(chatClient).streamChat(messages.capture(), any());
        assertThat(messages.getValue()).hasSize(4);
        assertThat(messages.getValue().get(0).role()).isEqualTo("system");
        assertThat(messages.getValue().get(0).content()).contains("Beijing").contains(MARKER);
        assertThat(messages.getValue().get(3)).isEqualTo(ChatCompletionClient.ChatMessage.user("Why is demand higher in July?"));
    }

    @Test
    @DisplayName("holds back text that could start the marker")
    void splitterHoldsPartialMarker() {
        List<String> out = new ArrayList<>();
        LlmClassifier.ReasoningSplitter splitter = new LlmClassifier.ReasoningSplitter(out::add);

        splitter.accept("abc##");
        assertThat(String.join("", out)).doesNotContain("#");

        splitter.accept("x");
        splitter.flush();
        assertThat(String.join("", out)).isEqualTo("abc##x");
    }
}
