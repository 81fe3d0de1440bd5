package com.z254.gridpulse.capability.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.gridpulse.capability.Classification;
import com.z254.gridpulse.capability.Classifier;
import com.z254.gridpulse.client.ChatCompletionClient;
import com.z254.gridpulse.client.ChatCompletionClient.ChatMessage;
import com.z254.gridpulse.domain.model.ConversationTurn;
import com.z254.gridpulse.domain.model.StepTemplate;
import com.z254.gridpulse.exception.ClassificationException;
import com.z254.gridpulse.region.RegionMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;

/**
 * Classifier backed by a chat model.
 *
 * <p>The model first writes its reasoning, which is streamed to the caller, then a
 * line containing only {@value #JSON_MARKER} followed by a JSON object with the
 * classification.
 */
@Component
@Primary
@ConditionalOnProperty(prefix = "gridpulse.llm", name = "enabled", havingValue = "true")
@Slf4j
public class LlmClassifier implements Classifier {

    static final String JSON_MARKER = "###JSON";

    private static final String SYSTEM_PROMPT = """
            You route questions for a regional power-demand analysis service.
            Supported regions: %s.

            Choose one intent:
            - forecast: the user wants a demand forecast or analysis for a region
            - retrieval: the user asks about the content of published reports
            - news: the user asks for recent news
            - chat: anything else about power or energy

            First explain your reasoning in two or three short sentences.
            Then write a line containing only %s, followed by a JSON object:
            {"intent": "forecast|retrieval|news|chat", "region": "<region as mentioned or null>",
             "horizon_days": <int or null>, "history_days": <int or null>,
             "keywords": ["..."], "in_scope": true|false,
             "reply": "<short polite answer when in_scope is false, otherwise null>"}
            """;

    private final ChatCompletionClient chatClient;
    private final ObjectMapper objectMapper;
    private final RegionMatcher regionMatcher;

    public LlmClassifier(ChatCompletionClient chatClient, ObjectMapper objectMapper, RegionMatcher regionMatcher) {
        this.chatClient = chatClient;
        this.objectMapper = objectMapper;
        this.regionMatcher = regionMatcher;
    }

    @Override
    public Classification classify(String query, List<ConversationTurn> history, Consumer<String> onReasoning) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(SYSTEM_PROMPT.formatted(
                String.join(", ", regionMatcher.supportedNames()), JSON_MARKER)));
        for (ConversationTurn turn : history) {
            messages.add(new ChatMessage(turn.getRole(), turn.getContent()));
        }
        messages.add(ChatMessage.user(query));

        ReasoningSplitter splitter = new ReasoningSplitter(onReasoning);
        String output = chatClient.streamChat(messages, splitter::accept);
        splitter.flush();
        return parse(output);
    }

    Classification parse(String output) {
        int marker = output.indexOf(JSON_MARKER);
        String jsonText = marker >= 0 ? output.substring(marker + JSON_MARKER.length()) : output;
        int start = jsonText.indexOf('{');
        int end = jsonText.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new ClassificationException("Classifier returned no JSON object");
        }

        JsonNode json;
        try {
            json = objectMapper.readTree(jsonText.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new ClassificationException("Classifier returned malformed JSON", e);
        }

        StepTemplate template = switch (json.path("intent").asText("chat").toLowerCase(Locale.ROOT)) {
            case "forecast" -> StepTemplate.FORECAST;
            case "retrieval" -> StepTemplate.RETRIEVAL;
            case "news" -> StepTemplate.NEWS;
            case "chat" -> StepTemplate.CHAT;
            default -> throw new ClassificationException("Unknown intent: " + json.path("intent").asText());
        };
        boolean inScope = json.path("in_scope").asBoolean(true);

        List<String> keywords = new ArrayList<>();
        json.path("keywords").forEach(node -> keywords.add(node.asText()));

        return Classification.builder()
                .template(inScope ? template : StepTemplate.CHAT)
                .regionMention(textOrNull(json.get("region")))
                .horizon(intOrNull(json.get("horizon_days")))
                .historyDays(intOrNull(json.get("history_days")))
                .keywords(keywords)
                .inScope(inScope)
                .reply(textOrNull(json.get("reply")))
                .reason("model classification")
                .build();
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        String text = node.asText().trim();
        return text.isEmpty() || text.equalsIgnoreCase("null") ? null : text;
    }

    private static Integer intOrNull(JsonNode node) {
        return node != null && node.canConvertToInt() ? node.asInt() : null;
    }

    /**
     * Forwards streamed text until the JSON marker appears. Text that could be the
     * start of the marker is held back until it is decided.
     */
    static final class ReasoningSplitter {

        private final Consumer<String> onReasoning;
        private final StringBuilder pending = new StringBuilder();
        private boolean done;

        ReasoningSplitter(Consumer<String> onReasoning) {
            this.onReasoning = onReasoning;
        }

        void accept(String delta) {
            if (done) {
                return;
            }
            pending.append(delta);
            int marker = pending.indexOf(JSON_MARKER);
            if (marker >= 0) {
                emit(pending.substring(0, marker));
                pending.setLength(0);
                done = true;
                return;
            }
            int safe = pending.length() - (JSON_MARKER.length() - 1);
            if (safe > 0) {
                emit(pending.substring(0, safe));
                pending.delete(0, safe);
            }
        }

        void flush() {
            if (!done) {
                emit(pending.toString());
                pending.setLength(0);
            }
        }

        private void emit(String text) {
            if (!text.isEmpty()) {
                onReasoning.accept(text);
            }
        }
    }
}
