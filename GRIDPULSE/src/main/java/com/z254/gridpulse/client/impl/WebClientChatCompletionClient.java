package com.z254.gridpulse.client.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.gridpulse.client.ChatCompletionClient;
import com.z254.gridpulse.config.GridPulseProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * WebClient-based implementation of ChatCompletionClient.
 * Works with any endpoint that speaks the OpenAI chat completions protocol.
 */
@Component
@ConditionalOnProperty(prefix = "gridpulse.llm", name = "enabled", havingValue = "true")
@Slf4j
public class WebClientChatCompletionClient implements ChatCompletionClient {

    private static final String CHAT_COMPLETIONS_PATH = "/chat/completions";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final GridPulseProperties.LlmProperties config;
    private final Timer llmCallTimer;
    private final Counter llmCallCounter;
    private final Counter llmErrorCounter;

    public WebClientChatCompletionClient(
            GridPulseProperties properties,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry) {
        this.config = properties.getLlm();
        this.objectMapper = objectMapper;

        this.webClient = WebClient.builder()
                .baseUrl(config.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();

        this.llmCallTimer = Timer.builder("gridpulse.llm.call.latency")
                .register(meterRegistry);
        this.llmCallCounter = Counter.builder("gridpulse.llm.calls")
                .register(meterRegistry);
        this.llmErrorCounter = Counter.builder("gridpulse.llm.errors")
                .register(meterRegistry);
        log.info("LLM client configured for {} (model {})", config.getBaseUrl(), config.getModel());
    }

    @Override
    @CircuitBreaker(name = "llm")
    public String streamChat(List<ChatMessage> messages, Consumer<String> onDelta) {
        llmCallCounter.increment();
        long startTime = System.currentTimeMillis();
        StringBuilder content = new StringBuilder();

        try {
            webClient.post()
                    .uri(CHAT_COMPLETIONS_PATH)
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .bodyValue(buildRequestBody(messages, true))
                    .retrieve()
                    .bodyToFlux(String.class)
                    .timeout(config.getTimeout())
                    .map(this::parseStreamDelta)
                    .filter(Objects::nonNull)
                    .toStream()
                    .forEach(delta -> {
                        content.append(delta);
                        onDelta.accept(delta);
                    });
        } catch (RuntimeException e) {
            llmErrorCounter.increment();
            log.error("LLM streaming error: {}", e.getMessage());
            throw e;
        }

        llmCallTimer.record(Duration.ofMillis(System.currentTimeMillis() - startTime));
        return content.toString();
    }

    @Override
    @CircuitBreaker(name = "llm")
    @Retry(name = "llm")
    public String complete(List<ChatMessage> messages) {
        llmCallCounter.increment();
        long startTime = System.currentTimeMillis();

        JsonNode json;
        try {
            json = webClient.post()
                    .uri(CHAT_COMPLETIONS_PATH)
                    .bodyValue(buildRequestBody(messages, false))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(config.getTimeout())
                    .block();
        } catch (RuntimeException e) {
            llmErrorCounter.increment();
            log.error("LLM completion error: {}", e.getMessage());
            throw e;
        }

        llmCallTimer.record(Duration.ofMillis(System.currentTimeMillis() - startTime));
        if (json == null || !json.has("choices") || json.get("choices").isEmpty()) {
            return "";
        }
        JsonNode message = json.get("choices").get(0).get("message");
        return message != null && message.hasNonNull("content") ? message.get("content").asText() : "";
    }

    private Map<String, Object> buildRequestBody(List<ChatMessage> messages, boolean stream) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", config.getModel());
        body.put("stream", stream);
        body.put("temperature", config.getTemperature());
        body.put("max_tokens", config.getMaxTokens());
        body.put("messages", messages.stream()
                .map(m -> Map.of("role", m.role(), "content", m.content()))
                .toList());
        return body;
    }

    /**
     * Content delta of one SSE line, or null for keep-alives, role-only deltas and the end marker.
     */
    String parseStreamDelta(String line) {
        String data = line.startsWith("data:") ? line.substring(5).trim() : line.trim();
        if (data.isEmpty() || data.equals("[DONE]")) {
            return null;
        }
        try {
            JsonNode json = objectMapper.readTree(data);
            if (!json.has("choices") || json.get("choices").isEmpty()) {
                return null;
            }
            JsonNode delta = json.get("choices").get(0).get("delta");
            if (delta == null || !delta.hasNonNull("content")) {
                return null;
            }
            String text = delta.get("content").asText();
            return text.isEmpty() ? null : text;
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse stream chunk: {}", e.getMessage());
            return null;
        }
    }
}
