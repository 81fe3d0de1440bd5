package com.z254.gridpulse.client.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.gridpulse.client.EmbeddingClient;
import com.z254.gridpulse.config.GridPulseProperties;
import com.z254.gridpulse.exception.GridPulseException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * WebClient-based implementation of EmbeddingClient for OpenAI-compatible
 * {@code /embeddings} endpoints.
 */
@Component
@ConditionalOnProperty(prefix = "gridpulse.retrieval", name = "enabled", havingValue = "true")
@Slf4j
public class WebClientEmbeddingClient implements EmbeddingClient {

    private static final String EMBEDDINGS_PATH = "/embeddings";

    private final WebClient webClient;
    private final GridPulseProperties.RetrievalProperties config;

    public WebClientEmbeddingClient(GridPulseProperties properties) {
        this.config = properties.getRetrieval();
        String baseUrl = config.getEmbeddingBaseUrl() != null
                ? config.getEmbeddingBaseUrl() : properties.getLlm().getBaseUrl();
        String apiKey = config.getEmbeddingApiKey() != null
                ? config.getEmbeddingApiKey() : properties.getLlm().getApiKey();

        WebClient.Builder builder = WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        this.webClient = builder.build();
        log.info("Embedding client configured for {} (model {})", baseUrl, config.getEmbeddingModel());
    }

    @Override
    @CircuitBreaker(name = "retrieval")
    @Retry(name = "retrieval")
    public Mono<List<Float>> embed(String text) {
        Map<String, Object> body = Map.of(
                "model", config.getEmbeddingModel(),
                "input", text);

        return webClient.post()
                .uri(EMBEDDINGS_PATH)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(config.getTimeout())
                .map(WebClientEmbeddingClient::parseEmbedding)
                .doOnError(e -> log.error("Embedding request failed: {}", e.getMessage()));
    }

    static List<Float> parseEmbedding(JsonNode json) {
        JsonNode embedding = json.path("data").path(0).path("embedding");
        if (!embedding.isArray() || embedding.isEmpty()) {
            throw new GridPulseException("Embedding response has no vector");
        }
        List<Float> vector = new ArrayList<>(embedding.size());
        for (JsonNode value : embedding) {
            vector.add(value.floatValue());
        }
        return vector;
    }
}
