package com.z254.gridpulse.client.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.gridpulse.client.ReportIndexClient;
import com.z254.gridpulse.config.GridPulseProperties;
import com.z254.gridpulse.domain.model.RetrievalRecord;
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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * WebClient-based implementation of ReportIndexClient over the Qdrant query API.
 *
 * <p>Points carry the chunk payload written by the report indexer:
 * {@code doc_id}, {@code doc_title}, {@code file_name}, {@code content} and
 * {@code page_number}.
 */
@Component
@ConditionalOnProperty(prefix = "gridpulse.retrieval", name = "enabled", havingValue = "true")
@Slf4j
public class WebClientQdrantClient implements ReportIndexClient {

    private static final String QUERY_PATH = "/collections/{collection}/points/query";

    private final WebClient webClient;
    private final GridPulseProperties.RetrievalProperties config;

    public WebClientQdrantClient(GridPulseProperties properties) {
        this.config = properties.getRetrieval();

        WebClient.Builder builder = WebClient.builder()
                .baseUrl(config.getQdrantUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (config.getQdrantApiKey() != null && !config.getQdrantApiKey().isBlank()) {
            builder.defaultHeader("api-key", config.getQdrantApiKey());
        }
        this.webClient = builder.build();
        log.info("Report index configured at {} (collection {})", config.getQdrantUrl(), config.getCollection());
    }

    @Override
    @CircuitBreaker(name = "retrieval")
    @Retry(name = "retrieval")
    public Mono<List<RetrievalRecord>> search(List<Float> vector, int limit) {
        return webClient.post()
                .uri(QUERY_PATH, config.getCollection())
                .bodyValue(queryBody(vector, limit, config))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(config.getTimeout())
                .map(WebClientQdrantClient::parsePoints)
                .doOnSuccess(records -> log.debug("Report index returned {} chunks", records.size()))
                .doOnError(e -> log.error("Report index query failed: {}", e.getMessage()));
    }

    static Map<String, Object> queryBody(List<Float> vector, int limit,
                                         GridPulseProperties.RetrievalProperties config) {
        Map<String, Object> body = new HashMap<>();
        body.put("query", vector);
        body.put("using", config.getVectorName());
        body.put("limit", limit);
        body.put("with_payload", true);
        if (config.getScoreThreshold() > 0) {
            body.put("score_threshold", config.getScoreThreshold());
        }
        return body;
    }

    static List<RetrievalRecord> parsePoints(JsonNode json) {
        List<RetrievalRecord> records = new ArrayList<>();
        JsonNode points = json.path("result").path("points");
        for (JsonNode point : points) {
            JsonNode payload = point.path("payload");
            String title = payload.path("doc_title").asText("");
            if (title.isBlank()) {
                title = payload.path("file_name").asText("");
            }
            JsonNode page = payload.get("page_number");
            records.add(RetrievalRecord.builder()
                    .documentId(payload.path("doc_id").asText(point.path("id").asText()))
                    .title(title)
                    .content(payload.path("content").asText(""))
                    .page(page != null && page.canConvertToInt() ? page.asInt() : null)
                    .score(point.path("score").asDouble(0.0))
                    .build());
        }
        return records;
    }
}
