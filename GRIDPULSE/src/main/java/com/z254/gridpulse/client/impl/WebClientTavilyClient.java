package com.z254.gridpulse.client.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.gridpulse.client.NewsSearchClient;
import com.z254.gridpulse.config.GridPulseProperties;
import com.z254.gridpulse.domain.model.ContextRecord;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * WebClient-based implementation of NewsSearchClient over the Tavily search API.
 */
@Component
@ConditionalOnProperty(prefix = "gridpulse.search", name = "enabled", havingValue = "true")
@Slf4j
public class WebClientTavilyClient implements NewsSearchClient {

    private static final int MAX_DAYS = 365;

    private static final List<Function<String, LocalDate>> DATE_PARSERS = List.of(
            value -> ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toLocalDate(),
            value -> OffsetDateTime.parse(value).toLocalDate(),
            value -> LocalDate.parse(value.substring(0, Math.min(10, value.length()))));

    private final WebClient webClient;
    private final GridPulseProperties.SearchProperties config;

    public WebClientTavilyClient(GridPulseProperties properties) {
        this.config = properties.getSearch();
        this.webClient = WebClient.builder()
                .baseUrl(config.getBaseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    @CircuitBreaker(name = "search")
    @Retry(name = "search")
    public Mono<List<ContextRecord>> search(String query, int days) {
        Map<String, Object> body = Map.of(
                "api_key", config.getApiKey() != null ? config.getApiKey() : "",
                "query", query,
                "topic", "news",
                "search_depth", "basic",
                "max_results", config.getMaxResults(),
                "days", Math.max(1, Math.min(days, MAX_DAYS)));

        return webClient.post()
                .uri("/search")
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(config.getTimeout())
                .map(WebClientTavilyClient::parseResults)
                .doOnSuccess(records -> log.debug("News search returned {} records", records.size()))
                .doOnError(e -> log.error("News search failed: {}", e.getMessage()));
    }

    static List<ContextRecord> parseResults(JsonNode json) {
        List<ContextRecord> records = new ArrayList<>();
        JsonNode results = json.get("results");
        if (results == null) {
            return records;
        }
        for (JsonNode result : results) {
            String url = result.path("url").asText(null);
            records.add(ContextRecord.builder()
                    .title(result.path("title").asText(""))
                    .summary(result.path("content").asText(""))
                    .url(url)
                    .source(host(url))
                    .publishedDate(parseDate(result.path("published_date").asText(null)))
                    .build());
        }
        return records;
    }

    static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (Function<String, LocalDate> parser : DATE_PARSERS) {
            try {
                return parser.apply(value);
            } catch (DateTimeParseException e) {
                log.trace("Date '{}' not in this format: {}", value, e.getMessage());
            }
        }
        log.debug("Unparseable published date '{}'", value);
        return null;
    }

    private static String host(String url) {
        if (url == null) {
            return null;
        }
        try {
            return URI.create(url).getHost();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
