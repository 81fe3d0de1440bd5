package com.z254.gridpulse.capability.impl;

import com.z254.gridpulse.capability.RetrievalFetcher;
import com.z254.gridpulse.client.EmbeddingClient;
import com.z254.gridpulse.client.ReportIndexClient;
import com.z254.gridpulse.config.GridPulseProperties;
import com.z254.gridpulse.domain.model.RetrievalRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Report passages from the vector index: the query is embedded, then the
 * nearest chunks are returned, blank ones dropped.
 */
@Component
@ConditionalOnProperty(prefix = "gridpulse.retrieval", name = "enabled", havingValue = "true")
@Slf4j
public class IndexedReportFetcher implements RetrievalFetcher {

    private final EmbeddingClient embeddingClient;
    private final ReportIndexClient indexClient;
    private final int topK;

    public IndexedReportFetcher(EmbeddingClient embeddingClient,
                                ReportIndexClient indexClient,
                                GridPulseProperties properties) {
        this.embeddingClient = embeddingClient;
        this.indexClient = indexClient;
        this.topK = properties.getRetrieval().getTopK();
    }

    @Override
    public Mono<List<RetrievalRecord>> retrieve(String query) {
        if (query == null || query.isBlank()) {
            return Mono.just(List.of());
        }
        return embeddingClient.embed(query)
                .flatMap(vector -> indexClient.search(vector, topK))
                .map(records -> records.stream()
                        .filter(record -> record.getContent() != null && !record.getContent().isBlank())
                        .toList())
                .doOnNext(records -> log.debug("Retrieved {} report passages", records.size()));
    }
}
