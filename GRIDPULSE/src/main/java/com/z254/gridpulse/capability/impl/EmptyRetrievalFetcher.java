package com.z254.gridpulse.capability.impl;

import com.z254.gridpulse.capability.RetrievalFetcher;
import com.z254.gridpulse.domain.model.RetrievalRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Retrieval fetcher for deployments without a report index.
 */
@Component
@ConditionalOnProperty(prefix = "gridpulse.retrieval", name = "enabled", havingValue = "false", matchIfMissing = true)
public class EmptyRetrievalFetcher implements RetrievalFetcher {

    @Override
    public Mono<List<RetrievalRecord>> retrieve(String query) {
        return Mono.just(List.of());
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
