package com.z254.gridpulse.capability;

import com.z254.gridpulse.domain.model.RetrievalRecord;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Source of passages from indexed reports. Optional.
 */
public interface RetrievalFetcher {

    Mono<List<RetrievalRecord>> retrieve(String query);

    /**
     * Whether retrieval is backed by an index at all.
     */
    default boolean isEnabled() {
        return true;
    }
}
