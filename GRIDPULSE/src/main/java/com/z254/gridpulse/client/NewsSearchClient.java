package com.z254.gridpulse.client;

import com.z254.gridpulse.domain.model.ContextRecord;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Client for a web news search API.
 */
public interface NewsSearchClient {

    /**
     * Search news published in the last {@code days} days.
     */
    Mono<List<ContextRecord>> search(String query, int days);
}
