package com.z254.gridpulse.client;

import com.z254.gridpulse.domain.model.RetrievalRecord;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Client for the vector index of report chunks.
 */
public interface ReportIndexClient {

    /**
     * Nearest chunks to a query vector, best first.
     *
     * @param vector query embedding
     * @param limit  maximum number of chunks
     */
    Mono<List<RetrievalRecord>> search(List<Float> vector, int limit);
}
