package com.z254.gridpulse.client;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Client for a text embedding API.
 */
public interface EmbeddingClient {

    /**
     * Dense embedding of one text.
     */
    Mono<List<Float>> embed(String text);
}
