package com.z254.gridpulse.event;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Bounded, TTL'd append-only log of serialized events, one per task.
 * On overflow the oldest entries are dropped.
 */
public interface EventLog {

    /**
     * Allocate the next sequence number for a task, starting at 1.
     */
    Mono<Long> nextSequence(String taskId);

    /**
     * Append a serialized event under its sequence number.
     */
    Mono<Void> append(String taskId, long seq, String json);

    /**
     * Read the retained entries with sequence number {@code >= fromSeq}, in order.
     */
    Flux<String> read(String taskId, long fromSeq);
}
