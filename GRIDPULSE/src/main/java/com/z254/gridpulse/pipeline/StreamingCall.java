package com.z254.gridpulse.pipeline;

import java.util.function.Consumer;

/**
 * A blocking call that reports text increments while it runs.
 *
 * @param <R> the final result type
 */
@FunctionalInterface
public interface StreamingCall<R> {

    R call(Consumer<String> onChunk) throws Exception;
}
