package com.z254.gridpulse.pipeline;

/**
 * One element of a bridged stream: a text chunk, or the final result.
 * The result is always the last element.
 */
public record Increment<R>(String chunk, R result, boolean last) {

    public static <R> Increment<R> ofChunk(String chunk) {
        return new Increment<>(chunk, null, false);
    }

    public static <R> Increment<R> ofResult(R result) {
        return new Increment<>(null, result, true);
    }

    public boolean isChunk() {
        return !last;
    }
}
