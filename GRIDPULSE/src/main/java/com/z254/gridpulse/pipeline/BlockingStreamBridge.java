package com.z254.gridpulse.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Adapts blocking incremental calls (classifier reasoning, narrator text) to
 * reactive streams.
 *
 * <p>The call runs on the bounded blocking pool. Each increment is pushed into a
 * buffered sink and emitted in order, followed by the final result. Cancelling
 * the subscription interrupts the worker.
 */
@Component
@Slf4j
public class BlockingStreamBridge {

    private final Scheduler blockingScheduler;

    public BlockingStreamBridge(@Qualifier("blockingScheduler") Scheduler blockingScheduler) {
        this.blockingScheduler = blockingScheduler;
    }

    /**
     * Bridge a blocking call.
     *
     * @param name            label used in logs and timeout messages
     * @param call            the blocking call
     * @param perChunkTimeout maximum wait for the first and each following increment; null for none
     * @return chunks in production order, then exactly one result
     */
    public <R> Flux<Increment<R>> bridge(String name, StreamingCall<R> call, Duration perChunkTimeout) {
        Flux<Increment<R>> increments = Flux.create(sink -> {
            Disposable worker;
            try {
                worker = blockingScheduler.schedule(() -> run(name, call, sink));
            } catch (RejectedExecutionException e) {
                log.warn("Blocking pool rejected {}", name);
                sink.error(e);
                return;
            }
            sink.onDispose(worker);
        }, FluxSink.OverflowStrategy.BUFFER);

        if (perChunkTimeout == null) {
            return increments;
        }
        return increments.timeout(perChunkTimeout, Mono.error(() -> new TimeoutException(
                name + " produced nothing for " + perChunkTimeout.toSeconds() + "s")));
    }

    /**
     * Bridge a call whose increments are not needed.
     */
    public <R> Mono<R> call(String name, StreamingCall<R> call, Duration timeout) {
        return bridge(name, call, timeout)
                .filter(Increment::last)
                .next()
                .mapNotNull(increment -> increment.result());
    }

    private <R> void run(String name, StreamingCall<R> call, FluxSink<Increment<R>> sink) {
        try {
            R result = call.call(chunk -> {
                if (chunk != null && !chunk.isEmpty() && !sink.isCancelled()) {
                    sink.next(Increment.ofChunk(chunk));
                }
            });
            sink.next(Increment.ofResult(result));
            sink.complete();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("{} interrupted", name);
            sink.error(e);
        } catch (Exception e) {
            log.debug("{} failed: {}", name, e.getMessage());
            sink.error(e);
        }
    }
}
