package com.z254.gridpulse.pipeline;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class BlockingStreamBridgeTest {

    private Scheduler scheduler;
    private BlockingStreamBridge bridge;

    @BeforeEach
    void setUp() {
        scheduler = Schedulers.newBoundedElastic(2, 16, "bridge-test");
        bridge = new BlockingStreamBridge(scheduler);
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    @Test
    @DisplayName("emits chunks in order followed by the result")
    void chunksThenResult() {
        StreamingCall<Integer> call = onChunk -> {
            onChunk.accept("Peak ");
            onChunk.accept("demand ");
            onChunk.accept("");
            onChunk.accept("rises.");
            return 3;
        };

        StepVerifier.create(bridge.bridge("narrator", call, Duration.ofSeconds(2)))
                .expectNext(Increment.ofChunk("Peak "), Increment.ofChunk("demand "), Increment.ofChunk("rises."))
                .expectNext(Increment.ofResult(3))
                .verifyComplete();
    }

    @Test
    @DisplayName("call() keeps only the final result")
    void callReturnsResult() {
        StepVerifier.create(bridge.call("classifier", onChunk -> {
                    onChunk.accept("thinking");
                    return "FORECAST";
                }, Duration.ofSeconds(2)))
                .expectNext("FORECAST")
                .verifyComplete();
    }

    @Test
    @DisplayName("propagates the call's failure")
    void propagatesFailure() {
        StepVerifier.create(bridge.bridge("narrator", onChunk -> {
                    onChunk.accept("partial");
                    throw new IOException("connection reset");
                }, null))
                .expectNext(Increment.ofChunk("partial"))
                .expectErrorMatches(e -> e instanceof IOException && e.getMessage().equals("connection reset"))
                .verify(Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("fails with a timeout when no increment arrives in time")
    void perChunkTimeout() {
        StepVerifier.create(bridge.bridge("narrator", onChunk -> {
                    Thread.sleep(5_000);
                    return "late";
                }, Duration.ofMillis(100)))
                .expectErrorMatches(e -> e instanceof TimeoutException && e.getMessage().startsWith("narrator"))
                .verify(Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("cancelling the subscription interrupts the worker")
    void cancellationInterruptsWorker() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        StreamingCall<String> call = onChunk -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return "never";
        };

        Disposable subscription = bridge.bridge("narrator", call, null).subscribe();
        assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();

        subscription.dispose();

        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }
}
