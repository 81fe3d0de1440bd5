package com.z254.gridpulse.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.gridpulse.config.GridPulseProperties;
import com.z254.gridpulse.config.RedisConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EventBus} over the in-memory event log.
 */
class EventBusTest {

    private static final String TASK = "task-1";

    private GridPulseProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        properties = new GridPulseProperties();
        properties.getEvents().setMaxLogLength(50);
        ObjectMapper objectMapper = new RedisConfig().objectMapper();
        meterRegistry = new SimpleMeterRegistry();
        eventBus = new EventBus(new InMemoryEventLog(properties), objectMapper, meterRegistry, properties);
    }

    private void publish(PipelineEvent... events) {
        Flux.fromArray(events)
                .concatMap(event -> eventBus.publish(TASK, event))
                .blockLast(Duration.ofSeconds(5));
    }

    @Nested
    @DisplayName("Publishing")
    class Publishing {

        @Test
        @DisplayName("assigns consecutive sequence numbers starting at 1")
        void assignsSequenceNumbers() {
            // Given / When
            publish(PipelineEvent.stepStart(1, "fetch_data"),
                    PipelineEvent.stepComplete(1, "fetch_data", "ok"),
                    PipelineEvent.stepStart(2, "analyze_sentiment"));

            // Then
            StepVerifier.create(eventBus.replay(TASK, 1).map(PipelineEvent::getSeq))
                    .expectNext(1L, 2L, 3L)
                    .verifyComplete();
        }

        @Test
        @DisplayName("stamps task id and keeps the payload")
        void stampsTaskId() {
            // When
            PipelineEvent published = eventBus.publish(TASK, PipelineEvent.thinking("looking at the query"))
                    .block(Duration.ofSeconds(5));

            // Then
            assertThat(published).isNotNull();
            assertThat(published.getTaskId()).isEqualTo(TASK);
            assertThat(published.getSeq()).isEqualTo(1L);
            assertThat(published.payloadString("content")).isEqualTo("looking at the query");
            assertThat(meterRegistry.counter("gridpulse.events.published", "type", "THINKING").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("keeps sequences independent per task")
        void sequencesPerTask() {
            // When
            eventBus.publish("a", PipelineEvent.thinking("x")).block(Duration.ofSeconds(5));
            eventBus.publish("a", PipelineEvent.thinking("y")).block(Duration.ofSeconds(5));
            PipelineEvent other = eventBus.publish("b", PipelineEvent.thinking("z")).block(Duration.ofSeconds(5));

            // Then
            assertThat(other).isNotNull();
            assertThat(other.getSeq()).isEqualTo(1L);
        }

        @Test
        @DisplayName("drops events for a closed task")
        void dropsForClosedTask() {
            // Given
            publish(PipelineEvent.thinking("before close"));
            eventBus.close(TASK);

            // When / Then
            StepVerifier.create(eventBus.publish(TASK, PipelineEvent.thinking("after close")))
                    .verifyComplete();
            StepVerifier.create(eventBus.replay(TASK, 1))
                    .expectNextCount(1)
                    .verifyComplete();
            assertThat(eventBus.isClosed(TASK)).isTrue();
        }
    }

    @Nested
    @DisplayName("Replay")
    class Replay {

        @Test
        @DisplayName("returns only events at or after the requested sequence")
        void replayFromSequence() {
            // Given
            publish(PipelineEvent.thinking("1"), PipelineEvent.thinking("2"),
                    PipelineEvent.thinking("3"), PipelineEvent.thinking("4"));

            // When / Then
            StepVerifier.create(eventBus.replay(TASK, 3).map(e -> e.payloadString("content")))
                    .expectNext("3", "4")
                    .verifyComplete();
        }

        @Test
        @DisplayName("returns nothing for an unknown task")
        void replayUnknownTask() {
            StepVerifier.create(eventBus.replay("missing", 1))
                    .verifyComplete();
        }

        @Test
        @DisplayName("drops the oldest entries beyond the log capacity")
        void boundedLog() {
            // Given
            properties.getEvents().setMaxLogLength(3);
            publish(PipelineEvent.thinking("1"), PipelineEvent.thinking("2"), PipelineEvent.thinking("3"),
                    PipelineEvent.thinking("4"), PipelineEvent.thinking("5"));

            // When / Then
            StepVerifier.create(eventBus.replay(TASK, 1).map(PipelineEvent::getSeq))
                    .expectNext(3L, 4L, 5L)
                    .verifyComplete();
        }

        @Test
        @DisplayName("replayed events equal the ones delivered live")
        void replayEqualsLive() {
            // Given
            Flux<PipelineEvent> live = eventBus.subscribe(TASK).replay().autoConnect(0);

            // When
            publish(PipelineEvent.data(1, EventType.DataType.FORECAST_METRICS, Map.of("mape", 4.2)),
                    PipelineEvent.done("completed", null));

            // Then
            List<PipelineEvent> delivered = live.collectList().block(Duration.ofSeconds(5));
            List<PipelineEvent> replayed = eventBus.replay(TASK, 1).collectList().block(Duration.ofSeconds(5));
            assertThat(delivered).isEqualTo(replayed);
        }
    }

    @Nested
    @DisplayName("Live delivery")
    class LiveDelivery {

        @Test
        @DisplayName("live subscribers complete after DONE")
        void liveCompletesAfterDone() {
            StepVerifier.create(eventBus.subscribe(TASK).map(PipelineEvent::getType))
                    .then(() -> publish(PipelineEvent.thinking("x"), PipelineEvent.done("completed", null)))
                    .expectNext(EventType.THINKING, EventType.DONE)
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("live subscribers only see events published after they attach")
        void liveSeesOnlyNewEvents() {
            // Given
            publish(PipelineEvent.thinking("old"));

            // When / Then
            StepVerifier.create(eventBus.subscribe(TASK).map(e -> e.payloadString("content")))
                    .then(() -> publish(PipelineEvent.thinking("new")))
                    .expectNext("new")
                    .thenCancel()
                    .verify(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("direct queue buffers events until consumed")
        void directQueueBuffers() {
            // Given
            Flux<PipelineEvent> direct = eventBus.attach(TASK);

            // When
            publish(PipelineEvent.stepStart(1, "answer"), PipelineEvent.stepComplete(1, "answer", null),
                    PipelineEvent.done("completed", null));

            // Then
            StepVerifier.create(direct.map(PipelineEvent::getSeq))
                    .expectNext(1L, 2L, 3L)
                    .verifyComplete();
        }

        @Test
        @DisplayName("closing a task completes its live subscribers")
        void closeCompletesSubscribers() {
            StepVerifier.create(eventBus.subscribe(TASK))
                    .then(() -> eventBus.close(TASK))
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));
        }
    }

    @Nested
    @DisplayName("Resume")
    class Resume {

        @Test
        @DisplayName("continues from the log into live events without duplicates")
        void resumeWithoutDuplicates() {
            // Given
            publish(PipelineEvent.thinking("1"), PipelineEvent.thinking("2"), PipelineEvent.thinking("3"));

            // When / Then
            StepVerifier.create(eventBus.resume(TASK, 2).map(PipelineEvent::getSeq))
                    .expectNext(2L, 3L)
                    .then(() -> publish(PipelineEvent.thinking("4"), PipelineEvent.done("completed", null)))
                    .expectNext(4L, 5L)
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("completes immediately when the log already holds DONE")
        void resumeFinishedTask() {
            // Given
            publish(PipelineEvent.thinking("1"), PipelineEvent.done("completed", null));

            // When / Then
            StepVerifier.create(eventBus.resume(TASK, 1).map(PipelineEvent::getType))
                    .expectNext(EventType.THINKING, EventType.DONE)
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("sees events published while the log is being read")
        void resumeConcurrentPublish() {
            // Given
            publish(PipelineEvent.thinking("1"));
            Mono<List<Long>> resumed = eventBus.resume(TASK, 1)
                    .map(PipelineEvent::getSeq)
                    .collectList();

            // When
            StepVerifier.create(resumed)
                    .then(() -> publish(PipelineEvent.thinking("2"), PipelineEvent.done("completed", null)))
                    // Then
                    .assertNext(seqs -> assertThat(seqs).containsExactly(1L, 2L, 3L))
                    .verifyComplete();
        }

        @Test
        @DisplayName("replays past the DONE of an earlier query")
        void resumeAcrossFollowUp() {
            // Given: a first run and a finished follow-up in the same log
            publish(PipelineEvent.thinking("first"), PipelineEvent.done("completed", null),
                    PipelineEvent.thinking("second"), PipelineEvent.done("completed", null));

            // When / Then
            StepVerifier.create(eventBus.resume(TASK, 0).map(PipelineEvent::getSeq))
                    .expectNext(1L, 2L, 3L, 4L)
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("tails a running follow-up until its own DONE")
        void resumeRunningFollowUp() {
            // Given
            publish(PipelineEvent.thinking("first"), PipelineEvent.done("completed", null),
                    PipelineEvent.thinking("second"));

            // When / Then
            StepVerifier.create(eventBus.resume(TASK, 1).map(PipelineEvent::getSeq))
                    .expectNext(1L, 2L, 3L)
                    .then(() -> publish(PipelineEvent.done("completed", null)))
                    .expectNext(4L)
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));
        }
    }
}
