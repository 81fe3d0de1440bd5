package com.z254.gridpulse.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.gridpulse.config.GridPulseProperties;
import com.z254.gridpulse.exception.GridPulseException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-task event channel for pipeline progress.
 *
 * <p>Every published event is:
 * <ul>
 *   <li>appended to the durable {@link EventLog} before {@link #publish} completes</li>
 *   <li>broadcast to live subscribers on a best-effort basis (slow subscribers may miss events)</li>
 *   <li>delivered to the task's direct queue, if one was attached</li>
 * </ul>
 *
 * <p>Callers publish events for one task sequentially; the bus assigns the sequence
 * numbers shared by the live and durable copies.
 */
@Service
@Slf4j
public class EventBus {

    private final EventLog eventLog;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final GridPulseProperties.EventProperties config;

    // Per-task broadcast sinks
    private final Map<String, Sinks.Many<PipelineEvent>> broadcastSinks = new ConcurrentHashMap<>();

    // Per-task direct queues
    private final Map<String, Sinks.Many<PipelineEvent>> directQueues = new ConcurrentHashMap<>();

    // Deleted tasks, kept until their log would have expired
    private final Map<String, Instant> closedTasks = new ConcurrentHashMap<>();

    public EventBus(EventLog eventLog,
                    ObjectMapper objectMapper,
                    MeterRegistry meterRegistry,
                    GridPulseProperties properties) {
        this.eventLog = eventLog;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.config = properties.getEvents();
        log.info("Initialized EventBus (log capacity {}, ttl {})", config.getMaxLogLength(), config.getTtl());
    }

    /**
     * Publish an event for a task.
     *
     * @param taskId the task id
     * @param event  an unpublished event
     * @return the event as logged and delivered, or empty when the task is closed
     */
    public Mono<PipelineEvent> publish(String taskId, PipelineEvent event) {
        if (isClosed(taskId)) {
            log.debug("Dropping {} event for closed task {}", event.getType(), taskId);
            return Mono.empty();
        }
        return eventLog.nextSequence(taskId)
                .flatMap(seq -> {
                    Stamped stamped = stamp(taskId, seq, event);
                    return eventLog.append(taskId, seq, stamped.json()).thenReturn(stamped.event());
                })
                .doOnNext(stamped -> {
                    meterRegistry.counter("gridpulse.events.published", "type", stamped.getType().name())
                            .increment();
                    deliver(taskId, stamped);
                });
    }

    /**
     * Subscribe to live events for a task. Never blocks the publisher.
     * Completes after the {@code DONE} event or when the task is closed.
     */
    public Flux<PipelineEvent> subscribe(String taskId) {
        return broadcastSink(taskId).asFlux()
                .takeUntil(PipelineEvent::isTerminal)
                .doOnSubscribe(s -> log.debug("Live subscriber attached to task {}", taskId))
                .doFinally(signal -> releaseIfIdle(taskId));
    }

    /**
     * Open the direct queue for a task. Events published after this call are
     * buffered until consumed. Replaces any previously attached queue.
     */
    public Flux<PipelineEvent> attach(String taskId) {
        Sinks.Many<PipelineEvent> queue = Sinks.many().unicast().onBackpressureBuffer();
        Sinks.Many<PipelineEvent> previous = directQueues.put(taskId, queue);
        if (previous != null) {
            previous.tryEmitComplete();
        }
        return queue.asFlux()
                .takeUntil(PipelineEvent::isTerminal)
                .doFinally(signal -> directQueues.remove(taskId, queue));
    }

    /**
     * Read the durable log from a sequence number.
     *
     * @param taskId  the task id
     * @param fromSeq first sequence number to return
     * @return the retained events with {@code seq >= fromSeq}, in order
     */
    public Flux<PipelineEvent> replay(String taskId, long fromSeq) {
        return eventLog.read(taskId, fromSeq)
                .map(this::deserialize);
    }

    /**
     * Replay from a sequence number, then continue with live events without
     * duplicates. The whole retained log is replayed, including the runs of
     * earlier queries. Completes at the end of the log when its last event is
     * {@code DONE}, otherwise after the next live {@code DONE}.
     */
    public Flux<PipelineEvent> resume(String taskId, long fromSeq) {
        return Flux.defer(() -> {
            Sinks.Many<PipelineEvent> buffer = Sinks.many().unicast().onBackpressureBuffer();
            Disposable live = subscribe(taskId)
                    .subscribe(buffer::tryEmitNext, buffer::tryEmitError, buffer::tryEmitComplete);
            AtomicLong lastSeq = new AtomicLong(fromSeq - 1);
            AtomicBoolean endsWithDone = new AtomicBoolean(false);

            Flux<PipelineEvent> logged = replay(taskId, fromSeq)
                    .doOnNext(event -> {
                        lastSeq.set(event.getSeq());
                        endsWithDone.set(event.isTerminal());
                    });
            Flux<PipelineEvent> tail = Flux.defer(() -> endsWithDone.get()
                    ? Flux.<PipelineEvent>empty()
                    : buffer.asFlux()
                            .filter(event -> event.getSeq() > lastSeq.get())
                            .doOnNext(event -> lastSeq.set(event.getSeq()))
                            .takeUntil(PipelineEvent::isTerminal));

            return logged.concatWith(tail)
                    .doFinally(signal -> live.dispose());
        });
    }

    /**
     * Close all live channels of a task. Later publishes for it are dropped;
     * events already logged stay available for replay until they expire.
     */
    public void close(String taskId) {
        closedTasks.put(taskId, Instant.now());
        completeChannels(taskId);
        log.debug("Closed event channels for task {}", taskId);
    }

    public boolean isClosed(String taskId) {
        return closedTasks.containsKey(taskId);
    }

    /**
     * Get statistics about the bus.
     */
    public Map<String, Object> getStats() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("broadcastChannels", broadcastSinks.size());
        stats.put("directQueues", directQueues.size());
        stats.put("closedTasks", closedTasks.size());
        return stats;
    }

    @Scheduled(fixedDelayString = "${gridpulse.events.cleanup-interval:PT10M}")
    public void pruneClosedTasks() {
        Instant cutoff = Instant.now().minus(config.getTtl());
        closedTasks.entrySet().removeIf(entry -> entry.getValue().isBefore(cutoff));
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private void deliver(String taskId, PipelineEvent event) {
        if (isClosed(taskId)) {
            return;
        }
        Sinks.Many<PipelineEvent> broadcast = broadcastSinks.get(taskId);
        if (broadcast != null) {
            Sinks.EmitResult result = broadcast.tryEmitNext(event);
            if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
                log.debug("Broadcast of event {} for task {} failed: {}", event.getSeq(), taskId, result);
            }
        }
        Sinks.Many<PipelineEvent> direct = directQueues.get(taskId);
        if (direct != null) {
            direct.tryEmitNext(event);
        }
        if (event.isTerminal()) {
            completeChannels(taskId);
        }
    }

    private void completeChannels(String taskId) {
        Sinks.Many<PipelineEvent> broadcast = broadcastSinks.remove(taskId);
        if (broadcast != null) {
            broadcast.tryEmitComplete();
        }
        Sinks.Many<PipelineEvent> direct = directQueues.remove(taskId);
        if (direct != null) {
            direct.tryEmitComplete();
        }
    }

    private Sinks.Many<PipelineEvent> broadcastSink(String taskId) {
        return broadcastSinks.computeIfAbsent(taskId, id -> Sinks.many().multicast().directBestEffort());
    }

    private void releaseIfIdle(String taskId) {
        broadcastSinks.computeIfPresent(taskId, (id, sink) -> sink.currentSubscriberCount() == 0 ? null : sink);
    }

    private Stamped stamp(String taskId, long seq, PipelineEvent event) {
        PipelineEvent draft = event.stamped(taskId, seq, event.getPayload());
        try {
            String json = objectMapper.writeValueAsString(draft);
            // The delivered copy is the logged one read back, so live and replayed events are equal
            return new Stamped(objectMapper.readValue(json, PipelineEvent.class), json);
        } catch (JsonProcessingException e) {
            throw new GridPulseException("Failed to serialize " + event.getType() + " event for task " + taskId, e);
        }
    }

    private PipelineEvent deserialize(String json) {
        try {
            return objectMapper.readValue(json, PipelineEvent.class);
        } catch (JsonProcessingException e) {
            throw new GridPulseException("Failed to deserialize logged event", e);
        }
    }

    private record Stamped(PipelineEvent event, String json) {
    }
}
