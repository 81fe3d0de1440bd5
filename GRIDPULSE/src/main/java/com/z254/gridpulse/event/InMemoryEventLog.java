package com.z254.gridpulse.event;

import com.z254.gridpulse.config.GridPulseProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory event log for local development: a bounded ring per task that
 * expires as a whole once the TTL passes without writes.
 */
@Component
@ConditionalOnProperty(prefix = "gridpulse.storage", name = "type", havingValue = "memory")
public class InMemoryEventLog implements EventLog {

    private final Map<String, TaskLog> logs = new ConcurrentHashMap<>();
    private final GridPulseProperties.EventProperties config;
    private final Clock clock;

    @Autowired
    public InMemoryEventLog(GridPulseProperties properties) {
        this(properties, Clock.systemUTC());
    }

    InMemoryEventLog(GridPulseProperties properties, Clock clock) {
        this.config = properties.getEvents();
        this.clock = clock;
    }

    @Override
    public Mono<Long> nextSequence(String taskId) {
        return Mono.fromCallable(() -> {
            TaskLog taskLog = taskLog(taskId);
            synchronized (taskLog) {
                taskLog.touch(clock.instant());
                return ++taskLog.lastSeq;
            }
        });
    }

    @Override
    public Mono<Void> append(String taskId, long seq, String json) {
        return Mono.fromRunnable(() -> {
            TaskLog taskLog = taskLog(taskId);
            synchronized (taskLog) {
                taskLog.entries.addLast(new Entry(seq, json));
                while (taskLog.entries.size() > config.getMaxLogLength()) {
                    taskLog.entries.removeFirst();
                }
                taskLog.touch(clock.instant());
            }
        });
    }

    @Override
    public Flux<String> read(String taskId, long fromSeq) {
        return Flux.defer(() -> {
            TaskLog taskLog = logs.get(taskId);
            if (taskLog == null || taskLog.isExpired(clock.instant())) {
                return Flux.empty();
            }
            List<String> result = new ArrayList<>();
            synchronized (taskLog) {
                for (Entry entry : taskLog.entries) {
                    if (entry.seq() >= fromSeq) {
                        result.add(entry.json());
                    }
                }
            }
            return Flux.fromIterable(result);
        });
    }

    private TaskLog taskLog(String taskId) {
        Instant now = clock.instant();
        return logs.compute(taskId, (id, existing) ->
                existing == null || existing.isExpired(now) ? new TaskLog(now.plus(config.getTtl())) : existing);
    }

    private final class TaskLog {
        private final Deque<Entry> entries = new ArrayDeque<>();
        private long lastSeq;
        private Instant expiresAt;

        private TaskLog(Instant expiresAt) {
            this.expiresAt = expiresAt;
        }

        private void touch(Instant now) {
            expiresAt = now.plus(config.getTtl());
        }

        private boolean isExpired(Instant now) {
            return !expiresAt.isAfter(now);
        }
    }

    private record Entry(long seq, String json) {
    }
}
