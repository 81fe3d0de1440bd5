package com.z254.gridpulse.health;

import com.z254.gridpulse.config.GridPulseProperties;
import com.z254.gridpulse.event.EventBus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Health indicator for GRIDPULSE service.
 * Reports storage reachability, active runs and event channel counts.
 */
@Component
@Slf4j
public class GridPulseHealthIndicator implements ReactiveHealthIndicator {

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final GridPulseProperties properties;
    private final EventBus eventBus;

    private final AtomicInteger activeRunCount = new AtomicInteger(0);
    private final AtomicLong totalRuns = new AtomicLong(0);
    private final AtomicLong failedRuns = new AtomicLong(0);

    public GridPulseHealthIndicator(
            ReactiveRedisTemplate<String, String> redisTemplate,
            GridPulseProperties properties,
            EventBus eventBus) {
        this.redisTemplate = redisTemplate;
        this.properties = properties;
        this.eventBus = eventBus;
    }

    @Override
    public Mono<Health> health() {
        boolean redisBacked = properties.getStorage().getType() == GridPulseProperties.StorageType.REDIS;
        Mono<Boolean> storageUp = redisBacked ? checkRedisHealth() : Mono.just(true);
        return storageUp
                .map(up -> {
                    Health.Builder builder = up ? Health.up() : Health.down();

                    builder.withDetail("storage", properties.getStorage().getType().name());
                    if (redisBacked) {
                        builder.withDetail("redis", up ? "UP" : "DOWN");
                    }
                    builder.withDetail("activeRuns", activeRunCount.get());
                    builder.withDetail("totalRuns", totalRuns.get());
                    builder.withDetail("failedRuns", failedRuns.get());
                    builder.withDetail("eventBus", eventBus.getStats());
                    builder.withDetail("llm.enabled", properties.getLlm().isEnabled());
                    builder.withDetail("search.enabled", properties.getSearch().isEnabled());
                    builder.withDetail("retrieval.enabled", properties.getRetrieval().isEnabled());

                    return builder.build();
                })
                .onErrorResume(e -> {
                    log.error("Health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }

    private Mono<Boolean> checkRedisHealth() {
        return redisTemplate.getConnectionFactory()
                .getReactiveConnection()
                .ping()
                .map(response -> "PONG".equals(response))
                .timeout(Duration.ofSeconds(5))
                .onErrorReturn(false);
    }

    // Called by the orchestrator

    public void runStarted() {
        activeRunCount.incrementAndGet();
        totalRuns.incrementAndGet();
    }

    public void runFinished(boolean success) {
        activeRunCount.decrementAndGet();
        if (!success) {
            failedRuns.incrementAndGet();
        }
    }

    public int getActiveRunCount() {
        return activeRunCount.get();
    }
}
