package com.z254.gridpulse.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.gridpulse.config.GridPulseProperties;
import com.z254.gridpulse.domain.model.AnalysisSession;
import com.z254.gridpulse.exception.GridPulseException;
import com.z254.gridpulse.exception.SessionNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Redis-backed {@link SessionStore}. Each session is one JSON string written with
 * {@code SET ... EX ttl}.
 */
@Repository
@ConditionalOnProperty(prefix = "gridpulse.storage", name = "type", havingValue = "redis", matchIfMissing = true)
@Slf4j
public class RedisSessionStore implements SessionStore {

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final GridPulseProperties.SessionProperties config;

    public RedisSessionStore(
            ReactiveRedisTemplate<String, String> redisTemplate,
            ObjectMapper objectMapper,
            GridPulseProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.config = properties.getSession();
    }

    @Override
    public Mono<String> create(AnalysisSession initial) {
        if (initial.getId() == null || initial.getId().isBlank()) {
            initial.setId(UUID.randomUUID().toString());
        }
        if (initial.getCreatedAt() == null) {
            initial.setCreatedAt(Instant.now());
        }
        return write(initial)
                .doOnSuccess(saved -> log.debug("Created session {}", saved.getId()))
                .map(AnalysisSession::getId);
    }

    @Override
    public Mono<AnalysisSession> get(String id) {
        return redisTemplate.opsForValue()
                .get(key(id))
                .map(this::deserialize);
    }

    @Override
    public Mono<AnalysisSession> mutate(String id, Consumer<AnalysisSession> mutation) {
        return get(id)
                .switchIfEmpty(Mono.error(() -> new SessionNotFoundException(id)))
                .flatMap(session -> {
                    mutation.accept(session);
                    return write(session);
                });
    }

    @Override
    public Mono<Boolean> delete(String id) {
        return redisTemplate.delete(key(id))
                .map(removed -> removed > 0)
                .doOnSuccess(removed -> log.debug("Deleted session {}: {}", id, removed));
    }

    private Mono<AnalysisSession> write(AnalysisSession session) {
        session.setUpdatedAt(Instant.now());
        String json = serialize(session);
        return redisTemplate.opsForValue()
                .set(key(session.getId()), json, config.getTtl())
                .thenReturn(session);
    }

    private String key(String id) {
        return config.getRedisKeyPrefix() + id;
    }

    private String serialize(AnalysisSession session) {
        try {
            return objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new GridPulseException("Failed to serialize session " + session.getId(), e);
        }
    }

    private AnalysisSession deserialize(String json) {
        try {
            return objectMapper.readValue(json, AnalysisSession.class);
        } catch (JsonProcessingException e) {
            throw new GridPulseException("Failed to deserialize session", e);
        }
    }
}
