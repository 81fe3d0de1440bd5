package com.z254.gridpulse.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.gridpulse.config.GridPulseProperties;
import com.z254.gridpulse.domain.model.AnalysisSession;
import com.z254.gridpulse.exception.GridPulseException;
import com.z254.gridpulse.exception.SessionNotFoundException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * In-memory {@link SessionStore} implementation for local development.
 * Sessions are held as JSON so callers never share instances with the store.
 */
@Repository
@ConditionalOnProperty(prefix = "gridpulse.storage", name = "type", havingValue = "memory")
public class InMemorySessionStore implements SessionStore {

    private final Map<String, Entry> store = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;
    private final GridPulseProperties.SessionProperties config;
    private final Clock clock;

    @Autowired
    public InMemorySessionStore(ObjectMapper objectMapper, GridPulseProperties properties) {
        this(objectMapper, properties, Clock.systemUTC());
    }

    InMemorySessionStore(ObjectMapper objectMapper, GridPulseProperties properties, Clock clock) {
        this.objectMapper = objectMapper;
        this.config = properties.getSession();
        this.clock = clock;
    }

    @Override
    public Mono<String> create(AnalysisSession initial) {
        if (initial.getId() == null || initial.getId().isBlank()) {
            initial.setId(UUID.randomUUID().toString());
        }
        if (initial.getCreatedAt() == null) {
            initial.setCreatedAt(clock.instant());
        }
        put(initial);
        return Mono.just(initial.getId());
    }

    @Override
    public Mono<AnalysisSession> get(String id) {
        return Mono.fromCallable(() -> {
            Entry entry = live(id);
            return entry == null ? null : deserialize(entry.json());
        });
    }

    @Override
    public Mono<AnalysisSession> mutate(String id, Consumer<AnalysisSession> mutation) {
        return Mono.fromCallable(() -> {
            Entry entry = live(id);
            if (entry == null) {
                throw new SessionNotFoundException(id);
            }
            AnalysisSession session = deserialize(entry.json());
            mutation.accept(session);
            put(session);
            return session;
        });
    }

    @Override
    public Mono<Boolean> delete(String id) {
        return Mono.just(store.remove(id) != null);
    }

    private Entry live(String id) {
        Entry entry = store.get(id);
        if (entry != null && !entry.expiresAt().isAfter(clock.instant())) {
            store.remove(id, entry);
            return null;
        }
        return entry;
    }

    private void put(AnalysisSession session) {
        Instant now = clock.instant();
        session.setUpdatedAt(now);
        store.put(session.getId(), new Entry(serialize(session), now.plus(config.getTtl())));
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

    private record Entry(String json, Instant expiresAt) {
    }
}
