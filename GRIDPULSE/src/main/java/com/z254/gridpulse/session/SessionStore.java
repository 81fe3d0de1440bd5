package com.z254.gridpulse.session;

import com.z254.gridpulse.domain.model.AnalysisSession;
import reactor.core.publisher.Mono;

import java.util.function.Consumer;

/**
 * Durable key-value store of analysis sessions with a retention TTL.
 * Every write refreshes the TTL.
 */
public interface SessionStore {

    /**
     * Persist a new session.
     *
     * @param initial the initial session; an id is assigned when missing
     * @return the session id
     */
    Mono<String> create(AnalysisSession initial);

    /**
     * Find a session by id.
     *
     * @param id the session id
     * @return the session, or empty when it does not exist or has expired
     */
    Mono<AnalysisSession> get(String id);

    /**
     * Read-modify-write a session. This is the only way results are merged.
     * Not atomic across concurrent mutators; callers keep one writer per task.
     *
     * @param id       the session id
     * @param mutation changes to apply
     * @return the stored session, or {@link com.z254.gridpulse.exception.SessionNotFoundException}
     */
    Mono<AnalysisSession> mutate(String id, Consumer<AnalysisSession> mutation);

    /**
     * Delete a session.
     *
     * @param id the session id
     * @return true if a session was removed
     */
    Mono<Boolean> delete(String id);
}
