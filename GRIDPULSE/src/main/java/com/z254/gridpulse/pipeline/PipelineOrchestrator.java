package com.z254.gridpulse.pipeline;

import com.z254.gridpulse.domain.model.AnalysisSession;
import com.z254.gridpulse.event.PipelineEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Entry point for analysis tasks: creation, follow-up queries, event access and deletion.
 * A task has at most one active run at a time.
 */
public interface PipelineOrchestrator {

    /**
     * Create a task for a query and start its run in the background.
     *
     * @return the new task id
     */
    Mono<String> submit(String query);

    /**
     * Create a task and stream its events directly. The stream sees every event
     * of the run and completes after {@code DONE}.
     */
    Flux<PipelineEvent> submitAndStream(String query);

    /**
     * Run a follow-up query on an existing task. Results are reset, the
     * conversation history is kept.
     *
     * @return the task id, {@link com.z254.gridpulse.exception.SessionNotFoundException} when the
     * task does not exist, {@link com.z254.gridpulse.exception.TaskAlreadyRunningException} while
     * a run is active
     */
    Mono<String> followUp(String taskId, String query);

    Mono<AnalysisSession> getSession(String taskId);

    /**
     * Stop any active run, close the task's channels and remove its session.
     *
     * @return true if a session was removed
     */
    Mono<Boolean> delete(String taskId);

    /**
     * Live events from now on.
     */
    Flux<PipelineEvent> liveEvents(String taskId);

    /**
     * Retained events from {@code fromSeq}, then live events without duplicates.
     */
    Flux<PipelineEvent> resumeEvents(String taskId, long fromSeq);

    /**
     * Retained events from {@code fromSeq}; completes at the end of the log.
     */
    Flux<PipelineEvent> eventLog(String taskId, long fromSeq);

    boolean isRunning(String taskId);
}
