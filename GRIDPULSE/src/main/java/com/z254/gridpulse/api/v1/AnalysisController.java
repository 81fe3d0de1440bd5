package com.z254.gridpulse.api.v1;

import com.z254.gridpulse.api.dto.AnalysisRequest;
import com.z254.gridpulse.api.dto.TaskCreatedResponse;
import com.z254.gridpulse.domain.model.AnalysisSession;
import com.z254.gridpulse.event.PipelineEvent;
import com.z254.gridpulse.exception.SessionNotFoundException;
import com.z254.gridpulse.exception.TaskAlreadyRunningException;
import com.z254.gridpulse.pipeline.PipelineOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * REST controller for analysis tasks and their event streams.
 */
@RestController
@RequestMapping("/api/v1/analyses")
@Tag(name = "Analyses", description = "Power-demand analysis tasks")
@Slf4j
public class AnalysisController {

    private final PipelineOrchestrator orchestrator;

    public AnalysisController(PipelineOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    @Operation(summary = "Create analysis", description = "Create a task and run it in the background")
    @ApiResponse(responseCode = "202", description = "Task accepted")
    public Mono<ResponseEntity<TaskCreatedResponse>> createAnalysis(@Valid @RequestBody AnalysisRequest request) {
        return orchestrator.submit(request.getQuery())
                .map(taskId -> ResponseEntity.status(HttpStatus.ACCEPTED).body(TaskCreatedResponse.accepted(taskId)))
                .doOnSuccess(r -> log.info("Accepted analysis task {}", r.getBody().getTaskId()));
    }

    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Create analysis with streaming",
               description = "Create a task and stream every event of its run")
    @ApiResponse(responseCode = "200", description = "Streaming task events")
    public Flux<ServerSentEvent<PipelineEvent>> createAnalysisStreaming(@Valid @RequestBody AnalysisRequest request) {
        return orchestrator.submitAndStream(request.getQuery())
                .map(AnalysisController::toServerSentEvent);
    }

    @PostMapping("/{id}/queries")
    @Operation(summary = "Ask follow-up", description = "Run a follow-up query on an existing task")
    @ApiResponse(responseCode = "202", description = "Follow-up accepted")
    @ApiResponse(responseCode = "404", description = "Task not found")
    @ApiResponse(responseCode = "409", description = "Task is still running")
    public Mono<ResponseEntity<TaskCreatedResponse>> followUp(
            @Parameter(description = "Task ID") @PathVariable String id,
            @Valid @RequestBody AnalysisRequest request) {

        return orchestrator.followUp(id, request.getQuery())
                .map(taskId -> ResponseEntity.status(HttpStatus.ACCEPTED).body(TaskCreatedResponse.accepted(taskId)))
                .onErrorResume(SessionNotFoundException.class,
                        e -> Mono.just(ResponseEntity.notFound().<TaskCreatedResponse>build()))
                .onErrorResume(TaskAlreadyRunningException.class,
                        e -> Mono.just(ResponseEntity.status(HttpStatus.CONFLICT).<TaskCreatedResponse>build()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get analysis", description = "Get the full session snapshot")
    @ApiResponse(responseCode = "200", description = "Task found")
    @ApiResponse(responseCode = "404", description = "Task not found")
    public Mono<ResponseEntity<AnalysisSession>> getAnalysis(
            @Parameter(description = "Task ID") @PathVariable String id) {

        return orchestrator.getSession(id)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete analysis", description = "Stop any active run and remove the task")
    @ApiResponse(responseCode = "204", description = "Task deleted")
    public Mono<ResponseEntity<Void>> deleteAnalysis(
            @Parameter(description = "Task ID") @PathVariable String id) {

        log.info("Deleting analysis task {}", id);
        return orchestrator.delete(id)
                .thenReturn(ResponseEntity.noContent().<Void>build());
    }

    @GetMapping(value = "/{id}/events/live", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Watch live events", description = "Events published from now on")
    @ApiResponse(responseCode = "200", description = "Streaming live events")
    @ApiResponse(responseCode = "404", description = "Task not found")
    public Mono<ResponseEntity<Flux<ServerSentEvent<PipelineEvent>>>> liveEvents(
            @Parameter(description = "Task ID") @PathVariable String id) {

        return orchestrator.getSession(id)
                .map(session -> streamResponse(isFinished(session)
                        ? Flux.<PipelineEvent>empty()
                        : orchestrator.liveEvents(id)))
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Resume events",
               description = "Retained events from a sequence number, then live events without duplicates")
    @ApiResponse(responseCode = "200", description = "Streaming events")
    @ApiResponse(responseCode = "404", description = "Task not found")
    public Mono<ResponseEntity<Flux<ServerSentEvent<PipelineEvent>>>> resumeEvents(
            @Parameter(description = "Task ID") @PathVariable String id,
            @Parameter(description = "First sequence number") @RequestParam(defaultValue = "1") long fromSeq) {

        return orchestrator.getSession(id)
                .map(session -> streamResponse(isFinished(session)
                        ? orchestrator.eventLog(id, fromSeq)
                        : orchestrator.resumeEvents(id, fromSeq)))
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/events/log")
    @Operation(summary = "Read event log", description = "Retained events from a sequence number")
    @ApiResponse(responseCode = "200", description = "Retained events, possibly none")
    public Flux<PipelineEvent> eventLog(
            @Parameter(description = "Task ID") @PathVariable String id,
            @Parameter(description = "First sequence number") @RequestParam(defaultValue = "1") long fromSeq) {

        return orchestrator.eventLog(id, fromSeq);
    }

    private boolean isFinished(AnalysisSession session) {
        return session.isTerminal() && !orchestrator.isRunning(session.getId());
    }

    private static ResponseEntity<Flux<ServerSentEvent<PipelineEvent>>> streamResponse(Flux<PipelineEvent> events) {
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .body(events.map(AnalysisController::toServerSentEvent));
    }

    private static ServerSentEvent<PipelineEvent> toServerSentEvent(PipelineEvent event) {
        return ServerSentEvent.<PipelineEvent>builder()
                .id(String.valueOf(event.getSeq()))
                .event(event.getType().name().toLowerCase(Locale.ROOT))
                .data(event)
                .build();
    }
}
