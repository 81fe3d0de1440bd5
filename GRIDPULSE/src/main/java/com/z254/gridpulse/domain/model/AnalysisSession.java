package com.z254.gridpulse.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * State of one analysis task: status, steps, accumulated results and the
 * conversation it belongs to.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisSession {

    private String id;

    private SessionStatus status;

    /**
     * Query driving the current run.
     */
    private String query;

    /**
     * Template chosen at classification, null until classified.
     */
    private StepTemplate template;

    private String regionCode;

    private String regionName;

    @Builder.Default
    private List<AnalysisStep> steps = new ArrayList<>();

    // ---- results ----

    @Builder.Default
    private List<TimeSeriesPoint> originalSeries = new ArrayList<>();

    @Builder.Default
    private List<TimeSeriesPoint> forecastSeries = new ArrayList<>();

    private Map<String, Double> forecastMetrics;

    private String forecastModel;

    @Builder.Default
    private List<ContextRecord> contextRecords = new ArrayList<>();

    @Builder.Default
    private List<RetrievalRecord> retrievalRecords = new ArrayList<>();

    private InfluenceResult influence;

    @Builder.Default
    private List<Zone> zones = new ArrayList<>();

    @Builder.Default
    private List<ChangePoint> changePoints = new ArrayList<>();

    private String sentimentSummary;

    private String narrative;

    // ---- conversation ----

    @Builder.Default
    private List<ConversationTurn> conversationHistory = new ArrayList<>();

    private String errorMessage;

    private Instant createdAt;

    private Instant updatedAt;

    public enum SessionStatus {
        PENDING,
        PROCESSING,
        COMPLETED,
        ERROR
    }

    /**
     * Create a pending session for a first query.
     */
    public static AnalysisSession create(String id, String query) {
        Instant now = Instant.now();
        return AnalysisSession.builder()
                .id(id)
                .status(SessionStatus.PENDING)
                .query(query)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * Original series followed by the forecast series.
     */
    @JsonIgnore
    public List<TimeSeriesPoint> getFullSeries() {
        return TimeSeriesPoint.concat(originalSeries, forecastSeries);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status == SessionStatus.COMPLETED || status == SessionStatus.ERROR;
    }

    public void applyTemplate(StepTemplate template) {
        this.template = template;
        this.steps = template.newSteps();
    }

    public AnalysisStep step(int stepId) {
        return steps.stream()
                .filter(step -> step.getId() == stepId)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown step " + stepId + " for session " + id));
    }

    public void updateStep(int stepId, AnalysisStep.StepStatus status, String message) {
        AnalysisStep step = step(stepId);
        step.setStatus(status);
        step.setMessage(message);
    }

    /**
     * Mark the run complete; every step that did not fail is completed.
     */
    public void markCompleted() {
        status = SessionStatus.COMPLETED;
        for (AnalysisStep step : steps) {
            if (step.getStatus() != AnalysisStep.StepStatus.ERROR) {
                step.setStatus(AnalysisStep.StepStatus.COMPLETED);
            }
        }
    }

    public void markError(String message) {
        status = SessionStatus.ERROR;
        errorMessage = message;
    }

    /**
     * Append a turn, keeping only the last {@code limit} turns.
     */
    public void appendTurn(ConversationTurn turn, int limit) {
        List<ConversationTurn> history = new ArrayList<>(conversationHistory);
        history.add(turn);
        if (history.size() > limit) {
            history = new ArrayList<>(history.subList(history.size() - limit, history.size()));
        }
        conversationHistory = history;
    }

    /**
     * Prepare for a follow-up query: results, steps and status are cleared,
     * identity and conversation history are kept.
     */
    public void resetForNewQuery(String newQuery) {
        status = SessionStatus.PENDING;
        query = newQuery;
        template = null;
        regionCode = null;
        regionName = null;
        steps = new ArrayList<>();
        originalSeries = new ArrayList<>();
        forecastSeries = new ArrayList<>();
        forecastMetrics = null;
        forecastModel = null;
        contextRecords = new ArrayList<>();
        retrievalRecords = new ArrayList<>();
        influence = null;
        zones = new ArrayList<>();
        changePoints = new ArrayList<>();
        sentimentSummary = null;
        narrative = null;
        errorMessage = null;
    }
}
