package com.z254.gridpulse.pipeline.impl;

import com.z254.gridpulse.capability.Classification;
import com.z254.gridpulse.domain.model.ChangePoint;
import com.z254.gridpulse.domain.model.ContextRecord;
import com.z254.gridpulse.domain.model.ConversationTurn;
import com.z254.gridpulse.domain.model.InfluenceResult;
import com.z254.gridpulse.domain.model.RegionInfo;
import com.z254.gridpulse.domain.model.RetrievalRecord;
import com.z254.gridpulse.domain.model.StepTemplate;
import com.z254.gridpulse.domain.model.TimeSeriesPoint;
import com.z254.gridpulse.domain.model.WeatherObservation;
import com.z254.gridpulse.domain.model.Zone;
import lombok.Getter;
import lombok.Setter;

import java.util.List;
import java.util.Map;

/**
 * Working state of one run. Owned by the run; steps read what earlier steps produced.
 */
@Getter
@Setter
class RunContext {

    private final String taskId;
    private final String query;
    private final List<ConversationTurn> history;
    private final boolean followUp;
    private final long startedAtNanos = System.nanoTime();

    private Classification classification;
    private StepTemplate template;
    private RegionInfo region;
    private int horizon;

    private List<TimeSeriesPoint> originalSeries = List.of();
    private List<WeatherObservation> weather = List.of();
    private List<ContextRecord> contextRecords = List.of();
    private List<RetrievalRecord> retrievalRecords = List.of();
    private InfluenceResult influence;
    private List<Zone> zones = List.of();
    private List<ChangePoint> changePoints = List.of();
    private List<TimeSeriesPoint> forecastSeries = List.of();
    private Map<String, Double> forecastMetrics;
    private String forecastModel;
    private String sentimentSummary;

    /**
     * Text appended to the conversation as the assistant's reply.
     */
    private String reply;

    RunContext(String taskId, String query, List<ConversationTurn> history, boolean followUp) {
        this.taskId = taskId;
        this.query = query;
        this.history = history == null ? List.of() : List.copyOf(history);
        this.followUp = followUp;
    }

    String templateName() {
        return template != null ? template.name() : null;
    }
}
