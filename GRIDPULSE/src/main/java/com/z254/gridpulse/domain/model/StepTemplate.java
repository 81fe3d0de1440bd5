package com.z254.gridpulse.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed step lists, one per kind of query.
 */
public enum StepTemplate {

    FORECAST(
            "Data fetch & preprocessing",
            "News & sentiment analysis",
            "Time-series feature analysis",
            "Parameter recommendation",
            "Model training & forecast",
            "Result visualization",
            "Report generation"),

    RETRIEVAL(
            "Report retrieval",
            "Answer generation"),

    NEWS(
            "News search",
            "News summary"),

    CHAT(
            "Answer generation");

    private final List<String> stepNames;

    StepTemplate(String... stepNames) {
        this.stepNames = List.of(stepNames);
    }

    public List<String> getStepNames() {
        return stepNames;
    }

    public int stepCount() {
        return stepNames.size();
    }

    /**
     * 1-indexed step name.
     */
    public String stepName(int step) {
        return stepNames.get(step - 1);
    }

    /**
     * Fresh pending steps for a new run.
     */
    public List<AnalysisStep> newSteps() {
        List<AnalysisStep> steps = new ArrayList<>(stepNames.size());
        for (int i = 0; i < stepNames.size(); i++) {
            steps.add(AnalysisStep.pending(i + 1, stepNames.get(i)));
        }
        return steps;
    }

    /**
     * Whether this template needs a resolved region to run.
     */
    public boolean requiresRegion() {
        return this == FORECAST;
    }
}
