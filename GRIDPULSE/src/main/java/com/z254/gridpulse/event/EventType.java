package com.z254.gridpulse.event;

import java.util.Map;
import java.util.Set;

/**
 * Kinds of pipeline events and the payload shape each one carries.
 */
public enum EventType {

    STEP_START(StepRule.REQUIRED, "stepName"),
    STEP_COMPLETE(StepRule.REQUIRED, "stepName"),
    STEP_ERROR(StepRule.REQUIRED, "stepName", "message"),
    THINKING(StepRule.FORBIDDEN, "content"),
    INTENT(StepRule.FORBIDDEN, "intent", "steps"),
    DATA(StepRule.OPTIONAL, "dataType", "data"),
    MODEL_SELECTION(StepRule.REQUIRED, "model", "horizon"),
    NARRATIVE_CHUNK(StepRule.OPTIONAL, "channel", "content"),
    ERROR(StepRule.FORBIDDEN, "message"),
    DONE(StepRule.FORBIDDEN, "status");

    private final StepRule stepRule;
    private final Set<String> requiredKeys;

    EventType(StepRule stepRule, String... requiredKeys) {
        this.stepRule = stepRule;
        this.requiredKeys = Set.of(requiredKeys);
    }

    public Set<String> getRequiredKeys() {
        return requiredKeys;
    }

    /**
     * Reject a step/payload combination that does not match this type's shape.
     *
     * @throws IllegalArgumentException on mismatch
     */
    public void validate(Integer step, Map<String, Object> payload) {
        if (stepRule == StepRule.REQUIRED && (step == null || step < 1)) {
            throw new IllegalArgumentException(this + " requires a step number >= 1");
        }
        if (stepRule == StepRule.FORBIDDEN && step != null) {
            throw new IllegalArgumentException(this + " does not carry a step number");
        }
        if (payload == null) {
            throw new IllegalArgumentException(this + " requires a payload");
        }
        for (String key : requiredKeys) {
            if (payload.get(key) == null) {
                throw new IllegalArgumentException(this + " payload is missing '" + key + "'");
            }
        }
        for (String key : payload.keySet()) {
            if (!requiredKeys.contains(key) && !OPTIONAL_KEYS.getOrDefault(this, Set.of()).contains(key)) {
                throw new IllegalArgumentException(this + " payload has undeclared key '" + key + "'");
            }
        }
        if (this == DATA && !DataType.isKnown(String.valueOf(payload.get("dataType")))) {
            throw new IllegalArgumentException("Unknown data type: " + payload.get("dataType"));
        }
        if (this == NARRATIVE_CHUNK && !NarrativeChannel.isKnown(String.valueOf(payload.get("channel")))) {
            throw new IllegalArgumentException("Unknown narrative channel: " + payload.get("channel"));
        }
    }

    private static final Map<EventType, Set<String>> OPTIONAL_KEYS = Map.of(
            STEP_COMPLETE, Set.of("message"),
            STEP_START, Set.of("message"),
            INTENT, Set.of("region", "reason"),
            NARRATIVE_CHUNK, Set.of("complete"),
            DONE, Set.of("message"));

    private enum StepRule {
        REQUIRED,
        OPTIONAL,
        FORBIDDEN
    }

    /**
     * Values of the {@code dataType} key on {@link #DATA} events.
     */
    public static final class DataType {
        public static final String TIME_SERIES_ORIGINAL = "time_series_original";
        public static final String TIME_SERIES_FULL = "time_series_full";
        public static final String CONTEXT_RECORDS = "context_records";
        public static final String RETRIEVAL_RECORDS = "retrieval_records";
        public static final String ANOMALY_ZONES = "anomaly_zones";
        public static final String INFLUENCE = "influence";
        public static final String CHANGE_POINTS = "change_points";
        public static final String FORECAST_METRICS = "forecast_metrics";

        private static final Set<String> ALL = Set.of(TIME_SERIES_ORIGINAL, TIME_SERIES_FULL, CONTEXT_RECORDS,
                RETRIEVAL_RECORDS, ANOMALY_ZONES, INFLUENCE, CHANGE_POINTS, FORECAST_METRICS);

        private DataType() {
        }

        public static boolean isKnown(String value) {
            return ALL.contains(value);
        }
    }

    /**
     * Values of the {@code channel} key on {@link #NARRATIVE_CHUNK} events.
     */
    public static final class NarrativeChannel {
        public static final String SENTIMENT = "sentiment";
        public static final String REPORT = "report";
        public static final String ANSWER = "answer";

        private static final Set<String> ALL = Set.of(SENTIMENT, REPORT, ANSWER);

        private NarrativeChannel() {
        }

        public static boolean isKnown(String value) {
            return ALL.contains(value);
        }
    }
}
