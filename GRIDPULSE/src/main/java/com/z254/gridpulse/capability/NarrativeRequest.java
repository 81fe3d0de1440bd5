package com.z254.gridpulse.capability;

import com.z254.gridpulse.domain.model.ConversationTurn;

import java.util.List;
import java.util.Map;

/**
 * What to write, for whom, and from which facts.
 *
 * @param kind    the piece of text to produce
 * @param query   the user query being answered
 * @param facts   structured inputs, keyed by name
 * @param history earlier conversation turns, oldest first
 */
public record NarrativeRequest(Kind kind, String query, Map<String, Object> facts, List<ConversationTurn> history) {

    public static final String REGION = "region";
    public static final String ORIGINAL_SERIES = "originalSeries";
    public static final String FORECAST_SERIES = "forecastSeries";
    public static final String FORECAST_METRICS = "forecastMetrics";
    public static final String FORECAST_MODEL = "forecastModel";
    public static final String CONTEXT_RECORDS = "contextRecords";
    public static final String RETRIEVAL_RECORDS = "retrievalRecords";
    public static final String INFLUENCE = "influence";
    public static final String ZONES = "zones";
    public static final String ZONE = "zone";
    public static final String CHANGE_POINTS = "changePoints";
    public static final String CHANGE_POINT = "changePoint";
    public static final String SENTIMENT_SUMMARY = "sentimentSummary";
    public static final String REPLY = "reply";

    public NarrativeRequest {
        facts = facts == null ? Map.of() : facts;
        history = history == null ? List.of() : List.copyOf(history);
    }

    public static NarrativeRequest of(Kind kind, String query, Map<String, Object> facts) {
        return new NarrativeRequest(kind, query, facts, List.of());
    }

    public Object fact(String key) {
        return facts.get(key);
    }

    @SuppressWarnings("unchecked")
    public <T> List<T> factList(String key) {
        Object value = facts.get(key);
        return value instanceof List<?> list ? (List<T>) list : List.of();
    }

    @SuppressWarnings("unchecked")
    public <T> T factAs(String key, Class<T> type) {
        Object value = facts.get(key);
        return type.isInstance(value) ? (T) value : null;
    }

    public enum Kind {
        SENTIMENT,
        REPORT,
        ANSWER,
        NEWS_SUMMARY,
        RETRIEVAL_ANSWER,
        CHANGE_POINT_NOTE,
        ZONE_SUMMARY
    }
}
