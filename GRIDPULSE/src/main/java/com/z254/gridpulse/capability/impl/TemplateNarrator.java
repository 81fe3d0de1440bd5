package com.z254.gridpulse.capability.impl;

import com.z254.gridpulse.capability.NarrativeRequest;
import com.z254.gridpulse.capability.Narrator;
import com.z254.gridpulse.domain.model.ChangePoint;
import com.z254.gridpulse.domain.model.ContextRecord;
import com.z254.gridpulse.domain.model.InfluenceResult;
import com.z254.gridpulse.domain.model.RegionInfo;
import com.z254.gridpulse.domain.model.RetrievalRecord;
import com.z254.gridpulse.domain.model.TimeSeriesPoint;
import com.z254.gridpulse.domain.model.Zone;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Deterministic narrator built from fixed sentence templates.
 *
 * <p>Serves as the default when no LLM is configured and as the replacement text
 * when the LLM narrator fails. Text is emitted one sentence at a time.
 */
@Component
@Slf4j
public class TemplateNarrator implements Narrator {

    private static final List<String> POSITIVE_WORDS = List.of(
            "growth", "record", "increase", "expand", "boost", "new capacity", "recovery", "增长", "创新高", "投产");

    private static final List<String> NEGATIVE_WORDS = List.of(
            "shortage", "outage", "blackout", "decline", "heatwave", "cold wave", "restriction", "限电", "停电", "下降");

    @Override
    public String narrate(NarrativeRequest request, Consumer<String> onChunk) {
        List<String> sentences = switch (request.kind()) {
            case SENTIMENT -> sentiment(request);
            case REPORT -> report(request);
            case ANSWER -> answer(request);
            case NEWS_SUMMARY -> newsSummary(request);
            case RETRIEVAL_ANSWER -> retrievalAnswer(request);
            case CHANGE_POINT_NOTE -> changePointNote(request);
            case ZONE_SUMMARY -> zoneSummary(request);
        };
        StringBuilder text = new StringBuilder();
        for (String sentence : sentences) {
            onChunk.accept(sentence);
            text.append(sentence);
        }
        return text.toString();
    }

    // --------------------------------------------------------------------------------------------
    // Per-kind templates
    // --------------------------------------------------------------------------------------------

    private List<String> sentiment(NarrativeRequest request) {
        List<ContextRecord> records = request.factList(NarrativeRequest.CONTEXT_RECORDS);
        List<String> out = new ArrayList<>();
        if (records.isEmpty()) {
            out.add("No recent news was found for this region, so the analysis relies on demand data alone.");
            return out;
        }
        int positive = 0;
        int negative = 0;
        for (ContextRecord record : records) {
            String text = (record.getTitle() + " " + record.getSummary()).toLowerCase(Locale.ROOT);
            if (POSITIVE_WORDS.stream().anyMatch(text::contains)) {
                positive++;
            }
            if (NEGATIVE_WORDS.stream().anyMatch(text::contains)) {
                negative++;
            }
        }
        String tone = positive > negative ? "mostly positive" : (negative > positive ? "mostly cautionary" : "mixed");
        out.add(String.format(Locale.ROOT, "%d recent news items were reviewed %s. ",
                records.size(), regionPhrase(request)));
        out.add(String.format(Locale.ROOT, "Their tone is %s (%d pointing to growth, %d to supply stress). ",
                tone, positive, negative));
        out.add("Most relevant: \"" + records.get(0).getTitle() + "\".");
        return out;
    }

    private List<String> report(NarrativeRequest request) {
        List<TimeSeriesPoint> original = request.factList(NarrativeRequest.ORIGINAL_SERIES);
        List<TimeSeriesPoint> forecast = request.factList(NarrativeRequest.FORECAST_SERIES);
        List<ChangePoint> changePoints = request.factList(NarrativeRequest.CHANGE_POINTS);
        List<Zone> zones = request.factList(NarrativeRequest.ZONES);
        InfluenceResult influence = request.factAs(NarrativeRequest.INFLUENCE, InfluenceResult.class);
        Map<?, ?> metrics = request.factAs(NarrativeRequest.FORECAST_METRICS, Map.class);
        String sentiment = request.factAs(NarrativeRequest.SENTIMENT_SUMMARY, String.class);

        List<String> out = new ArrayList<>();
        out.add("## Power demand analysis " + regionPhrase(request) + "\n\n");
        if (!original.isEmpty()) {
            double[] values = TimeSeriesPoint.values(original);
            out.add(String.format(Locale.ROOT,
                    "Over %d observed days (%s to %s) demand averaged %.0f MW, ranging from %.0f to %.0f MW. ",
                    values.length, original.get(0).getDate(), original.get(original.size() - 1).getDate(),
                    mean(values), min(values), max(values)));
        }
        if (!forecast.isEmpty() && !original.isEmpty()) {
            double lastObserved = original.get(original.size() - 1).getValue();
            double forecastMean = mean(TimeSeriesPoint.values(forecast));
            out.add(String.format(Locale.ROOT,
                    "The %d-day forecast averages %.0f MW, %s the last observed value by %.1f%%. ",
                    forecast.size(), forecastMean, forecastMean >= lastObserved ? "above" : "below",
                    Math.abs(pct(lastObserved, forecastMean))));
        }
        if (metrics != null && metrics.get("mape") instanceof Number mape) {
            out.add(String.format(Locale.ROOT, "Backtest error (MAPE) is %.2f%%. ", mape.doubleValue()));
        }
        out.add("\n\n");
        if (influence != null && influence.getSummary() != null) {
            out.add(influence.getSummary() + "\n\n");
        }
        if (!changePoints.isEmpty()) {
            ChangePoint strongest = changePoints.get(0);
            out.add(String.format(Locale.ROOT,
                    "%d change points were detected; the strongest is a %s on %s (%.1f standard deviations). ",
                    changePoints.size(), strongest.getDirection() == ChangePoint.Direction.RISE ? "rise" : "drop",
                    strongest.getDate(), strongest.getMagnitude()));
        }
        if (!zones.isEmpty()) {
            Zone top = zones.get(0);
            out.add(String.format(Locale.ROOT,
                    "The most significant interval runs from %s to %s with %s movement. ",
                    top.getStartDate(), top.getEndDate(), top.getSentiment().name().toLowerCase(Locale.ROOT)));
        }
        if (sentiment != null && !sentiment.isBlank()) {
            out.add("\n\nNews context: " + sentiment);
        }
        return out;
    }

    private List<String> answer(NarrativeRequest request) {
        String reply = request.factAs(NarrativeRequest.REPLY, String.class);
        if (reply != null) {
            return List.of(reply);
        }
        return List.of(
                "I can analyse regional power demand, forecast it, explain which factors drive it ",
                "and summarise related news. Ask for a forecast for one of the supported cities to get started.");
    }

    private List<String> newsSummary(NarrativeRequest request) {
        List<ContextRecord> records = request.factList(NarrativeRequest.CONTEXT_RECORDS);
        if (records.isEmpty()) {
            return List.of("No recent news matched the question.");
        }
        List<String> out = new ArrayList<>();
        out.add(String.format(Locale.ROOT, "Found %d recent news items.\n", records.size()));
        records.stream().limit(5).forEach(record -> out.add(String.format(Locale.ROOT, "- %s%s\n",
                record.getTitle(), record.getPublishedDate() != null ? " (" + record.getPublishedDate() + ")" : "")));
        return out;
    }

    private List<String> retrievalAnswer(NarrativeRequest request) {
        List<RetrievalRecord> records = request.factList(NarrativeRequest.RETRIEVAL_RECORDS);
        if (records.isEmpty()) {
            return List.of("No indexed report passage matched the question.");
        }
        List<String> out = new ArrayList<>();
        out.add("Relevant report passages:\n");
        records.stream().limit(3).forEach(record -> out.add(String.format(Locale.ROOT, "- %s%s: %s\n",
                record.getTitle(), record.getPage() != null ? " p." + record.getPage() : "",
                abbreviate(record.getContent(), 200))));
        return out;
    }

    private List<String> changePointNote(NarrativeRequest request) {
        ChangePoint point = request.factAs(NarrativeRequest.CHANGE_POINT, ChangePoint.class);
        if (point == null) {
            return List.of();
        }
        List<ContextRecord> related = request.factList(NarrativeRequest.CONTEXT_RECORDS);
        String base = String.format(Locale.ROOT, "%s demand %s by %.0f MW around %s (%.1f standard deviations%s).",
                point.isForecast() ? "Forecast" : "Observed",
                point.getDirection() == ChangePoint.Direction.RISE ? "rose" : "fell",
                Math.abs(point.getDelta()), point.getDate(), point.getMagnitude(),
                point.isFallback() ? ", below the detection threshold" : "");
        if (related.isEmpty()) {
            return List.of(base);
        }
        return List.of(base, " Nearby news: \"" + related.get(0).getTitle() + "\".");
    }

    private List<String> zoneSummary(NarrativeRequest request) {
        Zone zone = request.factAs(NarrativeRequest.ZONE, Zone.class);
        if (zone == null) {
            return List.of();
        }
        String kind = Zone.METHOD_CALM_FALLBACK.equals(zone.getMethod()) ? "Most active day in a calm period"
                : "Significant interval";
        return List.of(String.format(Locale.ROOT, "%s from %s to %s: average daily change %+.2f%%, impact %.2f.",
                kind, zone.getStartDate(), zone.getEndDate(), zone.getAvgReturn() * 100.0, zone.getImpact()));
    }

    // --------------------------------------------------------------------------------------------
    // Helpers
    // --------------------------------------------------------------------------------------------

    private static String regionPhrase(NarrativeRequest request) {
        RegionInfo region = request.factAs(NarrativeRequest.REGION, RegionInfo.class);
        return region != null ? "for " + region.getName() : "for the selected region";
    }

    private static String abbreviate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }

    private static double pct(double from, double to) {
        return from == 0.0 ? 0.0 : (to - from) / from * 100.0;
    }

    private static double mean(double[] values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return values.length == 0 ? 0.0 : sum / values.length;
    }

    private static double min(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
        }
        return min;
    }

    private static double max(double[] values) {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            max = Math.max(max, v);
        }
        return max;
    }
}
