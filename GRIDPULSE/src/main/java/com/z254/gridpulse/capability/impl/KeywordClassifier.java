package com.z254.gridpulse.capability.impl;

import com.z254.gridpulse.capability.Classification;
import com.z254.gridpulse.capability.Classifier;
import com.z254.gridpulse.domain.model.ConversationTurn;
import com.z254.gridpulse.domain.model.RegionInfo;
import com.z254.gridpulse.domain.model.StepTemplate;
import com.z254.gridpulse.exception.ClassificationException;
import com.z254.gridpulse.region.RegionMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based classifier. Used when no LLM is configured, and as the reference
 * behaviour for tests.
 *
 * <p>Report questions win over news questions, news over forecasts; anything else
 * is a chat. Queries with no power or energy vocabulary are out of scope.
 */
@Component
@Slf4j
public class KeywordClassifier implements Classifier {

    static final String OUT_OF_SCOPE_REPLY = "I can help with regional power demand: forecasts, the factors "
            + "that drive demand, related news and published reports. Try asking, for example, "
            + "\"Forecast Beijing's power demand for the next 30 days\".";

    private static final List<String> RETRIEVAL_WORDS = List.of(
            "report", "document", "according to", "white paper", "报告", "研报", "文档");

    private static final List<String> NEWS_WORDS = List.of(
            "news", "headline", "新闻", "资讯", "动态");

    private static final List<String> FORECAST_WORDS = List.of(
            "forecast", "predict", "projection", "trend", "outlook", "next ", "future",
            "预测", "未来", "走势", "趋势");

    private static final List<String> DOMAIN_WORDS = List.of(
            "power", "electric", "energy", "demand", "load", "grid", "consumption", "weather", "temperature",
            "电", "负荷", "能源", "供电", "用电", "天气");

    private static final List<String> GREETINGS = List.of(
            "hello", "hi", "hey", "thanks", "thank you", "你好", "谢谢");

    private static final Pattern FUTURE_SPAN = Pattern.compile(
            "(?:next|coming|future|未来)\\s*(\\d{1,3})\\s*(day|days|week|weeks|month|months|天|周|个月)");

    private static final Pattern PAST_SPAN = Pattern.compile(
            "(?:past|last|previous|过去|最近)\\s*(\\d{1,3})\\s*(day|days|week|weeks|month|months|天|周|个月)");

    // "in Atlantis", "for New Amsterdam": capitalized words after a preposition
    private static final Pattern PLACE_MENTION = Pattern.compile(
            "\\b(?:in|for|of|at)\\s+([A-Z][\\w'-]*(?:\\s+[A-Z][\\w'-]*)?)");

    private final RegionMatcher regionMatcher;

    public KeywordClassifier(RegionMatcher regionMatcher) {
        this.regionMatcher = regionMatcher;
    }

    @Override
    public Classification classify(String query, List<ConversationTurn> history, Consumer<String> onReasoning) {
        if (query == null || query.isBlank()) {
            throw new ClassificationException("Query is empty");
        }
        String lower = query.toLowerCase(Locale.ROOT);
        List<String> keywords = new ArrayList<>();

        StepTemplate template;
        if (matchAny(lower, RETRIEVAL_WORDS, keywords)) {
            template = StepTemplate.RETRIEVAL;
            onReasoning.accept("The query asks about published reports, so I will search the report index.\n");
        } else if (matchAny(lower, NEWS_WORDS, keywords)) {
            template = StepTemplate.NEWS;
            onReasoning.accept("The query asks for recent news, so I will search and summarize news.\n");
        } else if (matchAny(lower, FORECAST_WORDS, keywords)) {
            template = StepTemplate.FORECAST;
            onReasoning.accept("The query asks for a forecast, so I will run the full demand analysis.\n");
        } else {
            template = StepTemplate.CHAT;
            onReasoning.accept("No analysis keyword found, so I will answer directly.\n");
        }

        boolean inScope = matchAny(lower, DOMAIN_WORDS, keywords) || template != StepTemplate.CHAT
                || GREETINGS.stream().anyMatch(lower::startsWith);

        String regionMention = regionMention(query);
        if (regionMention == null && template == StepTemplate.FORECAST) {
            regionMention = lastRegion(history);
            if (regionMention != null) {
                onReasoning.accept("No region in this query; reusing " + regionMention + " from the conversation.\n");
            }
        } else if (regionMention != null) {
            onReasoning.accept("Region mentioned: " + regionMention + ".\n");
        }

        Integer horizon = days(FUTURE_SPAN, lower);
        Integer historyDays = days(PAST_SPAN, lower);
        if (horizon != null) {
            onReasoning.accept("Requested horizon: " + horizon + " days.\n");
        }

        log.debug("Classified query as {} (region={}, inScope={})", template, regionMention, inScope);
        return Classification.builder()
                .template(inScope ? template : StepTemplate.CHAT)
                .regionMention(regionMention)
                .horizon(horizon)
                .historyDays(historyDays)
                .keywords(keywords)
                .inScope(inScope)
                .reply(inScope ? null : OUT_OF_SCOPE_REPLY)
                .reason(inScope ? "keyword match: " + String.join(", ", keywords) : "no power-related keywords")
                .build();
    }

    private String regionMention(String query) {
        Optional<RegionInfo> known = regionMatcher.findInText(query);
        if (known.isPresent()) {
            return known.get().getName();
        }
        Matcher matcher = PLACE_MENTION.matcher(query);
        return matcher.find() ? matcher.group(1) : null;
    }

    private String lastRegion(List<ConversationTurn> history) {
        if (history == null) {
            return null;
        }
        for (int i = history.size() - 1; i >= 0; i--) {
            ConversationTurn turn = history.get(i);
            if (ConversationTurn.ROLE_USER.equals(turn.getRole())) {
                Optional<RegionInfo> region = regionMatcher.findInText(turn.getContent());
                if (region.isPresent()) {
                    return region.get().getName();
                }
            }
        }
        return null;
    }

    private static boolean matchAny(String lowerQuery, List<String> words, List<String> matched) {
        boolean found = false;
        for (String word : words) {
            if (lowerQuery.contains(word)) {
                matched.add(word);
                found = true;
            }
        }
        return found;
    }

    static Integer days(Pattern pattern, String lowerQuery) {
        Matcher matcher = pattern.matcher(lowerQuery);
        if (!matcher.find()) {
            return null;
        }
        int amount = Integer.parseInt(matcher.group(1));
        String unit = matcher.group(2);
        if (unit.startsWith("week") || unit.equals("周")) {
            return amount * 7;
        }
        if (unit.startsWith("month") || unit.equals("个月")) {
            return amount * 30;
        }
        return amount;
    }
}
