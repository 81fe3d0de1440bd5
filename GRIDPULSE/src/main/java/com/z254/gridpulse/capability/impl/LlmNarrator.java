package com.z254.gridpulse.capability.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.gridpulse.capability.NarrativeRequest;
import com.z254.gridpulse.capability.Narrator;
import com.z254.gridpulse.client.ChatCompletionClient;
import com.z254.gridpulse.client.ChatCompletionClient.ChatMessage;
import com.z254.gridpulse.domain.model.ConversationTurn;
import com.z254.gridpulse.exception.NarratorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Narrator backed by a chat model. Facts are passed to the model as JSON.
 */
@Component
@Primary
@ConditionalOnProperty(prefix = "gridpulse.llm", name = "enabled", havingValue = "true")
@Slf4j
public class LlmNarrator implements Narrator {

    private static final String SYSTEM_PROMPT = "You are an energy analyst writing for grid operators. "
            + "Use only the facts provided. Be concise and concrete; quote numbers with units.";

    private static final Map<NarrativeRequest.Kind, String> INSTRUCTIONS = Map.of(
            NarrativeRequest.Kind.SENTIMENT,
            "Summarize the tone of these news items and what they imply for power demand, in 3-5 sentences.",
            NarrativeRequest.Kind.REPORT,
            "Write a markdown analysis report: demand history, key drivers, forecast, change points, "
                    + "significant intervals and a short outlook.",
            NarrativeRequest.Kind.ANSWER,
            "Answer the user's question. If a reply is given in the facts, use it.",
            NarrativeRequest.Kind.NEWS_SUMMARY,
            "Summarize these news items for the user's question as a short bulleted list.",
            NarrativeRequest.Kind.RETRIEVAL_ANSWER,
            "Answer the user's question from these report passages, citing titles and pages.",
            NarrativeRequest.Kind.CHANGE_POINT_NOTE,
            "In one or two sentences, describe this change point and relate it to the news items if any fit.",
            NarrativeRequest.Kind.ZONE_SUMMARY,
            "In one sentence, describe this interval of unusual demand movement.");

    private final ChatCompletionClient chatClient;
    private final ObjectMapper objectMapper;

    public LlmNarrator(ChatCompletionClient chatClient, ObjectMapper objectMapper) {
        this.chatClient = chatClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String narrate(NarrativeRequest request, Consumer<String> onChunk) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(SYSTEM_PROMPT));
        for (ConversationTurn turn : request.history()) {
            messages.add(new ChatMessage(turn.getRole(), turn.getContent()));
        }
        messages.add(ChatMessage.user(prompt(request)));

        try {
            return chatClient.streamChat(messages, onChunk);
        } catch (RuntimeException e) {
            throw new NarratorException("LLM narration failed for " + request.kind() + ": " + e.getMessage(), e);
        }
    }

    private String prompt(NarrativeRequest request) {
        String facts;
        try {
            facts = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(request.facts());
        } catch (JsonProcessingException e) {
            throw new NarratorException("Could not serialize narrative facts", e);
        }
        return INSTRUCTIONS.get(request.kind())
                + "\n\nQuestion: " + request.query()
                + "\n\nFacts:\n" + facts;
    }
}
