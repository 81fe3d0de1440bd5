package com.z254.gridpulse.capability;

import com.z254.gridpulse.domain.model.ConversationTurn;

import java.util.List;
import java.util.function.Consumer;

/**
 * Chooses the step template for a query.
 *
 * <p>Implementations may block. Reasoning text produced while classifying is
 * passed to {@code onReasoning} as it becomes available.
 */
public interface Classifier {

    /**
     * Classify a query.
     *
     * @param query       the user query
     * @param history     earlier turns of the conversation, oldest first
     * @param onReasoning receives reasoning increments, in order
     * @return the classification
     * @throws com.z254.gridpulse.exception.ClassificationException when the query cannot be classified
     */
    Classification classify(String query, List<ConversationTurn> history, Consumer<String> onReasoning)
            throws Exception;
}
