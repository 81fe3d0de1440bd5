package com.z254.gridpulse.client;

import java.util.List;
import java.util.function.Consumer;

/**
 * Client for an OpenAI-compatible chat completions API.
 */
public interface ChatCompletionClient {

    /**
     * Stream a chat completion, blocking until it finishes.
     *
     * @param messages conversation, system prompt first
     * @param onDelta  receives content deltas, in order
     * @return the full completion text
     */
    String streamChat(List<ChatMessage> messages, Consumer<String> onDelta);

    /**
     * Complete a chat without streaming, blocking until it finishes.
     */
    String complete(List<ChatMessage> messages);

    record ChatMessage(String role, String content) {

        public static ChatMessage system(String content) {
            return new ChatMessage("system", content);
        }

        public static ChatMessage user(String content) {
            return new ChatMessage("user", content);
        }

        public static ChatMessage assistant(String content) {
            return new ChatMessage("assistant", content);
        }
    }
}
