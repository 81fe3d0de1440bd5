package com.z254.gridpulse.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One message of the conversation kept with a session.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationTurn {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    private String role;

    private String content;

    private Instant timestamp;

    public static ConversationTurn user(String content) {
        return new ConversationTurn(ROLE_USER, content, Instant.now());
    }

    public static ConversationTurn assistant(String content) {
        return new ConversationTurn(ROLE_ASSISTANT, content, Instant.now());
    }
}
