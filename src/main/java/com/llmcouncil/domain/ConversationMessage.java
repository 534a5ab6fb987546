package com.llmcouncil.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * One stored entry of a conversation.
 *
 * <p>User entries carry {@code content}; assistant entries carry the full {@code deliberation}.
 * Only the synthesized answer of an assistant entry is ever fed back into model context.
 */
public record ConversationMessage(String role, String content, DeliberationResult deliberation) {

    static final String PLACEHOLDER = "[Assistant response]";

    public ConversationMessage {
        Objects.requireNonNull(role, "role");
    }

    public static ConversationMessage user(String content) {
        return new ConversationMessage(ChatMessage.USER, Objects.requireNonNull(content, "content"), null);
    }

    public static ConversationMessage assistant(DeliberationResult deliberation) {
        Objects.requireNonNull(deliberation, "deliberation");
        String text = deliberation.stage3() == null ? null : deliberation.stage3().response();
        return new ConversationMessage(ChatMessage.ASSISTANT, text, deliberation);
    }

    @JsonIgnore
    public boolean isUser() {
        return ChatMessage.USER.equals(role);
    }

    /**
     * Text this entry contributes to model context: the user's words, or the chairman's
     * synthesized answer for an assistant turn. Stage 1/2 detail and errors are never included.
     */
    @JsonIgnore
    public String contextText() {
        if (isUser()) {
            return content == null ? "" : content;
        }
        if (deliberation != null && deliberation.stage3() != null) {
            return deliberation.stage3().response();
        }
        return content != null ? content : PLACEHOLDER;
    }
}
