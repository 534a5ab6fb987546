package com.llmcouncil.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A stored conversation with its full message history.
 */
public record Conversation(
        String id,
        Instant createdAt,
        String title,
        List<ConversationMessage> messages,
        CouncilOverrides overrides
) {

    public static final String DEFAULT_TITLE = "New Conversation";

    public Conversation {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(createdAt, "createdAt");
        title = title == null || title.isBlank() ? DEFAULT_TITLE : title;
        messages = messages == null ? List.of() : List.copyOf(messages);
        overrides = overrides == null ? CouncilOverrides.NONE : overrides;
    }

    public ConversationMetadata metadata() {
        return new ConversationMetadata(id, createdAt, title, messages.size());
    }
}
