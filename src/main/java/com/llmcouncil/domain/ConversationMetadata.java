package com.llmcouncil.domain;

import java.time.Instant;

/**
 * List-view summary of a conversation.
 */
public record ConversationMetadata(String id, Instant createdAt, String title, int messageCount) {
}
