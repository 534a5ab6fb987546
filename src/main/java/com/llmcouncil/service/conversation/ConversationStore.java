package com.llmcouncil.service.conversation;

import com.llmcouncil.domain.Conversation;
import com.llmcouncil.domain.ConversationMetadata;
import com.llmcouncil.domain.CouncilOverrides;
import com.llmcouncil.domain.DeliberationResult;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of conversations.
 *
 * <p>Mutating operations on an unknown id throw
 * {@link com.llmcouncil.exception.ConversationNotFoundException}; I/O and parse failures throw
 * {@link com.llmcouncil.exception.ConversationStoreException}. Stored errors are kept for
 * display only and are never fed back into model context.
 */
public interface ConversationStore {

    Conversation create();

    Optional<Conversation> get(String id);

    /**
     * Metadata of every stored conversation, newest first.
     */
    List<ConversationMetadata> list();

    void addUserMessage(String id, String content);

    void addAssistantMessage(String id, DeliberationResult deliberation);

    void updateTitle(String id, String title);

    void updateOverrides(String id, CouncilOverrides overrides);

    boolean delete(String id);

    int deleteAll();
}
