package com.llmcouncil.service.conversation;

import com.llmcouncil.domain.Conversation;
import com.llmcouncil.domain.CouncilSnapshot;
import com.llmcouncil.domain.DeliberationMode;
import com.llmcouncil.domain.DeliberationResult;
import com.llmcouncil.exception.ConversationHistoryException;
import com.llmcouncil.exception.ConversationNotFoundException;
import com.llmcouncil.exception.ConversationStoreException;
import com.llmcouncil.exception.DeliberationCancelledException;
import com.llmcouncil.exception.InvalidMessageException;
import com.llmcouncil.service.council.TitleGenerator;
import com.llmcouncil.service.orchestration.DeliberationEvent;
import com.llmcouncil.service.orchestration.DeliberationEventType;
import com.llmcouncil.service.orchestration.DeliberationListener;
import com.llmcouncil.service.orchestration.DeliberationOrchestrator;
import com.llmcouncil.service.orchestration.DeliberationRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * One user turn against a stored conversation: load, deliberate, persist.
 *
 * <p>Order of work:
 * <ol>
 *   <li>validate the message and load the conversation (a read failure is fatal)</li>
 *   <li>freeze the council configuration into a snapshot</li>
 *   <li>on the first message start title generation in parallel</li>
 *   <li>run the deliberation</li>
 *   <li>store the user message, the title and the assistant turn, then emit {@code complete}</li>
 * </ol>
 *
 * <p>Nothing is written before the deliberation returns, so a fatal turn leaves the stored
 * history as it was and user and assistant entries stay paired.
 */
@Service
public class CouncilTurnService {

    private static final Logger LOG = LogManager.getLogger(CouncilTurnService.class);

    private final ConversationStore store;
    private final CouncilConfigurationService configuration;
    private final DeliberationOrchestrator orchestrator;
    private final TitleGenerator titleGenerator;
    private final Executor executor;

    public CouncilTurnService(ConversationStore store,
                              CouncilConfigurationService configuration,
                              DeliberationOrchestrator orchestrator,
                              TitleGenerator titleGenerator,
                              @Qualifier("eventExecutor") Executor executor) {
        this.store = Objects.requireNonNull(store);
        this.configuration = Objects.requireNonNull(configuration);
        this.orchestrator = Objects.requireNonNull(orchestrator);
        this.titleGenerator = Objects.requireNonNull(titleGenerator);
        this.executor = Objects.requireNonNull(executor);
    }

    /**
     * @throws InvalidMessageException       if {@code content} is blank
     * @throws ConversationNotFoundException if the conversation does not exist
     * @throws ConversationHistoryException  if the stored history cannot be read
     */
    public DeliberationResult runTurn(String conversationId, String content, DeliberationMode mode,
                                      DeliberationListener listener) {
        if (content == null || content.isBlank()) {
            throw new InvalidMessageException("Message content must not be empty");
        }
        DeliberationListener out = listener == null ? DeliberationListener.NOOP : listener;
        Conversation conversation = loadHistory(conversationId);
        CouncilSnapshot snapshot = configuration.snapshot(conversation);
        boolean firstMessage = conversation.messages().isEmpty();

        CompletableFuture<String> title = firstMessage
                ? CompletableFuture.supplyAsync(() -> titleGenerator.generate(content, snapshot), executor)
                : null;

        DeliberationResult result;
        try {
            result = orchestrator.deliberate(new DeliberationRequest(conversationId, conversation.messages(),
                    content, mode, snapshot), out);
        } catch (RuntimeException e) {
            if (title != null) {
                title.cancel(true);
            }
            throw e;
        }

        String generated = title != null ? awaitTitle(title) : null;

        store.addUserMessage(conversationId, content);
        if (generated != null) {
            store.updateTitle(conversationId, generated);
            emit(out, DeliberationEvent.completed(DeliberationEventType.TITLE_COMPLETE,
                    Map.of("title", generated), null));
        }

        store.addAssistantMessage(conversationId, result);
        emit(out, DeliberationEvent.of(DeliberationEventType.COMPLETE));
        return result;
    }

    private Conversation loadHistory(String conversationId) {
        try {
            return store.get(conversationId).orElseThrow(() -> new ConversationNotFoundException(conversationId));
        } catch (ConversationStoreException e) {
            throw new ConversationHistoryException("Cannot read conversation history", conversationId, e);
        }
    }

    private static String awaitTitle(CompletableFuture<String> title) {
        try {
            return title.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliberationCancelledException("Interrupted while waiting for title", e);
        } catch (ExecutionException e) {
            LOG.warn("Title generation failed unexpectedly: {}", e.getCause().toString());
            return Conversation.DEFAULT_TITLE;
        }
    }

    private static void emit(DeliberationListener listener, DeliberationEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            LOG.warn("Turn listener failed on {}: {}", event.type().wireName(), e.toString());
        }
    }
}
