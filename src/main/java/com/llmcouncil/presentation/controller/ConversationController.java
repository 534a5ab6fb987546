package com.llmcouncil.presentation.controller;

import com.llmcouncil.domain.Conversation;
import com.llmcouncil.domain.ConversationMetadata;
import com.llmcouncil.domain.CouncilOverrides;
import com.llmcouncil.domain.DeliberationMode;
import com.llmcouncil.domain.DeliberationResult;
import com.llmcouncil.exception.ConversationNotFoundException;
import com.llmcouncil.exception.InvalidMessageException;
import com.llmcouncil.presentation.dto.CouncilConfigResponse;
import com.llmcouncil.presentation.dto.SendMessageRequest;
import com.llmcouncil.service.conversation.ConversationStore;
import com.llmcouncil.service.conversation.CouncilConfigurationService;
import com.llmcouncil.service.conversation.CouncilTurnService;
import com.llmcouncil.service.orchestration.DeliberationEvent;
import com.llmcouncil.service.orchestration.DeliberationListener;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Conversation API. Thin: validation of the request shape here, everything else in services.
 */
@RestController
@RequestMapping("/api/conversations")
class ConversationController {

    private static final Logger LOG = LogManager.getLogger(ConversationController.class);

    /** Streaming turns may run several model rounds; the emitter outlives the request timeout. */
    static final long SSE_TIMEOUT_MS = 15 * 60 * 1000L;

    private final ConversationStore store;
    private final CouncilTurnService turnService;
    private final CouncilConfigurationService configuration;
    private final Executor streamExecutor;

    ConversationController(ConversationStore store,
                           CouncilTurnService turnService,
                           CouncilConfigurationService configuration,
                           @Qualifier("streamExecutor") Executor streamExecutor) {
        this.store = store;
        this.turnService = turnService;
        this.configuration = configuration;
        this.streamExecutor = streamExecutor;
    }

    @GetMapping
    List<ConversationMetadata> list() {
        return store.list();
    }

    @PostMapping
    ResponseEntity<Conversation> create() {
        return ResponseEntity.status(HttpStatus.CREATED).body(store.create());
    }

    /**
     * Deletes every conversation. Requires {@code confirm=true}.
     */
    @DeleteMapping
    Map<String, Object> deleteAll(@RequestParam(name = "confirm", defaultValue = "false") boolean confirm) {
        if (!confirm) {
            throw new InvalidMessageException("Deleting all conversations requires confirm=true");
        }
        return Map.of("deleted", store.deleteAll());
    }

    @GetMapping("/{id}")
    Conversation get(@PathVariable("id") String id) {
        return store.get(id).orElseThrow(() -> new ConversationNotFoundException(id));
    }

    @DeleteMapping("/{id}")
    ResponseEntity<Void> delete(@PathVariable("id") String id) {
        if (!store.delete(id)) {
            throw new ConversationNotFoundException(id);
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/message")
    DeliberationResult sendMessage(@PathVariable("id") String id,
                                   @RequestParam(name = "mode", required = false) String mode,
                                   @Valid @RequestBody SendMessageRequest request) {
        return turnService.runTurn(id, request.content(), DeliberationMode.fromParam(mode),
                DeliberationListener.NOOP);
    }

    /**
     * Same turn as {@link #sendMessage}, relayed as Server-Sent Events at each stage boundary.
     * Preconditions are checked before the stream opens so that they still map to HTTP errors.
     */
    @PostMapping(path = "/{id}/message/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    SseEmitter sendMessageStream(@PathVariable("id") String id,
                                 @RequestParam(name = "mode", required = false) String mode,
                                 @Valid @RequestBody SendMessageRequest request) {
        DeliberationMode parsedMode = DeliberationMode.fromParam(mode);
        if (store.get(id).isEmpty()) {
            throw new ConversationNotFoundException(id);
        }
        SseEmitter emitter = new SseEmitter(SSE_TIMEOUT_MS);
        streamExecutor.execute(() -> {
            try {
                turnService.runTurn(id, request.content(), parsedMode, event -> send(emitter, event));
                emitter.complete();
            } catch (RuntimeException e) {
                LOG.error("Streaming turn failed for conversation {}", id, e);
                send(emitter, DeliberationEvent.error("An unexpected error occurred. Please try again.", null));
                emitter.complete();
            }
        });
        return emitter;
    }

    @GetMapping("/{id}/config")
    CouncilConfigResponse getConfig(@PathVariable("id") String id) {
        Conversation c = get(id);
        return new CouncilConfigResponse(c.overrides(), configuration.snapshot(c));
    }

    @PutMapping("/{id}/config")
    CouncilConfigResponse updateConfig(@PathVariable("id") String id, @RequestBody CouncilOverrides overrides) {
        CouncilOverrides valid = configuration.validate(overrides);
        store.updateOverrides(id, valid);
        return new CouncilConfigResponse(valid, configuration.snapshot(valid));
    }

    private static void send(SseEmitter emitter, DeliberationEvent event) {
        try {
            emitter.send(SseEmitter.event().data(event, MediaType.APPLICATION_JSON));
        } catch (IOException | IllegalStateException e) {
            // Client went away; the turn still completes and is persisted
            LOG.debug("Dropping {} event: {}", event.type().wireName(), e.toString());
        }
    }
}
