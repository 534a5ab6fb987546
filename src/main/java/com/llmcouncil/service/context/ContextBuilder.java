package com.llmcouncil.service.context;

import com.llmcouncil.config.properties.CouncilProperties;
import com.llmcouncil.config.properties.OpenRouterProperties;
import com.llmcouncil.domain.ChatMessage;
import com.llmcouncil.domain.ConversationMessage;
import com.llmcouncil.domain.CouncilSnapshot;
import com.llmcouncil.domain.ModelCallResult;
import com.llmcouncil.exception.ConversationHistoryException;
import com.llmcouncil.service.council.PromptTemplates;
import com.llmcouncil.service.model.ParallelModelQueryService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Builds the message list a turn starts from.
 *
 * <p>Up to {@code recentExchangeLimit} exchanges (user plus assistant) are copied verbatim.
 * Anything older is condensed by the chairman into one system message placed ahead of the
 * recent exchanges. Assistant entries contribute only their synthesized answer.
 *
 * <p>Summarization is best-effort: if the call fails the summary is omitted and the turn
 * continues with the recent exchanges. A history that cannot be interpreted is fatal and
 * raises {@link ConversationHistoryException}.
 */
@Component
public class ContextBuilder {

    private static final Logger LOG = LogManager.getLogger(ContextBuilder.class);

    static final String SUMMARY_PREFIX = "[Previous conversation summary: ";
    static final String TRUNCATION_MARKER = "[Earlier conversation truncated]\n\n";

    private final ParallelModelQueryService queryService;
    private final int recentExchangeLimit;
    private final int summaryMaxChars;
    private final Duration summaryTimeout;

    @Autowired
    public ContextBuilder(ParallelModelQueryService queryService, CouncilProperties council,
                          OpenRouterProperties openRouter) {
        this(queryService, council.getRecentExchangeLimit(), council.getSummaryMaxChars(),
                openRouter.getAuxiliaryTimeout());
    }

    public ContextBuilder(ParallelModelQueryService queryService, int recentExchangeLimit, int summaryMaxChars,
                          Duration summaryTimeout) {
        this.queryService = Objects.requireNonNull(queryService);
        if (recentExchangeLimit < 1) {
            throw new IllegalArgumentException("recentExchangeLimit must be >= 1");
        }
        this.recentExchangeLimit = recentExchangeLimit;
        this.summaryMaxChars = summaryMaxChars;
        this.summaryTimeout = Objects.requireNonNull(summaryTimeout);
    }

    /**
     * @param conversationId id used in error messages
     * @param history        prior entries, oldest first, excluding {@code newMessage}
     * @param newMessage     the user's new message
     * @param snapshot       council configuration of this turn; its chairman writes the summary
     * @return chronological message list ending with {@code newMessage}
     * @throws ConversationHistoryException if an entry has an unknown role or a user entry has no text
     */
    public List<ChatMessage> build(String conversationId, List<ConversationMessage> history, String newMessage,
                                   CouncilSnapshot snapshot) {
        if (history == null) {
            throw new ConversationHistoryException("Conversation history unavailable", conversationId);
        }
        List<ChatMessage> formatted = new ArrayList<>(history.size());
        for (int i = 0; i < history.size(); i++) {
            formatted.add(toChatMessage(conversationId, i, history.get(i)));
        }

        int recentMessages = recentExchangeLimit * 2;
        List<ChatMessage> out = new ArrayList<>();
        if (formatted.size() <= recentMessages) {
            out.addAll(formatted);
        } else {
            List<ChatMessage> older = formatted.subList(0, formatted.size() - recentMessages);
            List<ChatMessage> recent = formatted.subList(formatted.size() - recentMessages, formatted.size());
            String summary = summarize(older, snapshot);
            if (summary != null) {
                out.add(ChatMessage.system(SUMMARY_PREFIX + summary + "]"));
            }
            out.addAll(recent);
        }
        out.add(ChatMessage.user(newMessage));
        return List.copyOf(out);
    }

    private static ChatMessage toChatMessage(String conversationId, int index, ConversationMessage m) {
        if (m == null) {
            throw new ConversationHistoryException("Null entry at position " + index, conversationId);
        }
        if (ChatMessage.USER.equals(m.role())) {
            if (m.content() == null) {
                throw new ConversationHistoryException("User entry without content at position " + index,
                        conversationId);
            }
            return ChatMessage.user(m.content());
        }
        if (ChatMessage.ASSISTANT.equals(m.role())) {
            return ChatMessage.assistant(m.contextText());
        }
        throw new ConversationHistoryException("Unknown role '" + m.role() + "' at position " + index,
                conversationId);
    }

    /**
     * @return the summary text, or {@code null} when the summarizer failed or replied with nothing
     */
    private String summarize(List<ChatMessage> older, CouncilSnapshot snapshot) {
        String text = capped(transcript(older), summaryMaxChars);
        ModelCallResult r = queryService.queryOne(snapshot.chairmanModel(),
                List.of(ChatMessage.user(PromptTemplates.summary(text))), false, summaryTimeout);
        if (!r.isSuccess()) {
            LOG.warn("History summarization failed, continuing with recent exchanges only: kind={}, message={}",
                    r.error().kind().wireName(), r.error().message());
            return null;
        }
        String summary = r.content().strip();
        if (summary.isEmpty()) {
            LOG.warn("History summarization returned no text, continuing with recent exchanges only");
            return null;
        }
        LOG.debug("Summarized {} older messages into {} chars", older.size(), summary.length());
        return summary;
    }

    static String transcript(List<ChatMessage> messages) {
        StringBuilder sb = new StringBuilder();
        for (ChatMessage m : messages) {
            String role = m.role().substring(0, 1).toUpperCase(Locale.ROOT) + m.role().substring(1);
            sb.append(role).append(": ").append(m.content()).append("\n\n");
        }
        return sb.toString();
    }

    /**
     * Keeps the most recent {@code maxChars} characters, prefixed by a truncation marker.
     */
    static String capped(String text, int maxChars) {
        if (text.length() <= maxChars) {
            return text;
        }
        return TRUNCATION_MARKER + text.substring(text.length() - maxChars);
    }
}
