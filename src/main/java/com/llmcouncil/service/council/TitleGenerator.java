package com.llmcouncil.service.council;

import com.llmcouncil.config.properties.CouncilProperties;
import com.llmcouncil.config.properties.OpenRouterProperties;
import com.llmcouncil.domain.ChatMessage;
import com.llmcouncil.domain.Conversation;
import com.llmcouncil.domain.CouncilSnapshot;
import com.llmcouncil.domain.ModelCallResult;
import com.llmcouncil.service.model.ParallelModelQueryService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Asks the chairman for a short conversation title from the first user message.
 *
 * <p>Never fails: any model error yields {@link Conversation#DEFAULT_TITLE}.
 */
@Component
public class TitleGenerator {

    private static final Logger LOG = LogManager.getLogger(TitleGenerator.class);

    private final ParallelModelQueryService queryService;
    private final Duration timeout;
    private final int maxLength;

    @Autowired
    public TitleGenerator(ParallelModelQueryService queryService, OpenRouterProperties openRouter,
                          CouncilProperties council) {
        this(queryService, openRouter.getAuxiliaryTimeout(), council.getTitleMaxLength());
    }

    public TitleGenerator(ParallelModelQueryService queryService, Duration timeout, int maxLength) {
        this.queryService = Objects.requireNonNull(queryService);
        this.timeout = Objects.requireNonNull(timeout);
        this.maxLength = maxLength;
    }

    public String generate(String question, CouncilSnapshot snapshot) {
        ModelCallResult r = queryService.queryOne(snapshot.chairmanModel(),
                List.of(ChatMessage.user(PromptTemplates.title(question))), false, timeout);
        if (!r.isSuccess()) {
            LOG.warn("Title generation failed: kind={}, message={}", r.error().kind().wireName(), r.error().message());
            return Conversation.DEFAULT_TITLE;
        }
        return clean(r.content(), maxLength);
    }

    static String clean(String raw, int maxLength) {
        String title = raw == null ? "" : raw.strip();
        title = stripQuotes(title).strip();
        if (title.isEmpty()) {
            return Conversation.DEFAULT_TITLE;
        }
        if (title.length() > maxLength) {
            title = title.substring(0, maxLength - 3) + "...";
        }
        return title;
    }

    private static String stripQuotes(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && isQuote(s.charAt(start))) {
            start++;
        }
        while (end > start && isQuote(s.charAt(end - 1))) {
            end--;
        }
        return s.substring(start, end);
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }
}
