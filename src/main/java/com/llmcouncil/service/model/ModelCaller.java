package com.llmcouncil.service.model;

import com.llmcouncil.domain.ChatMessage;
import com.llmcouncil.domain.ModelCallResult;

import java.util.List;

/**
 * Issues one chat-completion request.
 *
 * <p>Implementations never throw for a failed call: every failure is classified into a
 * {@link com.llmcouncil.domain.ModelQueryError} and returned inside the result. The result
 * always carries the model id exactly as it was passed in, even when web search changed the
 * id sent on the wire.
 */
public interface ModelCaller {

    /**
     * @param model     configured model identifier (e.g. {@code openai/gpt-5})
     * @param messages  ordered message list
     * @param webSearch request the web-search capability for this call only
     * @return success content or a classified error
     */
    ModelCallResult call(String model, List<ChatMessage> messages, boolean webSearch);
}
