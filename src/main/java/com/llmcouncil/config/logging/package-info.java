/**
 * Request-scoped logging context.
 *
 * <p>{@link com.llmcouncil.config.logging.MdcFilter} seeds the Log4j2 ThreadContext for each
 * HTTP request; the orchestrator adds {@code conversationId} and {@code stage}.
 */
package com.llmcouncil.config.logging;
