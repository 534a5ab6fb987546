/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.llmcouncil.exception.CouncilException} so that
 * {@code GlobalExceptionHandler} can map them to HTTP responses in one place.
 *
 * <p>Model call failures are deliberately absent from this hierarchy: a failing council member
 * is recorded as a {@link com.llmcouncil.domain.ModelQueryError} value and never thrown. Only
 * turn-fatal conditions are exceptions:
 * <ul>
 *   <li>{@link com.llmcouncil.exception.ConversationNotFoundException} - unknown conversation id</li>
 *   <li>{@link com.llmcouncil.exception.ConversationHistoryException} - history unreadable or malformed</li>
 *   <li>{@link com.llmcouncil.exception.InvalidMessageException} - rejected user input</li>
 *   <li>{@link com.llmcouncil.exception.ConversationStoreException} - storage I/O failure</li>
 *   <li>{@link com.llmcouncil.exception.DeliberationCancelledException} - caller interrupted the turn</li>
 * </ul>
 *
 * @see com.llmcouncil.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.llmcouncil.exception;
