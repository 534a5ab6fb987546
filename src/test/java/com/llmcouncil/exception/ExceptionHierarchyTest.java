package com.llmcouncil.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void allDomainExceptionsAreCouncilExceptions() {
        assertThat(new ConversationNotFoundException("c1")).isInstanceOf(CouncilException.class);
        assertThat(new ConversationHistoryException("unreadable", "c1")).isInstanceOf(CouncilException.class);
        assertThat(new ConversationStoreException("disk full")).isInstanceOf(CouncilException.class);
        assertThat(new InvalidMessageException("blank")).isInstanceOf(CouncilException.class);
        assertThat(new DeliberationCancelledException("stop", null)).isInstanceOf(CouncilException.class);
        assertThat(new CouncilException("x")).isInstanceOf(RuntimeException.class);
    }

    @Test
    void notFoundCarriesConversationId() {
        ConversationNotFoundException ex = new ConversationNotFoundException("abc-123");

        assertThat(ex.getConversationId()).isEqualTo("abc-123");
        assertThat(ex.getMessage()).contains("abc-123");
    }

    @Test
    void historyFailureKeepsCauseAndId() {
        IOException cause = new IOException("bad json");
        ConversationHistoryException ex = new ConversationHistoryException("Cannot read history", "c9", cause);

        assertThat(ex.getConversationId()).isEqualTo("c9");
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.getMessage()).isEqualTo("Cannot read history (conversation: c9)");
    }
}
