package com.llmcouncil.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MdcFilterTest {

    private static final String UUID_PATTERN =
            "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}";

    private MdcFilter filter;
    private HttpServletRequest request;
    private HttpServletResponse response;
    private FilterChain chain;

    @BeforeEach
    void setUp() {
        filter = new MdcFilter();
        request = mock(HttpServletRequest.class);
        response = mock(HttpServletResponse.class);
        chain = mock(FilterChain.class);
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void propagatesRequestIdHeaderDuringChain() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("req-42");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/api/conversations/abc/message");
        Map<String, String> seen = new HashMap<>();
        doAnswer(inv -> {
            seen.putAll(ThreadContext.getImmutableContext());
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        assertThat(seen)
                .containsEntry("requestId", "req-42")
                .containsEntry("method", "POST")
                .containsEntry("uri", "/api/conversations/abc/message")
                .containsEntry("conversationId", "abc")
                .doesNotContainKey("userId");
        assertThat(ThreadContext.isEmpty()).isTrue();
        verify(response).setHeader(MdcFilter.REQUEST_ID_HEADER, "req-42");
    }

    @Test
    void generatesRequestIdWhenHeaderMissingOrBlank() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn(null, "   ");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/api/conversations");
        doAnswer(inv -> {
            assertThat(ThreadContext.get("requestId")).matches(UUID_PATTERN);
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);
        filter.doFilter(request, response, chain);

        verify(chain, times(2)).doFilter(request, response);
    }

    @Test
    void addsUserIdOnlyWhenPresent() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("req-1");
        when(request.getHeader(MdcFilter.USER_ID_HEADER)).thenReturn("alice");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/api/conversations");
        doAnswer(inv -> {
            assertThat(ThreadContext.get("userId")).isEqualTo("alice");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        assertThat(ThreadContext.get("userId")).isNull();
    }

    @Test
    void clearsContextWhenChainThrows() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("req-err");
        when(request.getMethod()).thenReturn("DELETE");
        when(request.getRequestURI()).thenReturn("/api/conversations");
        doThrow(new ServletException("boom")).when(chain).doFilter(any(), any());

        assertThatThrownBy(() -> filter.doFilter(request, response, chain))
                .isInstanceOf(ServletException.class)
                .hasMessage("boom");
        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void passesNonHttpRequestsThrough() throws ServletException, IOException {
        ServletRequest plain = mock(ServletRequest.class);
        ServletResponse plainResponse = mock(ServletResponse.class);
        doAnswer(inv -> {
            assertThat(ThreadContext.get("requestId")).isNull();
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(plain, plainResponse, chain);

        verify(chain).doFilter(plain, plainResponse);
    }

    @Test
    void conversationIdOnlyFromConversationPaths() {
        assertThat(MdcFilter.conversationIdOf("/api/conversations/c-1")).isEqualTo("c-1");
        assertThat(MdcFilter.conversationIdOf("/api/conversations/c-1/config")).isEqualTo("c-1");
        assertThat(MdcFilter.conversationIdOf("/api/conversations")).isNull();
        assertThat(MdcFilter.conversationIdOf("/actuator/health")).isNull();
        assertThat(MdcFilter.conversationIdOf(null)).isNull();
    }
}
