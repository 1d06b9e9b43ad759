package com.phillippitts.liveagent.config.logging;

import com.phillippitts.liveagent.service.session.CallSession;
import com.phillippitts.liveagent.service.session.SessionRegistry;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MdcFilterTest {

    private MdcFilter filter;
    private SessionRegistry sessions;
    private HttpServletRequest request;
    private HttpServletResponse response;
    private FilterChain chain;

    @BeforeEach
    void setUp() {
        sessions = mock(SessionRegistry.class);
        when(sessions.find(any())).thenReturn(Optional.empty());
        filter = new MdcFilter(sessions);
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
    void extractsRequestIdFromHeader() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("test-request-123");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/api/sessions");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("requestId")).isEqualTo("test-request-123");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        verify(chain).doFilter(request, response);
        verify(response).setHeader("X-Request-ID", "test-request-123");
    }

    @Test
    void generatesUuidIfRequestIdHeaderIsBlank() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("   ");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/actuator/health");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("requestId"))
                    .matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);
    }

    @Test
    void extractsCallIdFromHeader() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-123");
        when(request.getHeader("X-Call-ID")).thenReturn("call-456");
        when(request.getMethod()).thenReturn("DELETE");
        when(request.getRequestURI()).thenReturn("/api/sessions/s-1");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("callId")).isEqualTo("call-456");
            assertThat(ThreadContext.get("method")).isEqualTo("DELETE");
            assertThat(ThreadContext.get("uri")).isEqualTo("/api/sessions/s-1");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);
    }

    @Test
    void tagsSessionPathsWithTheLiveCall() throws ServletException, IOException {
        CallSession session = mock(CallSession.class);
        when(session.callId()).thenReturn("call-from-registry");
        when(sessions.find("s-42")).thenReturn(Optional.of(session));
        when(request.getHeader("X-Call-ID")).thenReturn("call-from-header");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/api/sessions/s-42");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("sessionId")).isEqualTo("s-42");
            assertThat(ThreadContext.get("callId")).isEqualTo("call-from-registry");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        verify(chain).doFilter(request, response);
    }

    @Test
    void listRequestsCarryNoSessionId() throws ServletException, IOException {
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/api/sessions");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("sessionId")).isNull();
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        assertThat(MdcFilter.sessionIdOf("/api/sessions/")).isEmpty();
        assertThat(MdcFilter.sessionIdOf("/api/sessions/s-1/extra")).contains("s-1");
    }

    @Test
    void doesNotSetCallIdIfHeaderIsBlank() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-123");
        when(request.getHeader("X-Call-ID")).thenReturn("  ");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/api/sessions");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("callId")).isNull();
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);
    }

    @Test
    void clearsContextEvenWhenChainThrows() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-123");
        when(request.getHeader("X-Call-ID")).thenReturn("call-456");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/api/sessions/s-1");
        doThrow(new ServletException("Test exception")).when(chain).doFilter(request, response);

        assertThatThrownBy(() -> filter.doFilter(request, response, chain))
                .isInstanceOf(ServletException.class)
                .hasMessage("Test exception");

        assertThat(ThreadContext.get("requestId")).isNull();
        assertThat(ThreadContext.get("callId")).isNull();
        assertThat(ThreadContext.get("method")).isNull();
        assertThat(ThreadContext.get("uri")).isNull();
        assertThat(ThreadContext.get("sessionId")).isNull();
    }
}
