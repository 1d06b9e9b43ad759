package com.phillippitts.liveagent.config.logging;

import com.phillippitts.liveagent.service.session.CallSession;
import com.phillippitts.liveagent.service.session.SessionRegistry;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tags admin API requests with the same ThreadContext keys the pipeline logs under, so a
 * {@code DELETE /api/sessions/{id}} line sits next to that call's stage logs.
 *
 * <ul>
 *   <li>requestId: X-Request-ID header or a generated UUID, echoed back on the response</li>
 *   <li>sessionId: the id in an {@code /api/sessions/{id}} path</li>
 *   <li>callId: the call of that live session, else the X-Call-ID header</li>
 *   <li>method, uri</li>
 * </ul>
 *
 * <p>The context is cleared after every request.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String CALL_ID_HEADER = "X-Call-ID";

    private static final Pattern SESSION_PATH = Pattern.compile("^/api/sessions/([^/]+)");

    private final SessionRegistry sessions;

    public MdcFilter(SessionRegistry sessions) {
        this.sessions = sessions;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                tag(http, response);
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private void tag(HttpServletRequest http, ServletResponse response) {
        String requestId = headerOrGenerate(http, REQUEST_ID_HEADER);
        ThreadContext.put("requestId", requestId);
        if (response instanceof HttpServletResponse httpResponse) {
            httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
        }
        ThreadContext.put("method", http.getMethod());
        ThreadContext.put("uri", http.getRequestURI());

        Optional<String> sessionId = sessionIdOf(http.getRequestURI());
        sessionId.ifPresent(id -> ThreadContext.put("sessionId", id));

        String callId = sessionId.flatMap(sessions::find)
                .map(CallSession::callId)
                .orElse(http.getHeader(CALL_ID_HEADER));
        if (callId != null && !callId.isBlank()) {
            ThreadContext.put("callId", callId);
        }
    }

    static Optional<String> sessionIdOf(String uri) {
        if (uri == null) {
            return Optional.empty();
        }
        Matcher matcher = SESSION_PATH.matcher(uri);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    private static String headerOrGenerate(HttpServletRequest req, String headerName) {
        String v = req.getHeader(headerName);
        return (v == null || v.isBlank()) ? UUID.randomUUID().toString() : v;
    }
}
