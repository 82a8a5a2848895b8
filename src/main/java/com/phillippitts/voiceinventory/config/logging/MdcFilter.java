package com.phillippitts.voiceinventory.config.logging;

import com.phillippitts.voiceinventory.util.LogSanitizer;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Puts request-scoped keys into the Log4j2 ThreadContext for the log pattern.
 *
 * <ul>
 *   <li>requestId: X-Request-ID header, or a generated UUID</li>
 *   <li>sessionId: X-Session-ID header, the client device running the recognizer (omitted if absent)</li>
 *   <li>method and uri of the request</li>
 * </ul>
 *
 * <p>Header values come from the client, so they are stripped of control characters and capped at
 * {@value #MAX_ID_LENGTH} characters before they reach a log line. The context is cleared after
 * every request.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String SESSION_ID_HEADER = "X-Session-ID";
    static final int MAX_ID_LENGTH = 64;

    private static final Pattern CONTROL = Pattern.compile("\\p{Cntrl}");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = clientId(http, REQUEST_ID_HEADER);
                ThreadContext.put("requestId", requestId != null ? requestId : UUID.randomUUID().toString());
                String sessionId = clientId(http, SESSION_ID_HEADER);
                if (sessionId != null) {
                    ThreadContext.put("sessionId", sessionId);
                }
                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    /**
     * @return the cleaned header value, or {@code null} if absent or blank after cleaning
     */
    static String clientId(HttpServletRequest request, String header) {
        String raw = request.getHeader(header);
        if (raw == null) {
            return null;
        }
        String cleaned = LogSanitizer.truncate(CONTROL.matcher(raw).replaceAll("").trim(), MAX_ID_LENGTH);
        return cleaned.isEmpty() ? null : cleaned;
    }
}
