package com.phillippitts.voicebridge.config.logging;

import com.phillippitts.voicebridge.util.LogSanitizer;
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
import java.util.UUID;

/**
 * Adds request-scoped values to Log4j2's MDC (ThreadContext) for structured logging.
 *
 * <p>Values added:</p>
 * <ul>
 *   <li>requestId: from X-Request-ID header, or generated UUID; echoed on the response</li>
 *   <li>client: masked client address (first X-Forwarded-For hop, else remote address)</li>
 *   <li>channel: {@code websocket} for upgrade requests, {@code http} otherwise</li>
 *   <li>method and uri</li>
 * </ul>
 *
 * <p>A WebSocket handshake is logged with the same requestId as its upgrade request. Sessions
 * add {@code sessionId} themselves once opened. The context is always cleared after the
 * request.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = headerOrGenerate(http, REQUEST_ID_HEADER);
                ThreadContext.put("requestId", requestId);
                ThreadContext.put("client", LogSanitizer.maskKey(clientAddress(http)));
                ThreadContext.put("channel", isWebSocketUpgrade(http) ? "websocket" : "http");
                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());
                if (response instanceof HttpServletResponse httpResponse) {
                    httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
                }
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static String headerOrGenerate(HttpServletRequest req, String headerName) {
        String v = req.getHeader(headerName);
        return (v == null || v.isBlank()) ? UUID.randomUUID().toString() : v;
    }

    private static String clientAddress(HttpServletRequest req) {
        String forwarded = req.getHeader(FORWARDED_FOR_HEADER);
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        String remote = req.getRemoteAddr();
        return remote == null ? "unknown" : remote;
    }

    private static boolean isWebSocketUpgrade(HttpServletRequest req) {
        return "websocket".equalsIgnoreCase(req.getHeader("Upgrade"));
    }
}
