package com.phillippitts.scantomack.config.logging;

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

/**
 * Seeds Log4j2's ThreadContext with request-scoped values for structured logging.
 *
 * <p>Keys:</p>
 * <ul>
 *   <li>requestId: X-Request-ID header, or a generated UUID</li>
 *   <li>correlationId: X-Correlation-ID header, when the caller supplies one; otherwise the
 *       processing facade fills it in once it has generated an id</li>
 *   <li>clientId: X-Client-ID header, when present</li>
 *   <li>method, uri</li>
 * </ul>
 *
 * <p>Everything is cleared after the request; servlet threads are pooled.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    static final String CLIENT_ID_HEADER = "X-Client-ID";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = http.getHeader(REQUEST_ID_HEADER);
                ThreadContext.put("requestId", isBlank(requestId) ? UUID.randomUUID().toString() : requestId);
                putIfPresent("correlationId", http.getHeader(CORRELATION_ID_HEADER));
                putIfPresent("clientId", http.getHeader(CLIENT_ID_HEADER));
                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static void putIfPresent(String key, String value) {
        if (!isBlank(value)) {
            ThreadContext.put(key, value);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
