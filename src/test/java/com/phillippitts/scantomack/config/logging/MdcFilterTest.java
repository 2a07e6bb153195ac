package com.phillippitts.scantomack.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
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
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MdcFilterTest {

    private static final String UUID_PATTERN = "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}";

    private MdcFilter filter;
    private HttpServletRequest request;
    private HttpServletResponse response;
    private FilterChain chain;
    private final Map<String, String> seen = new HashMap<>();

    @BeforeEach
    void setUp() throws ServletException, IOException {
        filter = new MdcFilter();
        request = mock(HttpServletRequest.class);
        response = mock(HttpServletResponse.class);
        chain = mock(FilterChain.class);
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/api/v1/ocr");
        doAnswer(invocation -> {
            seen.putAll(ThreadContext.getImmutableContext());
            return null;
        }).when(chain).doFilter(any(), any());
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void usesRequestIdHeaderWhenPresent() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-123");

        filter.doFilter(request, response, chain);

        assertThat(seen).containsEntry("requestId", "req-123")
                .containsEntry("method", "POST")
                .containsEntry("uri", "/api/v1/ocr");
        verify(chain).doFilter(request, response);
    }

    @Test
    void generatesUuidForMissingOrBlankRequestId() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("   ");

        filter.doFilter(request, response, chain);

        assertThat(seen.get("requestId")).matches(UUID_PATTERN);
    }

    @Test
    void copiesCorrelationAndClientIdsOnlyWhenSupplied() throws ServletException, IOException {
        when(request.getHeader("X-Correlation-ID")).thenReturn("corr-9");
        when(request.getHeader("X-Client-ID")).thenReturn(" ");

        filter.doFilter(request, response, chain);

        assertThat(seen).containsEntry("correlationId", "corr-9").doesNotContainKey("clientId");
    }

    @Test
    void clearsContextAfterRequest() throws ServletException, IOException {
        when(request.getHeader("X-Client-ID")).thenReturn("scanner-3");

        filter.doFilter(request, response, chain);

        assertThat(seen).containsEntry("clientId", "scanner-3");
        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void clearsContextEvenWhenChainThrows() throws ServletException, IOException {
        when(request.getHeader("X-Correlation-ID")).thenReturn("corr-1");
        doThrow(new ServletException("boom")).when(chain).doFilter(request, response);

        assertThatThrownBy(() -> filter.doFilter(request, response, chain))
                .isInstanceOf(ServletException.class)
                .hasMessage("boom");

        assertThat(ThreadContext.isEmpty()).isTrue();
    }
}
