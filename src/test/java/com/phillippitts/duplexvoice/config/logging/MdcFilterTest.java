package com.phillippitts.duplexvoice.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.matches;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
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
    void usesRequestIdFromHeaderAndEchoesIt() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-123");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/duplex/status");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("requestId")).isEqualTo("req-123");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        verify(response).setHeader("X-Request-ID", "req-123");
        verify(chain).doFilter(request, response);
    }

    @Test
    void generatesUuidIfRequestIdHeaderMissingOrBlank() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("   ");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/duplex/stop");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("requestId")).matches(UUID_PATTERN);
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        verify(response).setHeader(eq("X-Request-ID"), matches(UUID_PATTERN));
    }

    @Test
    void setsMethodAndUri() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-123");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/duplex/events");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("method")).isEqualTo("GET");
            assertThat(ThreadContext.get("uri")).isEqualTo("/duplex/events");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);
    }

    @Test
    void clearsContextAfterRequest() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-123");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/ping");

        filter.doFilter(request, response, chain);

        assertThat(ThreadContext.get("requestId")).isNull();
        assertThat(ThreadContext.get("method")).isNull();
        assertThat(ThreadContext.get("uri")).isNull();
    }

    @Test
    void clearsContextEvenWhenChainThrows() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-123");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/duplex/stop");
        doThrow(new ServletException("boom")).when(chain).doFilter(request, response);

        assertThatThrownBy(() -> filter.doFilter(request, response, chain))
                .isInstanceOf(ServletException.class)
                .hasMessage("boom");

        assertThat(ThreadContext.get("requestId")).isNull();
    }
}
