package com.phillippitts.voiceinventory.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
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
    private Map<String, String> seenDuringRequest;

    @BeforeEach
    void setUp() throws ServletException, IOException {
        filter = new MdcFilter();
        request = mock(HttpServletRequest.class);
        response = mock(HttpServletResponse.class);
        chain = mock(FilterChain.class);
        seenDuringRequest = new HashMap<>();
        doAnswer(invocation -> {
            seenDuringRequest.putAll(ThreadContext.getContext());
            return null;
        }).when(chain).doFilter(any(), any());
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void copiesRequestAndSessionHeaders() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("req-42");
        when(request.getHeader(MdcFilter.SESSION_ID_HEADER)).thenReturn("tablet-ward-b");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/api/voice/task/transcript");

        filter.doFilter(request, response, chain);

        assertThat(seenDuringRequest)
                .containsEntry("requestId", "req-42")
                .containsEntry("sessionId", "tablet-ward-b")
                .containsEntry("method", "POST")
                .containsEntry("uri", "/api/voice/task/transcript");
        verify(chain).doFilter(request, response);
    }

    @Test
    void generatesRequestIdWhenHeaderIsMissingOrBlank() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("  ");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/api/voice/capture");

        filter.doFilter(request, response, chain);

        assertThat(seenDuringRequest.get("requestId")).matches(UUID_PATTERN);
        assertThat(seenDuringRequest).doesNotContainKey("sessionId");
    }

    @Test
    void stripsControlCharactersAndCapsClientIds() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("req-1\r\nFAKE LOG LINE");
        when(request.getHeader(MdcFilter.SESSION_ID_HEADER)).thenReturn("s".repeat(200));
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/ping");

        filter.doFilter(request, response, chain);

        assertThat(seenDuringRequest.get("requestId")).isEqualTo("req-1FAKE LOG LINE");
        assertThat(seenDuringRequest.get("sessionId")).hasSize(MdcFilter.MAX_ID_LENGTH);
    }

    @Test
    void treatsControlOnlyHeaderAsMissing() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("req-1");
        when(request.getHeader(MdcFilter.SESSION_ID_HEADER)).thenReturn("\t\u0007");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/ping");

        filter.doFilter(request, response, chain);

        assertThat(seenDuringRequest).doesNotContainKey("sessionId");
    }

    @Test
    void clearsContextAfterRequest() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("req-1");
        when(request.getHeader(MdcFilter.SESSION_ID_HEADER)).thenReturn("s-1");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/ping");

        filter.doFilter(request, response, chain);

        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void clearsContextEvenWhenChainThrows() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("req-1");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/api/voice/task/confirm");
        doThrow(new ServletException("boom")).when(chain).doFilter(request, response);

        assertThatThrownBy(() -> filter.doFilter(request, response, chain))
                .isInstanceOf(ServletException.class)
                .hasMessage("boom");
        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void passesNonHttpRequestThrough() throws ServletException, IOException {
        ServletRequest plain = mock(ServletRequest.class);

        filter.doFilter(plain, response, chain);

        verify(chain).doFilter(plain, response);
        assertThat(seenDuringRequest).isEmpty();
    }
}
