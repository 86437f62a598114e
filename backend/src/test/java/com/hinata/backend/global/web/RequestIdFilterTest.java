package com.hinata.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.servlet.FilterChain;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @Test
    void keepsCallerIdAndBindsItForTheChain() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/auth/me");
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "  trace-42  ");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();
        FilterChain chain = (req, res) -> seen.set(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY));

        filter.doFilter(request, response, chain);

        assertThat(seen.get()).isEqualTo("trace-42");
        assertThat(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isEqualTo("trace-42");
        assertThat(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY)).isNull();
    }

    @Test
    void replacesUnsafeOrMissingIds() {
        assertThat(UUID.fromString(RequestIdFilter.acceptedOrNew(null))).isNotNull();
        assertThat(RequestIdFilter.acceptedOrNew("bad id\r\nX-Injected: 1")).doesNotContain("Injected");
        assertThat(RequestIdFilter.acceptedOrNew("x".repeat(129))).hasSize(36);
        assertThat(RequestIdFilter.acceptedOrNew("svc:abc.1_2-3")).isEqualTo("svc:abc.1_2-3");
    }
}
