package com.clausescan.util;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @Test
    void testFilter_EchoesIncomingId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/catalog");
        request.addHeader(CorrelationIdFilter.REQUEST_ID_HEADER, "abc-123");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> inChain = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain() {
            @Override
            public void doFilter(jakarta.servlet.ServletRequest req, jakarta.servlet.ServletResponse res) {
                inChain.set(MDC.get(CorrelationIdFilter.REQUEST_ID_MDC_KEY));
            }
        });

        assertThat(response.getHeader(CorrelationIdFilter.REQUEST_ID_HEADER)).isEqualTo("abc-123");
        assertThat(inChain.get()).isEqualTo("abc-123");
        assertThat(MDC.get(CorrelationIdFilter.REQUEST_ID_MDC_KEY)).isNull();
        assertThat(MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY)).isNull();
    }

    @Test
    void testFilter_GeneratesIdWhenMissingOrTooLong() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/catalog");
        request.addHeader(CorrelationIdFilter.REQUEST_ID_HEADER, "x".repeat(129));
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        String generated = response.getHeader(CorrelationIdFilter.REQUEST_ID_HEADER);
        assertThat(generated).isNotNull().hasSize(36).doesNotContain("xxx");
    }
}
