package com.github.dimitryivaniuta.dbgateway.web;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @Test
    void wellFormedClientIdIsKeptAndEchoed() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader(RequestContextKeys.CORRELATION_ID_HEADER, "req-42.a:b");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenInMdc = new AtomicReference<>();

        filter.doFilter(request, response, (req, res) -> seenInMdc.set(MDC.get(RequestContextKeys.CORRELATION_ID_MDC_KEY)));

        assertThat(seenInMdc.get()).isEqualTo("req-42.a:b");
        assertThat(response.getHeader(RequestContextKeys.CORRELATION_ID_HEADER)).isEqualTo("req-42.a:b");
        assertThat(MDC.get(RequestContextKeys.CORRELATION_ID_MDC_KEY)).isNull();
    }

    @Test
    void unsafeOrMissingIdIsReplaced() {
        String injected = CorrelationIdFilter.resolve("abc\nFAKE LOG LINE");

        assertThat(injected).isNotEqualTo("abc\nFAKE LOG LINE");
        assertThat(UUID.fromString(injected)).isNotNull();
        assertThat(UUID.fromString(CorrelationIdFilter.resolve(null))).isNotNull();
        assertThat(UUID.fromString(CorrelationIdFilter.resolve("x".repeat(129)))).isNotNull();
    }
}
