package com.roster.controller.rest;

import static org.assertj.core.api.Assertions.assertThat;

import com.roster.service.core.config.RosterProperties;
import jakarta.servlet.FilterChain;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class ClientOriginFilterTest {

    private final ClientOriginFilter filter = new ClientOriginFilter(new ClientOriginResolver(new RosterProperties()));

    @AfterEach
    void clear() {
        MDC.clear();
    }

    @Test
    void exposesOriginDuringRequestOnly() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest();
        req.setRemoteAddr("10.9.8.7");
        AtomicReference<String> seen = new AtomicReference<>();
        FilterChain chain = (r, s) -> seen.set(MDC.get("clientOrigin"));

        filter.doFilter(req, new MockHttpServletResponse(), chain);

        assertThat(seen.get()).isEqualTo("10.9.8.7");
        assertThat(MDC.get("clientOrigin")).isNull();
    }

    @Test
    void restoresPreviousValue() throws Exception {
        MDC.put("clientOrigin", "outer");
        FilterChain chain = (r, s) -> {};

        filter.doFilter(new MockHttpServletRequest(), new MockHttpServletResponse(), chain);

        assertThat(MDC.get("clientOrigin")).isEqualTo("outer");
    }
}
