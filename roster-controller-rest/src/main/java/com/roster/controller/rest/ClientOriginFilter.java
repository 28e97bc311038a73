package com.roster.controller.rest;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import java.io.IOException;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/** Exposes the resolved client origin to log lines written while a request is handled. */
@Component
public class ClientOriginFilter implements Filter {

    static final String MDC_KEY = "clientOrigin";

    private final ClientOriginResolver resolver;

    public ClientOriginFilter(ClientOriginResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        String previous = MDC.get(MDC_KEY);
        try {
            if (request instanceof HttpServletRequest req) {
                MDC.put(MDC_KEY, resolver.resolve(req));
            }
            chain.doFilter(request, response);
        } finally {
            // Restore prior MDC state for pooled threads
            if (previous == null) MDC.remove(MDC_KEY);
            else MDC.put(MDC_KEY, previous);
        }
    }
}
