package com.roster.controller.rest;

import com.roster.service.core.config.RosterProperties;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

/**
 * Determines the network origin used for rate limiting. The servlet remote address is used unless
 * {@code roster.gateway.trust-forwarded-for} is set, in which case the first {@code X-Forwarded-For} hop wins.
 */
@Component
public class ClientOriginResolver {

    static final String FORWARDED_FOR = "X-Forwarded-For";
    static final String UNKNOWN = "unknown";

    private final RosterProperties properties;

    public ClientOriginResolver(RosterProperties properties) {
        this.properties = properties;
    }

    public String resolve(HttpServletRequest request) {
        if (properties.getGateway().isTrustForwardedFor()) {
            String forwarded = firstHop(request.getHeader(FORWARDED_FOR));
            if (forwarded != null) {
                return forwarded;
            }
        }
        String remote = request.getRemoteAddr();
        return (remote == null || remote.isBlank()) ? UNKNOWN : remote;
    }

    private static String firstHop(String header) {
        if (header == null || header.isBlank()) return null;
        int comma = header.indexOf(',');
        String hop = (comma >= 0 ? header.substring(0, comma) : header).trim();
        return hop.isEmpty() ? null : hop;
    }
}
