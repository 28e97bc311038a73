package com.roster.service.core.ingest;

/** The submitting origin has used up its request budget for the current window. */
public class RateLimitExceededException extends RuntimeException {

    private final String origin;

    public RateLimitExceededException(String origin) {
        super("Rate limit exceeded for origin " + origin);
        this.origin = origin;
    }

    public String getOrigin() {
        return origin;
    }
}
