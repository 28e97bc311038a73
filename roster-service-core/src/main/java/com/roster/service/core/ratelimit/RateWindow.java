package com.roster.service.core.ratelimit;

import java.time.Duration;
import java.time.Instant;

/** Requests seen from one origin since {@code windowStart}. */
public record RateWindow(int count, Instant windowStart) {

    static RateWindow open(Instant now) {
        return new RateWindow(1, now);
    }

    RateWindow increment() {
        return new RateWindow(count == Integer.MAX_VALUE ? count : count + 1, windowStart);
    }

    /** True once strictly more than {@code window} has passed since the window opened. */
    boolean isElapsed(Instant now, Duration window) {
        return Duration.between(windowStart, now).compareTo(window) > 0;
    }
}
