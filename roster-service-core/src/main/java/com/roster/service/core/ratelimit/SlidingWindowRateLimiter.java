package com.roster.service.core.ratelimit;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-origin request counter over a window that restarts once it has elapsed.
 *
 * <p>Every call counts, rejected ones included, so an origin that keeps hammering stays rejected until its window
 * runs out. All state changes happen under one monitor.
 */
@Slf4j
public class SlidingWindowRateLimiter {

    private final Duration window;
    private final int maxRequests;

    private final Map<String, RateWindow> windows = new HashMap<>();
    private final Object lock = new Object();

    public SlidingWindowRateLimiter(Duration window, int maxRequests) {
        Objects.requireNonNull(window, "window");
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("rate limit window must be positive, got " + window);
        }
        if (maxRequests < 1) {
            throw new IllegalArgumentException("rate limit maxRequests must be >= 1, got " + maxRequests);
        }
        this.window = window;
        this.maxRequests = maxRequests;
    }

    /**
     * Records a request from {@code origin} at {@code now}.
     *
     * @return true if the request is within the origin's budget
     */
    public boolean admit(String origin, Instant now) {
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(now, "now");
        synchronized (lock) {
            RateWindow current = windows.get(origin);
            if (current == null || current.isElapsed(now, window)) {
                windows.put(origin, RateWindow.open(now));
                return true;
            }
            RateWindow next = current.increment();
            windows.put(origin, next);
            if (next.count() <= maxRequests) {
                return true;
            }
            if (next.count() == maxRequests + 1) {
                log.warn(
                        "Rate limit reached origin={} maxRequests={} windowStart={}",
                        origin,
                        maxRequests,
                        next.windowStart());
            }
            return false;
        }
    }

    /**
     * Drops windows that have already elapsed. The next request from such an origin opens a fresh window either way,
     * so eviction never changes an admission decision.
     *
     * @return number of windows removed
     */
    public int evictExpired(Instant now) {
        int removed = 0;
        synchronized (lock) {
            Iterator<RateWindow> it = windows.values().iterator();
            while (it.hasNext()) {
                if (it.next().isElapsed(now, window)) {
                    it.remove();
                    removed++;
                }
            }
        }
        return removed;
    }

    public Optional<RateWindow> window(String origin) {
        synchronized (lock) {
            return Optional.ofNullable(windows.get(origin));
        }
    }

    public int trackedOrigins() {
        synchronized (lock) {
            return windows.size();
        }
    }

    public Duration window() {
        return window;
    }

    public int maxRequests() {
        return maxRequests;
    }
}
