package com.roster.service.core.registry;

import com.roster.service.core.config.RosterProperties;
import com.roster.service.core.ratelimit.SlidingWindowRateLimiter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops elapsed rate-limit windows and, when {@code roster.registry.entry-ttl} is positive, registry
 * entries that have not been refreshed within the TTL.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RegistryExpiryJob {

    public record SweepResult(int windowsEvicted, int entriesEvicted) {}

    private final PlayerRegistry registry;
    private final SlidingWindowRateLimiter rateLimiter;
    private final RosterProperties properties;
    private final Clock clock;

    @Scheduled(
            fixedRateString = "${roster.registry.sweep-interval-millis:60000}",
            initialDelayString = "${roster.registry.sweep-interval-millis:60000}")
    public void sweepScheduled() {
        try {
            sweep();
        } catch (RuntimeException ex) {
            log.error("Registry sweep failed", ex);
        }
    }

    public SweepResult sweep() {
        Instant now = clock.instant();
        int windows = rateLimiter.evictExpired(now);
        int entries = 0;
        Duration ttl = properties.getRegistry().getEntryTtl();
        if (ttl != null && !ttl.isZero() && !ttl.isNegative()) {
            entries = registry.evictOlderThan(now.minus(ttl));
        }
        if (windows > 0 || entries > 0) {
            log.info(
                    "Registry sweep windowsEvicted={} entriesEvicted={} remainingEntries={} trackedOrigins={}",
                    windows,
                    entries,
                    registry.size(),
                    rateLimiter.trackedOrigins());
        } else {
            log.debug("Registry sweep found nothing to evict");
        }
        return new SweepResult(windows, entries);
    }
}
