package com.roster.service.core.registry;

import static org.assertj.core.api.Assertions.assertThat;

import com.roster.player.model.PlayerKey;
import com.roster.service.core.config.RosterProperties;
import com.roster.service.core.ratelimit.SlidingWindowRateLimiter;
import com.roster.service.core.sanitize.HtmlSanitizer;
import com.roster.service.core.support.PlayerPayloads;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class RegistryExpiryJobTest {

    private static final Instant T0 = Instant.parse("2026-01-30T09:00:00Z");

    private final PlayerRegistry registry = new PlayerRegistry(new HtmlSanitizer());
    private final SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(Duration.ofSeconds(10), 20);
    private final RosterProperties properties = new RosterProperties();

    private RegistryExpiryJob jobAt(Instant now) {
        return new RegistryExpiryJob(registry, limiter, properties, Clock.fixed(now, ZoneOffset.UTC));
    }

    @Test
    void keepsRegistryEntriesWhenTtlDisabled() {
        registry.upsert(new PlayerKey("A", "J1"), PlayerPayloads.valid("A", "J1"), "o", T0);
        limiter.admit("o", T0);

        RegistryExpiryJob.SweepResult result = jobAt(T0.plus(Duration.ofDays(1))).sweep();

        assertThat(result.entriesEvicted()).isZero();
        assertThat(result.windowsEvicted()).isEqualTo(1);
        assertThat(registry.size()).isEqualTo(1);
        assertThat(limiter.trackedOrigins()).isZero();
    }

    @Test
    void evictsEntriesOlderThanTtl() {
        properties.getRegistry().setEntryTtl(Duration.ofMinutes(10));
        registry.upsert(new PlayerKey("stale", "J1"), PlayerPayloads.valid("stale", "J1"), "o", T0);
        registry.upsert(
                new PlayerKey("live", "J1"), PlayerPayloads.valid("live", "J1"), "o", T0.plus(Duration.ofMinutes(8)));

        RegistryExpiryJob.SweepResult result =
                jobAt(T0.plus(Duration.ofMinutes(11))).sweep();

        assertThat(result.entriesEvicted()).isEqualTo(1);
        assertThat(registry.get(new PlayerKey("live", "J1"))).isPresent();
    }

    @Test
    void scheduledSweepRunsTheSameEviction() {
        properties.getRegistry().setEntryTtl(Duration.ofSeconds(30));
        registry.upsert(new PlayerKey("A", "J1"), PlayerPayloads.valid("A", "J1"), "o", T0);

        jobAt(T0.plusSeconds(31)).sweepScheduled();

        assertThat(registry.size()).isZero();
    }
}
