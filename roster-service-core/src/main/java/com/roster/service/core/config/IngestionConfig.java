package com.roster.service.core.config;

import com.roster.service.core.ratelimit.SlidingWindowRateLimiter;
import com.roster.service.core.validation.PlayerPayloadValidator;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Builds the stateful ingestion components from {@link RosterProperties}. */
@Configuration
@Slf4j
public class IngestionConfig {

    @Bean
    public SlidingWindowRateLimiter submissionRateLimiter(RosterProperties properties) {
        RosterProperties.RateLimit rateLimit = properties.getRateLimit();
        log.info(
                "Submission rate limit maxRequests={} window={}", rateLimit.getMaxRequests(), rateLimit.getWindow());
        return new SlidingWindowRateLimiter(rateLimit.getWindow(), rateLimit.getMaxRequests());
    }

    @Bean
    public PlayerPayloadValidator playerPayloadValidator(RosterProperties properties) {
        log.info("Player count parsing mode={}", properties.getValidation().getNumericMode());
        return new PlayerPayloadValidator(properties.getValidation().getNumericMode());
    }

    /** Source of rate-window starts, {@code lastUpdated} stamps and expiry cutoffs. */
    @Bean
    public Clock ingestionClock() {
        return Clock.systemUTC();
    }
}
