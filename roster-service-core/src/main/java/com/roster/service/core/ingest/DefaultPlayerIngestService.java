package com.roster.service.core.ingest;

import com.roster.player.model.PlayerFields;
import com.roster.player.model.PlayerKey;
import com.roster.player.model.PlayerView;
import com.roster.service.core.ratelimit.SlidingWindowRateLimiter;
import com.roster.service.core.registry.PlayerRegistry;
import com.roster.service.core.spi.PlayerIngestService;
import com.roster.service.core.validation.PlayerPayloadValidator;
import com.roster.service.core.validation.ValidationResult;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class DefaultPlayerIngestService implements PlayerIngestService {

    private final SlidingWindowRateLimiter rateLimiter;
    private final PlayerPayloadValidator validator;
    private final PlayerRegistry registry;
    private final Clock clock;

    @Override
    public PlayerKey submit(Map<String, ?> payload, String origin) {
        Instant now = clock.instant();
        if (!rateLimiter.admit(origin, now)) {
            throw new RateLimitExceededException(origin);
        }

        ValidationResult result = validator.check(payload);
        if (!result.valid()) {
            log.debug("Rejected submission from {}: {}", origin, result.describe());
            throw new InvalidPlayerDataException(result);
        }

        PlayerKey key = PlayerKey.from(payload);
        boolean created = registry.upsert(key, payload, origin, now);
        if (created) {
            log.info("Registered player {} in {}", key.playerName(), payload.get(PlayerFields.GAME_NAME));
        } else {
            log.info("Updated player data for {} in {}", key.playerName(), payload.get(PlayerFields.GAME_NAME));
        }
        return key;
    }

    @Override
    public List<PlayerView> list() {
        return registry.snapshot();
    }
}
