package com.roster.service.core.spi;

import com.roster.player.model.PlayerKey;
import com.roster.player.model.PlayerView;
import java.util.List;
import java.util.Map;

public interface PlayerIngestService {
    /**
     * Rate-limits, validates and stores one report.
     *
     * @return key of the stored record
     * @throws com.roster.service.core.ingest.RateLimitExceededException if {@code origin} is over its budget
     * @throws com.roster.service.core.ingest.InvalidPlayerDataException if the payload fails validation
     */
    PlayerKey submit(Map<String, ?> payload, String origin);

    /**
     * @return sanitized records without their origins
     */
    List<PlayerView> list();
}
