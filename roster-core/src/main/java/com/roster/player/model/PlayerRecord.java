package com.roster.player.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Latest status reported for one {@link PlayerKey}.
 *
 * <p>{@code fields} holds the submission exactly as received (raw values, extra keys included). {@code lastUpdated}
 * and {@code origin} are set by the registry. Instances are immutable so they can be handed to concurrent readers
 * without copying.
 */
public record PlayerRecord(Map<String, Object> fields, Instant lastUpdated, String origin) {

    public PlayerRecord {
        Objects.requireNonNull(fields, "fields");
        Objects.requireNonNull(lastUpdated, "lastUpdated");
        // keeps submission order and JSON nulls
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public PlayerKey key() {
        return PlayerKey.from(fields);
    }

    public Object field(String name) {
        return fields.get(name);
    }

    public String playerName() {
        return stringField(PlayerFields.PLAYER_NAME);
    }

    public String gameName() {
        return stringField(PlayerFields.GAME_NAME);
    }

    public String jobId() {
        return stringField(PlayerFields.JOB_ID);
    }

    private String stringField(String name) {
        Object value = fields.get(name);
        return value == null ? null : String.valueOf(value);
    }
}
