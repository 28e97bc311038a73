package com.roster.player.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Exported form of a {@link PlayerRecord}: the submitted fields flattened next to {@code lastUpdated}, without the
 * submitting origin.
 */
public final class PlayerView {

    private final Map<String, Object> fields;
    private final Instant lastUpdated;

    public PlayerView(Map<String, Object> fields, Instant lastUpdated) {
        Objects.requireNonNull(fields, "fields");
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.keySet().removeAll(PlayerFields.RESERVED);
        this.fields = Collections.unmodifiableMap(copy);
        this.lastUpdated = Objects.requireNonNull(lastUpdated, "lastUpdated");
    }

    @JsonAnyGetter
    public Map<String, Object> fields() {
        return fields;
    }

    public Object field(String name) {
        return fields.get(name);
    }

    @JsonProperty(PlayerFields.LAST_UPDATED)
    public Instant lastUpdated() {
        return lastUpdated;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PlayerView other)) return false;
        return fields.equals(other.fields) && lastUpdated.equals(other.lastUpdated);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields, lastUpdated);
    }

    @Override
    public String toString() {
        return "PlayerView{fields=" + fields + ", lastUpdated=" + lastUpdated + "}";
    }
}
