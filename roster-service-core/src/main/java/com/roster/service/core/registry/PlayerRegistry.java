package com.roster.service.core.registry;

import com.roster.player.model.PlayerKey;
import com.roster.player.model.PlayerRecord;
import com.roster.player.model.PlayerView;
import com.roster.service.core.sanitize.HtmlSanitizer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * In-memory store of the latest record per {@link PlayerKey}.
 *
 * <p>Writers (upsert, remove, eviction) hold the write lock; snapshots hold the read lock and may run in parallel.
 * Records are immutable, so a reader sees either the previous or the new record for a key, never a mix.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlayerRegistry {

    private final HtmlSanitizer sanitizer;

    private final Map<PlayerKey, PlayerRecord> entries = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Stores {@code fields} as the current record for {@code key}, replacing any previous one in place.
     *
     * @return true if the key was not tracked before
     */
    public boolean upsert(PlayerKey key, Map<String, ?> fields, String origin, Instant now) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(fields, "fields");
        PlayerRecord record = new PlayerRecord(new LinkedHashMap<>(fields), now, origin);
        lock.writeLock().lock();
        try {
            return entries.put(key, record) == null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Sanitized, origin-free copy of every record. Callers must not depend on the order. */
    public List<PlayerView> snapshot() {
        List<PlayerRecord> records;
        lock.readLock().lock();
        try {
            records = new ArrayList<>(entries.values());
        } finally {
            lock.readLock().unlock();
        }
        List<PlayerView> views = new ArrayList<>(records.size());
        for (PlayerRecord record : records) {
            PlayerRecord clean = sanitizer.clean(record);
            views.add(new PlayerView(clean.fields(), clean.lastUpdated()));
        }
        return views;
    }

    /** Raw stored record, origin included. */
    public Optional<PlayerRecord> get(PlayerKey key) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean remove(PlayerKey key) {
        lock.writeLock().lock();
        try {
            boolean removed = entries.remove(key) != null;
            if (removed) {
                log.info("Removed player record {}", key);
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes every record whose last update is strictly before {@code cutoff}.
     *
     * @return number of records removed
     */
    public int evictOlderThan(Instant cutoff) {
        int removed = 0;
        lock.writeLock().lock();
        try {
            Iterator<PlayerRecord> it = entries.values().iterator();
            while (it.hasNext()) {
                if (it.next().lastUpdated().isBefore(cutoff)) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        return removed;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
