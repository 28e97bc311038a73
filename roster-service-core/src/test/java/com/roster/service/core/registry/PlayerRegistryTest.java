package com.roster.service.core.registry;

import static org.assertj.core.api.Assertions.assertThat;

import com.roster.player.model.PlayerKey;
import com.roster.player.model.PlayerView;
import com.roster.service.core.sanitize.HtmlSanitizer;
import com.roster.service.core.support.PlayerPayloads;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class PlayerRegistryTest {

    private static final Instant T0 = Instant.parse("2026-01-30T09:00:00Z");

    private final PlayerRegistry registry = new PlayerRegistry(new HtmlSanitizer());

    @Test
    void repeatedUpsertsKeepOneRecordWithLatestValues() {
        PlayerKey key = new PlayerKey("A", "J1");
        for (int i = 1; i <= 5; i++) {
            Map<String, Object> payload =
                    PlayerPayloads.with(PlayerPayloads.valid("A", "J1"), "serverPlayers", String.valueOf(i));
            registry.upsert(key, payload, "10.0.0." + i, T0.plusSeconds(i));
        }

        assertThat(registry.size()).isEqualTo(1);
        var stored = registry.get(key).orElseThrow();
        assertThat(stored.field("serverPlayers")).isEqualTo("5");
        assertThat(stored.lastUpdated()).isEqualTo(T0.plusSeconds(5));
        assertThat(stored.origin()).isEqualTo("10.0.0.5");
    }

    @Test
    void upsertReportsWhetherKeyIsNew() {
        PlayerKey key = new PlayerKey("A", "J1");

        assertThat(registry.upsert(key, PlayerPayloads.valid("A", "J1"), "o", T0)).isTrue();
        assertThat(registry.upsert(key, PlayerPayloads.valid("A", "J1"), "o", T0)).isFalse();
    }

    @Test
    void samePlayerOnDifferentJobsIsTrackedSeparately() {
        registry.upsert(new PlayerKey("A", "J1"), PlayerPayloads.valid("A", "J1"), "o", T0);
        registry.upsert(new PlayerKey("A", "J2"), PlayerPayloads.valid("A", "J2"), "o", T0);

        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void replacesEveryFieldOfThePreviousRecord() {
        PlayerKey key = new PlayerKey("A", "J1");
        registry.upsert(key, PlayerPayloads.with(PlayerPayloads.valid("A", "J1"), "extra", "x"), "o", T0);
        registry.upsert(key, PlayerPayloads.valid("A", "J1"), "o", T0.plusSeconds(1));

        assertThat(registry.get(key).orElseThrow().fields()).doesNotContainKey("extra");
    }

    @Test
    void snapshotIsSanitizedAndLeavesStoredValuesRaw() {
        PlayerKey key = new PlayerKey("A", "J1");
        registry.upsert(key, PlayerPayloads.with(PlayerPayloads.valid("A", "J1"), "displayName", "<script>"), "o", T0);

        List<PlayerView> first = registry.snapshot();
        List<PlayerView> second = registry.snapshot();

        assertThat(first.get(0).field("displayName")).isEqualTo("&lt;script&gt;");
        assertThat(second).isEqualTo(first);
        assertThat(registry.get(key).orElseThrow().field("displayName")).isEqualTo("<script>");
    }

    @Test
    void snapshotNeverExposesOrigin() {
        Map<String, Object> payload = PlayerPayloads.with(PlayerPayloads.valid("A", "J1"), "ip", "1.2.3.4");
        payload = PlayerPayloads.with(payload, "origin", "1.2.3.4");
        registry.upsert(new PlayerKey("A", "J1"), payload, "10.0.0.1", T0);
        registry.upsert(new PlayerKey("B", "J1"), PlayerPayloads.valid("B", "J1"), "10.0.0.2", T0);

        for (PlayerView view : registry.snapshot()) {
            assertThat(view.fields()).doesNotContainKeys("ip", "origin");
            assertThat(view.fields().values()).doesNotContain("10.0.0.1", "10.0.0.2");
            assertThat(view.lastUpdated()).isEqualTo(T0);
        }
    }

    @Test
    void snapshotOfEmptyRegistryIsEmpty() {
        assertThat(registry.snapshot()).isEmpty();
    }

    @Test
    void removeDeletesOnlyTheGivenKey() {
        registry.upsert(new PlayerKey("A", "J1"), PlayerPayloads.valid("A", "J1"), "o", T0);
        registry.upsert(new PlayerKey("B", "J1"), PlayerPayloads.valid("B", "J1"), "o", T0);

        assertThat(registry.remove(new PlayerKey("A", "J1"))).isTrue();
        assertThat(registry.remove(new PlayerKey("A", "J1"))).isFalse();
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void evictsRecordsNotRefreshedSinceCutoff() {
        registry.upsert(new PlayerKey("old", "J1"), PlayerPayloads.valid("old", "J1"), "o", T0);
        registry.upsert(new PlayerKey("new", "J1"), PlayerPayloads.valid("new", "J1"), "o", T0.plusSeconds(120));

        int removed = registry.evictOlderThan(T0.plusSeconds(60));

        assertThat(removed).isEqualTo(1);
        assertThat(registry.get(new PlayerKey("new", "J1"))).isPresent();
        assertThat(registry.get(new PlayerKey("old", "J1"))).isEmpty();
    }

    @Test
    void concurrentUpsertsAndSnapshotsStayConsistent() throws Exception {
        int writers = 4;
        int rounds = 500;
        ExecutorService pool = Executors.newFixedThreadPool(writers + 2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int w = 0; w < writers; w++) {
                int writer = w;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < rounds; i++) {
                        Map<String, Object> payload = PlayerPayloads.valid("p" + (i % 10), "J1");
                        payload.put("serverPlayers", String.valueOf(i));
                        payload.put("maxPlayers", String.valueOf(i));
                        payload.put("writer", writer);
                        registry.upsert(new PlayerKey("p" + (i % 10), "J1"), payload, "o", T0);
                    }
                    return null;
                }));
            }
            for (int r = 0; r < 2; r++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < rounds; i++) {
                        for (PlayerView view : registry.snapshot()) {
                            // both counts are written together, a torn record would disagree
                            assertThat(view.field("serverPlayers")).isEqualTo(view.field("maxPlayers"));
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(registry.size()).isEqualTo(10);
    }
}
