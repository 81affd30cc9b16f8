package com.venue.scout.recommender.test.core;

import com.venue.scout.recommender.core.InMemoryTtlStateStore;
import com.venue.scout.recommender.test.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryTtlStateStoreTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-10-16T12:00:00Z"));
    private final InMemoryTtlStateStore store = new InMemoryTtlStateStore("scout:", clock);

    @Test
    void entriesExpireWithTheClock() {
        store.put("geo:1 main st", "40.0,-74.0", Duration.ofMinutes(5));
        assertThat(store.get("geo:1 main st")).contains("40.0,-74.0");

        clock.advance(Duration.ofMinutes(5));

        assertThat(store.get("geo:1 main st")).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    void zeroTtlNeverExpires() {
        store.put("k", "v", Duration.ZERO);
        clock.advance(Duration.ofDays(365));

        assertThat(store.get("k")).contains("v");
    }

    @Test
    void setIfAbsentHonorsLiveAndExpiredEntries() {
        assertThat(store.setIfAbsent("lock:generate:u1", "1", Duration.ofSeconds(30))).isTrue();
        assertThat(store.setIfAbsent("lock:generate:u1", "2", Duration.ofSeconds(30))).isFalse();

        clock.advance(Duration.ofSeconds(31));

        assertThat(store.setIfAbsent("lock:generate:u1", "3", Duration.ofSeconds(30))).isTrue();
        assertThat(store.get("lock:generate:u1")).contains("3");
    }

    @Test
    void onlyOneConcurrentSetIfAbsentWins() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> calls = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                String v = String.valueOf(i);
                calls.add(() -> store.setIfAbsent("lock", v, Duration.ofSeconds(30)));
            }
            int winners = 0;
            for (Future<Boolean> f : pool.invokeAll(calls)) {
                if (f.get()) winners++;
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void deleteRemovesEntry() {
        store.put("refresh:force:u1", "1", Duration.ofHours(1));
        store.delete("refresh:force:u1");

        assertThat(store.get("refresh:force:u1")).isEmpty();
    }
}
