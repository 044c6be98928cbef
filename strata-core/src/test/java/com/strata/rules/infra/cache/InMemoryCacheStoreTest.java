package com.strata.rules.infra.cache;

import com.strata.rules.api.model.CacheStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryCacheStoreTest {

    private MutableClock clock;
    private InMemoryCacheStore<Integer> cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        cache = InMemoryCacheStore.<Integer>builder()
                .maxSize(3)
                .defaultTtl(Duration.ofSeconds(60))
                .clock(clock)
                .build();
    }

    @Test
    @DisplayName("Should put and get value")
    void shouldPutAndGetValue() {
        cache.put("a", 1);

        assertThat(cache.get("a")).contains(1);
        assertThat(cache.get("missing")).isEmpty();
    }

    @Test
    @DisplayName("Should evict the least recently used entry when capacity is exceeded")
    void shouldEvictLeastRecentlyUsed() {
        cache.put("a", 1);
        cache.put("b", 2);
        cache.put("c", 3);

        cache.put("d", 4);

        assertThat(cache.keys()).containsExactlyInAnyOrder("b", "c", "d");
        assertThat(cache.stats().evictions()).isEqualTo(1);
    }

    @Test
    @DisplayName("A get right before the overflowing put protects the key")
    void getProtectsKeyFromEviction() {
        cache.put("a", 1);
        cache.put("b", 2);
        cache.put("c", 3);

        assertThat(cache.get("a")).contains(1);
        cache.put("d", 4);

        assertThat(cache.keys()).containsExactlyInAnyOrder("a", "c", "d");
    }

    @Test
    @DisplayName("maxSize=2: put a, put b, get a, put c evicts b")
    void twoEntryScenario() {
        InMemoryCacheStore<Integer> small = InMemoryCacheStore.<Integer>builder()
                .maxSize(2)
                .clock(clock)
                .build();

        small.put("a", 1);
        small.put("b", 2);
        small.get("a");
        small.put("c", 3);

        assertThat(small.get("b")).isEmpty();
        assertThat(small.get("a")).contains(1);
        assertThat(small.get("c")).contains(3);
    }

    @Test
    @DisplayName("Overwriting an existing key never evicts and refreshes recency")
    void overwriteDoesNotEvict() {
        cache.put("a", 1);
        cache.put("b", 2);
        cache.put("c", 3);

        cache.put("a", 10);
        cache.put("d", 4);

        assertThat(cache.keys()).containsExactlyInAnyOrder("a", "c", "d");
        assertThat(cache.get("a")).contains(10);
        assertThat(cache.stats().evictions()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should treat entry as absent once its TTL has elapsed")
    void shouldExpireAfterTtl() {
        cache.put("a", 1, Duration.ofSeconds(10));

        clock.advance(Duration.ofSeconds(10));
        assertThat(cache.get("a")).as("not expired at exactly the deadline").contains(1);

        clock.advance(Duration.ofMillis(1));
        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.keys()).doesNotContain("a");

        CacheStatus stats = cache.stats();
        assertThat(stats.expiredItems()).isEqualTo(1);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.hits()).isEqualTo(1);
    }

    @Test
    @DisplayName("Entry stored without TTL never expires")
    void nullTtlNeverExpires() {
        cache.put("a", 1, null);

        clock.advance(Duration.ofDays(365));

        assertThat(cache.get("a")).contains(1);
        assertThat(cache.peek("a")).hasValueSatisfying(e -> assertThat(e.expiresAt()).isNull());
    }

    @Test
    @DisplayName("Expired entries are purged before evicting a live one")
    void purgesExpiredBeforeEviction() {
        cache.put("a", 1, Duration.ofSeconds(1));
        cache.put("b", 2);
        cache.put("c", 3);

        clock.advance(Duration.ofSeconds(5));
        cache.put("d", 4);

        assertThat(cache.keys()).containsExactlyInAnyOrder("b", "c", "d");
        CacheStatus stats = cache.stats();
        assertThat(stats.evictions()).isZero();
        assertThat(stats.expiredItems()).isEqualTo(1);
    }

    @Test
    @DisplayName("Hit updates lastAccessedAt; peek leaves recency and counters alone")
    void hitTouchesEntry() {
        cache.put("a", 1);
        clock.advance(Duration.ofSeconds(3));

        cache.get("a");

        CacheStore.CacheEntry<Integer> entry = cache.peek("a").orElseThrow();
        assertThat(entry.createdAt()).isEqualTo(clock.instant().minusSeconds(3));
        assertThat(entry.lastAccessedAt()).isEqualTo(clock.instant());
        assertThat(entry.expiresAt()).isEqualTo(entry.createdAt().plusSeconds(60));
        assertThat(cache.stats().totalAccesses()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should report hit rate over lifetime counters and reset them on clear")
    void statsAndClear() {
        cache.put("a", 1);
        cache.get("a");
        cache.get("a");
        cache.get("a");
        cache.get("x");

        CacheStatus stats = cache.stats();
        assertThat(stats.size()).isEqualTo(1);
        assertThat(stats.maxSize()).isEqualTo(3);
        assertThat(stats.totalAccesses()).isEqualTo(4);
        assertThat(stats.hitRate()).isEqualTo(0.75);

        cache.invalidate("a");
        assertThat(cache.stats().totalAccesses()).as("invalidate keeps counters").isEqualTo(4);

        cache.put("b", 2);
        cache.clear();

        CacheStatus cleared = cache.stats();
        assertThat(cleared.size()).isZero();
        assertThat(cleared.totalAccesses()).isZero();
        assertThat(cleared.hitRate()).isZero();
    }

    @Test
    @DisplayName("Should reject invalid configuration and TTL")
    void shouldRejectInvalidArguments() {
        assertThatThrownBy(() -> InMemoryCacheStore.builder().maxSize(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxSize");
        assertThatThrownBy(() -> cache.put("a", 1, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> cache.put("a", null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Concurrent gets and puts keep size within capacity")
    void concurrentAccessKeepsBookkeepingConsistent() throws Exception {
        InMemoryCacheStore<Integer> shared = InMemoryCacheStore.<Integer>builder()
                .maxSize(50)
                .clock(clock)
                .build();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                int offset = t * 1000;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        String key = "k" + ((offset + i) % 120);
                        shared.put(key, i);
                        shared.get(key);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        CacheStatus stats = shared.stats();
        assertThat(stats.size()).isLessThanOrEqualTo(50);
        assertThat(shared.keys()).hasSize((int) stats.size());
        assertThat(stats.totalAccesses()).isEqualTo(8 * 500);
    }
}
