package org.lite.telemetry.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lite.telemetry.config.CacheProperties;
import org.lite.telemetry.model.CachedValue;
import org.lite.telemetry.support.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ResponseCacheTest {

    private MutableClock clock;
    private ResponseCache<String> cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-11T10:00:00Z"));
        cache = new ResponseCache<>("test", Duration.ofSeconds(30), 3, clock);
    }

    @Test
    void testGet_FreshEntryReturnedWithAge() {
        // Given
        cache.put("k", "v");
        clock.advance(Duration.ofSeconds(12));

        // When
        Optional<CachedValue<String>> hit = cache.get("k");

        // Then
        assertTrue(hit.isPresent());
        assertEquals("v", hit.get().getValue());
        assertEquals(12L, hit.get().ageSeconds(clock.instant()));
    }

    @Test
    void testGet_EntryExpiresExactlyAtTtl() {
        // Given
        cache.put("k", "v");
        clock.advance(Duration.ofSeconds(30));

        // When
        Optional<CachedValue<String>> hit = cache.get("k");

        // Then
        assertTrue(hit.isEmpty());
        assertEquals(0, cache.size(), "Stale entry is removed on read");
    }

    @Test
    void testPut_EvictsEarliestInsertedNotLeastRecentlyRead() {
        // Given
        cache.put("a", "1");
        cache.put("b", "2");
        cache.put("c", "3");
        cache.get("a");

        // When
        cache.put("d", "4");

        // Then
        assertEquals(3, cache.size());
        assertTrue(cache.get("a").isEmpty());
        assertTrue(cache.get("d").isPresent());
    }

    @Test
    void testPut_ReinsertRefreshesTimestampAndOrder() {
        // Given
        cache.put("a", "1");
        cache.put("b", "2");
        clock.advance(Duration.ofSeconds(20));
        cache.put("a", "1b");
        cache.put("c", "3");

        // When
        cache.put("d", "4");
        clock.advance(Duration.ofSeconds(15));

        // Then
        assertTrue(cache.get("b").isEmpty(), "b was the earliest remaining insertion");
        assertEquals("1b", cache.get("a").map(CachedValue::getValue).orElse(null));
    }

    @Test
    void testInvalidateAndClear() {
        // Given
        cache.put("a", "1");
        cache.put("b", "2");

        // When & Then
        assertTrue(cache.invalidate("a"));
        assertFalse(cache.invalidate("a"));
        cache.clear();
        assertEquals(0, cache.size());
    }

    @Test
    void testConstructor_RejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new ResponseCache<String>("bad", Duration.ofSeconds(1), 0, clock));
    }

    @Test
    void testManager_CachesAreIsolatedAndConfiguredByName() {
        // Given
        ResponseCacheManager manager = new ResponseCacheManager(new CacheProperties(), clock);

        // When
        ResponseCache<String> blocking = manager.getCache(CacheProperties.BLOCKING);
        ResponseCache<String> security = manager.getCache(CacheProperties.SECURITY);
        blocking.put("database=PROD", "report");

        // Then
        assertSame(blocking, manager.getCache(CacheProperties.BLOCKING));
        assertEquals(Duration.ofSeconds(15), blocking.getTtl());
        assertEquals(50, security.getMaxEntries());
        assertTrue(security.get("database=PROD").isEmpty());
        assertEquals(Duration.ofSeconds(60), manager.getCache("unlisted").getTtl());

        ResponseCacheManager other = new ResponseCacheManager(new CacheProperties(), clock);
        assertTrue(other.<String>getCache(CacheProperties.BLOCKING).get("database=PROD").isEmpty());
    }

    @Test
    void testConcurrentPutAndGet_NeverExceedsCapacity() throws Exception {
        // Given
        ResponseCache<Integer> shared = new ResponseCache<>("shared", Duration.ofSeconds(30), 5, clock);
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger maxSeen = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        // When
        try {
            for (int t = 0; t < threads; t++) {
                int worker = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 500; i++) {
                        String key = "w" + worker + "-" + (i % 20);
                        shared.put(key, i);
                        shared.get(key).ifPresent(hit -> assertNotNull(hit.getValue()));
                        maxSeen.accumulateAndGet(shared.size(), Math::max);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        // Then
        assertTrue(maxSeen.get() <= 5, "size reached " + maxSeen.get());
        assertEquals(5, shared.size());
    }
}
