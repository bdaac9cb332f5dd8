package org.lite.telemetry.service;

import lombok.extern.slf4j.Slf4j;
import org.lite.telemetry.model.CachedValue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Size- and TTL-bounded cache of query results. When full, the earliest inserted entry is
 * evicted, regardless of how recently it was read. An entry is fresh while
 * {@code now - storedAt < ttl}; reading a stale entry removes it.
 *
 * <p>All access is serialized on the instance monitor.
 */
@Slf4j
public class ResponseCache<T> {

    private final String name;
    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;
    private final Map<String, CachedValue<T>> entries = new LinkedHashMap<>();

    public ResponseCache(String name, Duration ttl, int maxEntries, Clock clock) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive for cache " + name);
        }
        this.name = name;
        this.ttl = ttl;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    public synchronized Optional<CachedValue<T>> get(String key) {
        CachedValue<T> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!isFresh(entry, clock.instant())) {
            entries.remove(key);
            log.debug("Cache {}: expired entry removed for key {}", name, key);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    public synchronized void put(String key, T value) {
        // Re-inserting a key moves it to the back of the eviction order.
        entries.remove(key);
        if (entries.size() >= maxEntries) {
            Iterator<String> oldest = entries.keySet().iterator();
            String evicted = oldest.next();
            oldest.remove();
            log.debug("Cache {}: evicted {} (capacity {})", name, evicted, maxEntries);
        }
        entries.put(key, new CachedValue<>(value, clock.instant()));
    }

    public synchronized boolean invalidate(String key) {
        return entries.remove(key) != null;
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    public String getName() {
        return name;
    }

    public Duration getTtl() {
        return ttl;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    private boolean isFresh(CachedValue<T> entry, Instant now) {
        return Duration.between(entry.getStoredAt(), now).compareTo(ttl) < 0;
    }
}
