package org.lite.telemetry.service;

import lombok.extern.slf4j.Slf4j;
import org.lite.telemetry.config.CacheProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the named response caches. Query services obtain their cache here once and pass it
 * into every execution, so each engine instance has its own isolated cache state.
 */
@Component
@Slf4j
public class ResponseCacheManager {

    private final CacheProperties cacheProperties;
    private final Clock clock;
    private final Map<String, ResponseCache<?>> caches = new ConcurrentHashMap<>();

    public ResponseCacheManager(CacheProperties cacheProperties, Clock clock) {
        this.cacheProperties = cacheProperties;
        this.clock = clock;
    }

    @SuppressWarnings("unchecked")
    public <T> ResponseCache<T> getCache(String name) {
        return (ResponseCache<T>) caches.computeIfAbsent(name, this::create);
    }

    public void clearAll() {
        caches.values().forEach(ResponseCache::clear);
        log.info("Cleared {} response caches", caches.size());
    }

    private ResponseCache<?> create(String name) {
        CacheProperties.Spec spec = cacheProperties.specFor(name);
        log.info("Creating response cache '{}' with ttl {} and max {} entries",
                name, spec.getTtl(), spec.getMaxEntries());
        return new ResponseCache<>(name, spec.getTtl(), spec.getMaxEntries(), clock);
    }
}
