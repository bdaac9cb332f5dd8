package org.lite.telemetry.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.telemetry.dto.ResultEnvelope;
import org.lite.telemetry.exception.ConfigurationMissingException;
import org.lite.telemetry.exception.MalformedPayloadException;
import org.lite.telemetry.exception.UpstreamUnavailableException;
import org.lite.telemetry.model.CachedValue;
import org.lite.telemetry.model.QueryResult;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Runs a query path with cache lookup, configuration check and a single upstream attempt,
 * folding every failure into a {@link QueryResult} status. The returned {@code Mono} never
 * errors.
 *
 * <ul>
 *   <li>cache hit: {@code connected}, {@code cached=true}</li>
 *   <li>required setting absent: {@code pending_config} with the empty payload</li>
 *   <li>timeout or connection failure: {@code mock} when the kind has demo data, else {@code error}</li>
 *   <li>non-success status or unreadable payload: {@code error} with the empty payload</li>
 * </ul>
 *
 * Only {@code connected} results are cached.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ResilientQueryExecutor {

    private final ResponseCacheManager cacheManager;
    private final Clock clock;

    public <T> Mono<ResultEnvelope<T>> execute(QuerySpec<T> spec) {
        ResponseCache<T> cache = cacheManager.getCache(spec.getCacheName());

        if (!spec.isSkipCache()) {
            Optional<CachedValue<T>> hit = cache.get(spec.getCacheKey());
            if (hit.isPresent()) {
                long age = hit.get().ageSeconds(clock.instant());
                log.info("Cache hit for {} [{}], age {}s", spec.getKind(), spec.getCacheKey(), age);
                return Mono.just(envelope(QueryResult.connected(hit.get().getValue()), true, age));
            }
            log.info("Cache miss for {} [{}]", spec.getKind(), spec.getCacheKey());
        }

        if (spec.getMissingSetting() != null) {
            return Mono.just(envelope(unconfigured(spec), null, null));
        }

        return Mono.defer(() -> spec.getFetch().get())
                .switchIfEmpty(Mono.error(() -> new MalformedPayloadException("Upstream returned no body")))
                .map(payload -> {
                    cache.put(spec.getCacheKey(), payload);
                    return envelope(QueryResult.connected(payload), false, null);
                })
                .onErrorResume(error -> Mono.just(envelope(classify(spec, error), null, null)));
    }

    <T> QueryResult<T> classify(QuerySpec<T> spec, Throwable error) {
        if (error instanceof ConfigurationMissingException) {
            return QueryResult.pendingConfig(spec.getEmptyPayload().get(), error.getMessage());
        }
        if (isTransient(error)) {
            if (spec.hasDemoData()) {
                log.warn("{} upstream unavailable ({}), serving demo data", spec.getKind(), error.getMessage());
                return QueryResult.mock(spec.getDemoPayload().get(), "Upstream unavailable, showing demo data: " + error.getMessage());
            }
            log.error("{} upstream unavailable: {}", spec.getKind(), error.getMessage());
            return QueryResult.error(spec.getEmptyPayload().get(), error.getMessage());
        }
        log.error("{} query failed: {}", spec.getKind(), error.getMessage());
        return QueryResult.error(spec.getEmptyPayload().get(),
                error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());
    }

    private <T> QueryResult<T> unconfigured(QuerySpec<T> spec) {
        String message = new ConfigurationMissingException(spec.getMissingSetting()).getMessage();
        if (spec.isDemoWhenUnconfigured() && spec.hasDemoData()) {
            log.warn("{}: {}, serving demo data", spec.getKind(), message);
            return QueryResult.mock(spec.getDemoPayload().get(), message + ", showing demo data");
        }
        log.info("{}: {}", spec.getKind(), message);
        return QueryResult.pendingConfig(spec.getEmptyPayload().get(), message);
    }

    private static boolean isTransient(Throwable error) {
        return error instanceof UpstreamUnavailableException || error instanceof TimeoutException;
    }

    private <T> ResultEnvelope<T> envelope(QueryResult<T> result, Boolean cached, Long cacheAge) {
        return ResultEnvelope.<T>builder()
                .status(result.getStatus())
                .cached(cached)
                .cacheAge(cacheAge)
                .message(result.getMessage())
                .payload(result.getPayload())
                .timestamp(clock.instant().toString())
                .build();
    }
}
