package org.lite.telemetry.service;

import lombok.Builder;
import lombok.Value;
import org.lite.telemetry.enums.QueryKind;
import reactor.core.publisher.Mono;

import java.util.function.Supplier;

/**
 * Everything {@link ResilientQueryExecutor} needs to run one query path.
 *
 * @param <T> payload type
 */
@Value
@Builder
public class QuerySpec<T> {
    QueryKind kind;
    String cacheName;
    String cacheKey;
    boolean skipCache;

    /**
     * Name of the required setting that is absent, or null when the path is fully configured.
     */
    String missingSetting;

    /**
     * Serve demo data instead of {@code pending_config} while the setting is missing.
     */
    boolean demoWhenUnconfigured;

    Supplier<Mono<T>> fetch;
    Supplier<T> emptyPayload;

    /**
     * Demo dataset for this query kind; null when the kind has none.
     */
    Supplier<T> demoPayload;

    public boolean hasDemoData() {
        return demoPayload != null;
    }
}
