package org.lite.telemetry.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * TTL and capacity per logical response cache. Entries under {@code telemetry.cache.caches}
 * override the defaults below by name.
 */
@ConfigurationProperties(prefix = "telemetry.cache")
@Data
public class CacheProperties {

    public static final String TRACE_LIST = "trace-list";
    public static final String TRACE_DETAIL = "trace-detail";
    public static final String WORKFLOW_TRACES = "workflow-traces";
    public static final String BLOCKING = "blocking";
    public static final String SQL_MONITOR = "sql-monitor";
    public static final String PARALLELISM = "parallelism";
    public static final String SECURITY = "security";
    public static final String QUALITY = "quality";
    public static final String COORDINATOR_STATUS = "coordinator-status";

    private Spec fallback = new Spec(Duration.ofSeconds(60), 20);
    private Map<String, Spec> caches = defaults();

    public Spec specFor(String name) {
        Spec spec = caches.get(name);
        return spec != null ? spec : fallback;
    }

    private static Map<String, Spec> defaults() {
        Map<String, Spec> specs = new LinkedHashMap<>();
        specs.put(TRACE_LIST, new Spec(Duration.ofMinutes(2), 20));
        specs.put(TRACE_DETAIL, new Spec(Duration.ofMinutes(5), 50));
        specs.put(WORKFLOW_TRACES, new Spec(Duration.ofMinutes(1), 20));
        specs.put(BLOCKING, new Spec(Duration.ofSeconds(15), 20));
        specs.put(SQL_MONITOR, new Spec(Duration.ofSeconds(15), 20));
        specs.put(PARALLELISM, new Spec(Duration.ofSeconds(15), 20));
        specs.put(SECURITY, new Spec(Duration.ofSeconds(30), 50));
        specs.put(QUALITY, new Spec(Duration.ofMinutes(1), 50));
        specs.put(COORDINATOR_STATUS, new Spec(Duration.ofSeconds(10), 5));
        return specs;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Spec {
        private Duration ttl;
        private int maxEntries;
    }
}
