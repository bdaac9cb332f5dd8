package org.lite.telemetry.util;

import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

public final class CacheKeys {

    private CacheKeys() {
    }

    /**
     * Canonical {@code k=v&k=v} form of the query parameters, sorted by name so equivalent
     * queries collide. Names and values are percent-encoded; null values serialize as the
     * empty string.
     */
    public static String of(Map<String, ?> params) {
        if (params == null || params.isEmpty()) {
            return "";
        }
        Map<String, String> sorted = new TreeMap<>();
        params.forEach((k, v) -> sorted.put(k, v == null ? "" : String.valueOf(v)));
        return sorted.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
    }

    private static String encode(String value) {
        return UriUtils.encode(value, StandardCharsets.UTF_8);
    }
}
