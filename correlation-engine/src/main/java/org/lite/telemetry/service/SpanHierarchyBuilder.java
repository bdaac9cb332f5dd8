package org.lite.telemetry.service;

import lombok.extern.slf4j.Slf4j;
import org.lite.telemetry.enums.MultipleRootPolicy;
import org.lite.telemetry.model.SpanHierarchy;
import org.lite.telemetry.model.SpanRecord;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves the root span of a trace, its duration and the parent-to-children index.
 */
@Component
@Slf4j
public class SpanHierarchyBuilder {

    public SpanHierarchy build(String traceKey, List<SpanRecord> spans, MultipleRootPolicy policy) {
        List<SpanRecord> safeSpans = spans != null ? spans : List.of();

        List<SpanRecord> rootCandidates = new ArrayList<>();
        Map<String, List<String>> childrenIndex = new LinkedHashMap<>();
        Set<String> services = new LinkedHashSet<>();
        int errorSpans = 0;

        for (SpanRecord span : safeSpans) {
            if (!span.hasParent()) {
                rootCandidates.add(span);
            } else if (span.getSpanKey() != null) {
                childrenIndex.computeIfAbsent(span.getParentSpanKey(), k -> new ArrayList<>()).add(span.getSpanKey());
            }
            if (span.isError()) {
                errorSpans++;
            }
            if (span.getServiceName() != null) {
                services.add(span.getServiceName());
            }
        }

        SpanRecord rootSpan = selectRoot(traceKey, rootCandidates, policy);

        return SpanHierarchy.builder()
                .traceKey(traceKey)
                .rootSpan(rootSpan)
                .rootCandidates(rootCandidates.size())
                .spans(Collections.unmodifiableList(new ArrayList<>(safeSpans)))
                .childrenIndex(childrenIndex)
                .totalDurationMs(totalDuration(rootSpan, safeSpans))
                .errorSpans(errorSpans)
                .services(new ArrayList<>(services))
                .build();
    }

    private SpanRecord selectRoot(String traceKey, List<SpanRecord> candidates, MultipleRootPolicy policy) {
        if (candidates.isEmpty()) {
            return null;
        }
        if (candidates.size() == 1) {
            return candidates.get(0);
        }
        log.warn("Trace {} has {} parentless spans, applying root policy {}", traceKey, candidates.size(), policy);
        return policy == MultipleRootPolicy.NONE ? null : candidates.get(0);
    }

    /**
     * Root span duration when positive, otherwise the wall-clock envelope of all timed spans.
     */
    static double totalDuration(SpanRecord rootSpan, List<SpanRecord> spans) {
        if (rootSpan != null && rootSpan.getDurationMs() > 0) {
            return rootSpan.getDurationMs();
        }
        Instant earliest = null;
        Instant latest = null;
        for (SpanRecord span : spans) {
            if (span.getTimeStarted() != null && (earliest == null || span.getTimeStarted().isBefore(earliest))) {
                earliest = span.getTimeStarted();
            }
            if (span.getTimeEnded() != null && (latest == null || span.getTimeEnded().isAfter(latest))) {
                latest = span.getTimeEnded();
            }
        }
        if (earliest == null || latest == null || latest.isBefore(earliest)) {
            return 0;
        }
        return Duration.between(earliest, latest).toMillis();
    }
}
