package org.lite.telemetry.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class QualitySummary {
    int totalChecks;
    int passedChecks;
    int failedChecks;
    double passRate;
    Map<String, TypeBreakdown> byType;
    Map<String, Integer> bySeverity;

    @Value
    public static class TypeBreakdown {
        int total;
        int passed;
        int failed;
        double avgScore;
    }
}
