package org.lite.telemetry.model;

import lombok.Builder;
import lombok.Value;
import org.lite.telemetry.enums.Severity;

import java.util.Map;

@Value
@Builder
public class SecuritySummary {
    int totalChecks;
    int detectedIssues;
    int blockedRequests;
    Map<String, TypeBreakdown> byType;
    Map<String, Integer> bySeverity;
    Map<String, Integer> byLocation;
    int riskScore;
    Severity overallRisk;

    @Value
    public static class TypeBreakdown {
        int total;
        int detected;
        int blocked;
    }
}
