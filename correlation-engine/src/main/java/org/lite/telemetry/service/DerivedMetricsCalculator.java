package org.lite.telemetry.service;

import org.lite.telemetry.enums.PxSessionStatus;
import org.lite.telemetry.enums.Severity;
import org.lite.telemetry.enums.SqlExecutionStatus;
import org.lite.telemetry.enums.TraceStatus;
import org.lite.telemetry.model.BlockingSession;
import org.lite.telemetry.model.BlockingSummary;
import org.lite.telemetry.model.PxSession;
import org.lite.telemetry.model.QualityCheck;
import org.lite.telemetry.model.QualitySummary;
import org.lite.telemetry.model.SecurityCheck;
import org.lite.telemetry.model.SecuritySummary;
import org.lite.telemetry.model.SqlExecution;
import org.lite.telemetry.model.SqlMonitorSummary;
import org.lite.telemetry.model.WorkflowExecutionTrace;
import org.lite.telemetry.model.WorkflowSummary;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scalar health signals computed from normalized records. Every method is pure and falls
 * back to a documented default when the inputs cannot support the metric.
 */
@Component
public class DerivedMetricsCalculator {

    static final double HUNG_MIN_ELAPSED_SECS = 600;
    static final double HUNG_MAX_VELOCITY = 10;

    // ==================== SQL MONITOR ====================

    /**
     * Rows per second, undefined (null) unless some time has elapsed.
     */
    public Double velocity(long rowsProcessed, double elapsedSecs) {
        if (elapsedSecs <= 0) {
            return null;
        }
        return rowsProcessed / elapsedSecs;
    }

    /**
     * A statement is hung when it is still executing after ten minutes and moves fewer than
     * ten rows per second.
     */
    public boolean isHung(SqlExecutionStatus status, double elapsedSecs, Double velocity) {
        return status == SqlExecutionStatus.EXECUTING
                && elapsedSecs > HUNG_MIN_ELAPSED_SECS
                && velocity != null
                && velocity < HUNG_MAX_VELOCITY;
    }

    public SqlExecution withProgress(SqlExecution execution) {
        Double velocity = velocity(execution.getRowsProcessed(), execution.getElapsedTimeSecs());
        return execution.toBuilder()
                .velocity(velocity)
                .hung(isHung(execution.getStatus(), execution.getElapsedTimeSecs(), velocity))
                .build();
    }

    public SqlMonitorSummary sqlMonitorSummary(List<SqlExecution> executions) {
        int executing = 0;
        int hung = 0;
        double elapsed = 0;
        for (SqlExecution execution : executions) {
            if (execution.getStatus() == SqlExecutionStatus.EXECUTING) {
                executing++;
                elapsed += execution.getElapsedTimeSecs();
            }
            if (execution.isHung()) {
                hung++;
            }
        }
        long average = executing > 0 ? Math.round(elapsed / executing) : 0;
        return new SqlMonitorSummary(executing, hung, average);
    }

    // ==================== PARALLEL EXECUTION ====================

    /**
     * Achieved over requested degree of parallelism for active sessions, as a percentage
     * rounded to two decimals. 100 when nothing was requested.
     */
    public double dopEfficiency(List<PxSession> sessions) {
        long requested = 0;
        long actual = 0;
        for (PxSession session : sessions) {
            if (session.getStatus() == PxSessionStatus.ACTIVE) {
                requested += session.getRequestedDop();
                actual += session.getActualDop();
            }
        }
        if (requested == 0) {
            return 100.0;
        }
        return round2(actual * 100.0 / requested);
    }

    // ==================== BLOCKING ====================

    public BlockingSummary blockingSummary(List<BlockingSession> sessions) {
        int roots = 0;
        int blocked = 0;
        long maxWait = 0;
        Set<String> users = new LinkedHashSet<>();
        for (BlockingSession session : sessions) {
            if (session.isRoot()) {
                roots++;
            } else {
                blocked++;
                users.add(session.getUsername());
            }
            maxWait = Math.max(maxWait, session.getWaitTimeSecs());
        }
        return BlockingSummary.builder()
                .totalBlocked(blocked)
                .rootBlockers(roots)
                .maxWaitTime(maxWait)
                .affectedUsers(new ArrayList<>(users))
                .build();
    }

    // ==================== WORKFLOW TRACES ====================

    public WorkflowSummary workflowSummary(List<WorkflowExecutionTrace> traces) {
        double total = 0;
        int errors = 0;
        for (WorkflowExecutionTrace trace : traces) {
            total += trace.getTotalDurationMs();
            if (trace.getStatus() == TraceStatus.ERROR) {
                errors++;
            }
        }
        int count = traces.size();
        return WorkflowSummary.builder()
                .traceCount(count)
                .totalDurationMs(total)
                .averageDurationMs(count > 0 ? round2(total / count) : 0)
                .errorCount(errors)
                .errorRate(count > 0 ? round2((double) errors / count) : 0)
                .build();
    }

    // ==================== LLM CHECKS ====================

    /**
     * Weighted severity of detected issues per check, capped at 100.
     */
    public int riskScore(List<SecurityCheck> checks) {
        long weighted = 0;
        for (SecurityCheck check : checks) {
            if (check.isDetected()) {
                weighted += check.getSeverity().getWeight();
            }
        }
        long score = Math.round(weighted * 100.0 / Math.max(1, checks.size()));
        return (int) Math.min(100, score);
    }

    public double passRate(int passed, int total) {
        return total > 0 ? (double) passed / total : 0;
    }

    public SecuritySummary securitySummary(List<SecurityCheck> checks) {
        Map<String, int[]> byType = new LinkedHashMap<>();
        Map<String, Integer> bySeverity = severityBuckets();
        Map<String, Integer> byLocation = new LinkedHashMap<>();
        byLocation.put("input", 0);
        byLocation.put("output", 0);
        byLocation.put("both", 0);

        int detected = 0;
        int blocked = 0;
        Severity overall = Severity.LOW;
        for (SecurityCheck check : checks) {
            int[] counts = byType.computeIfAbsent(check.getCheckType(), k -> new int[3]);
            counts[0]++;
            if (check.isBlocked()) {
                blocked++;
                counts[2]++;
            }
            if (!check.isDetected()) {
                continue;
            }
            detected++;
            counts[1]++;
            bySeverity.merge(check.getSeverity().getValue(), 1, Integer::sum);
            byLocation.merge(check.getLocation(), 1, Integer::sum);
            if (check.getSeverity().compareTo(overall) > 0) {
                overall = check.getSeverity();
            }
        }

        Map<String, SecuritySummary.TypeBreakdown> types = new LinkedHashMap<>();
        byType.forEach((type, c) -> types.put(type, new SecuritySummary.TypeBreakdown(c[0], c[1], c[2])));
        return SecuritySummary.builder()
                .totalChecks(checks.size())
                .detectedIssues(detected)
                .blockedRequests(blocked)
                .byType(types)
                .bySeverity(bySeverity)
                .byLocation(byLocation)
                .riskScore(riskScore(checks))
                .overallRisk(overall)
                .build();
    }

    public QualitySummary qualitySummary(List<QualityCheck> checks) {
        Map<String, List<QualityCheck>> grouped = new LinkedHashMap<>();
        Map<String, Integer> bySeverity = severityBuckets();
        int passed = 0;
        for (QualityCheck check : checks) {
            grouped.computeIfAbsent(check.getCheckType(), k -> new ArrayList<>()).add(check);
            bySeverity.merge(check.getSeverity().getValue(), 1, Integer::sum);
            if (check.isPassed()) {
                passed++;
            }
        }

        Map<String, QualitySummary.TypeBreakdown> types = new LinkedHashMap<>();
        grouped.forEach((type, typeChecks) -> {
            int typePassed = (int) typeChecks.stream().filter(QualityCheck::isPassed).count();
            double avgScore = typeChecks.stream().mapToDouble(QualityCheck::getScore).average().orElse(0);
            types.put(type, new QualitySummary.TypeBreakdown(typeChecks.size(), typePassed,
                    typeChecks.size() - typePassed, avgScore));
        });
        return QualitySummary.builder()
                .totalChecks(checks.size())
                .passedChecks(passed)
                .failedChecks(checks.size() - passed)
                .passRate(passRate(passed, checks.size()))
                .byType(types)
                .bySeverity(bySeverity)
                .build();
    }

    private static Map<String, Integer> severityBuckets() {
        Map<String, Integer> buckets = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            buckets.put(severity.getValue(), 0);
        }
        return buckets;
    }

    static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
