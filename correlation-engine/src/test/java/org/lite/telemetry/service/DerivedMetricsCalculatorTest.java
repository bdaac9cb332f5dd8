package org.lite.telemetry.service;

import org.junit.jupiter.api.Test;
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

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DerivedMetricsCalculatorTest {

    private final DerivedMetricsCalculator metrics = new DerivedMetricsCalculator();

    @Test
    void testVelocity_UndefinedWithoutElapsedTime() {
        assertNull(metrics.velocity(1000, 0));
        assertNull(metrics.velocity(1000, -5));
        assertEquals(50.0, metrics.velocity(1000, 20));
    }

    @Test
    void testIsHung_RequiresExecutingLongAndSlow() {
        assertTrue(metrics.isHung(SqlExecutionStatus.EXECUTING, 601, 9.9));
        assertFalse(metrics.isHung(SqlExecutionStatus.EXECUTING, 600, 1.0), "Exactly ten minutes is not hung");
        assertFalse(metrics.isHung(SqlExecutionStatus.EXECUTING, 1200, 10.0), "Ten rows per second is not hung");
        assertFalse(metrics.isHung(SqlExecutionStatus.DONE, 5000, 0.1));
        assertFalse(metrics.isHung(SqlExecutionStatus.EXECUTING, 5000, null));
    }

    @Test
    void testWithProgressAndSqlMonitorSummary() {
        // Given
        List<SqlExecution> executions = new ArrayList<>();
        executions.add(metrics.withProgress(SqlExecution.builder()
                .sqlId("slow").status(SqlExecutionStatus.EXECUTING).elapsedTimeSecs(1200).rowsProcessed(600).build()));
        executions.add(metrics.withProgress(SqlExecution.builder()
                .sqlId("fast").status(SqlExecutionStatus.EXECUTING).elapsedTimeSecs(301).rowsProcessed(1_000_000).build()));
        executions.add(metrics.withProgress(SqlExecution.builder()
                .sqlId("done").status(SqlExecutionStatus.DONE).elapsedTimeSecs(0).build()));

        // When
        SqlMonitorSummary summary = metrics.sqlMonitorSummary(executions);

        // Then
        assertEquals(0.5, executions.get(0).getVelocity());
        assertTrue(executions.get(0).isHung());
        assertFalse(executions.get(1).isHung());
        assertNull(executions.get(2).getVelocity());
        assertEquals(2, summary.getTotalExecuting());
        assertEquals(1, summary.getTotalHung());
        assertEquals(751L, summary.getAvgElapsedTime());
    }

    @Test
    void testDopEfficiency_OnlyActiveSessionsCount() {
        // Given
        List<PxSession> sessions = List.of(
                PxSession.builder().requestedDop(8).actualDop(4).status(PxSessionStatus.ACTIVE).build(),
                PxSession.builder().requestedDop(4).actualDop(4).status(PxSessionStatus.ACTIVE).build(),
                PxSession.builder().requestedDop(16).actualDop(1).status(PxSessionStatus.DONE).build());

        // When & Then
        assertEquals(66.67, metrics.dopEfficiency(sessions));
    }

    @Test
    void testDopEfficiency_NothingRequestedIsFullEfficiency() {
        assertEquals(100.0, metrics.dopEfficiency(List.of()));
        assertEquals(100.0, metrics.dopEfficiency(List.of(
                PxSession.builder().requestedDop(8).actualDop(2).status(PxSessionStatus.IDLE).build())));
    }

    @Test
    void testBlockingSummary() {
        // Given
        List<BlockingSession> sessions = List.of(
                BlockingSession.builder().sid(1).username("ROOT").waitTimeSecs(5).build(),
                BlockingSession.builder().sid(2).username("APP").blockingSession(1L).waitTimeSecs(120).build(),
                BlockingSession.builder().sid(3).username("APP").blockingSession(2L).waitTimeSecs(30).build(),
                BlockingSession.builder().sid(4).username("BATCH").blockingSession(1L).waitTimeSecs(60).build());

        // When
        BlockingSummary summary = metrics.blockingSummary(sessions);

        // Then
        assertEquals(3, summary.getTotalBlocked());
        assertEquals(1, summary.getRootBlockers());
        assertEquals(120L, summary.getMaxWaitTime());
        assertEquals(List.of("APP", "BATCH"), summary.getAffectedUsers());
    }

    @Test
    void testWorkflowSummary() {
        // Given
        List<WorkflowExecutionTrace> traces = List.of(
                WorkflowExecutionTrace.builder().status(TraceStatus.SUCCESS).totalDurationMs(1000).build(),
                WorkflowExecutionTrace.builder().status(TraceStatus.ERROR).totalDurationMs(500).build(),
                WorkflowExecutionTrace.builder().status(TraceStatus.PENDING).totalDurationMs(0).build());

        // When
        WorkflowSummary summary = metrics.workflowSummary(traces);

        // Then
        assertEquals(3, summary.getTraceCount());
        assertEquals(500.0, summary.getAverageDurationMs());
        assertEquals(1, summary.getErrorCount());
        assertEquals(0.33, summary.getErrorRate());
        assertEquals(0.0, metrics.workflowSummary(List.of()).getErrorRate());
    }

    @Test
    void testRiskScore_WeightedAndCapped() {
        // Given: one medium finding among ten checks
        List<SecurityCheck> mixed = new ArrayList<>();
        mixed.add(securityCheck("pii_detection", true, Severity.MEDIUM, "input", false));
        for (int i = 0; i < 9; i++) {
            mixed.add(securityCheck("jailbreak", false, Severity.LOW, "output", false));
        }
        List<SecurityCheck> severe = List.of(
                securityCheck("jailbreak", true, Severity.CRITICAL, "input", true),
                securityCheck("jailbreak", true, Severity.CRITICAL, "input", true));

        // When & Then
        assertEquals(50, metrics.riskScore(mixed));
        assertEquals(100, metrics.riskScore(severe));
        assertEquals(0, metrics.riskScore(List.of()));
    }

    @Test
    void testPassRate() {
        assertEquals(0.75, metrics.passRate(3, 4));
        assertEquals(0.0, metrics.passRate(0, 0));
    }

    @Test
    void testSecuritySummary_OnlyDetectedChecksCountTowardsSeverity() {
        // Given
        List<SecurityCheck> checks = List.of(
                securityCheck("jailbreak", true, Severity.HIGH, "input", true),
                securityCheck("jailbreak", false, Severity.CRITICAL, "output", false),
                securityCheck("pii_detection", true, Severity.MEDIUM, "both", false));

        // When
        SecuritySummary summary = metrics.securitySummary(checks);

        // Then
        assertEquals(3, summary.getTotalChecks());
        assertEquals(2, summary.getDetectedIssues());
        assertEquals(1, summary.getBlockedRequests());
        assertEquals(Severity.HIGH, summary.getOverallRisk());
        assertEquals(1, summary.getBySeverity().get("high"));
        assertEquals(0, summary.getBySeverity().get("critical"));
        assertEquals(1, summary.getByLocation().get("both"));
        assertEquals(0, summary.getByLocation().get("output"));
        assertEquals(2, summary.getByType().get("jailbreak").getTotal());
        assertEquals(1, summary.getByType().get("jailbreak").getDetected());
    }

    @Test
    void testSecuritySummary_NothingDetectedIsLowRisk() {
        // When
        SecuritySummary summary = metrics.securitySummary(List.of(securityCheck("jailbreak", false, Severity.LOW, "input", false)));

        // Then
        assertEquals(Severity.LOW, summary.getOverallRisk());
        assertEquals(0, summary.getRiskScore());
    }

    @Test
    void testQualitySummary() {
        // Given
        List<QualityCheck> checks = List.of(
                qualityCheck("relevance", 0.9, true, Severity.LOW),
                qualityCheck("relevance", 0.5, false, Severity.HIGH),
                qualityCheck("toxicity", 0.1, true, Severity.LOW));

        // When
        QualitySummary summary = metrics.qualitySummary(checks);

        // Then
        assertEquals(2, summary.getPassedChecks());
        assertEquals(1, summary.getFailedChecks());
        assertEquals(2.0 / 3, summary.getPassRate(), 1e-9);
        assertEquals(0.7, summary.getByType().get("relevance").getAvgScore(), 1e-9);
        assertEquals(1, summary.getByType().get("relevance").getFailed());
        assertEquals(2, summary.getBySeverity().get("low"));
    }

    @Test
    void testRound2_HalfUp() {
        assertEquals(0.13, DerivedMetricsCalculator.round2(0.125));
        assertEquals(66.67, DerivedMetricsCalculator.round2(200.0 / 3));
    }

    private static SecurityCheck securityCheck(String type, boolean detected, Severity severity, String location, boolean blocked) {
        return SecurityCheck.builder()
                .checkType(type)
                .detected(detected)
                .severity(severity)
                .location(location)
                .blocked(blocked)
                .build();
    }

    private static QualityCheck qualityCheck(String type, double score, boolean passed, Severity severity) {
        return QualityCheck.builder()
                .checkType(type)
                .score(score)
                .passed(passed)
                .severity(severity)
                .build();
    }
}
