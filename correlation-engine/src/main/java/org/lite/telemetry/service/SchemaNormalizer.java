package org.lite.telemetry.service;

import lombok.extern.slf4j.Slf4j;
import org.lite.telemetry.enums.PxSessionStatus;
import org.lite.telemetry.enums.Severity;
import org.lite.telemetry.enums.SqlExecutionStatus;
import org.lite.telemetry.model.BlockingSession;
import org.lite.telemetry.model.DopDowngrade;
import org.lite.telemetry.model.PxSession;
import org.lite.telemetry.model.PxSystemStats;
import org.lite.telemetry.model.QualityCheck;
import org.lite.telemetry.model.RawRecord;
import org.lite.telemetry.model.SecurityCheck;
import org.lite.telemetry.model.SpanRecord;
import org.lite.telemetry.model.SqlExecution;
import org.lite.telemetry.model.TraceSummary;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns upstream records into canonical models. Each field is read through an alias list in
 * priority order with a fixed default, so renamed or missing upstream fields never fail a
 * query. Stateless.
 */
@Component
@Slf4j
public class SchemaNormalizer {

    public static final String UNKNOWN = "UNKNOWN";
    static final int MAX_SQL_TEXT_LENGTH = 500;
    public static final int DEFAULT_MAX_PARALLEL_SERVERS = 128;

    // ==================== BLOCKING SESSIONS ====================

    /**
     * Reads a blocking snapshot. Sessions listed under {@code root_blockers} are roots by
     * definition; sessions under the blocked or flat lists are roots only when they carry no
     * blocking session id.
     */
    public List<BlockingSession> normalizeBlockingSessions(RawRecord payload) {
        List<BlockingSession> sessions = new ArrayList<>();
        for (RawRecord blocker : payload.records("root_blockers")) {
            sessions.add(blockingSession(blocker, true, "SQL*Net message from client"));
        }
        for (RawRecord blocked : payload.records("blocked_sessions", "blocking_sessions")) {
            sessions.add(blockingSession(blocked, false, "enq: TX - row lock contention"));
        }
        for (RawRecord session : payload.records("sessions")) {
            sessions.add(blockingSession(session, false, "enq: TX - row lock contention"));
        }
        log.debug("Normalized {} blocking sessions", sessions.size());
        return sessions;
    }

    public boolean hasBlockingData(RawRecord payload) {
        return payload.has("root_blockers", "blocked_sessions", "blocking_sessions", "sessions");
    }

    BlockingSession blockingSession(RawRecord raw, boolean forcedRoot, String defaultWaitEvent) {
        Long blockingSession = forcedRoot ? null : raw.optionalLong("blocking_session", "BLOCKING_SESSION", "blockedBy");
        return BlockingSession.builder()
                .sid(raw.longValue(0, "sid", "SID"))
                .serial(raw.longValue(0, "serial", "SERIAL#", "serial_number"))
                .instId(raw.intValue(1, "inst_id", "INST_ID"))
                .username(raw.text(UNKNOWN, "username", "USERNAME"))
                .sqlId(raw.optionalText("sql_id", "SQL_ID"))
                .waitEvent(raw.text(defaultWaitEvent, "wait_event", "WAIT_EVENT"))
                .waitTimeSecs(raw.longValue(0, "seconds_in_wait", "SECONDS_IN_WAIT", "wait_time_secs", "wait"))
                .blockingSession(blockingSession)
                .blockingInstance(blockingSession == null ? null
                        : raw.intValue(1, "blocking_instance", "BLOCKING_INSTANCE"))
                .build();
    }

    // ==================== SQL MONITOR ====================

    public List<SqlExecution> normalizeSqlExecutions(RawRecord payload) {
        List<SqlExecution> executions = new ArrayList<>();
        for (RawRecord exec : payload.records("executions", "sql_monitor", "active_sql")) {
            String sqlText = exec.text("", "sql_text", "SQL_TEXT", "sql_fulltext");
            executions.add(SqlExecution.builder()
                    .sqlId(exec.text("", "sql_id", "SQL_ID"))
                    .sqlExecId(exec.longValue(0, "sql_exec_id", "SQL_EXEC_ID"))
                    .status(SqlExecutionStatus.fromValue(exec.optionalText("status", "STATUS")))
                    .username(exec.text(UNKNOWN, "username", "USERNAME", "parsing_schema_name"))
                    .sqlText(sqlText.length() > MAX_SQL_TEXT_LENGTH ? sqlText.substring(0, MAX_SQL_TEXT_LENGTH) : sqlText)
                    .elapsedTimeSecs(exec.doubleValue(0, "elapsed_time_secs", "elapsed_seconds", "ELAPSED_TIME", "elapsed_time"))
                    .cpuTimeSecs(exec.doubleValue(0, "cpu_time_secs", "cpu_seconds", "CPU_TIME", "cpu_time"))
                    .bufferGets(exec.longValue(0, "buffer_gets", "BUFFER_GETS"))
                    .diskReads(exec.longValue(0, "disk_reads", "DISK_READS", "physical_read_requests"))
                    .rowsProcessed(exec.longValue(0, "rows_processed", "ROWS_PROCESSED", "output_rows"))
                    .dop(exec.intValue(1, "dop", "DOP", "degree_of_parallelism"))
                    .pxServersAllocated(exec.intValue(0, "px_servers_allocated", "PX_SERVERS_ALLOCATED"))
                    .lastRefreshTime(exec.optionalText("last_refresh_time", "LAST_REFRESH_TIME"))
                    .build());
        }
        return executions;
    }

    // ==================== PARALLEL EXECUTION ====================

    public List<PxSession> normalizePxSessions(RawRecord payload) {
        List<PxSession> sessions = new ArrayList<>();
        for (RawRecord session : payload.records("sessions", "px_sessions", "parallel_sessions")) {
            sessions.add(PxSession.builder()
                    .qcSid(session.longValue(0, "qc_sid", "QC_SID", "sid"))
                    .qcSerial(session.longValue(0, "qc_serial", "QC_SERIAL", "serial"))
                    .sqlId(session.text("", "sql_id", "SQL_ID"))
                    .username(session.text(UNKNOWN, "username", "USERNAME", "parsing_schema_name"))
                    .requestedDop(session.intValue(1, "requested_dop", "REQUESTED_DOP", "req_dop"))
                    .actualDop(session.intValue(1, "actual_dop", "ACTUAL_DOP", "degree"))
                    .serversAllocated(session.intValue(0, "servers_allocated", "SERVERS_ALLOCATED", "px_servers"))
                    .serversBusy(session.intValue(0, "servers_busy", "SERVERS_BUSY"))
                    .elapsedSeconds(session.doubleValue(0, "elapsed_seconds", "ELAPSED_SECONDS", "elapsed_time_secs"))
                    .status(PxSessionStatus.fromValue(session.optionalText("status", "STATUS")))
                    .build());
        }
        return sessions;
    }

    public List<DopDowngrade> normalizeDowngrades(RawRecord payload, Instant now) {
        List<DopDowngrade> downgrades = new ArrayList<>();
        for (RawRecord d : payload.records("downgrades", "recent_downgrades", "dop_downgrades")) {
            downgrades.add(DopDowngrade.builder()
                    .timestamp(d.text(now.toString(), "timestamp", "TIMESTAMP"))
                    .sqlId(d.text("", "sql_id", "SQL_ID"))
                    .requestedDop(d.intValue(0, "requested_dop", "REQUESTED_DOP"))
                    .actualDop(d.intValue(0, "actual_dop", "ACTUAL_DOP"))
                    .reason(d.text("Unknown", "reason", "REASON", "downgrade_reason"))
                    .qcSid(d.longValue(0, "qc_sid", "QC_SID"))
                    .build());
        }
        return downgrades;
    }

    /**
     * System-wide PX server counts, present only when the upstream reported at least one of
     * them either in a stats container or at the top level.
     */
    public Optional<PxSystemStats> normalizeSystemStats(RawRecord payload) {
        RawRecord stats = payload.record("system_stats", "parallel_stats");
        if (stats.isEmpty()) {
            stats = payload;
        }
        if (!stats.has("max_parallel_servers", "servers_in_use")) {
            return Optional.empty();
        }
        return Optional.of(new PxSystemStats(
                stats.intValue(DEFAULT_MAX_PARALLEL_SERVERS, "max_parallel_servers", "MAX_PARALLEL_SERVERS", "parallel_max_servers"),
                stats.intValue(0, "servers_in_use", "SERVERS_IN_USE", "parallel_servers_busy")));
    }

    // ==================== TRACES AND SPANS ====================

    public List<SpanRecord> normalizeSpans(List<RawRecord> rawSpans, String traceKey) {
        List<SpanRecord> spans = new ArrayList<>(rawSpans.size());
        for (RawRecord raw : rawSpans) {
            spans.add(span(raw, traceKey));
        }
        return spans;
    }

    SpanRecord span(RawRecord raw, String traceKey) {
        Instant started = raw.instant("timeStarted", "startTime", "start_time");
        Instant ended = raw.instant("timeEnded", "endTime", "end_time");
        Double duration = raw.optionalDouble("durationInMs", "durationMs", "duration_ms");
        if (duration == null && started != null && ended != null) {
            duration = (double) Duration.between(started, ended).toMillis();
        }
        String statusCode = raw.optionalText("status.code", "status");
        boolean error = raw.bool(false, "isError", "is_error", "error")
                || "ERROR".equalsIgnoreCase(statusCode);
        String spanName = raw.text("unknown", "spanName", "operationName", "name");
        return SpanRecord.builder()
                .spanKey(raw.optionalText("spanKey", "key", "spanId", "span_id"))
                .parentSpanKey(raw.optionalText("parentSpanKey", "parentKey", "parentSpanId", "parent_span_id"))
                .traceKey(raw.text(traceKey, "traceKey", "traceId", "trace_id"))
                .spanName(spanName)
                .serviceName(raw.text("unknown", "serviceName", "service_name"))
                .operationName(raw.text(spanName, "operationName", "spanName", "name"))
                .timeStarted(started)
                .timeEnded(ended)
                .durationMs(duration != null ? duration : 0)
                .status(statusCode != null ? statusCode : (error ? "ERROR" : "OK"))
                .spanKind(raw.text("INTERNAL", "kind", "spanKind"))
                .error(error)
                .errorMessage(raw.text("", "status.message", "errorMessage"))
                .tags(raw.stringMap("tags", "attributes"))
                .build();
    }

    public String traceKey(RawRecord trace, String defaultKey) {
        return trace.text(defaultKey, "traceKey", "traceId", "trace_id", "key");
    }

    /**
     * Reads a trace listing, either as APM query rows ({@code queryResultRowData} plus
     * {@code queryResultRowMetadata}, durations in microseconds) or as plain trace objects.
     */
    public List<TraceSummary> normalizeTraceSummaries(RawRecord payload, Instant now) {
        List<RawRecord> rows = payload.record("queryResultResponse").records("queryResultRows");
        List<TraceSummary> traces = new ArrayList<>();
        if (!rows.isEmpty()) {
            for (RawRecord row : rows) {
                traces.add(traceSummaryFromRow(row, now));
            }
            return traces;
        }
        for (RawRecord trace : payload.records("traces", "items")) {
            traces.add(traceSummary(trace, now));
        }
        return traces;
    }

    private TraceSummary traceSummaryFromRow(RawRecord row, Instant now) {
        RawRecord data = row.record("queryResultRowData");
        RawRecord metadata = row.record("queryResultRowMetadata");
        Instant started = data.instant("TraceFirstSpanStartTime");
        if (started == null) {
            started = now;
        }
        double durationMs = data.doubleValue(0, "TraceDuration") / 1000.0;
        int errorCount = data.intValue(0, "ErrorCount");
        return TraceSummary.builder()
                .traceKey(metadata.text(data.text("unknown", "TraceId"), "trace_id"))
                .rootSpanServiceName(data.text("unknown", "ServiceName"))
                .rootSpanOperationName(data.text("unknown", "OperationName"))
                .timeEarliestSpanStarted(started)
                .timeLatestSpanEnded(started.plusMillis((long) durationMs))
                .rootSpanDurationMs(durationMs)
                .traceStatus(data.text("OK", "TraceStatus"))
                .traceErrorType(errorCount > 0 ? "ERROR" : "")
                .spanCount(data.intValue(1, "SpanCount"))
                .errorSpanCount(errorCount)
                .build();
    }

    private TraceSummary traceSummary(RawRecord trace, Instant now) {
        Instant started = trace.instant("timeEarliestSpanStarted", "startTime");
        Instant ended = trace.instant("timeLatestSpanEnded", "endTime");
        double durationMs = trace.doubleValue(0, "rootSpanDurationInMs", "rootSpanDurationMs", "totalDurationMs");
        int errorCount = trace.intValue(0, "errorSpanCount", "errorCount");
        return TraceSummary.builder()
                .traceKey(traceKey(trace, "unknown"))
                .rootSpanServiceName(trace.text("unknown", "rootSpanServiceName", "serviceName"))
                .rootSpanOperationName(trace.text("unknown", "rootSpanOperationName", "operationName"))
                .timeEarliestSpanStarted(started != null ? started : now)
                .timeLatestSpanEnded(ended != null ? ended : (started != null ? started : now).plusMillis((long) durationMs))
                .rootSpanDurationMs(durationMs)
                .traceStatus(trace.text("OK", "traceStatus", "status"))
                .traceErrorType(trace.text(errorCount > 0 ? "ERROR" : "", "traceErrorType"))
                .spanCount(trace.intValue(1, "spanCount"))
                .errorSpanCount(errorCount)
                .build();
    }

    // ==================== LLM CHECKS ====================

    public List<SecurityCheck> normalizeSecurityChecks(RawRecord payload) {
        List<SecurityCheck> checks = new ArrayList<>();
        for (RawRecord c : payload.records("checks", "securityChecks", "items")) {
            boolean detected = c.bool(false, "detected", "isDetected");
            checks.add(SecurityCheck.builder()
                    .checkId(c.text("", "checkId", "id"))
                    .traceId(c.text("", "traceId", "trace_id"))
                    .spanId(c.text("", "spanId", "span_id"))
                    .checkType(c.text("custom", "checkType", "type"))
                    .detected(detected)
                    .severity(Severity.fromValue(c.optionalText("severity")))
                    .confidence(c.doubleValue(0, "confidence"))
                    .location(c.text("input", "location"))
                    .details(c.text("", "details", "description"))
                    .timestamp(c.instant("timestamp", "time"))
                    .remediation(c.optionalText("remediation"))
                    .model(c.optionalText("metadata.model", "model"))
                    .blocked(c.bool(false, "metadata.blockedContent", "blocked", "blockedContent"))
                    .build());
        }
        return checks;
    }

    public List<QualityCheck> normalizeQualityChecks(RawRecord payload) {
        List<QualityCheck> checks = new ArrayList<>();
        for (RawRecord c : payload.records("checks", "qualityChecks", "items")) {
            checks.add(QualityCheck.builder()
                    .checkId(c.text("", "checkId", "id"))
                    .traceId(c.text("", "traceId", "trace_id"))
                    .spanId(c.text("", "spanId", "span_id"))
                    .checkType(c.text("custom", "checkType", "type"))
                    .score(c.doubleValue(0, "score"))
                    .passed(c.bool(false, "passed"))
                    .severity(Severity.fromValue(c.optionalText("severity")))
                    .details(c.text("", "details", "description"))
                    .timestamp(c.instant("timestamp", "time"))
                    .model(c.optionalText("metadata.model", "model"))
                    .build());
        }
        return checks;
    }
}
