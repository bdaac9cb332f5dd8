package org.lite.telemetry.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.telemetry.config.CacheProperties;
import org.lite.telemetry.config.CoordinatorProperties;
import org.lite.telemetry.dto.ResultEnvelope;
import org.lite.telemetry.enums.QueryKind;
import org.lite.telemetry.model.RawRecord;
import org.lite.telemetry.model.SqlExecution;
import org.lite.telemetry.model.SqlMonitorReport;
import org.lite.telemetry.service.CoordinatorClient;
import org.lite.telemetry.service.DerivedMetricsCalculator;
import org.lite.telemetry.service.OracleCommands;
import org.lite.telemetry.service.QuerySpec;
import org.lite.telemetry.service.ResilientQueryExecutor;
import org.lite.telemetry.service.SchemaNormalizer;
import org.lite.telemetry.service.SqlMonitorService;
import org.lite.telemetry.util.CacheKeys;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class SqlMonitorServiceImpl implements SqlMonitorService {

    private final CoordinatorClient coordinatorClient;
    private final CoordinatorProperties coordinatorProperties;
    private final SchemaNormalizer normalizer;
    private final DerivedMetricsCalculator metrics;
    private final ResilientQueryExecutor executor;

    @Override
    public Mono<ResultEnvelope<SqlMonitorReport>> monitor(String database, boolean skipCache) {
        String db = database != null && !database.isBlank() ? database : coordinatorProperties.getDefaultDatabase();
        log.info("SQL monitor requested for database {}", db);

        return executor.execute(QuerySpec.<SqlMonitorReport>builder()
                .kind(QueryKind.SQL_MONITOR)
                .cacheName(CacheProperties.SQL_MONITOR)
                .cacheKey(CacheKeys.of(Map.of("database", db)))
                .skipCache(skipCache)
                .missingSetting(coordinatorProperties.isConfigured() ? null : CoordinatorProperties.CHAT_URL_SETTING)
                .fetch(() -> coordinatorClient.sendCommand(OracleCommands.runningSql(db))
                        .map(payload -> toReport(db, payload)))
                .emptyPayload(() -> SqlMonitorReport.empty(db))
                .build());
    }

    SqlMonitorReport toReport(String database, RawRecord payload) {
        List<SqlExecution> executions = normalizer.normalizeSqlExecutions(payload).stream()
                .map(metrics::withProgress)
                .collect(Collectors.toList());
        long hung = executions.stream().filter(SqlExecution::isHung).count();
        if (hung > 0) {
            log.warn("{} hung SQL execution(s) on {}", hung, database);
        }
        return new SqlMonitorReport(database, executions, metrics.sqlMonitorSummary(executions));
    }
}
