package org.lite.telemetry.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.telemetry.config.CacheProperties;
import org.lite.telemetry.config.CoordinatorProperties;
import org.lite.telemetry.dto.ResultEnvelope;
import org.lite.telemetry.enums.PxSessionStatus;
import org.lite.telemetry.enums.QueryKind;
import org.lite.telemetry.model.DopDowngrade;
import org.lite.telemetry.model.ParallelismReport;
import org.lite.telemetry.model.PxSession;
import org.lite.telemetry.model.PxSystemStats;
import org.lite.telemetry.model.RawRecord;
import org.lite.telemetry.service.CoordinatorClient;
import org.lite.telemetry.service.DerivedMetricsCalculator;
import org.lite.telemetry.service.OracleCommands;
import org.lite.telemetry.service.ParallelExecutionService;
import org.lite.telemetry.service.QuerySpec;
import org.lite.telemetry.service.ResilientQueryExecutor;
import org.lite.telemetry.service.SchemaNormalizer;
import org.lite.telemetry.util.CacheKeys;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class ParallelExecutionServiceImpl implements ParallelExecutionService {

    private final CoordinatorClient coordinatorClient;
    private final CoordinatorProperties coordinatorProperties;
    private final SchemaNormalizer normalizer;
    private final DerivedMetricsCalculator metrics;
    private final ResilientQueryExecutor executor;
    private final Clock clock;

    @Override
    public Mono<ResultEnvelope<ParallelismReport>> analyze(String database, boolean skipCache) {
        String db = database != null && !database.isBlank() ? database : coordinatorProperties.getDefaultDatabase();
        log.info("Parallel execution analysis requested for database {}", db);

        return executor.execute(QuerySpec.<ParallelismReport>builder()
                .kind(QueryKind.PARALLEL_EXECUTION)
                .cacheName(CacheProperties.PARALLELISM)
                .cacheKey(CacheKeys.of(Map.of("database", db)))
                .skipCache(skipCache)
                .missingSetting(coordinatorProperties.isConfigured() ? null : CoordinatorProperties.CHAT_URL_SETTING)
                .fetch(() -> coordinatorClient.sendCommand(OracleCommands.checkParallelism(db))
                        .map(payload -> toReport(db, payload)))
                .emptyPayload(() -> ParallelismReport.empty(db))
                .build());
    }

    ParallelismReport toReport(String database, RawRecord payload) {
        Instant now = clock.instant();
        List<PxSession> sessions = normalizer.normalizePxSessions(payload);
        List<PxSession> active = sessions.stream()
                .filter(s -> s.getStatus() == PxSessionStatus.ACTIVE)
                .collect(Collectors.toList());
        Optional<PxSystemStats> stats = normalizer.normalizeSystemStats(payload);

        int serversInUse = stats.map(PxSystemStats::getServersInUse)
                .orElseGet(() -> active.stream().mapToInt(PxSession::getServersAllocated).sum());
        int maxServers = stats.map(PxSystemStats::getMaxParallelServers).orElse(SchemaNormalizer.DEFAULT_MAX_PARALLEL_SERVERS);

        List<DopDowngrade> downgrades = normalizer.normalizeDowngrades(payload, now);
        if (downgrades.isEmpty()) {
            downgrades = sessions.stream()
                    .filter(PxSession::isDowngraded)
                    .map(s -> DopDowngrade.builder()
                            .timestamp(now.toString())
                            .sqlId(s.getSqlId())
                            .requestedDop(s.getRequestedDop())
                            .actualDop(s.getActualDop())
                            .reason("DOP downgrade detected")
                            .qcSid(s.getQcSid())
                            .build())
                    .collect(Collectors.toList());
        }

        return ParallelismReport.builder()
                .database(database)
                .sessions(sessions)
                .recentDowngrades(downgrades)
                .maxParallelServers(maxServers)
                .serversInUse(serversInUse)
                .serversAvailable(maxServers - serversInUse)
                .activePxSessions(active.size())
                .dopEfficiencyPercent(metrics.dopEfficiency(sessions))
                .build();
    }
}
