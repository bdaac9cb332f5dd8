package org.lite.telemetry.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.telemetry.config.CacheProperties;
import org.lite.telemetry.config.CoordinatorProperties;
import org.lite.telemetry.dto.ResultEnvelope;
import org.lite.telemetry.enums.QueryKind;
import org.lite.telemetry.exception.MalformedPayloadException;
import org.lite.telemetry.model.BlockingReport;
import org.lite.telemetry.model.BlockingSession;
import org.lite.telemetry.model.BlockingTree;
import org.lite.telemetry.model.RawRecord;
import org.lite.telemetry.service.BlockingAnalysisService;
import org.lite.telemetry.service.CoordinatorClient;
import org.lite.telemetry.service.DependencyTreeBuilder;
import org.lite.telemetry.service.DerivedMetricsCalculator;
import org.lite.telemetry.service.OracleCommands;
import org.lite.telemetry.service.QuerySpec;
import org.lite.telemetry.service.ResilientQueryExecutor;
import org.lite.telemetry.service.SchemaNormalizer;
import org.lite.telemetry.util.CacheKeys;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@Service
@Slf4j
@RequiredArgsConstructor
public class BlockingAnalysisServiceImpl implements BlockingAnalysisService {

    private final CoordinatorClient coordinatorClient;
    private final CoordinatorProperties coordinatorProperties;
    private final SchemaNormalizer normalizer;
    private final DependencyTreeBuilder treeBuilder;
    private final DerivedMetricsCalculator metrics;
    private final ResilientQueryExecutor executor;

    @Override
    public Mono<ResultEnvelope<BlockingReport>> analyze(String database, boolean skipCache) {
        String db = database != null && !database.isBlank() ? database : coordinatorProperties.getDefaultDatabase();
        log.info("Blocking analysis requested for database {}", db);

        return executor.execute(QuerySpec.<BlockingReport>builder()
                .kind(QueryKind.BLOCKING_SESSIONS)
                .cacheName(CacheProperties.BLOCKING)
                .cacheKey(CacheKeys.of(Map.of("database", db)))
                .skipCache(skipCache)
                .missingSetting(coordinatorProperties.isConfigured() ? null : CoordinatorProperties.CHAT_URL_SETTING)
                .fetch(() -> coordinatorClient.sendCommand(OracleCommands.checkBlocking(db))
                        .map(payload -> toReport(db, payload)))
                .emptyPayload(() -> BlockingReport.empty(db))
                .build());
    }

    BlockingReport toReport(String database, RawRecord payload) {
        if (!normalizer.hasBlockingData(payload)) {
            String message = payload.text("", "message").toLowerCase(Locale.ROOT);
            if (message.contains("no blocking") || message.contains("no sessions") || message.contains("healthy")) {
                log.info("Coordinator reports no blocking on {}", database);
                return BlockingReport.empty(database);
            }
            log.warn("Coordinator answer for {} carries no blocking data: {}", database, payload);
            throw new MalformedPayloadException("Unrecognized blocking answer from coordinator");
        }

        List<BlockingSession> sessions = normalizer.normalizeBlockingSessions(payload);
        BlockingTree tree = treeBuilder.build(sessions);
        return BlockingReport.builder()
                .database(database)
                .sessions(tree.getChain())
                .tree(tree.getRoots())
                .summary(metrics.blockingSummary(tree.getChain()))
                .build();
    }
}
