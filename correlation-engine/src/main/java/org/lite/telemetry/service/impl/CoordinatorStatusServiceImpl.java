package org.lite.telemetry.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.telemetry.config.CacheProperties;
import org.lite.telemetry.config.CoordinatorProperties;
import org.lite.telemetry.dto.ResultEnvelope;
import org.lite.telemetry.enums.QueryKind;
import org.lite.telemetry.model.CoordinatorStatus;
import org.lite.telemetry.service.CoordinatorClient;
import org.lite.telemetry.service.CoordinatorStatusService;
import org.lite.telemetry.service.QuerySpec;
import org.lite.telemetry.service.ResilientQueryExecutor;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Service
@Slf4j
@RequiredArgsConstructor
public class CoordinatorStatusServiceImpl implements CoordinatorStatusService {

    private final CoordinatorClient coordinatorClient;
    private final CoordinatorProperties coordinatorProperties;
    private final ResilientQueryExecutor executor;

    @Override
    public Mono<ResultEnvelope<CoordinatorStatus>> status(boolean skipCache) {
        log.debug("Coordinator status requested");
        return executor.execute(QuerySpec.<CoordinatorStatus>builder()
                .kind(QueryKind.COORDINATOR_STATUS)
                .cacheName(CacheProperties.COORDINATOR_STATUS)
                .cacheKey("status")
                .skipCache(skipCache)
                .missingSetting(coordinatorProperties.isStatusConfigured() ? null : CoordinatorProperties.STATUS_URL_SETTING)
                .fetch(coordinatorClient::getStatus)
                .emptyPayload(CoordinatorStatus::offline)
                .build());
    }
}
