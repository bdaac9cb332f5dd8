package org.lite.telemetry.service;

import org.lite.telemetry.dto.ResultEnvelope;
import org.lite.telemetry.model.CoordinatorStatus;
import reactor.core.publisher.Mono;

public interface CoordinatorStatusService {
    Mono<ResultEnvelope<CoordinatorStatus>> status(boolean skipCache);
}
