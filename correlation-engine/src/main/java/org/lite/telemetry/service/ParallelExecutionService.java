package org.lite.telemetry.service;

import org.lite.telemetry.dto.ResultEnvelope;
import org.lite.telemetry.model.ParallelismReport;
import reactor.core.publisher.Mono;

public interface ParallelExecutionService {
    Mono<ResultEnvelope<ParallelismReport>> analyze(String database, boolean skipCache);
}
