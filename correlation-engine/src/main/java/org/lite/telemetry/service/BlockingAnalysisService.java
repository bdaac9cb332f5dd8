package org.lite.telemetry.service;

import org.lite.telemetry.dto.ResultEnvelope;
import org.lite.telemetry.model.BlockingReport;
import reactor.core.publisher.Mono;

public interface BlockingAnalysisService {
    Mono<ResultEnvelope<BlockingReport>> analyze(String database, boolean skipCache);
}
