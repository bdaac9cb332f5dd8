package org.lite.telemetry.service;

import org.lite.telemetry.dto.ResultEnvelope;
import org.lite.telemetry.model.SqlMonitorReport;
import reactor.core.publisher.Mono;

public interface SqlMonitorService {
    Mono<ResultEnvelope<SqlMonitorReport>> monitor(String database, boolean skipCache);
}
