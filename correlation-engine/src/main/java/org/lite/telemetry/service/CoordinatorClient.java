package org.lite.telemetry.service;

import org.lite.telemetry.model.CoordinatorStatus;
import org.lite.telemetry.model.RawRecord;
import reactor.core.publisher.Mono;

/**
 * Orchestration backend that runs agent commands and reports its own health.
 */
public interface CoordinatorClient {

    /**
     * Sends a chat command and returns the data portion of the answer. Errors with an
     * exception from {@code org.lite.telemetry.exception} on timeout, non-success status or an
     * unreadable body.
     */
    Mono<RawRecord> sendCommand(String command);

    Mono<CoordinatorStatus> getStatus();
}
