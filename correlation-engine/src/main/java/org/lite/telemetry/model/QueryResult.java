package org.lite.telemetry.model;

import lombok.Value;
import org.lite.telemetry.enums.ResultStatus;

/**
 * Outcome of one query path: a payload tagged with its availability status. Every query
 * path produces exactly one of these; failures are folded into the status, never thrown.
 */
@Value
public class QueryResult<T> {
    ResultStatus status;
    T payload;
    String message;

    public static <T> QueryResult<T> connected(T payload) {
        return new QueryResult<>(ResultStatus.CONNECTED, payload, null);
    }

    public static <T> QueryResult<T> mock(T payload, String message) {
        return new QueryResult<>(ResultStatus.MOCK, payload, message);
    }

    public static <T> QueryResult<T> error(T payload, String message) {
        return new QueryResult<>(ResultStatus.ERROR, payload, message);
    }

    public static <T> QueryResult<T> pendingConfig(T payload, String message) {
        return new QueryResult<>(ResultStatus.PENDING_CONFIG, payload, message);
    }

    public boolean isConnected() {
        return status == ResultStatus.CONNECTED;
    }
}
