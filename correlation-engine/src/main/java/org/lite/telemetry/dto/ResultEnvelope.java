package org.lite.telemetry.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.Builder;
import lombok.Value;
import org.lite.telemetry.enums.ResultStatus;

/**
 * Uniform response shape for every derived-metric endpoint. Payload fields are written inline
 * next to the status fields.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResultEnvelope<T> {
    ResultStatus status;
    Boolean cached;
    Long cacheAge;
    String message;
    @JsonUnwrapped
    T payload;
    String timestamp;

    @JsonIgnore
    public boolean isConnected() {
        return status == ResultStatus.CONNECTED;
    }

    /**
     * Envelope for a request that was refused before any query ran.
     */
    public static <T> ResultEnvelope<T> rejected(String message, String timestamp) {
        return ResultEnvelope.<T>builder()
                .status(ResultStatus.ERROR)
                .message(message)
                .timestamp(timestamp)
                .build();
    }
}
