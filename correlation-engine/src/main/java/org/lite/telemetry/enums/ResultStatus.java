package org.lite.telemetry.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Availability vocabulary attached to every response envelope.
 */
public enum ResultStatus {
    CONNECTED("connected"),          // live upstream data
    MOCK("mock"),                    // static demo data, upstream unreachable or unconfigured
    ERROR("error"),                  // upstream failed, timed out or returned an unusable payload
    PENDING_CONFIG("pending_config"); // a required identifier or endpoint is not set

    private final String value;

    ResultStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
