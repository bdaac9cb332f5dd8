package org.lite.telemetry.enums;

import java.util.Locale;

public enum PxSessionStatus {
    ACTIVE,
    IDLE,
    DONE;

    public static PxSessionStatus fromValue(String raw) {
        String status = String.valueOf(raw).toUpperCase(Locale.ROOT);
        if (status.contains("ACTIVE") || status.contains("EXECUTING") || status.contains("RUNNING")) return ACTIVE;
        if (status.contains("IDLE") || status.contains("WAITING")) return IDLE;
        return DONE;
    }
}
