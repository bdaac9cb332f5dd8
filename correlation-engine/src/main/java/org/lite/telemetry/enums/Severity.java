package org.lite.telemetry.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Ordered severity tiers for security and quality check results. Declaration order is the
 * tier order, lowest first.
 */
public enum Severity {
    LOW(1),
    MEDIUM(5),
    HIGH(20),
    CRITICAL(40);

    private final int weight;

    Severity(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Severity fromValue(String value) {
        if (value == null) {
            return LOW;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return LOW;
        }
    }
}
