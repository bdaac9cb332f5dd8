package org.lite.telemetry.model;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

@Value
public class CachedValue<T> {
    T value;
    Instant storedAt;

    public long ageSeconds(Instant now) {
        return Math.max(0, Duration.between(storedAt, now).getSeconds());
    }
}
