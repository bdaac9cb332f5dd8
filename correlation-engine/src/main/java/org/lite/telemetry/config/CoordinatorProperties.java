package org.lite.telemetry.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection settings for the coordinator (orchestration) backend.
 * Values are opaque to the engine; only their presence is checked.
 */
@ConfigurationProperties(prefix = "telemetry.coordinator")
@Data
public class CoordinatorProperties {

    public static final String CHAT_URL_SETTING = "telemetry.coordinator.chat-url";
    public static final String STATUS_URL_SETTING = "telemetry.coordinator.status-url";

    private String chatUrl;
    private String statusUrl;
    private Duration chatTimeout = Duration.ofSeconds(15);
    private Duration statusTimeout = Duration.ofSeconds(5);
    private String defaultDatabase = "ATPAdi";

    public boolean isConfigured() {
        return chatUrl != null && !chatUrl.isBlank();
    }

    public boolean isStatusConfigured() {
        return statusUrl != null && !statusUrl.isBlank();
    }
}
