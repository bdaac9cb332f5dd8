package org.lite.telemetry.config;

import lombok.Data;
import org.lite.telemetry.enums.MultipleRootPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "telemetry.tracing")
@Data
public class TracingProperties {

    public static final String BASE_URL_SETTING = "telemetry.tracing.base-url";
    public static final String DOMAIN_SETTING = "telemetry.tracing.apm-domain-id";

    private String baseUrl;
    private String apmDomainId;
    private Duration listTimeout = Duration.ofSeconds(10);
    private Duration detailTimeout = Duration.ofSeconds(10);
    private MultipleRootPolicy multipleRootPolicy = MultipleRootPolicy.FIRST_ENCOUNTERED;
    private int maxBatchSize = 10;

    public boolean isConfigured() {
        return baseUrl != null && !baseUrl.isBlank();
    }

    public boolean isDomainConfigured() {
        return apmDomainId != null && !apmDomainId.isBlank();
    }
}
