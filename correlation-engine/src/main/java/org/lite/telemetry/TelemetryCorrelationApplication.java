package org.lite.telemetry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TelemetryCorrelationApplication {
    public static void main(String[] args) {
        SpringApplication.run(TelemetryCorrelationApplication.class, args);
    }
}
