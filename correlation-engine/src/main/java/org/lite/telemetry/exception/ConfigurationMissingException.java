package org.lite.telemetry.exception;

public class ConfigurationMissingException extends RuntimeException {

    public ConfigurationMissingException(String setting) {
        super(String.format("%s not configured", setting));
    }
}
