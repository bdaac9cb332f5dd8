package org.lite.telemetry.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.lite.telemetry.enums.QueryKind;

import java.util.HashMap;
import java.util.Map;

/**
 * Transport-agnostic inbound query.
 */
@Data
public class QueryRequest {
    @NotNull
    private QueryKind queryKind;
    private Map<String, String> parameters = new HashMap<>();
    @Valid
    private Options options = new Options();

    public String parameter(String name, String defaultValue) {
        String value = parameters != null ? parameters.get(name) : null;
        return value != null && !value.isBlank() ? value : defaultValue;
    }

    @Data
    public static class Options {
        private boolean skipCache;
        private Integer limit;
        private Integer offset;
    }
}
