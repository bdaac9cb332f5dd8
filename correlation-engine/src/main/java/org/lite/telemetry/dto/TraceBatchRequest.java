package org.lite.telemetry.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class TraceBatchRequest {
    private List<String> traceKeys = new ArrayList<>();
    private boolean skipCache;
}
