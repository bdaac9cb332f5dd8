package org.lite.telemetry.model;

import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
public class SecurityReport {
    List<SecurityCheck> checks;
    SecuritySummary summary;
    Pagination pagination;
    Map<String, String> filters;
}
