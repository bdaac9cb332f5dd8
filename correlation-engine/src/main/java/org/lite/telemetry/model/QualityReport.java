package org.lite.telemetry.model;

import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
public class QualityReport {
    List<QualityCheck> checks;
    QualitySummary summary;
    Pagination pagination;
    Map<String, String> filters;
}
