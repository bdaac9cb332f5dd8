package org.lite.telemetry.model;

import lombok.Value;
import org.lite.telemetry.dto.ResultEnvelope;

import java.util.List;

@Value
public class TraceBatchReport {
    List<ResultEnvelope<TraceDetail>> traces;
    int totalRequested;
    int totalReturned;
}
