package org.lite.telemetry.model;

import lombok.Value;

import java.util.List;

@Value
public class WorkflowTraceReport {
    List<WorkflowExecutionTrace> traces;
    WorkflowSummary summary;
    String source;
}
