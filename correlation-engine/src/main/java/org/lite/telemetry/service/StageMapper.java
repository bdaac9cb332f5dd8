package org.lite.telemetry.service;

import org.lite.telemetry.enums.PipelineStage;
import org.lite.telemetry.enums.TraceStatus;
import org.lite.telemetry.model.SpanHierarchy;
import org.lite.telemetry.model.SpanRecord;
import org.lite.telemetry.model.StageExecution;
import org.lite.telemetry.model.ToolCall;
import org.lite.telemetry.model.WorkflowExecutionTrace;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Groups the spans of one trace into pipeline stages by name pattern and assembles the
 * workflow view of the trace.
 */
@Component
public class StageMapper {

    static final int MAX_RESPONSE_LENGTH = 200;
    static final String DEFAULT_ROUTING_TYPE = "WORKFLOW";

    /**
     * One entry per stage that matched at least one span, ordered by start time. A span can
     * count towards several stages.
     */
    public List<StageExecution> map(List<SpanRecord> spans) {
        List<StageExecution> stages = new ArrayList<>();
        if (spans == null || spans.isEmpty()) {
            return stages;
        }
        for (PipelineStage stage : PipelineStage.values()) {
            List<SpanRecord> matched = new ArrayList<>();
            for (SpanRecord span : spans) {
                if (matches(span, stage)) {
                    matched.add(span);
                }
            }
            if (!matched.isEmpty()) {
                stages.add(aggregate(stage, matched));
            }
        }
        stages.sort(Comparator.comparing(StageExecution::getStartTime, Comparator.nullsLast(Comparator.naturalOrder())));
        return stages;
    }

    public WorkflowExecutionTrace toWorkflowTrace(SpanHierarchy hierarchy) {
        List<SpanRecord> spans = hierarchy.getSpans();
        return WorkflowExecutionTrace.builder()
                .traceKey(hierarchy.getTraceKey())
                .stages(map(spans))
                .status(traceStatus(spans))
                .totalDurationMs(hierarchy.getTotalDurationMs())
                .startTime(earliestStart(spans))
                .endTime(latestEnd(spans))
                .routingType(routingType(spans))
                .query(query(spans))
                .response(response(spans))
                .build();
    }

    static boolean matches(SpanRecord span, PipelineStage stage) {
        String spanName = lower(span.getSpanName());
        String operationName = lower(span.getOperationName());
        for (String pattern : stage.getSpanPatterns()) {
            if (spanName.contains(pattern) || operationName.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    private StageExecution aggregate(PipelineStage stage, List<SpanRecord> matched) {
        double duration = 0;
        boolean error = false;
        List<ToolCall> toolCalls = new ArrayList<>();
        for (SpanRecord span : matched) {
            duration += span.getDurationMs();
            error |= span.isError();
            String name = lower(span.getSpanName());
            if (name.contains("tool") || name.contains("mcp")) {
                toolCalls.add(new ToolCall(toolName(span), span.getDurationMs(), span.isError() ? "error" : "success"));
            }
        }
        return StageExecution.builder()
                .stage(stage)
                .stageName(stage.getDisplayName())
                .spanKey(matched.get(0).getSpanKey())
                .spans(matched)
                .startTime(earliestStart(matched))
                .endTime(latestEnd(matched))
                .durationMs(duration)
                .error(error)
                .toolCalls(toolCalls)
                .build();
    }

    private static String toolName(SpanRecord span) {
        String tagged = span.tag("tool.name");
        if (tagged != null && !tagged.isBlank()) {
            return tagged;
        }
        return span.getOperationName() != null ? span.getOperationName() : "unknown";
    }

    private static TraceStatus traceStatus(List<SpanRecord> spans) {
        if (spans.isEmpty()) {
            return TraceStatus.PENDING;
        }
        if (spans.stream().anyMatch(SpanRecord::isError)) {
            return TraceStatus.ERROR;
        }
        if (spans.stream().anyMatch(s -> s.getTimeEnded() == null)) {
            return TraceStatus.PENDING;
        }
        return TraceStatus.SUCCESS;
    }

    private static String routingType(List<SpanRecord> spans) {
        for (SpanRecord span : spans) {
            if (lower(span.getSpanName()).contains("router") || span.tag("routing.type") != null) {
                String routing = span.tag("routing.type");
                return routing != null && !routing.isBlank() ? routing : DEFAULT_ROUTING_TYPE;
            }
        }
        return DEFAULT_ROUTING_TYPE;
    }

    private static String query(List<SpanRecord> spans) {
        SpanRecord input = firstNamed(spans, "input");
        if (input == null) {
            return null;
        }
        String query = input.tag("query");
        return query != null ? query : input.tag("user.query");
    }

    private static String response(List<SpanRecord> spans) {
        SpanRecord output = firstNamed(spans, "output");
        String response = output != null ? output.tag("response") : null;
        if (response == null || response.length() <= MAX_RESPONSE_LENGTH) {
            return response;
        }
        return response.substring(0, MAX_RESPONSE_LENGTH);
    }

    private static SpanRecord firstNamed(List<SpanRecord> spans, String fragment) {
        for (SpanRecord span : spans) {
            if (lower(span.getSpanName()).contains(fragment)) {
                return span;
            }
        }
        return null;
    }

    private static Instant earliestStart(List<SpanRecord> spans) {
        return spans.stream()
                .map(SpanRecord::getTimeStarted)
                .filter(Objects::nonNull)
                .min(Comparator.naturalOrder())
                .orElse(null);
    }

    private static Instant latestEnd(List<SpanRecord> spans) {
        return spans.stream()
                .map(SpanRecord::getTimeEnded)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
