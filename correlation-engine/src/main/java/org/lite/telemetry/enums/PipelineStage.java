package org.lite.telemetry.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Logical phases of the coordinator pipeline and the span-name fragments that identify them.
 */
public enum PipelineStage {
    INPUT("Input", List.of("input_node", "query_enhancement", "context_extraction")),
    CLASSIFIER("Classifier", List.of("classifier_node", "intent_classification", "entity_extraction")),
    ROUTER("Router", List.of("router_node", "routing_decision", "determine_routing")),
    WORKFLOW("Workflow", List.of("workflow_node", "workflow_execution", "execute_workflow")),
    PARALLEL("Parallel", List.of("parallel_node", "parallel_orchestrator", "multi_agent_execution")),
    AGENT("Agent", List.of("agent_node", "agent_execution", "llm_invocation")),
    ACTION("Action", List.of("action_node", "tool_execution", "mcp_call")),
    OUTPUT("Output", List.of("output_node", "response_formatting", "format_response"));

    private final String displayName;
    private final List<String> spanPatterns;

    PipelineStage(String displayName, List<String> spanPatterns) {
        this.displayName = displayName;
        this.spanPatterns = spanPatterns;
    }

    @JsonValue
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String getDisplayName() {
        return displayName;
    }

    public List<String> getSpanPatterns() {
        return spanPatterns;
    }
}
