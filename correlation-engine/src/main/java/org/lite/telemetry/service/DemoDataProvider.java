package org.lite.telemetry.service;

import lombok.RequiredArgsConstructor;
import org.lite.telemetry.enums.Severity;
import org.lite.telemetry.model.QualityCheck;
import org.lite.telemetry.model.SecurityCheck;
import org.lite.telemetry.model.SpanRecord;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Demo datasets served with status {@code mock} when an upstream is unreachable. Generated
 * from a fixed seed so repeated calls return the same records, anchored to the current time.
 */
@Component
@RequiredArgsConstructor
public class DemoDataProvider {

    static final int DEMO_CHECK_COUNT = 200;
    private static final long SEED = 20240611L;

    private static final String[] MODELS = {"gpt-4-turbo", "gpt-4o", "claude-3-sonnet", "claude-3-haiku"};
    private static final String[] SECURITY_TYPES = {
            "prompt_injection", "pii_detection", "jailbreak", "data_leakage", "harmful_content", "credential_exposure"};
    private static final String[] QUALITY_TYPES = {
            "hallucination", "relevance", "coherence", "factual_accuracy", "toxicity", "bias"};
    private static final String[] LOCATIONS = {"input", "output", "both"};
    private static final String[] ROUTING_TYPES = {"WORKFLOW", "AGENT", "PARALLEL", "WORKFLOW", "WORKFLOW", "AGENT"};
    private static final String[] QUERIES = {
            "List all compartments in my tenancy",
            "Why is my database slow today?",
            "Show cost summary for November",
            "Check blocking sessions",
            "Analyze database performance and compare with costs",
            "What are the current security alerts?"};

    private final Clock clock;

    public List<SecurityCheck> securityChecks() {
        Random random = new Random(SEED);
        Instant now = clock.instant();
        List<SecurityCheck> checks = new ArrayList<>(DEMO_CHECK_COUNT);
        for (int i = 0; i < DEMO_CHECK_COUNT; i++) {
            String type = SECURITY_TYPES[random.nextInt(SECURITY_TYPES.length)];
            boolean detected = random.nextDouble() < 0.15;
            Severity severity = detected ? detectedSeverity(random.nextDouble()) : Severity.LOW;
            boolean blocked = detected && (severity.compareTo(Severity.HIGH) >= 0 || random.nextBoolean());
            checks.add(SecurityCheck.builder()
                    .checkId(String.format("sc_demo_%04d", i))
                    .traceId("trace_demo_" + random.nextInt(1000))
                    .spanId("span_" + random.nextInt(10000))
                    .checkType(type)
                    .detected(detected)
                    .severity(severity)
                    .confidence(detected ? 0.7 + random.nextDouble() * 0.3 : 0.9 + random.nextDouble() * 0.1)
                    .location(LOCATIONS[random.nextInt(LOCATIONS.length)])
                    .details(detected ? "Potential " + type.replace('_', ' ') + " detected" : "No " + type.replace('_', ' ') + " detected")
                    .timestamp(now.minusMillis(random.nextInt(86_400_000)))
                    .remediation(detected ? (blocked ? "Request blocked and logged" : "Content sanitized") : null)
                    .model(MODELS[random.nextInt(MODELS.length)])
                    .blocked(blocked)
                    .build());
        }
        return checks;
    }

    public List<QualityCheck> qualityChecks() {
        Random random = new Random(SEED + 1);
        Instant now = clock.instant();
        List<QualityCheck> checks = new ArrayList<>(DEMO_CHECK_COUNT);
        for (int i = 0; i < DEMO_CHECK_COUNT; i++) {
            String type = QUALITY_TYPES[random.nextInt(QUALITY_TYPES.length)];
            // toxicity, bias and hallucination are better when low
            boolean lowerIsBetter = type.equals("toxicity") || type.equals("bias") || type.equals("hallucination");
            double score = Math.round(random.nextDouble() * 1000) / 1000.0;
            double threshold = lowerIsBetter ? 0.3 : 0.7;
            boolean passed = lowerIsBetter ? score < threshold : score >= threshold;
            double distance = lowerIsBetter ? score - threshold : threshold - score;
            checks.add(QualityCheck.builder()
                    .checkId(String.format("qc_demo_%04d", i))
                    .traceId("trace_demo_" + random.nextInt(1000))
                    .spanId("span_" + random.nextInt(10000))
                    .checkType(type)
                    .score(score)
                    .passed(passed)
                    .severity(passed ? Severity.LOW : distanceSeverity(distance))
                    .details(passed ? "Response within " + type.replace('_', ' ') + " threshold"
                            : "Response outside " + type.replace('_', ' ') + " threshold")
                    .timestamp(now.minusMillis(random.nextInt(86_400_000)))
                    .model(MODELS[random.nextInt(MODELS.length)])
                    .build());
        }
        return checks;
    }

    /**
     * Span sets for {@code count} pipeline executions, one minute apart and ending now.
     */
    public List<List<SpanRecord>> workflowSpans(int count) {
        Random random = new Random(SEED + 2);
        Instant now = clock.instant();
        List<List<SpanRecord>> traces = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String routing = ROUTING_TYPES[i % ROUTING_TYPES.length];
            String traceKey = String.format("trace-demo-%03d", i);
            Instant start = now.minusSeconds(60L * (count - i));
            boolean failed = random.nextDouble() > 0.9;
            traces.add(pipelineSpans(traceKey, routing, QUERIES[i % QUERIES.length], start, failed, random));
        }
        return traces;
    }

    private List<SpanRecord> pipelineSpans(String traceKey, String routing, String query, Instant start,
                                           boolean failed, Random random) {
        SpanBuilder spans = new SpanBuilder(traceKey, start);
        String root = spans.add(null, "coordinator_request", 0, Map.of());
        spans.add(root, "input_node", 50 + random.nextInt(100), Map.of("query", query));
        spans.add(root, "classifier_node", 100 + random.nextInt(300), Map.of());
        spans.add(root, "router_node", 20 + random.nextInt(30), Map.of("routing.type", routing));
        switch (routing) {
            case "AGENT" -> {
                String agent = spans.add(root, "agent_node", 1500 + random.nextInt(1500), Map.of());
                spans.add(agent, "tool_execution", 400 + random.nextInt(800), Map.of("tool.name", "oci_database_execute_sql"));
            }
            case "PARALLEL" -> {
                String parallel = spans.add(root, "parallel_node", 4000 + random.nextInt(4000), Map.of());
                spans.add(parallel, "mcp_call", 3000, Map.of("tool.name", "DbTroubleshootAgent"));
                spans.add(parallel, "mcp_call", 2500, Map.of("tool.name", "FinOpsAgent"));
            }
            default -> {
                String workflow = spans.add(root, "workflow_node", 300 + random.nextInt(300), Map.of());
                spans.add(workflow, "tool_execution", 250, Map.of("tool.name", "oci_identity_list_compartments"));
            }
        }
        spans.add(root, "output_node", 30 + random.nextInt(50), Map.of("response", "Completed: " + query));
        return spans.finish(failed);
    }

    private static Severity detectedSeverity(double roll) {
        if (roll < 0.1) return Severity.CRITICAL;
        if (roll < 0.3) return Severity.HIGH;
        if (roll < 0.6) return Severity.MEDIUM;
        return Severity.LOW;
    }

    private static Severity distanceSeverity(double distance) {
        if (distance > 0.4) return Severity.CRITICAL;
        if (distance > 0.2) return Severity.HIGH;
        if (distance > 0) return Severity.MEDIUM;
        return Severity.LOW;
    }

    /**
     * Lays spans out back to back. The root span is stretched over all children on finish.
     */
    private static final class SpanBuilder {
        private final String traceKey;
        private final Instant start;
        private final List<SpanRecord> spans = new ArrayList<>();
        private Instant cursor;

        private SpanBuilder(String traceKey, Instant start) {
            this.traceKey = traceKey;
            this.start = start;
            this.cursor = start;
        }

        private String add(String parentKey, String name, long durationMs, Map<String, String> tags) {
            String key = traceKey + "-" + spans.size();
            Instant ended = cursor.plusMillis(durationMs);
            spans.add(SpanRecord.builder()
                    .spanKey(key)
                    .parentSpanKey(parentKey)
                    .traceKey(traceKey)
                    .spanName(name)
                    .serviceName("coordinator")
                    .operationName(name)
                    .timeStarted(cursor)
                    .timeEnded(ended)
                    .durationMs(durationMs)
                    .status("OK")
                    .spanKind(parentKey == null ? "SERVER" : "INTERNAL")
                    .errorMessage("")
                    .tags(new HashMap<>(tags))
                    .build());
            if (parentKey != null) {
                cursor = ended;
            }
            return key;
        }

        private List<SpanRecord> finish(boolean failLast) {
            long total = cursor.toEpochMilli() - start.toEpochMilli();
            spans.set(0, spans.get(0).toBuilder().timeEnded(cursor).durationMs(total).build());
            if (failLast) {
                int last = spans.size() - 1;
                spans.set(last, spans.get(last).toBuilder().error(true).status("ERROR")
                        .errorMessage("Response formatting failed").build());
            }
            return spans;
        }
    }
}
