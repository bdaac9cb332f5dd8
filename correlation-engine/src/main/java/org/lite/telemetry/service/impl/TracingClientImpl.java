package org.lite.telemetry.service.impl;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.telemetry.config.TracingProperties;
import org.lite.telemetry.exception.ConfigurationMissingException;
import org.lite.telemetry.exception.MalformedPayloadException;
import org.lite.telemetry.exception.UpstreamFailureException;
import org.lite.telemetry.model.RawRecord;
import org.lite.telemetry.service.TracingClient;
import org.lite.telemetry.util.UpstreamErrors;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

@Service
@Slf4j
@RequiredArgsConstructor
public class TracingClientImpl implements TracingClient {

    static final String TRACE_QUERY =
            "show (traces) TraceStatus, TraceFirstSpanStartTime, ServiceName, OperationName, TraceDuration, ErrorCount";

    @NonNull
    private final WebClient.Builder webClientBuilder;

    @NonNull
    private final TracingProperties properties;

    @Override
    public Mono<RawRecord> listTraces(Instant start, Instant end, int limit) {
        return requireDomain().then(Mono.defer(() -> {
            String url = UriComponentsBuilder.fromHttpUrl(baseUrl())
                    .path("/20200630/queries/actions/runQuery")
                    .queryParam("apmDomainId", properties.getApmDomainId())
                    .queryParam("timeSpanStartedGreaterThanOrEqualTo", start.toString())
                    .queryParam("timeSpanStartedLessThan", end.toString())
                    .queryParam("limit", limit)
                    .build()
                    .toUriString();
            return exchange(HttpMethod.POST, url, Map.of("queryText", TRACE_QUERY), properties.getListTimeout());
        }));
    }

    @Override
    public Mono<RawRecord> getTrace(String traceKey) {
        return requireDomain().then(Mono.defer(() -> {
            String url = UriComponentsBuilder.fromHttpUrl(baseUrl())
                    .path("/20200630/traces/{traceKey}")
                    .queryParam("apmDomainId", properties.getApmDomainId())
                    .buildAndExpand(traceKey)
                    .toUriString();
            return exchange(HttpMethod.GET, url, null, properties.getDetailTimeout())
                    .map(body -> {
                        RawRecord trace = body.record("trace");
                        if (trace.isEmpty() && !body.has("spans")) {
                            throw new UpstreamFailureException(url, 404, "Trace " + traceKey + " not found");
                        }
                        return trace.isEmpty() ? body : trace;
                    });
        }));
    }

    @Override
    public Mono<RawRecord> listWorkflowTraces(int limit, String traceKey) {
        return requireBaseUrl().then(Mono.defer(() -> {
            UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(baseUrl());
            if (traceKey != null && !traceKey.isBlank()) {
                uri.path("/apm/trace/{traceKey}");
            } else {
                uri.path("/apm/traces").queryParam("limit", limit);
            }
            String url = uri.buildAndExpand(traceKey != null ? traceKey : "").toUriString();
            return exchange(HttpMethod.GET, url, null, properties.getListTimeout());
        }));
    }

    @Override
    public Mono<RawRecord> listSecurityChecks(String timeRange) {
        return listChecks("/llm-observability/security-checks", timeRange);
    }

    @Override
    public Mono<RawRecord> listQualityChecks(String timeRange) {
        return listChecks("/llm-observability/quality-checks", timeRange);
    }

    private Mono<RawRecord> listChecks(String path, String timeRange) {
        return requireBaseUrl().then(Mono.defer(() -> {
            String url = UriComponentsBuilder.fromHttpUrl(baseUrl())
                    .path(path)
                    .queryParam("timeRange", timeRange)
                    .build()
                    .toUriString();
            return exchange(HttpMethod.GET, url, null, properties.getListTimeout());
        }));
    }

    private Mono<RawRecord> exchange(HttpMethod method, String url, Object body, Duration timeout) {
        log.info("Tracing backend request {} {}", method, url);
        WebClient.RequestBodySpec request = webClientBuilder.build()
                .method(method)
                .uri(url)
                .accept(MediaType.APPLICATION_JSON);
        if (body != null) {
            request.contentType(MediaType.APPLICATION_JSON).bodyValue(body);
        }
        return request
                .retrieve()
                .onStatus(status -> status.isError(), response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .flatMap(text -> Mono.error(new UpstreamFailureException(url, response.statusCode().value(), text))))
                .bodyToMono(Object.class)
                .timeout(timeout)
                .map(decoded -> {
                    if (!(decoded instanceof Map<?, ?>)) {
                        throw new MalformedPayloadException(url + " did not return a JSON object");
                    }
                    return RawRecord.of(decoded);
                })
                .doOnError(error -> log.error("Tracing backend call failed at {}: {}", url, error.getMessage()))
                .onErrorMap(error -> UpstreamErrors.translate(url, error));
    }

    private Mono<Void> requireBaseUrl() {
        return properties.isConfigured() ? Mono.empty() : Mono.error(new ConfigurationMissingException(TracingProperties.BASE_URL_SETTING));
    }

    private Mono<Void> requireDomain() {
        if (!properties.isDomainConfigured()) {
            return Mono.error(new ConfigurationMissingException(TracingProperties.DOMAIN_SETTING));
        }
        return requireBaseUrl();
    }

    private String baseUrl() {
        String url = properties.getBaseUrl();
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
