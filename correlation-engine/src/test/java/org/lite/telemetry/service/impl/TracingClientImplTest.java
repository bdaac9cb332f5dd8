package org.lite.telemetry.service.impl;

import org.junit.jupiter.api.Test;
import org.lite.telemetry.config.TracingProperties;
import org.lite.telemetry.exception.ConfigurationMissingException;
import org.lite.telemetry.exception.UpstreamFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TracingClientImplTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    private TracingClientImpl client(ExchangeFunction exchange, TracingProperties properties) {
        ExchangeFunction recording = request -> {
            requests.add(request);
            return exchange.exchange(request);
        };
        return new TracingClientImpl(WebClient.builder().exchangeFunction(recording), properties);
    }

    private static TracingProperties configured() {
        TracingProperties properties = new TracingProperties();
        properties.setBaseUrl("https://apm.example.com");
        properties.setApmDomainId("ocid1.apmdomain.oc1..demo");
        return properties;
    }

    private static Mono<ClientResponse> json(HttpStatus status, String body) {
        return Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }

    @Test
    void testListTraces_RunsQueryWithDomainAndWindow() {
        // Given
        TracingClientImpl client = client(request -> json(HttpStatus.OK, "{\"queryResultResponse\":{\"queryResultRows\":[]}}"), configured());
        Instant end = Instant.parse("2024-06-11T10:00:00Z");

        // When & Then
        StepVerifier.create(client.listTraces(end.minusSeconds(3600), end, 50))
                .assertNext(payload -> assertTrue(payload.has("queryResultResponse")))
                .verifyComplete();
        ClientRequest request = requests.get(0);
        assertEquals(HttpMethod.POST, request.method());
        assertEquals("/20200630/queries/actions/runQuery", request.url().getPath());
        assertTrue(request.url().getQuery().contains("apmDomainId=ocid1.apmdomain.oc1..demo"));
        assertTrue(request.url().getQuery().contains("limit=50"));
    }

    @Test
    void testGetTrace_UnwrapsTraceObject() {
        // Given
        TracingClientImpl client = client(request -> json(HttpStatus.OK,
                "{\"trace\":{\"key\":\"abc\",\"spans\":[{\"key\":\"s1\"}]}}"), configured());

        // When & Then
        StepVerifier.create(client.getTrace("abc"))
                .assertNext(trace -> assertEquals(1, trace.records("spans").size()))
                .verifyComplete();
        assertEquals("/20200630/traces/abc", requests.get(0).url().getPath());
    }

    @Test
    void testGetTrace_EmptyAnswerIsNotFound() {
        // Given
        TracingClientImpl client = client(request -> json(HttpStatus.OK, "{}"), configured());

        // When & Then
        StepVerifier.create(client.getTrace("missing"))
                .expectErrorSatisfies(error -> assertEquals(404,
                        assertInstanceOf(UpstreamFailureException.class, error).getStatusCode()))
                .verify();
    }

    @Test
    void testListTraces_MissingDomainIsConfigurationError() {
        // Given
        TracingProperties properties = configured();
        properties.setApmDomainId(" ");
        TracingClientImpl client = client(request -> json(HttpStatus.OK, "{}"), properties);

        // When & Then
        StepVerifier.create(client.listTraces(Instant.EPOCH, Instant.EPOCH.plusSeconds(60), 10))
                .expectErrorMessage(TracingProperties.DOMAIN_SETTING + " not configured")
                .verify();
        assertTrue(requests.isEmpty());
    }

    @Test
    void testListWorkflowTraces_SingleTraceAndListingPaths() {
        // Given
        TracingClientImpl client = client(request -> json(HttpStatus.OK, "{\"traces\":[]}"), configured());

        // When
        client.listWorkflowTraces(10, "abc").block();
        client.listWorkflowTraces(25, null).block();

        // Then
        assertEquals("/apm/trace/abc", requests.get(0).url().getPath());
        assertEquals("/apm/traces", requests.get(1).url().getPath());
        assertEquals("limit=25", requests.get(1).url().getQuery());
    }

    @Test
    void testListSecurityChecks_PassesTimeRange() {
        // Given
        TracingClientImpl client = client(request -> json(HttpStatus.OK, "{\"checks\":[]}"), configured());

        // When
        client.listSecurityChecks("7d").block();

        // Then
        assertEquals("/llm-observability/security-checks", requests.get(0).url().getPath());
        assertEquals("timeRange=7d", requests.get(0).url().getQuery());
    }

    @Test
    void testListQualityChecks_UnconfiguredBaseUrl() {
        // Given
        TracingClientImpl client = client(request -> json(HttpStatus.OK, "{}"), new TracingProperties());

        // When & Then
        StepVerifier.create(client.listQualityChecks("24h"))
                .expectError(ConfigurationMissingException.class)
                .verify();
    }
}
