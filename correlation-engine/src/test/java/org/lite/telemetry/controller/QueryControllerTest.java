package org.lite.telemetry.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lite.telemetry.dto.QueryRequest;
import org.lite.telemetry.dto.ResultEnvelope;
import org.lite.telemetry.enums.QueryKind;
import org.lite.telemetry.enums.ResultStatus;
import org.lite.telemetry.exception.InvalidQueryException;
import org.lite.telemetry.model.BlockingReport;
import org.lite.telemetry.service.QueryDispatcher;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@WebFluxTest(controllers = QueryController.class)
class QueryControllerTest {

    @Autowired
    private WebTestClient client;

    @MockBean
    private QueryDispatcher queryDispatcher;

    @MockBean
    private Clock clock;

    @BeforeEach
    void setUp() {
        when(clock.instant()).thenReturn(Instant.parse("2024-06-11T10:00:00Z"));
    }

    @Test
    void testQuery_ReturnsEnvelopeWithInlinePayload() {
        // Given
        ResultEnvelope<?> envelope = ResultEnvelope.<BlockingReport>builder()
                .status(ResultStatus.CONNECTED)
                .cached(false)
                .payload(BlockingReport.empty("PROD"))
                .timestamp("2024-06-11T10:00:00Z")
                .build();
        when(queryDispatcher.dispatch(any(QueryRequest.class))).thenReturn(Mono.<ResultEnvelope<?>>just(envelope));

        // When & Then
        client.post().uri("/api/query")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"queryKind\":\"blocking_sessions\",\"parameters\":{\"database\":\"PROD\"}}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("connected")
                .jsonPath("$.cached").isEqualTo(false)
                .jsonPath("$.database").isEqualTo("PROD")
                .jsonPath("$.summary.totalBlocked").isEqualTo(0)
                .jsonPath("$.message").doesNotExist();
    }

    @Test
    void testQuery_MissingKindIsBadRequest() {
        // When & Then
        client.post().uri("/api/query")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"parameters\":{}}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.status").isEqualTo("error")
                .jsonPath("$.timestamp").isEqualTo("2024-06-11T10:00:00Z");
        verifyNoInteractions(queryDispatcher);
    }

    @Test
    void testQuery_UnknownKindIsBadRequest() {
        // When & Then
        client.post().uri("/api/query")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"queryKind\":\"disk_usage\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.status").isEqualTo("error");
    }

    @Test
    void testQuery_InvalidParametersAreBadRequest() {
        // Given
        when(queryDispatcher.dispatch(any(QueryRequest.class)))
                .thenReturn(Mono.error(new InvalidQueryException("traceKey parameter is required")));

        // When & Then
        client.post().uri("/api/query")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"queryKind\":\"" + QueryKind.TRACE_DETAIL.getValue() + "\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("traceKey parameter is required");
    }
}
