package org.lite.telemetry.service.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.lite.telemetry.config.CacheProperties;
import org.lite.telemetry.config.CoordinatorProperties;
import org.lite.telemetry.dto.ResultEnvelope;
import org.lite.telemetry.enums.ResultStatus;
import org.lite.telemetry.exception.UpstreamUnavailableException;
import org.lite.telemetry.model.CoordinatorStatus;
import org.lite.telemetry.service.CoordinatorClient;
import org.lite.telemetry.service.ResilientQueryExecutor;
import org.lite.telemetry.service.ResponseCacheManager;
import org.lite.telemetry.support.MutableClock;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CoordinatorStatusServiceImplTest {

    @Mock
    private CoordinatorClient coordinatorClient;

    private CoordinatorProperties properties;
    private CoordinatorStatusServiceImpl coordinatorStatusService;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2024-06-11T10:00:00Z"));
        properties = new CoordinatorProperties();
        properties.setStatusUrl("http://coordinator:3001");
        coordinatorStatusService = new CoordinatorStatusServiceImpl(coordinatorClient, properties,
                new ResilientQueryExecutor(new ResponseCacheManager(new CacheProperties(), clock), clock));
    }

    @Test
    void testStatus_Running() {
        // Given
        when(coordinatorClient.getStatus()).thenReturn(Mono.just(new CoordinatorStatus("running", Map.of("oci-db", true), 12)));

        // When
        ResultEnvelope<CoordinatorStatus> envelope = coordinatorStatusService.status(false).block();

        // Then
        assertEquals(ResultStatus.CONNECTED, envelope.getStatus());
        assertEquals(12, envelope.getPayload().getToolsCount());
    }

    @Test
    void testStatus_UnreachableReportsOffline() {
        // Given
        when(coordinatorClient.getStatus()).thenReturn(Mono.error(new UpstreamUnavailableException("coordinator unavailable: refused")));

        // When
        ResultEnvelope<CoordinatorStatus> envelope = coordinatorStatusService.status(true).block();

        // Then
        assertEquals(ResultStatus.ERROR, envelope.getStatus());
        assertEquals("offline", envelope.getPayload().getState());
    }

    @Test
    void testStatus_UnconfiguredIsPendingConfig() {
        // Given
        properties.setStatusUrl("");

        // When
        ResultEnvelope<CoordinatorStatus> envelope = coordinatorStatusService.status(false).block();

        // Then
        assertEquals(ResultStatus.PENDING_CONFIG, envelope.getStatus());
        verifyNoInteractions(coordinatorClient);
    }
}
