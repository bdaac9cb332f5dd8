package org.lite.telemetry.service.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.lite.telemetry.config.CacheProperties;
import org.lite.telemetry.config.CoordinatorProperties;
import org.lite.telemetry.enums.ResultStatus;
import org.lite.telemetry.exception.UpstreamUnavailableException;
import org.lite.telemetry.model.BlockingReport;
import org.lite.telemetry.model.BlockingSession;
import org.lite.telemetry.model.RawRecord;
import org.lite.telemetry.service.CoordinatorClient;
import org.lite.telemetry.service.DependencyTreeBuilder;
import org.lite.telemetry.service.DerivedMetricsCalculator;
import org.lite.telemetry.service.ResilientQueryExecutor;
import org.lite.telemetry.service.ResponseCacheManager;
import org.lite.telemetry.service.SchemaNormalizer;
import org.lite.telemetry.support.MutableClock;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BlockingAnalysisServiceImplTest {

    @Mock
    private CoordinatorClient coordinatorClient;

    private CoordinatorProperties properties;
    private BlockingAnalysisServiceImpl blockingAnalysisService;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2024-06-11T10:00:00Z"));
        properties = new CoordinatorProperties();
        properties.setChatUrl("http://coordinator:3001");
        blockingAnalysisService = new BlockingAnalysisServiceImpl(coordinatorClient, properties, new SchemaNormalizer(),
                new DependencyTreeBuilder(), new DerivedMetricsCalculator(),
                new ResilientQueryExecutor(new ResponseCacheManager(new CacheProperties(), clock), clock));
    }

    @Test
    void testAnalyze_BuildsTreeAndSummary() {
        // Given
        RawRecord payload = RawRecord.of(Map.of(
                "root_blockers", List.of(Map.of("sid", 100, "username", "BATCH")),
                "blocked_sessions", List.of(
                        Map.of("sid", 200, "username", "APP", "blocking_session", 100, "seconds_in_wait", 90),
                        Map.of("sid", 300, "username", "REPORT", "blocking_session", 200, "seconds_in_wait", 30))));
        when(coordinatorClient.sendCommand("check blocking sessions on PROD")).thenReturn(Mono.just(payload));

        // When & Then
        StepVerifier.create(blockingAnalysisService.analyze("PROD", false))
                .assertNext(envelope -> {
                    assertEquals(ResultStatus.CONNECTED, envelope.getStatus());
                    BlockingReport report = envelope.getPayload();
                    assertEquals("PROD", report.getDatabase());
                    assertEquals(1, report.getTree().size());
                    assertEquals(3, report.getSessions().size());
                    assertEquals(2, report.getSessions().get(2).getLevel());
                    assertEquals(2, report.getSummary().getTotalBlocked());
                    assertEquals(1, report.getSummary().getRootBlockers());
                    assertEquals(90L, report.getSummary().getMaxWaitTime());
                    assertEquals(List.of("APP", "REPORT"), report.getSummary().getAffectedUsers());
                })
                .verifyComplete();
    }

    @Test
    void testAnalyze_HealthyAnswerIsEmptyConnectedReport() {
        // Given
        when(coordinatorClient.sendCommand(anyString()))
                .thenReturn(Mono.just(RawRecord.of(Map.of("message", "No blocking sessions found. Database is healthy."))));

        // When & Then
        StepVerifier.create(blockingAnalysisService.analyze(null, false))
                .assertNext(envelope -> {
                    assertEquals(ResultStatus.CONNECTED, envelope.getStatus());
                    assertEquals(properties.getDefaultDatabase(), envelope.getPayload().getDatabase());
                    assertTrue(envelope.getPayload().getSessions().isEmpty());
                    assertEquals(0, envelope.getPayload().getSummary().getTotalBlocked());
                })
                .verifyComplete();
    }

    @Test
    void testAnalyze_ThreeLevelChainFromAliasedRecords() {
        // Given
        RawRecord payload = RawRecord.of(Map.of("sessions", List.of(
                Map.of("sid", 156, "blockedBy", 287, "wait", 212),
                Map.of("sid", 145, "wait", 847),
                Map.of("sid", 287, "blockedBy", 145, "wait", 623))));
        when(coordinatorClient.sendCommand(anyString())).thenReturn(Mono.just(payload));

        // When & Then
        StepVerifier.create(blockingAnalysisService.analyze("PROD", false))
                .assertNext(envelope -> {
                    assertEquals(ResultStatus.CONNECTED, envelope.getStatus());
                    BlockingReport report = envelope.getPayload();
                    assertEquals(1, report.getTree().size());
                    assertEquals(145L, report.getTree().get(0).getSession().getSid());
                    assertEquals(List.of(145L, 287L, 156L), report.getSessions().stream()
                            .map(BlockingSession::getSid).collect(Collectors.toList()));
                    assertEquals(List.of(0, 1, 2), report.getSessions().stream()
                            .map(BlockingSession::getLevel).collect(Collectors.toList()));
                    assertEquals(2, report.getSummary().getTotalBlocked());
                    assertEquals(1, report.getSummary().getRootBlockers());
                    assertEquals(847L, report.getSummary().getMaxWaitTime());
                })
                .verifyComplete();
    }

    @Test
    void testAnalyze_UnrecognizedAnswerIsErrorAndNotCached() {
        // Given
        when(coordinatorClient.sendCommand(anyString()))
                .thenReturn(Mono.just(RawRecord.of(Map.of("message", "ORA-12541: TNS:no listener"))));

        // When & Then
        StepVerifier.create(blockingAnalysisService.analyze("PROD", false))
                .assertNext(envelope -> {
                    assertEquals(ResultStatus.ERROR, envelope.getStatus());
                    assertNull(envelope.getCached());
                    assertTrue(envelope.getPayload().getSessions().isEmpty());
                })
                .verifyComplete();
        StepVerifier.create(blockingAnalysisService.analyze("PROD", false))
                .assertNext(envelope -> assertEquals(ResultStatus.ERROR, envelope.getStatus()))
                .verifyComplete();
        verify(coordinatorClient, times(2)).sendCommand(anyString());
    }

    @Test
    void testAnalyze_SecondCallServedFromCache() {
        // Given
        when(coordinatorClient.sendCommand(anyString())).thenReturn(Mono.just(RawRecord.of(Map.of("sessions", List.of()))));

        // When
        blockingAnalysisService.analyze("PROD", false).block();
        Boolean cached = blockingAnalysisService.analyze("PROD", false).block().getCached();

        // Then
        assertEquals(Boolean.TRUE, cached);
        verify(coordinatorClient, times(1)).sendCommand(anyString());
    }

    @Test
    void testAnalyze_UnreachableCoordinatorIsErrorWithEmptyReport() {
        // Given
        when(coordinatorClient.sendCommand(anyString()))
                .thenReturn(Mono.error(new UpstreamUnavailableException("coordinator unavailable: Request timeout")));

        // When & Then
        StepVerifier.create(blockingAnalysisService.analyze("PROD", false))
                .assertNext(envelope -> {
                    assertEquals(ResultStatus.ERROR, envelope.getStatus());
                    assertTrue(envelope.getPayload().getTree().isEmpty());
                })
                .verifyComplete();
    }

    @Test
    void testAnalyze_UnconfiguredCoordinatorIsPendingConfig() {
        // Given
        properties.setChatUrl(null);

        // When & Then
        StepVerifier.create(blockingAnalysisService.analyze("PROD", false))
                .assertNext(envelope -> assertEquals(ResultStatus.PENDING_CONFIG, envelope.getStatus()))
                .verifyComplete();
        verifyNoInteractions(coordinatorClient);
    }
}
