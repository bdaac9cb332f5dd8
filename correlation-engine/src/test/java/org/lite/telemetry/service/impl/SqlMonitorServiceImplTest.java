package org.lite.telemetry.service.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.lite.telemetry.config.CacheProperties;
import org.lite.telemetry.config.CoordinatorProperties;
import org.lite.telemetry.enums.ResultStatus;
import org.lite.telemetry.model.RawRecord;
import org.lite.telemetry.model.SqlMonitorReport;
import org.lite.telemetry.service.CoordinatorClient;
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

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SqlMonitorServiceImplTest {

    @Mock
    private CoordinatorClient coordinatorClient;

    private SqlMonitorServiceImpl sqlMonitorService;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2024-06-11T10:00:00Z"));
        CoordinatorProperties properties = new CoordinatorProperties();
        properties.setChatUrl("http://coordinator:3001");
        sqlMonitorService = new SqlMonitorServiceImpl(coordinatorClient, properties, new SchemaNormalizer(),
                new DerivedMetricsCalculator(),
                new ResilientQueryExecutor(new ResponseCacheManager(new CacheProperties(), clock), clock));
    }

    @Test
    void testMonitor_FlagsHungStatements() {
        // Given
        RawRecord payload = RawRecord.of(Map.of("executions", List.of(
                Map.of("sql_id", "a1", "status", "EXECUTING", "elapsed_time_secs", 900, "rows_processed", 450),
                Map.of("sql_id", "b2", "status", "EXECUTING", "elapsed_time_secs", 100, "rows_processed", 10),
                Map.of("sql_id", "c3", "status", "DONE", "elapsed_time_secs", 0))));
        when(coordinatorClient.sendCommand("show running SQL on PROD")).thenReturn(Mono.just(payload));

        // When & Then
        StepVerifier.create(sqlMonitorService.monitor("PROD", true))
                .assertNext(envelope -> {
                    assertEquals(ResultStatus.CONNECTED, envelope.getStatus());
                    SqlMonitorReport report = envelope.getPayload();
                    assertTrue(report.getExecutions().get(0).isHung());
                    assertEquals(0.5, report.getExecutions().get(0).getVelocity());
                    assertFalse(report.getExecutions().get(1).isHung());
                    assertNull(report.getExecutions().get(2).getVelocity());
                    assertEquals(2, report.getSummary().getTotalExecuting());
                    assertEquals(1, report.getSummary().getTotalHung());
                    assertEquals(500L, report.getSummary().getAvgElapsedTime());
                })
                .verifyComplete();
    }
}
