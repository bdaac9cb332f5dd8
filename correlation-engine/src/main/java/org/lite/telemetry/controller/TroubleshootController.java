package org.lite.telemetry.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.telemetry.dto.ResultEnvelope;
import org.lite.telemetry.model.BlockingReport;
import org.lite.telemetry.model.ParallelismReport;
import org.lite.telemetry.model.SqlMonitorReport;
import org.lite.telemetry.service.BlockingAnalysisService;
import org.lite.telemetry.service.ParallelExecutionService;
import org.lite.telemetry.service.SqlMonitorService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Database troubleshooting views derived from coordinator agent answers.
 */
@RestController
@RequestMapping("/api/troubleshoot/oracle")
@RequiredArgsConstructor
@Slf4j
public class TroubleshootController {

    private final BlockingAnalysisService blockingAnalysisService;
    private final SqlMonitorService sqlMonitorService;
    private final ParallelExecutionService parallelExecutionService;

    /**
     * Blocking chains as a forest plus summary.
     *
     * @param database target database, the configured default when absent
     */
    @GetMapping("/blocking")
    public Mono<ResponseEntity<ResultEnvelope<BlockingReport>>> blocking(
            @RequestParam(required = false) String database,
            @RequestParam(defaultValue = "false") boolean skipCache) {
        return blockingAnalysisService.analyze(database, skipCache)
                .doOnSuccess(envelope -> log.info("Blocking analysis for {} finished with status {}",
                        database, envelope.getStatus().getValue()))
                .map(ResponseEntity::ok);
    }

    @GetMapping("/sqlmon")
    public Mono<ResponseEntity<ResultEnvelope<SqlMonitorReport>>> sqlMonitor(
            @RequestParam(required = false) String database,
            @RequestParam(defaultValue = "false") boolean skipCache) {
        return sqlMonitorService.monitor(database, skipCache).map(ResponseEntity::ok);
    }

    @GetMapping("/px")
    public Mono<ResponseEntity<ResultEnvelope<ParallelismReport>>> parallelExecution(
            @RequestParam(required = false) String database,
            @RequestParam(defaultValue = "false") boolean skipCache) {
        return parallelExecutionService.analyze(database, skipCache).map(ResponseEntity::ok);
    }
}
