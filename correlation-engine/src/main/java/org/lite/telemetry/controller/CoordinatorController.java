package org.lite.telemetry.controller;

import lombok.RequiredArgsConstructor;
import org.lite.telemetry.dto.ResultEnvelope;
import org.lite.telemetry.model.CoordinatorStatus;
import org.lite.telemetry.service.CoordinatorStatusService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/coordinator")
@RequiredArgsConstructor
public class CoordinatorController {

    private final CoordinatorStatusService coordinatorStatusService;

    @GetMapping("/status")
    public Mono<ResponseEntity<ResultEnvelope<CoordinatorStatus>>> status(
            @RequestParam(defaultValue = "false") boolean skipCache) {
        return coordinatorStatusService.status(skipCache).map(ResponseEntity::ok);
    }
}
