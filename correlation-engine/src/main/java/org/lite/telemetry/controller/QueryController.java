package org.lite.telemetry.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.telemetry.dto.QueryRequest;
import org.lite.telemetry.dto.ResultEnvelope;
import org.lite.telemetry.exception.InvalidQueryException;
import org.lite.telemetry.service.QueryDispatcher;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.stream.Collectors;

/**
 * Single entry point taking a {@link QueryRequest} for any query kind.
 */
@RestController
@RequestMapping("/api/query")
@RequiredArgsConstructor
@Slf4j
public class QueryController {

    private final QueryDispatcher queryDispatcher;
    private final Clock clock;

    @PostMapping
    public Mono<ResponseEntity<ResultEnvelope<?>>> query(@Valid @RequestBody QueryRequest request) {
        return queryDispatcher.dispatch(request)
                .<ResponseEntity<ResultEnvelope<?>>>map(ResponseEntity::ok)
                .onErrorResume(InvalidQueryException.class, error -> Mono.just(badRequest(error.getMessage())));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ResultEnvelope<?>> handleValidation(WebExchangeBindException error) {
        String message = error.getFieldErrors().stream()
                .map(field -> field.getField() + " " + field.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Rejected query: {}", message);
        return badRequest(message);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ResultEnvelope<?>> handleUnreadable(ServerWebInputException error) {
        log.warn("Rejected unreadable query: {}", error.getReason());
        return badRequest(error.getReason() != null ? error.getReason() : "Malformed query");
    }

    private ResponseEntity<ResultEnvelope<?>> badRequest(String message) {
        return ResponseEntity.badRequest().body(ResultEnvelope.rejected(message, clock.instant().toString()));
    }
}
