package org.lite.telemetry.service.impl;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.telemetry.config.CoordinatorProperties;
import org.lite.telemetry.exception.ConfigurationMissingException;
import org.lite.telemetry.exception.MalformedPayloadException;
import org.lite.telemetry.exception.UpstreamFailureException;
import org.lite.telemetry.model.CoordinatorStatus;
import org.lite.telemetry.model.RawRecord;
import org.lite.telemetry.service.CoordinatorClient;
import org.lite.telemetry.util.UpstreamErrors;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
@Slf4j
@RequiredArgsConstructor
public class CoordinatorClientImpl implements CoordinatorClient {

    @NonNull
    private final WebClient.Builder webClientBuilder;

    @NonNull
    private final CoordinatorProperties properties;

    @Override
    public Mono<RawRecord> sendCommand(String command) {
        if (!properties.isConfigured()) {
            return Mono.error(new ConfigurationMissingException(CoordinatorProperties.CHAT_URL_SETTING));
        }
        String url = trimSlash(properties.getChatUrl()) + "/chat";
        log.info("Sending coordinator command '{}' to {}", command, url);

        return webClientBuilder.build()
                .post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("message", command))
                .retrieve()
                .onStatus(status -> status.isError(), response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .flatMap(body -> Mono.error(new UpstreamFailureException(url, response.statusCode().value(), body))))
                .bodyToMono(Object.class)
                .timeout(properties.getChatTimeout())
                .map(body -> extractData(url, body))
                .doOnError(error -> log.error("Coordinator command failed at {}: {}", url, error.getMessage()))
                .onErrorMap(error -> UpstreamErrors.translate(url, error));
    }

    @Override
    public Mono<CoordinatorStatus> getStatus() {
        if (!properties.isStatusConfigured()) {
            return Mono.error(new ConfigurationMissingException(CoordinatorProperties.STATUS_URL_SETTING));
        }
        String baseUrl = trimSlash(properties.getStatusUrl());
        WebClient webClient = webClientBuilder.build();

        Mono<Object> status = get(webClient, baseUrl + "/status");
        // Tool listing is best effort; a running coordinator without it still reports running.
        Mono<List<RawRecord>> tools = get(webClient, baseUrl + "/tools?limit=100")
                .map(body -> RawRecord.of(body).records("tools"))
                .onErrorResume(error -> {
                    log.warn("Coordinator tool listing unavailable: {}", error.getMessage());
                    return Mono.just(List.of());
                });

        return Mono.zip(status, tools)
                .map(tuple -> {
                    Map<String, Boolean> servers = new LinkedHashMap<>();
                    Set<String> names = new LinkedHashSet<>();
                    for (RawRecord tool : tuple.getT2()) {
                        String server = tool.optionalText("server");
                        if (server != null) {
                            names.add(server);
                        }
                    }
                    names.forEach(name -> servers.put(name, Boolean.TRUE));
                    return new CoordinatorStatus("running", servers, tuple.getT2().size());
                })
                .onErrorMap(error -> UpstreamErrors.translate(baseUrl, error));
    }

    private Mono<Object> get(WebClient webClient, String url) {
        return webClient.get()
                .uri(url)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .onStatus(status -> status.isError(), response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .flatMap(body -> Mono.error(new UpstreamFailureException(url, response.statusCode().value(), body))))
                .bodyToMono(Object.class)
                .timeout(properties.getStatusTimeout());
    }

    /**
     * The answer carries its data under {@code data}, {@code result} or at the top level. A
     * plain-text answer becomes {@code {message: text}}; the top-level message is kept next
     * to nested data so callers can still read it.
     */
    static RawRecord extractData(String url, Object body) {
        if (!(body instanceof Map<?, ?>)) {
            throw new MalformedPayloadException(url + " did not return a JSON object");
        }
        RawRecord root = RawRecord.of(body);
        Object data = root.asMap().get("data");
        if (data == null) {
            data = root.asMap().get("result");
        }
        if (data == null) {
            return root;
        }
        if (data instanceof String text) {
            return RawRecord.of(Map.of("message", text));
        }
        if (!(data instanceof Map<?, ?>)) {
            throw new MalformedPayloadException(url + " returned data that is not an object");
        }
        RawRecord nested = RawRecord.of(data);
        String message = root.optionalText("response", "message");
        if (message == null || nested.has("message")) {
            return nested;
        }
        Map<String, Object> merged = new LinkedHashMap<>(nested.asMap());
        merged.put("message", message);
        return RawRecord.of(merged);
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
