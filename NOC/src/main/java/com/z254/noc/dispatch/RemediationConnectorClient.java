package com.z254.noc.dispatch;

import com.z254.noc.config.NocProperties;
import com.z254.noc.domain.model.ActionType;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Client for the remediation connector.
 * <p>
 * Forwards remediation and ticket actions:
 * <ul>
 *     <li>HTTP execution via the connector REST API</li>
 *     <li>Dry-run simulation when the request asks for it</li>
 * </ul>
 */
@Slf4j
@Component
public class RemediationConnectorClient {

    private final WebClient webClient;

    public RemediationConnectorClient(WebClient.Builder webClientBuilder,
                                      NocProperties nocProperties) {
        this.webClient = webClientBuilder
                .baseUrl(nocProperties.getRemediation().getUrl())
                .build();
    }

    /**
     * Execute an action via the connector.
     */
    @CircuitBreaker(name = "remediation-client", fallbackMethod = "executeFallback")
    @Retry(name = "remediation-client")
    public Mono<ConnectorResult> execute(ConnectorRequest request) {
        log.info("Executing action via remediation connector: decisionId={}, type={}, target={}",
                request.getDecisionId(), request.getActionType(), request.getTarget());

        if (request.isDryRun()) {
            return executeDryRun(request);
        }

        return webClient.post()
                .uri(request.getActionType() == ActionType.TICKET ? "/api/v1/tickets" : "/api/v1/actions")
                .bodyValue(request)
                .retrieve()
                .bodyToMono(ConnectorResponse.class)
                .map(this::toResult)
                .doOnSuccess(result ->
                        log.info("Connector action result: decisionId={}, executionId={}, success={}",
                                request.getDecisionId(), result.getExecutionId(), result.isSuccess()))
                .doOnError(error ->
                        log.error("Connector action failed: decisionId={}, error={}",
                                request.getDecisionId(), error.getMessage()));
    }

    /**
     * Fallback when the connector is unavailable.
     */
    public Mono<ConnectorResult> executeFallback(ConnectorRequest request, Throwable throwable) {
        log.warn("Remediation connector unavailable for decision: {}, error: {}",
                request.getDecisionId(), throwable.getMessage());

        return Mono.just(ConnectorResult.builder()
                .success(false)
                .errorMessage("Remediation connector unavailable: " + throwable.getMessage())
                .executedAt(Instant.now())
                .build());
    }

    // ========== Private Methods ==========

    private Mono<ConnectorResult> executeDryRun(ConnectorRequest request) {
        log.info("DRY_RUN: Would execute {} on {}", request.getActionType(), request.getTarget());

        return Mono.just(ConnectorResult.builder()
                .success(true)
                .executionId("DRY-RUN-" + UUID.randomUUID().toString().substring(0, 8))
                .message("Dry run completed successfully")
                .executedAt(Instant.now())
                .dryRun(true)
                .details(Map.of(
                        "action", request.getActionType().toJson(),
                        "target", request.getTarget(),
                        "mode", "DRY_RUN"
                ))
                .build());
    }

    private ConnectorResult toResult(ConnectorResponse response) {
        return ConnectorResult.builder()
                .success("COMPLETED".equals(response.getStatus()) ||
                         "SUCCESS".equals(response.getStatus()))
                .executionId(response.getExecutionId())
                .message(response.getMessage())
                .errorMessage(response.getError())
                .executedAt(Instant.now())
                .details(response.getDetails() != null ? response.getDetails() : Map.of())
                .build();
    }

    // ========== Data Classes ==========

    @Data
    @Builder
    public static class ConnectorRequest {
        private String decisionId;
        private ActionType actionType;
        private String target;
        @Builder.Default
        private Map<String, Object> parameters = new HashMap<>();
        private boolean dryRun;
        private String idempotencyKey;
    }

    @Data
    @Builder
    public static class ConnectorResult {
        private boolean success;
        private String executionId;
        private String message;
        private String errorMessage;
        private Instant executedAt;
        private boolean dryRun;
        @Builder.Default
        private Map<String, Object> details = new HashMap<>();
    }

    @Data
    static class ConnectorResponse {
        private String executionId;
        private String status;
        private String message;
        private String error;
        private Map<String, Object> details;
    }
}
