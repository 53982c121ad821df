package com.z254.noc.client.impl;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.z254.noc.client.DecisionService;
import com.z254.noc.config.NocProperties;
import com.z254.noc.domain.error.NocException;
import com.z254.noc.domain.model.Decision;
import com.z254.noc.domain.model.RemediationAction;
import com.z254.noc.domain.model.RemediationRule;
import com.z254.noc.domain.model.Severity;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * WebClient-based implementation of DecisionService.
 * <p>
 * The service is advisory. Missing response fields are defaulted here; transport
 * failures surface as {@link NocException} with kind {@code DECISION_UNAVAILABLE}.
 */
@Slf4j
@Component
public class WebClientDecisionService implements DecisionService {

    private static final ParameterizedTypeReference<Map<String, Object>> MAP_TYPE =
            new ParameterizedTypeReference<>() {
            };

    private final WebClient webClient;
    private final NocProperties.Decision config;

    public WebClientDecisionService(WebClient.Builder webClientBuilder,
                                    NocProperties nocProperties) {
        this.config = nocProperties.getDecision();
        this.webClient = webClientBuilder
                .baseUrl(config.getUrl())
                .build();
    }

    @Override
    @CircuitBreaker(name = "decision-client", fallbackMethod = "decideFallback")
    @Retry(name = "decision-client")
    public Mono<Decision> decide(Map<String, Object> context, List<RemediationRule> rules) {
        DecisionRequest request = DecisionRequest.builder()
                .context(context)
                .rules(rules != null ? rules : List.of())
                .build();

        return webClient.post()
                .uri("/api/v1/decisions")
                .bodyValue(request)
                .retrieve()
                .bodyToMono(DecisionResponse.class)
                .timeout(config.getReadTimeout())
                .map(this::toDecision)
                .doOnSuccess(decision -> log.info("Decision received: id={}, rootCause={}, confidence={}",
                        decision.getId(), decision.getRootCause(), decision.getConfidence()))
                .doOnError(error -> log.error("Decision request failed: {}", error.getMessage()));
    }

    /**
     * Fallback when the decision service is unavailable.
     */
    public Mono<Decision> decideFallback(Map<String, Object> context, List<RemediationRule> rules,
                                         Throwable throwable) {
        log.warn("Decision service unavailable: {}", throwable.getMessage());
        return Mono.error(NocException.decisionUnavailable(
                "Decision service unavailable: " + throwable.getMessage(), throwable));
    }

    @Override
    @CircuitBreaker(name = "decision-client", fallbackMethod = "analyzeFallback")
    public Mono<Map<String, Object>> analyze(Map<String, Object> context) {
        return webClient.post()
                .uri("/api/v1/insights")
                .bodyValue(context)
                .retrieve()
                .bodyToMono(MAP_TYPE)
                .timeout(config.getReadTimeout())
                .doOnError(error -> log.error("Insight request failed: {}", error.getMessage()));
    }

    /**
     * Fallback for insight requests.
     */
    public Mono<Map<String, Object>> analyzeFallback(Map<String, Object> context, Throwable throwable) {
        log.warn("Decision service unavailable for insight: {}", throwable.getMessage());
        return Mono.error(NocException.decisionUnavailable(
                "Decision service unavailable: " + throwable.getMessage(), throwable));
    }

    // ========== Private Methods ==========

    private Decision toDecision(DecisionResponse response) {
        return Decision.builder()
                .id(response.getId())
                .rootCause(response.getRootCause() != null ? response.getRootCause() : Decision.UNKNOWN_ROOT_CAUSE)
                .confidence(clamp(response.getConfidence()))
                .severity(Severity.from(response.getSeverity()))
                .actions(response.getActions() != null
                        ? response.getActions().stream().filter(Objects::nonNull).toList()
                        : List.of())
                .details(response.getDetails() != null ? response.getDetails() : Map.of())
                .build();
    }

    private static double clamp(Double confidence) {
        if (confidence == null || confidence.isNaN()) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    // ========== Data Classes ==========

    @Data
    @Builder
    static class DecisionRequest {
        private Map<String, Object> context;
        private List<RemediationRule> rules;
    }

    @Data
    static class DecisionResponse {
        private String id;
        @JsonAlias("root_cause")
        private String rootCause;
        private Double confidence;
        private String severity;
        private List<RemediationAction> actions;
        private Map<String, Object> details = new HashMap<>();
    }
}
