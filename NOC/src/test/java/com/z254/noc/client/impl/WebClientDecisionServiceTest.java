package com.z254.noc.client.impl;

import com.z254.noc.config.NocProperties;
import com.z254.noc.domain.model.ActionType;
import com.z254.noc.domain.model.Decision;
import com.z254.noc.domain.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link WebClientDecisionService} response mapping.
 */
class WebClientDecisionServiceTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    private WebClientDecisionService serviceReturning(HttpStatus status, String body) {
        WebClient.Builder builder = WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                });
        return new WebClientDecisionService(builder, new NocProperties());
    }

    @Test
    @DisplayName("Should map a complete decision response")
    void shouldMapDecision() {
        WebClientDecisionService service = serviceReturning(HttpStatus.OK, """
                {"id": "D-7", "root_cause": "disk full", "confidence": 0.9, "severity": "high",
                 "actions": [{"type": "remediate", "target": "cleanup-runbook"}]}
                """);

        StepVerifier.create(service.decide(Map.of("alerts", List.of()), List.of()))
                .assertNext(decision -> {
                    assertThat(decision.getId()).isEqualTo("D-7");
                    assertThat(decision.getRootCause()).isEqualTo("disk full");
                    assertThat(decision.getConfidence()).isEqualTo(0.9);
                    assertThat(decision.getSeverity()).isEqualTo(Severity.HIGH);
                    assertThat(decision.getActions()).singleElement()
                            .satisfies(action -> {
                                assertThat(action.getType()).isEqualTo(ActionType.REMEDIATE);
                                assertThat(action.getTarget()).isEqualTo("cleanup-runbook");
                            });
                })
                .verifyComplete();

        assertThat(requests.get(0).url().getPath()).isEqualTo("/api/v1/decisions");
    }

    @Test
    @DisplayName("Should default missing fields and clamp confidence")
    void shouldDefaultMissingFields() {
        WebClientDecisionService service = serviceReturning(HttpStatus.OK, "{\"confidence\": 1.7}");

        StepVerifier.create(service.decide(Map.of(), null))
                .assertNext(decision -> {
                    assertThat(decision.idOrPlaceholder()).isEqualTo(Decision.UNKNOWN_ID);
                    assertThat(decision.getRootCause()).isEqualTo(Decision.UNKNOWN_ROOT_CAUSE);
                    assertThat(decision.getConfidence()).isEqualTo(1.0);
                    assertThat(decision.getSeverity()).isEqualTo(Severity.MEDIUM);
                    assertThat(decision.getActions()).isEmpty();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should surface server errors")
    void shouldFailOnServerError() {
        WebClientDecisionService service = serviceReturning(HttpStatus.INTERNAL_SERVER_ERROR, "{}");

        StepVerifier.create(service.decide(Map.of(), List.of()))
                .expectError()
                .verify();
    }

    @Test
    @DisplayName("Should return the insight map")
    void shouldReturnInsights() {
        WebClientDecisionService service = serviceReturning(HttpStatus.OK, "{\"summary\": \"CPU spike\"}");

        StepVerifier.create(service.analyze(Map.of("service", "EC2")))
                .assertNext(insight -> assertThat(insight).containsEntry("summary", "CPU spike"))
                .verifyComplete();

        assertThat(requests.get(0).url().getPath()).isEqualTo("/api/v1/insights");
    }
}
