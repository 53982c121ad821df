package com.z254.noc.api.v1;

import com.z254.noc.anomaly.AnomalyAnalyzer;
import com.z254.noc.domain.error.ErrorKind;
import com.z254.noc.domain.error.StageError;
import com.z254.noc.domain.model.MetricAnalysis;
import com.z254.noc.domain.model.ResultStatus;
import com.z254.noc.domain.model.ServiceMonitorReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ServiceMonitorControllerTest {

    @Mock
    private AnomalyAnalyzer anomalyAnalyzer;

    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        webTestClient = WebTestClient.bindToController(new ServiceMonitorController(anomalyAnalyzer)).build();
    }

    @Test
    void analysisParsesTheIsoWindow() {
        when(anomalyAnalyzer.analyze("EC2", "CPUUtilization", Duration.ofMinutes(30)))
                .thenReturn(Mono.just(MetricAnalysis.builder()
                        .service("EC2")
                        .metric("CPUUtilization")
                        .window(Duration.ofMinutes(30))
                        .status(ResultStatus.SUCCESS)
                        .timestamp(Instant.now())
                        .build()));

        webTestClient.get().uri("/api/v1/services/EC2/metrics/CPUUtilization/analysis?window=PT30M")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.metric").isEqualTo("CPUUtilization");
    }

    @Test
    void malformedWindowIsRejected() {
        webTestClient.get().uri("/api/v1/services/EC2/metrics/CPUUtilization/analysis?window=an-hour")
                .exchange()
                .expectStatus().isBadRequest();

        verifyNoInteractions(anomalyAnalyzer);
    }

    @Test
    void invalidAnalysisInputIsBadRequest() {
        when(anomalyAnalyzer.analyze(eq("EC2"), eq("CPUUtilization"), eq(Duration.ofSeconds(-60))))
                .thenReturn(Mono.just(MetricAnalysis.failed("EC2", "CPUUtilization", Duration.ofSeconds(-60),
                        StageError.of(ErrorKind.INVALID_INPUT, "Window must be positive"))));

        webTestClient.get().uri("/api/v1/services/EC2/metrics/CPUUtilization/analysis?window=-PT1M")
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void unknownServiceMonitorIsNotFound() {
        when(anomalyAnalyzer.monitor("DynamoDB")).thenReturn(Mono.just(ServiceMonitorReport.builder()
                .service("DynamoDB")
                .status(ResultStatus.ERROR)
                .error(StageError.of(ErrorKind.INVALID_INPUT, "No key metrics defined for service: DynamoDB"))
                .build()));

        webTestClient.get().uri("/api/v1/services/DynamoDB/monitor")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.status").isEqualTo("error");
    }
}
