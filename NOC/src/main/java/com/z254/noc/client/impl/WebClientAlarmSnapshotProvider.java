package com.z254.noc.client.impl;

import com.z254.noc.client.AlarmSnapshotProvider;
import com.z254.noc.config.NocProperties;
import com.z254.noc.domain.error.NocException;
import com.z254.noc.domain.model.Alarm;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * WebClient-based implementation of AlarmSnapshotProvider.
 * Reads firing alarms from the monitoring gateway.
 */
@Slf4j
@Component
public class WebClientAlarmSnapshotProvider implements AlarmSnapshotProvider {

    private final WebClient webClient;
    private final NocProperties.Monitoring config;

    public WebClientAlarmSnapshotProvider(WebClient.Builder webClientBuilder,
                                          NocProperties nocProperties) {
        this.config = nocProperties.getMonitoring();
        this.webClient = webClientBuilder
                .baseUrl(config.getUrl())
                .build();
    }

    @Override
    @CircuitBreaker(name = "monitoring-client", fallbackMethod = "listFiringFallback")
    @Retry(name = "monitoring-client")
    public Mono<List<Alarm>> listFiring() {
        return webClient.get()
                .uri(builder -> builder
                        .path("/api/v1/alarms")
                        .queryParam("state", "ALARM")
                        .build())
                .retrieve()
                .bodyToMono(AlarmListResponse.class)
                .timeout(config.getReadTimeout())
                .map(response -> response.getAlarms() != null ? response.getAlarms() : List.<Alarm>of())
                .doOnSuccess(alarms -> log.debug("Fetched {} firing alarms", alarms.size()))
                .doOnError(error -> log.error("Failed to get current alarms: {}", error.getMessage()));
    }

    /**
     * Fallback when the monitoring gateway is unavailable.
     */
    public Mono<List<Alarm>> listFiringFallback(Throwable throwable) {
        log.warn("Monitoring gateway unavailable for alarm snapshot: {}", throwable.getMessage());
        return Mono.error(NocException.upstreamUnavailable(
                "Monitoring gateway unavailable: " + throwable.getMessage(), throwable));
    }

    // ========== Data Classes ==========

    @Data
    static class AlarmListResponse {
        private List<Alarm> alarms = new ArrayList<>();
    }
}
