package com.z254.noc.client.impl;

import com.z254.noc.client.TimeSeriesSource;
import com.z254.noc.config.NocProperties;
import com.z254.noc.domain.error.NocException;
import com.z254.noc.domain.model.Sample;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * WebClient-based implementation of TimeSeriesSource.
 * <p>
 * Requests the {@code Average} statistic of a metric from the monitoring gateway. The
 * signal source is turned back into a namespace by adding the vendor prefix.
 */
@Slf4j
@Component
public class WebClientTimeSeriesSource implements TimeSeriesSource {

    private static final String STATISTIC = "Average";

    private final WebClient webClient;
    private final NocProperties nocProperties;

    public WebClientTimeSeriesSource(WebClient.Builder webClientBuilder,
                                     NocProperties nocProperties) {
        this.nocProperties = nocProperties;
        this.webClient = webClientBuilder
                .baseUrl(nocProperties.getMonitoring().getUrl())
                .build();
    }

    @Override
    @CircuitBreaker(name = "monitoring-client", fallbackMethod = "samplesFallback")
    @Retry(name = "monitoring-client")
    public Mono<List<Sample>> samples(String service, String metric, Duration window, Duration period) {
        Instant end = Instant.now();
        Instant start = end.minus(window);
        String namespace = nocProperties.getAnalysis().getNamespacePrefix() + service;

        return webClient.get()
                .uri(builder -> builder
                        .path("/api/v1/metrics/statistics")
                        .queryParam("namespace", namespace)
                        .queryParam("metricName", metric)
                        .queryParam("startTime", start.toString())
                        .queryParam("endTime", end.toString())
                        .queryParam("period", period.toSeconds())
                        .queryParam("statistic", STATISTIC)
                        .build())
                .retrieve()
                .bodyToMono(StatisticsResponse.class)
                .timeout(nocProperties.getMonitoring().getReadTimeout())
                .map(this::toSamples)
                .doOnError(error -> log.error("Error getting metric data for {}/{}: {}",
                        service, metric, error.getMessage()));
    }

    /**
     * Fallback when the monitoring gateway is unavailable.
     */
    public Mono<List<Sample>> samplesFallback(String service, String metric, Duration window,
                                              Duration period, Throwable throwable) {
        log.warn("Monitoring gateway unavailable for {}/{}: {}", service, metric, throwable.getMessage());
        return Mono.error(NocException.upstreamUnavailable(
                "Metric statistics unavailable for " + service + "/" + metric, throwable));
    }

    // ========== Private Methods ==========

    private List<Sample> toSamples(StatisticsResponse response) {
        if (response.getDatapoints() == null) {
            return List.of();
        }
        // datapoints arrive unordered
        return response.getDatapoints().stream()
                .filter(Objects::nonNull)
                .filter(point -> point.getAverage() != null)
                .map(point -> Sample.of(point.getTimestamp(), point.getAverage()))
                .sorted(Comparator.comparing(Sample::getTimestamp, Comparator.nullsFirst(Comparator.naturalOrder())))
                .toList();
    }

    // ========== Data Classes ==========

    @Data
    static class StatisticsResponse {
        private String label;
        private List<Datapoint> datapoints = new ArrayList<>();
    }

    @Data
    static class Datapoint {
        private Instant timestamp;
        private Double average;
        private String unit;
    }
}
