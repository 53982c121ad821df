package com.z254.noc.domain.model;

import com.z254.noc.domain.error.StageError;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Anomaly analysis of one metric of one signal source.
 * <p>
 * A {@link ResultStatus#SUCCESS} analysis may still carry an {@code error} when the
 * time-series source was unavailable and the analysis ran on no data.
 */
@Value
@Builder(toBuilder = true)
public class MetricAnalysis {

    String service;

    String metric;

    Duration window;

    @Builder.Default
    List<Sample> samples = List.of();

    @Builder.Default
    List<Anomaly> anomalies = List.of();

    /** Qualitative insight from the decision service, empty when unavailable */
    @Builder.Default
    Map<String, Object> insights = Map.of();

    ResultStatus status;

    StageError error;

    Instant timestamp;

    public static MetricAnalysis failed(String service, String metric, Duration window, StageError error) {
        return MetricAnalysis.builder()
                .service(service)
                .metric(metric)
                .window(window)
                .status(ResultStatus.ERROR)
                .error(error)
                .timestamp(Instant.now())
                .build();
    }

    public boolean hasAnomalies() {
        return !anomalies.isEmpty();
    }
}
