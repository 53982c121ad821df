package com.z254.noc.domain.model;

import com.z254.noc.domain.error.StageError;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Metric evidence for one signal source, scoped to one pipeline run.
 */
@Value
@Builder
public class ServiceInsight {

    String service;

    @Builder.Default
    List<MetricSeries> metrics = List.of();

    /** Qualitative analysis from the decision service, empty when unavailable */
    @Builder.Default
    Map<String, Object> analysis = Map.of();

    StageError error;

    Instant timestamp;

    public int getAnomalyCount() {
        return metrics.stream().mapToInt(series -> series.getAnomalies().size()).sum();
    }
}
