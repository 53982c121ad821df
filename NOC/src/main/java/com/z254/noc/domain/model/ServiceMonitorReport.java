package com.z254.noc.domain.model;

import com.z254.noc.domain.error.StageError;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Analysis of every key metric of a signal source.
 */
@Value
@Builder
public class ServiceMonitorReport {

    String service;

    /** Metric name to analysis, in catalog order */
    @Builder.Default
    Map<String, MetricAnalysis> metrics = Map.of();

    ResultStatus status;

    StageError error;

    Instant timestamp;
}
