package com.z254.noc.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Raw samples of one key metric and the anomalies found in them.
 */
@Value
@Builder
public class MetricSeries {

    String metric;

    @Builder.Default
    List<Sample> samples = List.of();

    @Builder.Default
    List<Anomaly> anomalies = List.of();
}
