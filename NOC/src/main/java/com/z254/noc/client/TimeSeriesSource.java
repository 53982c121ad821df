package com.z254.noc.client;

import com.z254.noc.domain.model.Sample;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Source of metric statistics for a signal source.
 */
public interface TimeSeriesSource {

    /**
     * Samples of {@code metric} over {@code [now - window, now]}, one per {@code period}.
     */
    Mono<List<Sample>> samples(String service, String metric, Duration window, Duration period);
}
