package com.z254.noc.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One statistic of a signal over a sample period.
 */
@Value
@Builder
@Jacksonized
public class Sample {

    Instant timestamp;

    double value;

    public static Sample of(Instant timestamp, double value) {
        return new Sample(timestamp, value);
    }
}
