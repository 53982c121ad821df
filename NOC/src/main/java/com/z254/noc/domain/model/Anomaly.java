package com.z254.noc.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A sample flagged as statistically extreme within its window.
 */
@Value
@Builder
public class Anomaly {

    Instant timestamp;

    double value;

    /** Distance from the window mean in standard deviations */
    double deviation;

    /** Absolute threshold the deviation was compared against */
    double threshold;
}
