package com.z254.noc.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * A firing monitoring alarm as observed in one snapshot.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Alarm {

    /** Alarm identifier */
    String alarmName;

    /** Namespace the metric belongs to, e.g. {@code AWS/EC2} */
    String namespace;

    String metricName;

    /** Alarm state, normally {@code ALARM} */
    String state;

    /** Last state transition; may be absent */
    Instant stateUpdatedTimestamp;

    /** Dimensional tags */
    @Builder.Default
    Map<String, String> dimensions = Map.of();

    String description;

    /**
     * State transition time used for ordering. Alarms without one sort first.
     */
    @JsonIgnore
    public Instant getEffectiveTimestamp() {
        return stateUpdatedTimestamp != null ? stateUpdatedTimestamp : Instant.MIN;
    }

    /**
     * Value of a dimension, {@code null} when absent.
     */
    public String dimension(String key) {
        return dimensions != null ? dimensions.get(key) : null;
    }

    /**
     * Signal source of this alarm: the namespace with the vendor prefix removed.
     *
     * @return the source, or {@code null} when the alarm carries no namespace
     */
    public String signalSource(String vendorPrefix) {
        if (namespace == null) {
            return null;
        }
        if (vendorPrefix != null && !vendorPrefix.isEmpty()) {
            return namespace.replace(vendorPrefix, "");
        }
        return namespace;
    }
}
