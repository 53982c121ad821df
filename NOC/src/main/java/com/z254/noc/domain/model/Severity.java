package com.z254.noc.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Incident severity as reported by the decision service.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Parse a severity label. Absent or unrecognised labels are MEDIUM.
     */
    @JsonCreator
    public static Severity from(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        try {
            return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return MEDIUM;
        }
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }
}
