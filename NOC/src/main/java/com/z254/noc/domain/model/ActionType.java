package com.z254.noc.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of remediation actions a decision can request.
 */
public enum ActionType {
    /** Run a remediation runbook or function against infrastructure */
    REMEDIATE,
    /** Publish a message to a notification channel */
    NOTIFY,
    /** Open a ticket in the ticketing system */
    TICKET,
    /** Missing or unrecognised type */
    UNKNOWN;

    @JsonCreator
    public static ActionType from(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return ActionType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }
}
