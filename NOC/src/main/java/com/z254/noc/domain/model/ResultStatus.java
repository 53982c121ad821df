package com.z254.noc.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome status of a pipeline, correlation pass or analysis.
 */
public enum ResultStatus {
    SUCCESS,
    ERROR;

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }
}
