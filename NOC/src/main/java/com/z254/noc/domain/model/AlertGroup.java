package com.z254.noc.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.z254.noc.domain.error.StageError;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Correlated cluster of alarms believed to share a root cause.
 * <p>
 * Membership is fixed at creation; groups are never merged or split afterwards.
 */
@Value
@Builder(toBuilder = true)
public class AlertGroup {

    public static final String UNKNOWN_ROOT_CAUSE = "unknown";

    /** Members in state-transition order, never empty */
    @Singular
    List<Alarm> alarms;

    @Builder.Default
    String rootCause = UNKNOWN_ROOT_CAUSE;

    /** Confidence in [0,1] */
    double confidence;

    @Singular
    List<RemediationAction> recommendedActions;

    /** Set when history or decision lookup failed for this group */
    StageError error;

    /**
     * A group whose analysis failed: root cause unknown, zero confidence, no actions.
     */
    public static AlertGroup degraded(List<Alarm> alarms, StageError error) {
        return AlertGroup.builder()
                .alarms(alarms)
                .rootCause(UNKNOWN_ROOT_CAUSE)
                .confidence(0.0)
                .error(error)
                .build();
    }

    public String getRootCause() {
        return rootCause != null ? rootCause : UNKNOWN_ROOT_CAUSE;
    }

    @JsonIgnore
    public boolean isDegraded() {
        return error != null;
    }

    public int size() {
        return alarms.size();
    }
}
