package com.z254.noc.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Result of executing one remediation action.
 */
@Value
@Builder
public class ActionOutcome {

    RemediationAction action;

    ResultStatus status;

    /** Connector or transport execution id, absent on failure */
    String executionId;

    boolean dryRun;

    String error;

    @Builder.Default
    Map<String, Object> details = Map.of();

    public static ActionOutcome failed(RemediationAction action, String error) {
        return ActionOutcome.builder()
                .action(action)
                .status(ResultStatus.ERROR)
                .error(error)
                .build();
    }
}
