package com.z254.noc.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * An action recommended by the decision service or a remediation rule.
 * <p>
 * The target is opaque to the pipeline: a runbook document, a function name
 * or a notification topic depending on the type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemediationAction {

    @Builder.Default
    private ActionType type = ActionType.UNKNOWN;

    private String target;

    @Builder.Default
    private Map<String, Object> parameters = new HashMap<>();
}
