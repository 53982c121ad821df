package com.z254.noc.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcomes of every action of one decision, in decision order.
 */
@Value
@Builder
public class ActionReport {

    String decisionId;

    @Builder.Default
    List<ActionOutcome> actionResults = List.of();

    public static ActionReport empty(String decisionId) {
        return ActionReport.builder().decisionId(decisionId).build();
    }

    public long getFailureCount() {
        return actionResults.stream().filter(o -> o.getStatus() == ResultStatus.ERROR).count();
    }
}
