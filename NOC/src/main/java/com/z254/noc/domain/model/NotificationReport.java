package com.z254.noc.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcomes of one incident's notification fan-out, in channel order.
 */
@Value
@Builder
public class NotificationReport {

    String incidentId;

    @Builder.Default
    List<NotificationOutcome> notificationResults = List.of();

    public long getFailureCount() {
        return notificationResults.stream().filter(o -> o.getStatus() == ResultStatus.ERROR).count();
    }
}
