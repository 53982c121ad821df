package com.z254.noc.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Assembled record of one correlated, decided and dispatched alert group.
 * <p>
 * Built once per group per pipeline run and handed to incident sinks; this
 * service does not persist it itself.
 */
@Value
@Builder
public class IncidentRecord {

    String id;

    AlertGroup correlation;

    /** Service insights keyed by signal source, in first-referenced order */
    @Builder.Default
    Map<String, ServiceInsight> metricInsights = Map.of();

    Decision decision;

    ActionReport actions;

    NotificationReport notifications;

    Instant timestamp;

    public Severity getSeverity() {
        return decision != null ? decision.getSeverity() : Severity.MEDIUM;
    }
}
