package com.z254.noc.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Summary of a past incident as returned by the incident store.
 */
@Value
@Builder
@Jacksonized
public class HistoricalIncident {

    String id;

    Instant timestamp;

    String rootCause;

    Severity severity;

    @Builder.Default
    List<String> alarmNames = List.of();

    /** Decision id of the incident, if any */
    String decisionId;

    public static HistoricalIncident from(IncidentRecord record) {
        return HistoricalIncident.builder()
                .id(record.getId())
                .timestamp(record.getTimestamp())
                .rootCause(record.getDecision() != null ? record.getDecision().getRootCause() : null)
                .severity(record.getDecision() != null ? record.getDecision().getSeverity() : null)
                .alarmNames(record.getCorrelation().getAlarms().stream()
                        .map(Alarm::getAlarmName)
                        .toList())
                .decisionId(record.getDecision() != null ? record.getDecision().idOrPlaceholder() : null)
                .build();
    }
}
