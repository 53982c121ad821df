package com.z254.noc.client;

import com.z254.noc.domain.model.HistoricalIncident;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Append-only record of past incidents.
 */
public interface IncidentStore {

    /**
     * Incidents recorded at or after {@code since}, oldest first.
     */
    Mono<List<HistoricalIncident>> recent(Instant since);
}
