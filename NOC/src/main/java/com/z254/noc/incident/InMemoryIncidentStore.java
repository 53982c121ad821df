package com.z254.noc.incident;

import com.z254.noc.client.IncidentSink;
import com.z254.noc.client.IncidentStore;
import com.z254.noc.config.NocProperties;
import com.z254.noc.domain.model.HistoricalIncident;
import com.z254.noc.domain.model.IncidentRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Append-only in-memory incident history.
 * <p>
 * Every processed incident is appended as a sink, so later runs see it as history.
 * Records older than the retention window, or beyond the record limit, are evicted
 * oldest first.
 */
@Slf4j
@Repository
public class InMemoryIncidentStore implements IncidentStore, IncidentSink {

    private final Deque<HistoricalIncident> incidents = new ConcurrentLinkedDeque<>();
    private final NocProperties.Incidents config;

    public InMemoryIncidentStore(NocProperties nocProperties) {
        this.config = nocProperties.getIncidents();
    }

    @Override
    public Mono<List<HistoricalIncident>> recent(Instant since) {
        return Mono.fromCallable(() -> {
            evictExpired();
            return incidents.stream()
                    .filter(incident -> incident.getTimestamp() != null && !incident.getTimestamp().isBefore(since))
                    .toList();
        });
    }

    @Override
    public Mono<Void> publish(IncidentRecord record) {
        return Mono.fromRunnable(() -> append(HistoricalIncident.from(record)));
    }

    @Override
    public String name() {
        return "in-memory-history";
    }

    /**
     * Append a past incident directly.
     */
    public void append(HistoricalIncident incident) {
        incidents.addLast(incident);
        while (incidents.size() > config.getMaxRecords()) {
            incidents.pollFirst();
        }
        log.debug("Recorded incident {} in history, size={}", incident.getId(), incidents.size());
    }

    public int size() {
        return incidents.size();
    }

    // ========== Private Methods ==========

    private void evictExpired() {
        Instant cutoff = Instant.now().minus(config.getRetention());
        incidents.removeIf(incident -> incident.getTimestamp() == null || incident.getTimestamp().isBefore(cutoff));
    }
}
