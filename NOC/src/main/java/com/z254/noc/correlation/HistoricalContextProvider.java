package com.z254.noc.correlation;

import com.z254.noc.client.IncidentStore;
import com.z254.noc.config.NocProperties;
import com.z254.noc.domain.error.ErrorKind;
import com.z254.noc.domain.error.StageError;
import com.z254.noc.domain.model.HistoricalContext;
import com.z254.noc.observability.NocMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Looks up recent incidents to give the decision service history for an alert group.
 * <p>
 * The lookup range is fixed before the store is called. When the store fails, the
 * context is empty but still reports that range, together with the error.
 */
@Slf4j
@Component
public class HistoricalContextProvider {

    private final IncidentStore incidentStore;
    private final NocProperties nocProperties;
    private final NocMetrics metrics;

    public HistoricalContextProvider(IncidentStore incidentStore,
                                     NocProperties nocProperties,
                                     NocMetrics metrics) {
        this.incidentStore = incidentStore;
        this.nocProperties = nocProperties;
        this.metrics = metrics;
    }

    /**
     * Incidents of the configured look-back window. Never fails.
     */
    public Mono<HistoricalContext> recentHistory() {
        Instant end = Instant.now();
        Instant start = end.minus(nocProperties.getCorrelation().getHistoryLookback());

        return Mono.defer(() -> incidentStore.recent(start))
                .defaultIfEmpty(List.of())
                .map(incidents -> HistoricalContext.builder()
                        .incidents(incidents)
                        .start(start)
                        .end(end)
                        .build())
                .onErrorResume(error -> {
                    log.error("Failed to get historical context: {}", error.getMessage());
                    metrics.recordUpstreamFailure();
                    return Mono.just(HistoricalContext.unavailable(start, end,
                            StageError.of(ErrorKind.UPSTREAM_UNAVAILABLE, error)));
                });
    }
}
