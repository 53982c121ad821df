package com.z254.noc.health;

import com.z254.noc.config.NocProperties;
import com.z254.noc.domain.model.ResultStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Health indicator for the NOC service.
 * <p>
 * Reports on:
 * <ul>
 *     <li>Last pipeline run status and time</li>
 *     <li>Consecutive failed runs, DOWN once the configured limit is reached</li>
 *     <li>Correlation and analysis configuration</li>
 * </ul>
 */
@Slf4j
@Component
public class NocHealthIndicator implements ReactiveHealthIndicator {

    private final NocProperties nocProperties;

    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicLong totalRuns = new AtomicLong(0);
    private final AtomicReference<Instant> lastRunAt = new AtomicReference<>();
    private final AtomicReference<ResultStatus> lastRunStatus = new AtomicReference<>();

    public NocHealthIndicator(NocProperties nocProperties) {
        this.nocProperties = nocProperties;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth);
    }

    private Health checkHealth() {
        Map<String, Object> details = new HashMap<>();
        int failures = consecutiveFailures.get();
        int maxFailures = nocProperties.getHealth().getMaxConsecutiveFailures();

        details.put("totalRuns", totalRuns.get());
        details.put("consecutiveFailures", failures);
        details.put("maxConsecutiveFailures", maxFailures);
        details.put("lastRunAt", lastRunAt.get() != null ? lastRunAt.get().toString() : "NEVER");
        details.put("lastRunStatus", lastRunStatus.get() != null ? lastRunStatus.get().toJson() : "NONE");

        details.put("correlationWindow", nocProperties.getCorrelation().getWindow().toString());
        details.put("relationshipStrategy", nocProperties.getCorrelation().getRelationshipStrategy().name());
        details.put("thresholdSigma", nocProperties.getAnalysis().getThresholdSigma());

        if (failures >= maxFailures) {
            details.put("error", "Pipeline failed " + failures + " consecutive runs");
            return Health.down()
                    .withDetails(details)
                    .build();
        }
        return Health.up()
                .withDetails(details)
                .build();
    }

    /**
     * Record the outcome of a pipeline run.
     */
    public void recordRun(ResultStatus status) {
        totalRuns.incrementAndGet();
        lastRunAt.set(Instant.now());
        lastRunStatus.set(status);
        if (status == ResultStatus.SUCCESS) {
            consecutiveFailures.set(0);
        } else {
            int failures = consecutiveFailures.incrementAndGet();
            if (failures >= nocProperties.getHealth().getMaxConsecutiveFailures()) {
                log.warn("Pipeline failed {} consecutive runs", failures);
            }
        }
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }
}
