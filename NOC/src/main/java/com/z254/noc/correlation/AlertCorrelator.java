package com.z254.noc.correlation;

import com.z254.noc.client.DecisionService;
import com.z254.noc.config.NocProperties;
import com.z254.noc.domain.error.ErrorKind;
import com.z254.noc.domain.error.StageError;
import com.z254.noc.domain.model.Alarm;
import com.z254.noc.domain.model.AlertGroup;
import com.z254.noc.domain.model.CorrelationResult;
import com.z254.noc.domain.model.Decision;
import com.z254.noc.domain.model.HistoricalContext;
import com.z254.noc.observability.NocMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Groups firing alarms into candidate incidents and asks the decision service
 * for a root-cause hypothesis per group.
 * <p>
 * Grouping is a single linear scan:
 * <ul>
 *     <li>alarms are ordered by state transition time, missing times first</li>
 *     <li>each alarm is compared only with the last member of the open group</li>
 *     <li>a related alarm joins the open group, any other alarm opens a new one</li>
 * </ul>
 * Two members of the same group are therefore related only through the chain of
 * members between them, not necessarily directly.
 */
@Slf4j
@Component
public class AlertCorrelator {

    private final HistoricalContextProvider historyProvider;
    private final DecisionService decisionService;
    private final ResourceRelationship resourceRelationship;
    private final NocProperties nocProperties;
    private final NocMetrics metrics;

    public AlertCorrelator(HistoricalContextProvider historyProvider,
                           DecisionService decisionService,
                           ResourceRelationship resourceRelationship,
                           NocProperties nocProperties,
                           NocMetrics metrics) {
        this.historyProvider = historyProvider;
        this.decisionService = decisionService;
        this.resourceRelationship = resourceRelationship;
        this.nocProperties = nocProperties;
        this.metrics = metrics;
    }

    /**
     * Correlate alarms and annotate every group.
     * <p>
     * Groups are annotated one at a time in grouping order. A failed history or decision
     * lookup degrades only that group.
     *
     * @param alarms current firing alarms
     * @return the correlation result; an error status only if grouping itself failed
     */
    public Mono<CorrelationResult> correlate(List<Alarm> alarms) {
        metrics.recordCorrelationPass();

        if (alarms == null || alarms.isEmpty()) {
            log.debug("No alarms to correlate");
            return Mono.just(CorrelationResult.success(List.of()));
        }

        List<List<Alarm>> partitions;
        try {
            partitions = groupAlarms(alarms);
        } catch (RuntimeException e) {
            log.error("Failed to correlate alerts: {}", e.getMessage(), e);
            return Mono.just(CorrelationResult.failure(StageError.of(ErrorKind.PARTIAL_STAGE_FAILURE, e)));
        }

        log.info("Correlated {} alarms into {} groups", alarms.size(), partitions.size());

        return Flux.fromIterable(partitions)
                .concatMap(this::analyzeGroup)
                .doOnNext(group -> metrics.recordGroup(group.size(), group.isDegraded()))
                .collectList()
                .map(CorrelationResult::success);
    }

    /**
     * Partition alarms into chain-adjacent groups. Package-private for tests.
     */
    List<List<Alarm>> groupAlarms(List<Alarm> alarms) {
        List<Alarm> sorted = alarms.stream()
                .sorted(Comparator.comparing(Alarm::getEffectiveTimestamp))
                .toList();

        List<List<Alarm>> groups = new ArrayList<>();
        List<Alarm> current = new ArrayList<>();

        for (Alarm alarm : sorted) {
            if (current.isEmpty() || areRelated(current.get(current.size() - 1), alarm)) {
                current.add(alarm);
            } else {
                groups.add(List.copyOf(current));
                current = new ArrayList<>();
                current.add(alarm);
            }
        }
        if (!current.isEmpty()) {
            groups.add(List.copyOf(current));
        }
        return groups;
    }

    /**
     * Related when the state transitions are within the correlation window and the alarms
     * share a namespace or the resource relationship links them.
     */
    boolean areRelated(Alarm previous, Alarm current) {
        Duration gap = Duration.between(previous.getEffectiveTimestamp(), current.getEffectiveTimestamp()).abs();
        if (gap.compareTo(nocProperties.getCorrelation().getWindow()) > 0) {
            return false;
        }
        return Objects.equals(previous.getNamespace(), current.getNamespace())
                || resourceRelationship.related(previous, current);
    }

    // ========== Private Methods ==========

    private Mono<AlertGroup> analyzeGroup(List<Alarm> alarms) {
        return historyProvider.recentHistory()
                .flatMap(history -> Mono.defer(() -> decisionService.decide(buildContext(alarms, history), List.of()))
                        .switchIfEmpty(Mono.error(new IllegalStateException("Decision service returned no decision")))
                        .map(decision -> toGroup(alarms, decision, history)))
                .onErrorResume(error -> {
                    log.error("Failed to analyze alert group of {} alarms: {}", alarms.size(), error.getMessage());
                    metrics.recordDecisionUnavailable();
                    return Mono.just(AlertGroup.degraded(alarms,
                            StageError.of(ErrorKind.DECISION_UNAVAILABLE, error)));
                });
    }

    private AlertGroup toGroup(List<Alarm> alarms, Decision decision, HistoricalContext history) {
        if (decision.getError() != null) {
            return AlertGroup.degraded(alarms, decision.getError());
        }
        return AlertGroup.builder()
                .alarms(alarms)
                .rootCause(decision.getRootCause() != null ? decision.getRootCause() : AlertGroup.UNKNOWN_ROOT_CAUSE)
                .confidence(decision.getConfidence())
                .recommendedActions(decision.getActions())
                .error(history.getError())
                .build();
    }

    private Map<String, Object> buildContext(List<Alarm> alarms, HistoricalContext history) {
        Map<String, Object> timeRange = new LinkedHashMap<>();
        timeRange.put("start", history.getStart());
        timeRange.put("end", history.getEnd());

        Map<String, Object> historyContext = new LinkedHashMap<>();
        historyContext.put("recent_incidents", history.getIncidents());
        historyContext.put("time_range", timeRange);

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("alerts", alarms);
        context.put("history", historyContext);
        context.put("timestamp", Instant.now());
        return context;
    }
}
