package com.z254.noc.pipeline;

import com.z254.noc.anomaly.AnomalyAnalyzer;
import com.z254.noc.client.ActionDispatcher;
import com.z254.noc.client.AlarmSnapshotProvider;
import com.z254.noc.client.DecisionService;
import com.z254.noc.client.IncidentSink;
import com.z254.noc.client.Notifier;
import com.z254.noc.client.RuleMatcher;
import com.z254.noc.config.NocProperties;
import com.z254.noc.correlation.AlertCorrelator;
import com.z254.noc.domain.error.ErrorKind;
import com.z254.noc.domain.error.InvalidInputException;
import com.z254.noc.domain.error.NocException;
import com.z254.noc.domain.error.StageError;
import com.z254.noc.domain.model.ActionReport;
import com.z254.noc.domain.model.Alarm;
import com.z254.noc.domain.model.AlertGroup;
import com.z254.noc.domain.model.CorrelationResult;
import com.z254.noc.domain.model.Decision;
import com.z254.noc.domain.model.IncidentRecord;
import com.z254.noc.domain.model.NotificationChannel;
import com.z254.noc.domain.model.NotificationReport;
import com.z254.noc.domain.model.PipelineResult;
import com.z254.noc.domain.model.RemediationRule;
import com.z254.noc.domain.model.ServiceInsight;
import com.z254.noc.health.NocHealthIndicator;
import com.z254.noc.observability.NocMetrics;
import com.z254.noc.observability.NocStructuredLogger;
import com.z254.noc.observability.NocStructuredLogger.GroupEventType;
import com.z254.noc.observability.NocStructuredLogger.PipelineEventType;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs the alarm pipeline for one incoming event.
 * <p>
 * Stages, strictly in sequence:
 * <ol>
 *     <li>current alarm snapshot (an unavailable source counts as no alarms)</li>
 *     <li>correlation into alert groups</li>
 *     <li>per group, in group order: service insights, rule matching, decision,
 *     action dispatch, notification, incident record</li>
 * </ol>
 * Only invalid input or a failed correlation yields an error result. A group whose
 * processing fails is returned as a degraded record; every other failure degrades the
 * affected stage and is reported in the result.
 */
@Slf4j
@Service
public class NocOrchestrator {

    static final String DETAIL_FIELD = "detail";

    private final AlarmSnapshotProvider snapshotProvider;
    private final AlertCorrelator correlator;
    private final AnomalyAnalyzer anomalyAnalyzer;
    private final RuleMatcher ruleMatcher;
    private final DecisionService decisionService;
    private final ActionDispatcher actionDispatcher;
    private final Notifier notifier;
    private final NotificationChannelSelector channelSelector;
    private final List<IncidentSink> incidentSinks;
    private final NocProperties nocProperties;
    private final NocMetrics metrics;
    private final NocStructuredLogger structuredLogger;
    private final NocHealthIndicator healthIndicator;

    public NocOrchestrator(AlarmSnapshotProvider snapshotProvider,
                           AlertCorrelator correlator,
                           AnomalyAnalyzer anomalyAnalyzer,
                           RuleMatcher ruleMatcher,
                           DecisionService decisionService,
                           ActionDispatcher actionDispatcher,
                           Notifier notifier,
                           NotificationChannelSelector channelSelector,
                           List<IncidentSink> incidentSinks,
                           NocProperties nocProperties,
                           NocMetrics metrics,
                           NocStructuredLogger structuredLogger,
                           NocHealthIndicator healthIndicator) {
        this.snapshotProvider = snapshotProvider;
        this.correlator = correlator;
        this.anomalyAnalyzer = anomalyAnalyzer;
        this.ruleMatcher = ruleMatcher;
        this.decisionService = decisionService;
        this.actionDispatcher = actionDispatcher;
        this.notifier = notifier;
        this.channelSelector = channelSelector;
        this.incidentSinks = List.copyOf(incidentSinks);
        this.nocProperties = nocProperties;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.healthIndicator = healthIndicator;
    }

    /**
     * Process a raw alarm event.
     *
     * @param event event payload; must contain a {@code detail} field
     * @return the aggregate result; never an error signal
     */
    public Mono<PipelineResult> processEvent(Map<String, Object> event) {
        String correlationId = UUID.randomUUID().toString();

        return Mono.defer(() -> {
                    validate(event);
                    Timer.Sample timer = metrics.startPipelineTimer();
                    structuredLogger.logPipelineEvent(correlationId, PipelineEventType.STARTED,
                            "Processing alarm event", Map.of("source", String.valueOf(event.get("source"))));

                    List<StageError> warnings = new CopyOnWriteArrayList<>();
                    return currentAlarms(warnings)
                            .flatMap(correlator::correlate)
                            .flatMap(correlation -> processGroups(correlation, warnings))
                            .map(results -> PipelineResult.success(results, warnings))
                            .doOnSuccess(result -> {
                                metrics.recordPipelineCompleted(timer);
                                Map<String, Object> details = new LinkedHashMap<>();
                                details.put("incidents", result.getResults().size());
                                details.put("warnings", result.getWarnings().size());
                                structuredLogger.logPipelineEvent(correlationId,
                                        warnings.isEmpty() ? PipelineEventType.COMPLETED : PipelineEventType.DEGRADED,
                                        "Alarm event processed", details);
                            })
                            .doOnError(error -> metrics.recordPipelineFailed(timer));
                })
                .onErrorResume(error -> {
                    ErrorKind kind = error instanceof NocException nocException
                            ? nocException.getKind() : ErrorKind.PARTIAL_STAGE_FAILURE;
                    String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
                    structuredLogger.logPipelineEvent(correlationId, PipelineEventType.FAILED,
                            "Error processing event", Map.of("kind", kind.name(), "error", message));
                    return Mono.just(PipelineResult.error(kind, message));
                })
                .doOnNext(result -> {
                    if (result.getErrorKind() != ErrorKind.INVALID_INPUT) {
                        healthIndicator.recordRun(result.getStatus());
                    }
                });
    }

    /**
     * Blocking variant of {@link #processEvent} for non-reactive callers.
     */
    public PipelineResult processEventBlocking(Map<String, Object> event) {
        return processEvent(event).block();
    }

    // ========== Private Methods ==========

    private void validate(Map<String, Object> event) {
        if (event == null) {
            throw new InvalidInputException("Invalid event structure: event is empty");
        }
        if (!event.containsKey(DETAIL_FIELD)) {
            throw new InvalidInputException("Invalid event structure: missing 'detail' field");
        }
    }

    private Mono<List<Alarm>> currentAlarms(List<StageError> warnings) {
        return Mono.defer(snapshotProvider::listFiring)
                .defaultIfEmpty(List.of())
                .onErrorResume(error -> {
                    log.error("Failed to get current alarms: {}", error.getMessage());
                    metrics.recordUpstreamFailure();
                    warnings.add(StageError.of(ErrorKind.UPSTREAM_UNAVAILABLE, error));
                    return Mono.just(List.of());
                });
    }

    private Mono<List<IncidentRecord>> processGroups(CorrelationResult correlation, List<StageError> warnings) {
        if (!correlation.isSuccess()) {
            String reason = correlation.getError() != null ? correlation.getError().getMessage() : "unknown error";
            return Mono.error(new NocException(ErrorKind.PARTIAL_STAGE_FAILURE, "Correlation failed: " + reason));
        }
        return Flux.fromIterable(correlation.getGroups())
                .concatMap(group -> {
                    String incidentId = UUID.randomUUID().toString();
                    return Mono.defer(() -> processGroup(incidentId, group, warnings))
                            .onErrorResume(error -> Mono.just(failedGroup(incidentId, group, error, warnings)));
                })
                .collectList();
    }

    private Mono<IncidentRecord> processGroup(String incidentId, AlertGroup group, List<StageError> warnings) {
        Map<String, Object> correlated = new LinkedHashMap<>();
        correlated.put("alarms", group.size());
        correlated.put("rootCause", group.getRootCause());
        structuredLogger.logGroupEvent(incidentId, group.isDegraded() ? GroupEventType.DEGRADED : GroupEventType.CORRELATED,
                "Alert group correlated", correlated);

        return metricInsights(group)
                .flatMap(insights -> decide(incidentId, group, insights, warnings)
                        .flatMap(decision -> dispatch(decision, warnings)
                                .flatMap(actions -> {
                                    IncidentRecord pending = IncidentRecord.builder()
                                            .id(incidentId)
                                            .correlation(group)
                                            .metricInsights(insights)
                                            .decision(decision)
                                            .actions(actions)
                                            .timestamp(Instant.now())
                                            .build();
                                    return notify(pending, decision, warnings)
                                            .map(notifications -> IncidentRecord.builder()
                                                    .id(incidentId)
                                                    .correlation(group)
                                                    .metricInsights(insights)
                                                    .decision(decision)
                                                    .actions(actions)
                                                    .notifications(notifications)
                                                    .timestamp(Instant.now())
                                                    .build());
                                })))
                .flatMap(record -> publish(record, warnings).thenReturn(record))
                .doOnNext(record -> structuredLogger.logGroupEvent(incidentId, GroupEventType.RECORDED,
                        "Incident recorded", Map.of("severity", record.getSeverity().toJson(),
                                "actions", record.getActions().getActionResults().size(),
                                "notifications", record.getNotifications().getNotificationResults().size())));
    }

    /**
     * Record for a group whose processing failed outside the per-stage fallbacks.
     * The group keeps its correlation; the decision is marked unavailable and no
     * action or notification outcome is reported.
     */
    private IncidentRecord failedGroup(String incidentId, AlertGroup group, Throwable error,
                                       List<StageError> warnings) {
        StageError stageError = StageError.of(ErrorKind.PARTIAL_STAGE_FAILURE,
                "Processing failed for incident " + incidentId + ": "
                        + (error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName()));
        log.error("Alert group processing failed for incident {}", incidentId, error);
        warnings.add(stageError);
        structuredLogger.logGroupEvent(incidentId, GroupEventType.DEGRADED,
                "Alert group processing failed", Map.of("error", stageError.getMessage()));

        Decision decision = Decision.unavailable(stageError);
        return IncidentRecord.builder()
                .id(incidentId)
                .correlation(group)
                .decision(decision)
                .actions(ActionReport.empty(decision.idOrPlaceholder()))
                .notifications(NotificationReport.builder().incidentId(incidentId).build())
                .timestamp(Instant.now())
                .build();
    }

    private Mono<Map<String, ServiceInsight>> metricInsights(AlertGroup group) {
        String prefix = nocProperties.getAnalysis().getNamespacePrefix();
        Set<String> services = new LinkedHashSet<>();
        for (Alarm alarm : group.getAlarms()) {
            String service = alarm.signalSource(prefix);
            if (service != null && !service.isBlank()) {
                services.add(service);
            }
        }

        return Flux.fromIterable(services)
                .concatMap(anomalyAnalyzer::serviceInsights)
                .collect(LinkedHashMap<String, ServiceInsight>::new,
                        (insights, insight) -> insights.put(insight.getService(), insight))
                .map(insights -> (Map<String, ServiceInsight>) insights);
    }

    private Mono<Decision> decide(String incidentId, AlertGroup group, Map<String, ServiceInsight> insights,
                                  List<StageError> warnings) {
        List<RemediationRule> rules;
        try {
            rules = ruleMatcher.matchingRules(group.getAlarms());
        } catch (RuntimeException e) {
            log.error("Failed to get matching rules: {}", e.getMessage());
            warnings.add(StageError.of(ErrorKind.PARTIAL_STAGE_FAILURE, e));
            rules = List.of();
        }

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("alerts", group.getAlarms());
        context.put("root_cause", group.getRootCause());
        context.put("confidence", group.getConfidence());
        context.put("recommended_actions", group.getRecommendedActions());
        context.put("metric_insights", insights);

        List<RemediationRule> matched = rules;
        return Mono.defer(() -> decisionService.decide(context, matched))
                .switchIfEmpty(Mono.error(new IllegalStateException("Decision service returned no decision")))
                .onErrorResume(error -> {
                    StageError stageError = StageError.of(ErrorKind.DECISION_UNAVAILABLE, error);
                    metrics.recordDecisionUnavailable();
                    warnings.add(stageError);
                    structuredLogger.logGroupEvent(incidentId, GroupEventType.DEGRADED,
                            "Decision unavailable", Map.of("error", stageError.getMessage()));
                    return Mono.just(Decision.unavailable(stageError));
                })
                .doOnNext(decision -> {
                    if (decision.isAvailable()) {
                        Map<String, Object> details = new LinkedHashMap<>();
                        details.put("decisionId", decision.idOrPlaceholder());
                        details.put("rootCause", decision.getRootCause());
                        details.put("severity", decision.getSeverity().toJson());
                        structuredLogger.logGroupEvent(incidentId, GroupEventType.DECIDED, "Decision obtained", details);
                    }
                });
    }

    private Mono<ActionReport> dispatch(Decision decision, List<StageError> warnings) {
        return Mono.defer(() -> actionDispatcher.execute(decision))
                .defaultIfEmpty(ActionReport.empty(decision.idOrPlaceholder()))
                .onErrorResume(error -> {
                    log.error("Failed to execute actions for decision {}: {}", decision.idOrPlaceholder(), error.getMessage());
                    warnings.add(StageError.of(ErrorKind.PARTIAL_STAGE_FAILURE, error));
                    return Mono.just(ActionReport.empty(decision.idOrPlaceholder()));
                });
    }

    private Mono<NotificationReport> notify(IncidentRecord incident, Decision decision, List<StageError> warnings) {
        List<NotificationChannel> channels = channelSelector.select(decision.getSeverity());
        return Mono.defer(() -> notifier.send(incident, channels, decision.getSeverity()))
                .defaultIfEmpty(NotificationReport.builder().incidentId(incident.getId()).build())
                .onErrorResume(error -> {
                    log.error("Failed to send notifications for incident {}: {}", incident.getId(), error.getMessage());
                    warnings.add(StageError.of(ErrorKind.PARTIAL_STAGE_FAILURE, error));
                    return Mono.just(NotificationReport.builder().incidentId(incident.getId()).build());
                });
    }

    private Mono<Void> publish(IncidentRecord record, List<StageError> warnings) {
        return Flux.fromIterable(incidentSinks)
                .concatMap(sink -> Mono.defer(() -> sink.publish(record))
                        .onErrorResume(error -> {
                            log.error("Incident sink {} failed for {}: {}", sink.name(), record.getId(), error.getMessage());
                            warnings.add(StageError.of(ErrorKind.PARTIAL_STAGE_FAILURE,
                                    "Incident sink " + sink.name() + " failed: " + error.getMessage()));
                            return Mono.empty();
                        }))
                .then();
    }
}
