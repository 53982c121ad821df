package com.z254.noc.dispatch;

import com.z254.noc.client.ActionDispatcher;
import com.z254.noc.config.NocProperties;
import com.z254.noc.domain.model.ActionOutcome;
import com.z254.noc.domain.model.ActionReport;
import com.z254.noc.domain.model.ActionType;
import com.z254.noc.domain.model.Decision;
import com.z254.noc.domain.model.RemediationAction;
import com.z254.noc.domain.model.ResultStatus;
import com.z254.noc.notify.NotificationTransport;
import com.z254.noc.observability.NocMetrics;
import com.z254.noc.observability.NocStructuredLogger;
import com.z254.noc.observability.NocStructuredLogger.OutcomeEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Executes decision actions one at a time, in decision order.
 * <p>
 * Action handling by type:
 * <ul>
 *     <li>REMEDIATE and TICKET are forwarded to the remediation connector</li>
 *     <li>NOTIFY publishes to the action's topic</li>
 *     <li>UNKNOWN yields an error outcome</li>
 * </ul>
 */
@Slf4j
@Component
public class DefaultActionDispatcher implements ActionDispatcher {

    static final String DRY_RUN_PARAMETER = "dryRun";

    private final RemediationConnectorClient connectorClient;
    private final NotificationTransport notificationTransport;
    private final NocProperties nocProperties;
    private final NocMetrics metrics;
    private final NocStructuredLogger structuredLogger;

    public DefaultActionDispatcher(RemediationConnectorClient connectorClient,
                                   NotificationTransport notificationTransport,
                                   NocProperties nocProperties,
                                   NocMetrics metrics,
                                   NocStructuredLogger structuredLogger) {
        this.connectorClient = connectorClient;
        this.notificationTransport = notificationTransport;
        this.nocProperties = nocProperties;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
    }

    @Override
    public Mono<ActionReport> execute(Decision decision) {
        String decisionId = decision.idOrPlaceholder();
        if (decision.getActions().isEmpty()) {
            return Mono.just(ActionReport.empty(decisionId));
        }

        return Flux.fromIterable(decision.getActions())
                .concatMap(action -> process(decisionId, action)
                        .onErrorResume(error -> Mono.just(ActionOutcome.failed(action, error.getMessage()))))
                .doOnNext(outcome -> record(decisionId, outcome))
                .collectList()
                .map(outcomes -> ActionReport.builder()
                        .decisionId(decisionId)
                        .actionResults(outcomes)
                        .build());
    }

    // ========== Private Methods ==========

    private Mono<ActionOutcome> process(String decisionId, RemediationAction action) {
        ActionType type = action.getType() != null ? action.getType() : ActionType.UNKNOWN;
        return switch (type) {
            case REMEDIATE, TICKET -> forwardToConnector(decisionId, type, action);
            case NOTIFY -> publishNotification(action);
            case UNKNOWN -> {
                log.warn("Unknown action type for target: {}", action.getTarget());
                yield Mono.just(ActionOutcome.failed(action, "Unknown action type"));
            }
        };
    }

    private Mono<ActionOutcome> forwardToConnector(String decisionId, ActionType type, RemediationAction action) {
        if (action.getTarget() == null || action.getTarget().isBlank()) {
            return Mono.just(ActionOutcome.failed(action, "No " + type.toJson() + " target found"));
        }

        RemediationConnectorClient.ConnectorRequest request = RemediationConnectorClient.ConnectorRequest.builder()
                .decisionId(decisionId)
                .actionType(type)
                .target(action.getTarget())
                .parameters(action.getParameters() != null ? action.getParameters() : Map.of())
                .dryRun(isDryRun(action))
                .idempotencyKey(decisionId + ":" + type.toJson() + ":" + action.getTarget())
                .build();

        return connectorClient.execute(request)
                .map(result -> ActionOutcome.builder()
                        .action(action)
                        .status(result.isSuccess() ? ResultStatus.SUCCESS : ResultStatus.ERROR)
                        .executionId(result.getExecutionId())
                        .dryRun(result.isDryRun())
                        .error(result.getErrorMessage())
                        .details(result.getDetails() != null ? result.getDetails() : Map.of())
                        .build());
    }

    private Mono<ActionOutcome> publishNotification(RemediationAction action) {
        if (action.getTarget() == null || action.getTarget().isBlank()) {
            return Mono.just(ActionOutcome.failed(action, "No notification topic found"));
        }
        Map<String, Object> parameters = action.getParameters() != null ? action.getParameters() : Map.of();
        String subject = String.valueOf(parameters.getOrDefault("subject", ""));
        String message = String.valueOf(parameters.getOrDefault("message", ""));

        return notificationTransport.publishTopic(action.getTarget(), subject, message)
                .map(messageId -> ActionOutcome.builder()
                        .action(action)
                        .status(ResultStatus.SUCCESS)
                        .executionId(messageId)
                        .build());
    }

    private boolean isDryRun(RemediationAction action) {
        Object flag = action.getParameters() != null ? action.getParameters().get(DRY_RUN_PARAMETER) : null;
        if (flag instanceof Boolean value) {
            return value;
        }
        if (flag instanceof String value) {
            return Boolean.parseBoolean(value);
        }
        return nocProperties.getRemediation().isDryRunDefault();
    }

    private void record(String decisionId, ActionOutcome outcome) {
        boolean success = outcome.getStatus() == ResultStatus.SUCCESS;
        ActionType type = outcome.getAction() != null && outcome.getAction().getType() != null
                ? outcome.getAction().getType() : ActionType.UNKNOWN;
        metrics.recordAction(type, success);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("decisionId", decisionId);
        details.put("type", type.toJson());
        details.put("target", outcome.getAction() != null ? outcome.getAction().getTarget() : null);
        details.put("dryRun", outcome.isDryRun());
        if (!success) {
            details.put("error", outcome.getError());
        }
        structuredLogger.logOutcomeEvent(null,
                success ? OutcomeEventType.ACTION_SUCCEEDED : OutcomeEventType.ACTION_FAILED,
                success ? "Action executed" : "Action failed", details);
    }
}
