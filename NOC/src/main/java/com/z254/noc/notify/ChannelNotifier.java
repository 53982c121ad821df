package com.z254.noc.notify;

import com.z254.noc.client.Notifier;
import com.z254.noc.config.NocProperties;
import com.z254.noc.domain.model.Alarm;
import com.z254.noc.domain.model.IncidentRecord;
import com.z254.noc.domain.model.NotificationChannel;
import com.z254.noc.domain.model.NotificationOutcome;
import com.z254.noc.domain.model.NotificationReport;
import com.z254.noc.domain.model.ResultStatus;
import com.z254.noc.domain.model.Severity;
import com.z254.noc.observability.NocMetrics;
import com.z254.noc.observability.NocStructuredLogger;
import com.z254.noc.observability.NocStructuredLogger.OutcomeEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders an incident for each requested channel and hands it to the transport.
 * <p>
 * Channels are notified one at a time in the given order. A failed channel yields an
 * error outcome and does not affect the others.
 */
@Slf4j
@Component
public class ChannelNotifier implements Notifier {

    static final String STATUS_OPEN = "OPEN";

    private final NotificationTransport transport;
    private final NocProperties.Notifications config;
    private final NocMetrics metrics;
    private final NocStructuredLogger structuredLogger;

    public ChannelNotifier(NotificationTransport transport,
                           NocProperties nocProperties,
                           NocMetrics metrics,
                           NocStructuredLogger structuredLogger) {
        this.transport = transport;
        this.config = nocProperties.getNotifications();
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
    }

    @Override
    public Mono<NotificationReport> send(IncidentRecord incident, List<NotificationChannel> channels, Severity severity) {
        Severity effective = severity != null ? severity : Severity.MEDIUM;

        return Flux.fromIterable(channels)
                .concatMap(channel -> Mono.defer(() -> transport.deliver(channel, render(channel, incident, effective)))
                        .map(response -> NotificationOutcome.delivered(channel, response))
                        .onErrorResume(error -> Mono.just(NotificationOutcome.failed(channel, error.getMessage()))))
                .doOnNext(outcome -> record(incident.getId(), outcome))
                .collectList()
                .map(outcomes -> NotificationReport.builder()
                        .incidentId(incident.getId())
                        .notificationResults(outcomes)
                        .build());
    }

    /**
     * Build the channel-specific payload.
     */
    Map<String, Object> render(NotificationChannel channel, IncidentRecord incident, Severity severity) {
        String title = title(incident, severity);
        String description = description(incident);
        String label = severity.name();

        return switch (channel) {
            case TEAMS -> Map.of(
                    "type", "message",
                    "attachments", List.of(Map.of(
                            "contentType", "application/vnd.microsoft.card.adaptive",
                            "content", Map.of(
                                    "type", "AdaptiveCard",
                                    "body", List.of(
                                            Map.of("type", "TextBlock", "text", title, "weight", "bolder", "size", "large"),
                                            Map.of("type", "TextBlock", "text", description, "wrap", true),
                                            Map.of("type", "FactSet", "facts", List.of(
                                                    Map.of("title", "Severity", "value", label),
                                                    Map.of("title", "Status", "value", STATUS_OPEN)))),
                                    "actions", List.of(Map.of(
                                            "type", "Action.OpenUrl",
                                            "title", "View Details",
                                            "url", config.getConsoleUrl() + primaryAlarmName(incident)))))));
            case SLACK -> Map.of("blocks", List.of(
                    Map.of("type", "header", "text", Map.of("type", "plain_text", "text", title)),
                    Map.of("type", "section", "text", Map.of("type", "mrkdwn", "text", description)),
                    Map.of("type", "section", "fields", List.of(
                            Map.of("type", "mrkdwn", "text", "*Severity:*\n" + label),
                            Map.of("type", "mrkdwn", "text", "*Status:*\n" + STATUS_OPEN)))));
            case PAGERDUTY -> Map.of("incident", Map.of(
                    "type", "incident",
                    "title", title,
                    "description", description,
                    "urgency", severity.isAtLeast(Severity.HIGH) ? "high" : "low",
                    "body", Map.of(
                            "type", "incident_body",
                            "details", details(incident))));
            case EMAIL -> Map.of(
                    "from", config.getEmailFrom() != null ? config.getEmailFrom() : "",
                    "to", config.getEmailRecipients(),
                    "subject", "[" + label + "] " + title,
                    "html", "<h1>" + HtmlUtils.htmlEscape(title) + "</h1>"
                            + "<p>" + HtmlUtils.htmlEscape(description) + "</p>"
                            + "<h2>Details</h2><ul>"
                            + "<li><strong>Severity:</strong> " + label + "</li>"
                            + "<li><strong>Status:</strong> " + STATUS_OPEN + "</li>"
                            + "<li><strong>Incident ID:</strong> " + HtmlUtils.htmlEscape(String.valueOf(incident.getId())) + "</li>"
                            + "</ul>");
        };
    }

    // ========== Private Methods ==========

    private String title(IncidentRecord incident, Severity severity) {
        List<Alarm> alarms = incident.getCorrelation().getAlarms();
        String primary = primaryAlarmName(incident);
        String suffix = alarms.size() > 1 ? " (+" + (alarms.size() - 1) + " related)" : "";
        return severity.name() + " incident: " + primary + suffix;
    }

    private String description(IncidentRecord incident) {
        String rootCause = incident.getDecision() != null ? incident.getDecision().getRootCause() : "unknown";
        double confidence = incident.getDecision() != null ? incident.getDecision().getConfidence() : 0.0;
        return String.format(Locale.ROOT, "Root cause: %s (confidence %.2f)", rootCause, confidence);
    }

    private String primaryAlarmName(IncidentRecord incident) {
        List<Alarm> alarms = incident.getCorrelation().getAlarms();
        String name = alarms.isEmpty() ? null : alarms.get(0).getAlarmName();
        return name != null ? name : "unknown";
    }

    private Map<String, Object> details(IncidentRecord incident) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("incidentId", incident.getId());
        details.put("alarms", incident.getCorrelation().getAlarms().stream()
                .map(alarm -> alarm.getAlarmName() != null ? alarm.getAlarmName() : "unknown")
                .toList());
        details.put("signalSources", List.copyOf(incident.getMetricInsights().keySet()));
        if (incident.getDecision() != null) {
            details.put("decisionId", incident.getDecision().idOrPlaceholder());
        }
        return details;
    }

    private void record(String incidentId, NotificationOutcome outcome) {
        boolean success = outcome.getStatus() == ResultStatus.SUCCESS;
        metrics.recordNotification(outcome.getChannel(), success);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("channel", outcome.getChannel().toJson());
        if (!success) {
            details.put("error", outcome.getError());
        }
        structuredLogger.logOutcomeEvent(incidentId,
                success ? OutcomeEventType.NOTIFICATION_SENT : OutcomeEventType.NOTIFICATION_FAILED,
                success ? "Notification sent" : "Notification failed", details);
    }
}
