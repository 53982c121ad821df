package com.z254.noc.observability;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured logging utility for the NOC service.
 * <p>
 * Provides consistent, machine-readable log output with:
 * <ul>
 *     <li>MDC context management for correlation and incident IDs</li>
 *     <li>Domain-specific logging methods for pipeline runs, alert groups and outcomes</li>
 * </ul>
 * Output lines have the shape {@code message | data={json}}.
 */
@Slf4j
@Component
public class NocStructuredLogger {

    // MDC keys
    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_INCIDENT_ID = "incidentId";
    public static final String MDC_SERVICE = "signalSource";

    /**
     * Log a pipeline lifecycle event.
     */
    public void logPipelineEvent(String correlationId, PipelineEventType eventType,
                                 String message, Map<String, Object> details) {
        try (var scope = withCorrelationId(correlationId)) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("correlationId", correlationId);
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case STARTED, COMPLETED -> log.info("{} | data={}", message, formatLogData(logData));
                case DEGRADED -> log.warn("{} | data={}", message, formatLogData(logData));
                case FAILED -> log.error("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log an alert group event.
     */
    public void logGroupEvent(String incidentId, GroupEventType eventType,
                              String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_INCIDENT_ID, incidentId != null ? incidentId : ""))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            if (incidentId != null) {
                logData.put("incidentId", incidentId);
            }
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case CORRELATED, DECIDED, RECORDED -> log.info("{} | data={}", message, formatLogData(logData));
                case DEGRADED -> log.warn("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log the outcome of one action or notification.
     */
    public void logOutcomeEvent(String incidentId, OutcomeEventType eventType,
                                String message, Map<String, Object> details) {
        Map<String, Object> logData = new LinkedHashMap<>();
        logData.put("event", eventType.name());
        if (incidentId != null) {
            logData.put("incidentId", incidentId);
        }
        if (details != null) {
            logData.putAll(details);
        }

        switch (eventType) {
            case ACTION_SUCCEEDED, NOTIFICATION_SENT -> log.info("{} | data={}", message, formatLogData(logData));
            case ACTION_FAILED, NOTIFICATION_FAILED -> log.error("{} | data={}", message, formatLogData(logData));
        }
    }

    /**
     * Log an anomaly detection result for one metric.
     */
    public void logAnomalies(String service, String metric, int sampleCount, int anomalyCount) {
        try (var scope = withContext(Map.of(MDC_SERVICE, service))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", "ANOMALY_SCAN");
            logData.put("service", service);
            logData.put("metric", metric);
            logData.put("samples", sampleCount);
            logData.put("anomalies", anomalyCount);

            if (anomalyCount > 0) {
                log.warn("Anomalies detected | data={}", formatLogData(logData));
            } else {
                log.debug("No anomalies | data={}", formatLogData(logData));
            }
        }
    }

    /**
     * Set MDC context.
     */
    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    /**
     * Set correlation ID in MDC.
     */
    public MDCScope withCorrelationId(String correlationId) {
        MDC.put(MDC_CORRELATION_ID, correlationId);
        return new MDCScope(MDC_CORRELATION_ID);
    }

    private String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    // ========== Event Type Enums ==========

    public enum PipelineEventType {
        STARTED, COMPLETED, DEGRADED, FAILED
    }

    public enum GroupEventType {
        CORRELATED, DECIDED, DEGRADED, RECORDED
    }

    public enum OutcomeEventType {
        ACTION_SUCCEEDED, ACTION_FAILED, NOTIFICATION_SENT, NOTIFICATION_FAILED
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
