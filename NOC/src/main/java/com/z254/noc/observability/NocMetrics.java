package com.z254.noc.observability;

import com.z254.noc.domain.model.ActionType;
import com.z254.noc.domain.model.NotificationChannel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized metrics for the NOC service.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Pipeline runs (started, completed, failed, latency)</li>
 *     <li>Correlation passes and group sizes</li>
 *     <li>Anomaly detection and decision availability</li>
 *     <li>Action and notification outcomes</li>
 * </ul>
 */
@Component
public class NocMetrics {

    private final MeterRegistry meterRegistry;

    // Pipeline metrics
    @Getter
    private final Counter pipelineStarted;
    @Getter
    private final Counter pipelineCompleted;
    @Getter
    private final Counter pipelineFailed;
    private final Timer pipelineLatency;

    // Correlation metrics
    @Getter
    private final Counter correlationPasses;
    @Getter
    private final Counter groupsCreated;
    @Getter
    private final Counter groupsDegraded;
    private final DistributionSummary groupSize;

    // Analysis metrics
    @Getter
    private final Counter anomaliesDetected;
    @Getter
    private final Counter decisionsUnavailable;
    @Getter
    private final Counter upstreamFailures;

    private final Map<String, Counter> actionsByOutcome = new ConcurrentHashMap<>();
    private final Map<String, Counter> notificationsByOutcome = new ConcurrentHashMap<>();

    public NocMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.pipelineStarted = Counter.builder("noc.pipeline.started")
                .description("Pipeline runs started")
                .register(meterRegistry);
        this.pipelineCompleted = Counter.builder("noc.pipeline.completed")
                .description("Pipeline runs completed with status success")
                .register(meterRegistry);
        this.pipelineFailed = Counter.builder("noc.pipeline.failed")
                .description("Pipeline runs completed with status error")
                .register(meterRegistry);
        this.pipelineLatency = Timer.builder("noc.pipeline.latency")
                .description("End-to-end pipeline latency")
                .publishPercentiles(0.5, 0.75, 0.95, 0.99)
                .register(meterRegistry);

        this.correlationPasses = Counter.builder("noc.correlation.passes")
                .description("Correlation passes executed")
                .register(meterRegistry);
        this.groupsCreated = Counter.builder("noc.correlation.groups")
                .description("Alert groups created")
                .register(meterRegistry);
        this.groupsDegraded = Counter.builder("noc.correlation.groups.degraded")
                .description("Alert groups whose history or decision lookup failed")
                .register(meterRegistry);
        this.groupSize = DistributionSummary.builder("noc.correlation.group.size")
                .description("Alarms per alert group")
                .register(meterRegistry);

        this.anomaliesDetected = Counter.builder("noc.anomalies.detected")
                .description("Anomalous samples detected")
                .register(meterRegistry);
        this.decisionsUnavailable = Counter.builder("noc.decisions.unavailable")
                .description("Decision service calls that failed")
                .register(meterRegistry);
        this.upstreamFailures = Counter.builder("noc.upstream.failures")
                .description("Snapshot, history or time-series lookups that failed")
                .register(meterRegistry);
    }

    // ========== Pipeline Methods ==========

    public Timer.Sample startPipelineTimer() {
        pipelineStarted.increment();
        return Timer.start(meterRegistry);
    }

    public void recordPipelineCompleted(Timer.Sample sample) {
        sample.stop(pipelineLatency);
        pipelineCompleted.increment();
    }

    public void recordPipelineFailed(Timer.Sample sample) {
        sample.stop(pipelineLatency);
        pipelineFailed.increment();
    }

    // ========== Correlation Methods ==========

    public void recordCorrelationPass() {
        correlationPasses.increment();
    }

    public void recordGroup(int size, boolean degraded) {
        groupsCreated.increment();
        groupSize.record(size);
        if (degraded) {
            groupsDegraded.increment();
        }
    }

    // ========== Analysis Methods ==========

    public void recordAnomalies(int count) {
        if (count > 0) {
            anomaliesDetected.increment(count);
        }
    }

    public void recordDecisionUnavailable() {
        decisionsUnavailable.increment();
    }

    public void recordUpstreamFailure() {
        upstreamFailures.increment();
    }

    // ========== Outcome Methods ==========

    public void recordAction(ActionType type, boolean success) {
        String key = type.name() + ":" + success;
        actionsByOutcome.computeIfAbsent(key, k ->
                Counter.builder("noc.actions.executed")
                        .tag("action_type", type.toJson())
                        .tag("outcome", success ? "success" : "error")
                        .description("Actions executed by type and outcome")
                        .register(meterRegistry))
                .increment();
    }

    public void recordNotification(NotificationChannel channel, boolean success) {
        String key = channel.name() + ":" + success;
        notificationsByOutcome.computeIfAbsent(key, k ->
                Counter.builder("noc.notifications.sent")
                        .tag("channel", channel.toJson())
                        .tag("outcome", success ? "success" : "error")
                        .description("Notifications sent by channel and outcome")
                        .register(meterRegistry))
                .increment();
    }
}
