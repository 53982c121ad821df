package com.z254.noc.anomaly;

import com.z254.noc.client.DecisionService;
import com.z254.noc.client.TimeSeriesSource;
import com.z254.noc.config.NocProperties;
import com.z254.noc.domain.error.ErrorKind;
import com.z254.noc.domain.error.StageError;
import com.z254.noc.domain.model.Anomaly;
import com.z254.noc.domain.model.MetricAnalysis;
import com.z254.noc.domain.model.MetricSeries;
import com.z254.noc.domain.model.ResultStatus;
import com.z254.noc.domain.model.Sample;
import com.z254.noc.domain.model.ServiceInsight;
import com.z254.noc.domain.model.ServiceMonitorReport;
import com.z254.noc.observability.NocMetrics;
import com.z254.noc.observability.NocStructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Statistical analysis of signal-source metrics.
 * <p>
 * Operations:
 * <ul>
 *     <li>{@link #analyze}: anomalies of one metric over a window</li>
 *     <li>{@link #monitor}: {@code analyze} over every key metric of a source</li>
 *     <li>{@link #serviceInsights}: key metric evidence for the pipeline</li>
 * </ul>
 * None of these fail the returned {@code Mono}; failures are carried in the result.
 */
@Slf4j
@Service
public class AnomalyAnalyzer {

    private final TimeSeriesSource timeSeriesSource;
    private final DecisionService decisionService;
    private final AnomalyDetector detector;
    private final KeyMetricCatalog catalog;
    private final NocProperties nocProperties;
    private final NocMetrics metrics;
    private final NocStructuredLogger structuredLogger;

    public AnomalyAnalyzer(TimeSeriesSource timeSeriesSource,
                           DecisionService decisionService,
                           AnomalyDetector detector,
                           KeyMetricCatalog catalog,
                           NocProperties nocProperties,
                           NocMetrics metrics,
                           NocStructuredLogger structuredLogger) {
        this.timeSeriesSource = timeSeriesSource;
        this.decisionService = decisionService;
        this.detector = detector;
        this.catalog = catalog;
        this.nocProperties = nocProperties;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
    }

    /**
     * Analyze one metric of a signal source over {@code [now - window, now]}.
     * <p>
     * Invalid arguments produce an error result with {@link ErrorKind#INVALID_INPUT}. An
     * unavailable time-series source produces a successful result with no anomalies and
     * the upstream error attached.
     */
    public Mono<MetricAnalysis> analyze(String service, String metric, Duration window) {
        Optional<String> invalid = validate(service, metric, window);
        if (invalid.isPresent()) {
            log.warn("Rejected metric analysis for {}/{}: {}", service, metric, invalid.get());
            return Mono.just(MetricAnalysis.failed(service, metric, window,
                    StageError.of(ErrorKind.INVALID_INPUT, invalid.get())));
        }

        return fetchSamples(service, metric, window)
                .flatMap(fetch -> {
                    if (fetch.error() != null) {
                        return Mono.just(emptyAnalysis(service, metric, window, fetch.error()));
                    }
                    if (fetch.samples().isEmpty()) {
                        log.warn("No metric data found for {}/{}", service, metric);
                        return Mono.just(emptyAnalysis(service, metric, window, null));
                    }
                    return detectAndExplain(service, metric, window, fetch.samples());
                })
                .onErrorResume(error -> {
                    log.error("Error analyzing metrics for {}/{}: {}", service, metric, error.getMessage(), error);
                    return Mono.just(MetricAnalysis.failed(service, metric, window,
                            StageError.of(ErrorKind.PARTIAL_STAGE_FAILURE, error)));
                });
    }

    /**
     * Analyze every key metric of a signal source over the default window.
     * <p>
     * An unknown source yields an error report. A failing metric keeps its error in its
     * own slot and does not fail the report.
     */
    public Mono<ServiceMonitorReport> monitor(String service) {
        Optional<List<String>> keyMetrics = catalog.keyMetrics(service);
        if (keyMetrics.isEmpty()) {
            log.warn("No key metrics defined for service: {}", service);
            return Mono.just(ServiceMonitorReport.builder()
                    .service(service)
                    .status(ResultStatus.ERROR)
                    .error(StageError.of(ErrorKind.INVALID_INPUT, "No key metrics defined for service: " + service))
                    .timestamp(Instant.now())
                    .build());
        }

        Duration window = nocProperties.getAnalysis().getDefaultWindow();
        return Flux.fromIterable(keyMetrics.get())
                .concatMap(metric -> analyze(service, metric, window))
                .collect(LinkedHashMap<String, MetricAnalysis>::new,
                        (results, analysis) -> results.put(analysis.getMetric(), analysis))
                .map(results -> ServiceMonitorReport.builder()
                        .service(service)
                        .metrics(results)
                        .status(ResultStatus.SUCCESS)
                        .timestamp(Instant.now())
                        .build());
    }

    /**
     * Fetch every key metric of a signal source, detect anomalies in each and ask the
     * decision service for a qualitative analysis.
     * <p>
     * Metrics whose samples could not be fetched are left out and noted in the insight error.
     */
    public Mono<ServiceInsight> serviceInsights(String service) {
        Optional<List<String>> keyMetrics = catalog.keyMetrics(service);
        if (keyMetrics.isEmpty()) {
            log.warn("No key metrics defined for service: {}", service);
            return Mono.just(ServiceInsight.builder()
                    .service(service)
                    .error(StageError.of(ErrorKind.PARTIAL_STAGE_FAILURE,
                            "No key metrics defined for service: " + service))
                    .timestamp(Instant.now())
                    .build());
        }

        Duration window = nocProperties.getAnalysis().getDefaultWindow();
        List<String> failedMetrics = new ArrayList<>();

        return Flux.fromIterable(keyMetrics.get())
                .concatMap(metric -> fetchSamples(service, metric, window)
                        .flatMap(fetch -> {
                            if (fetch.error() != null) {
                                failedMetrics.add(metric);
                                return Mono.empty();
                            }
                            if (fetch.samples().isEmpty()) {
                                return Mono.empty();
                            }
                            List<Anomaly> anomalies = detector.detect(fetch.samples());
                            structuredLogger.logAnomalies(service, metric, fetch.samples().size(), anomalies.size());
                            metrics.recordAnomalies(anomalies.size());
                            return Mono.just(MetricSeries.builder()
                                    .metric(metric)
                                    .samples(fetch.samples())
                                    .anomalies(anomalies)
                                    .build());
                        }))
                .collectList()
                .flatMap(series -> bestEffortAnalysis(Map.of("service", service, "metrics", series))
                        .map(analysis -> ServiceInsight.builder()
                                .service(service)
                                .metrics(series)
                                .analysis(analysis)
                                .error(failedMetrics.isEmpty() ? null : StageError.of(ErrorKind.UPSTREAM_UNAVAILABLE,
                                        "Metric data unavailable for " + String.join(", ", failedMetrics)))
                                .timestamp(Instant.now())
                                .build()))
                .onErrorResume(error -> {
                    log.error("Failed to get service insights for {}: {}", service, error.getMessage());
                    return Mono.just(ServiceInsight.builder()
                            .service(service)
                            .error(StageError.of(ErrorKind.PARTIAL_STAGE_FAILURE, error))
                            .timestamp(Instant.now())
                            .build());
                });
    }

    // ========== Private Methods ==========

    private Optional<String> validate(String service, String metric, Duration window) {
        if (service == null || service.isBlank() || metric == null || metric.isBlank()) {
            return Optional.of("Service and metric name are required");
        }
        if (window == null || window.isNegative() || window.isZero()) {
            return Optional.of("Window must be positive");
        }
        return Optional.empty();
    }

    private Mono<SampleFetch> fetchSamples(String service, String metric, Duration window) {
        Duration period = nocProperties.getAnalysis().getSamplePeriod();
        return Mono.defer(() -> timeSeriesSource.samples(service, metric, window, period))
                .defaultIfEmpty(List.of())
                .map(samples -> new SampleFetch(samples, null))
                .onErrorResume(error -> {
                    log.error("Error getting metric data for {}/{}: {}", service, metric, error.getMessage());
                    metrics.recordUpstreamFailure();
                    return Mono.just(new SampleFetch(List.of(), StageError.of(ErrorKind.UPSTREAM_UNAVAILABLE, error)));
                });
    }

    private Mono<MetricAnalysis> detectAndExplain(String service, String metric, Duration window,
                                                  List<Sample> samples) {
        List<Anomaly> anomalies = detector.detect(samples);
        structuredLogger.logAnomalies(service, metric, samples.size(), anomalies.size());
        metrics.recordAnomalies(anomalies.size());

        Mono<Map<String, Object>> insights = anomalies.isEmpty()
                ? Mono.just(Map.of())
                : bestEffortAnalysis(Map.of(
                        "metric_data", samples,
                        "anomalies", anomalies,
                        "timestamp", Instant.now()));

        return insights.map(insight -> MetricAnalysis.builder()
                .service(service)
                .metric(metric)
                .window(window)
                .samples(samples)
                .anomalies(anomalies)
                .insights(insight)
                .status(ResultStatus.SUCCESS)
                .timestamp(Instant.now())
                .build());
    }

    private Mono<Map<String, Object>> bestEffortAnalysis(Map<String, Object> context) {
        return Mono.defer(() -> decisionService.analyze(context))
                .defaultIfEmpty(Map.of())
                .onErrorResume(error -> {
                    log.warn("Decision service insight unavailable: {}", error.getMessage());
                    return Mono.just(Map.of());
                });
    }

    private MetricAnalysis emptyAnalysis(String service, String metric, Duration window, StageError error) {
        return MetricAnalysis.builder()
                .service(service)
                .metric(metric)
                .window(window)
                .status(ResultStatus.SUCCESS)
                .error(error)
                .timestamp(Instant.now())
                .build();
    }

    private record SampleFetch(List<Sample> samples, StageError error) {
    }
}
