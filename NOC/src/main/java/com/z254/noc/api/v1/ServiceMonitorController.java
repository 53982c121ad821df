package com.z254.noc.api.v1;

import com.z254.noc.anomaly.AnomalyAnalyzer;
import com.z254.noc.domain.error.ErrorKind;
import com.z254.noc.domain.model.MetricAnalysis;
import com.z254.noc.domain.model.ResultStatus;
import com.z254.noc.domain.model.ServiceInsight;
import com.z254.noc.domain.model.ServiceMonitorReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.format.DateTimeParseException;

/**
 * REST API controller for signal source monitoring and metric analysis.
 */
@RestController
@RequestMapping("/api/v1/services")
@Tag(name = "Services", description = "Signal source monitoring and metric analysis")
public class ServiceMonitorController {

    private final AnomalyAnalyzer anomalyAnalyzer;

    public ServiceMonitorController(AnomalyAnalyzer anomalyAnalyzer) {
        this.anomalyAnalyzer = anomalyAnalyzer;
    }

    @GetMapping("/{service}/monitor")
    @Operation(summary = "Monitor service", description = "Analyze every key metric of a signal source")
    public Mono<ResponseEntity<ServiceMonitorReport>> monitor(
            @Parameter(description = "Signal source, e.g. EC2") @PathVariable String service) {

        return anomalyAnalyzer.monitor(service)
                .map(report -> report.getStatus() == ResultStatus.SUCCESS
                        ? ResponseEntity.ok(report)
                        : ResponseEntity.status(HttpStatus.NOT_FOUND).body(report));
    }

    @GetMapping("/{service}/metrics/{metric}/analysis")
    @Operation(summary = "Analyze metric", description = "Detect anomalies in one metric over a window")
    public Mono<ResponseEntity<MetricAnalysis>> analyze(
            @Parameter(description = "Signal source, e.g. EC2") @PathVariable String service,
            @Parameter(description = "Metric name") @PathVariable String metric,
            @Parameter(description = "ISO-8601 window, e.g. PT1H") @RequestParam(defaultValue = "PT1H") String window) {

        Duration parsed;
        try {
            parsed = Duration.parse(window);
        } catch (DateTimeParseException e) {
            return Mono.just(ResponseEntity.badRequest().build());
        }

        return anomalyAnalyzer.analyze(service, metric, parsed)
                .map(analysis -> {
                    if (analysis.getStatus() == ResultStatus.SUCCESS) {
                        return ResponseEntity.ok(analysis);
                    }
                    HttpStatus status = analysis.getError() != null && analysis.getError().getKind() == ErrorKind.INVALID_INPUT
                            ? HttpStatus.BAD_REQUEST : HttpStatus.INTERNAL_SERVER_ERROR;
                    return ResponseEntity.status(status).body(analysis);
                });
    }

    @GetMapping("/{service}/insights")
    @Operation(summary = "Service insights", description = "Key metric evidence and qualitative analysis for a signal source")
    public Mono<ResponseEntity<ServiceInsight>> insights(
            @Parameter(description = "Signal source, e.g. EC2") @PathVariable String service) {

        return anomalyAnalyzer.serviceInsights(service)
                .map(ResponseEntity::ok);
    }
}
