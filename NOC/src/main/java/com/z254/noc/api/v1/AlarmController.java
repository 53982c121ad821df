package com.z254.noc.api.v1;

import com.z254.noc.client.AlarmSnapshotProvider;
import com.z254.noc.client.IncidentStore;
import com.z254.noc.domain.model.Alarm;
import com.z254.noc.domain.model.HistoricalIncident;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * REST API controller for current alarms and incident history.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Alarms", description = "Current firing alarms and incident history")
public class AlarmController {

    private final AlarmSnapshotProvider snapshotProvider;
    private final IncidentStore incidentStore;

    public AlarmController(AlarmSnapshotProvider snapshotProvider, IncidentStore incidentStore) {
        this.snapshotProvider = snapshotProvider;
        this.incidentStore = incidentStore;
    }

    @GetMapping("/alarms")
    @Operation(summary = "List firing alarms", description = "Alarms currently in ALARM state")
    public Mono<ResponseEntity<List<Alarm>>> listAlarms() {
        return snapshotProvider.listFiring()
                .map(ResponseEntity::ok)
                .onErrorResume(error -> {
                    log.error("Failed to list alarms: {}", error.getMessage());
                    return Mono.just(ResponseEntity.status(HttpStatus.BAD_GATEWAY).build());
                });
    }

    @GetMapping("/incidents")
    @Operation(summary = "Incident history", description = "Incidents recorded in the last N hours")
    public Mono<ResponseEntity<List<HistoricalIncident>>> incidentHistory(
            @Parameter(description = "Look-back in hours")
            @RequestParam(defaultValue = "24") int hours) {

        if (hours <= 0) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        Instant since = Instant.now().minus(Duration.ofHours(hours));
        return incidentStore.recent(since)
                .map(ResponseEntity::ok)
                .onErrorResume(error -> {
                    log.error("Failed to get incident history: {}", error.getMessage());
                    return Mono.just(ResponseEntity.status(HttpStatus.BAD_GATEWAY).build());
                });
    }
}
