package com.z254.noc.api.v1;

import com.z254.noc.domain.error.ErrorKind;
import com.z254.noc.domain.model.PipelineResult;
import com.z254.noc.pipeline.NocOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * REST API controller for alarm event processing.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/events")
@Tag(name = "Events", description = "Alarm event processing")
public class EventController {

    private final NocOrchestrator orchestrator;

    public EventController(NocOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    @Operation(summary = "Process alarm event",
               description = "Run the correlation, decision and notification pipeline for an alarm event")
    public Mono<ResponseEntity<PipelineResult>> processEvent(@RequestBody(required = false) Map<String, Object> event) {
        return orchestrator.processEvent(event)
                .map(result -> ResponseEntity.status(statusOf(result)).body(result));
    }

    static HttpStatus statusOf(PipelineResult result) {
        if (result.isSuccess()) {
            return HttpStatus.OK;
        }
        return result.getErrorKind() == ErrorKind.INVALID_INPUT
                ? HttpStatus.BAD_REQUEST
                : HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
