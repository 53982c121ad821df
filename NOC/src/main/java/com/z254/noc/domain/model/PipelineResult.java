package com.z254.noc.domain.model;

import com.z254.noc.domain.error.ErrorKind;
import com.z254.noc.domain.error.StageError;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate result of one pipeline run.
 * <p>
 * An {@link ResultStatus#ERROR} result never carries results; local degradations
 * inside a successful run show up as warnings and per-record errors.
 */
@Value
@Builder
public class PipelineResult {

    ResultStatus status;

    @Builder.Default
    List<IncidentRecord> results = List.of();

    /** Degradations that did not abort the run */
    @Builder.Default
    List<StageError> warnings = List.of();

    String error;

    ErrorKind errorKind;

    Instant timestamp;

    public static PipelineResult success(List<IncidentRecord> results, List<StageError> warnings) {
        return PipelineResult.builder()
                .status(ResultStatus.SUCCESS)
                .results(List.copyOf(results))
                .warnings(List.copyOf(warnings))
                .timestamp(Instant.now())
                .build();
    }

    public static PipelineResult error(ErrorKind kind, String message) {
        return PipelineResult.builder()
                .status(ResultStatus.ERROR)
                .error(message)
                .errorKind(kind)
                .timestamp(Instant.now())
                .build();
    }

    public boolean isSuccess() {
        return status == ResultStatus.SUCCESS;
    }
}
