package com.z254.noc.domain.model;

import com.z254.noc.domain.error.StageError;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Output of one correlation pass.
 */
@Value
@Builder
public class CorrelationResult {

    ResultStatus status;

    @Builder.Default
    List<AlertGroup> groups = List.of();

    Instant correlationTime;

    StageError error;

    public static CorrelationResult success(List<AlertGroup> groups) {
        return CorrelationResult.builder()
                .status(ResultStatus.SUCCESS)
                .groups(List.copyOf(groups))
                .correlationTime(Instant.now())
                .build();
    }

    public static CorrelationResult failure(StageError error) {
        return CorrelationResult.builder()
                .status(ResultStatus.ERROR)
                .groups(List.of())
                .correlationTime(Instant.now())
                .error(error)
                .build();
    }

    public boolean isSuccess() {
        return status == ResultStatus.SUCCESS;
    }
}
