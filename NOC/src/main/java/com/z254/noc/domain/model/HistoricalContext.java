package com.z254.noc.domain.model;

import com.z254.noc.domain.error.StageError;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Recent incidents handed to the decision service alongside an alert group.
 * <p>
 * The time range is computed before the store is queried, so a failed lookup still
 * reports the range it attempted.
 */
@Value
@Builder
public class HistoricalContext {

    @Builder.Default
    List<HistoricalIncident> incidents = List.of();

    Instant start;

    Instant end;

    StageError error;

    public static HistoricalContext unavailable(Instant start, Instant end, StageError error) {
        return HistoricalContext.builder()
                .start(start)
                .end(end)
                .error(error)
                .build();
    }

    public boolean isAvailable() {
        return error == null;
    }
}
