package com.z254.noc.client;

import com.z254.noc.domain.model.IncidentRecord;
import reactor.core.publisher.Mono;

/**
 * Receiver of assembled incident records.
 */
public interface IncidentSink {

    Mono<Void> publish(IncidentRecord record);

    /** Name used in logs and warnings */
    default String name() {
        return getClass().getSimpleName();
    }
}
