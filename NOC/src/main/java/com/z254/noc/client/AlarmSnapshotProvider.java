package com.z254.noc.client;

import com.z254.noc.domain.model.Alarm;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Source of the alarms currently firing in the monitored environment.
 */
public interface AlarmSnapshotProvider {

    /**
     * Current firing alarms. May fail with an upstream error; callers degrade to an empty snapshot.
     */
    Mono<List<Alarm>> listFiring();
}
