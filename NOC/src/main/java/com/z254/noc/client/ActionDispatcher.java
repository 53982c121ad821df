package com.z254.noc.client;

import com.z254.noc.domain.model.ActionReport;
import com.z254.noc.domain.model.Decision;
import reactor.core.publisher.Mono;

/**
 * Executes the actions of a decision.
 */
public interface ActionDispatcher {

    /**
     * Execute every action in decision order. A failing action yields an error outcome
     * and does not stop the others.
     */
    Mono<ActionReport> execute(Decision decision);
}
