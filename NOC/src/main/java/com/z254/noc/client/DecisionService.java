package com.z254.noc.client;

import com.z254.noc.domain.model.Decision;
import com.z254.noc.domain.model.RemediationRule;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Opaque scoring service producing root-cause and remediation judgements.
 * <p>
 * The context shape depends on the caller:
 * <ul>
 *     <li>correlation sends {@code alerts} and {@code history}</li>
 *     <li>the pipeline sends {@code group} and {@code metric_insights}</li>
 *     <li>metric analysis sends samples and anomalies</li>
 * </ul>
 */
public interface DecisionService {

    /**
     * Obtain a decision. Fields absent from the response take their defaults.
     */
    Mono<Decision> decide(Map<String, Object> context, List<RemediationRule> rules);

    /**
     * Qualitative analysis of metric evidence.
     */
    Mono<Map<String, Object>> analyze(Map<String, Object> context);
}
