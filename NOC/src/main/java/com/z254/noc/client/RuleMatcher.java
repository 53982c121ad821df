package com.z254.noc.client;

import com.z254.noc.domain.model.Alarm;
import com.z254.noc.domain.model.RemediationRule;

import java.util.List;

/**
 * Read-only lookup of the remediation rules that apply to a set of alarms.
 */
public interface RuleMatcher {

    List<RemediationRule> matchingRules(List<Alarm> alarms);
}
