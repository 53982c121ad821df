package com.z254.noc.incident;

import com.z254.noc.client.RuleMatcher;
import com.z254.noc.config.NocProperties;
import com.z254.noc.domain.model.Alarm;
import com.z254.noc.domain.model.RemediationRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Matches alarms against the remediation rules bound from {@code noc.rules}.
 * <p>
 * A rule is returned once, in configuration order, if it matches any of the alarms.
 */
@Slf4j
@Component
public class ConfiguredRuleMatcher implements RuleMatcher {

    private final NocProperties nocProperties;

    public ConfiguredRuleMatcher(NocProperties nocProperties) {
        this.nocProperties = nocProperties;
    }

    @Override
    public List<RemediationRule> matchingRules(List<Alarm> alarms) {
        if (alarms == null || alarms.isEmpty()) {
            return List.of();
        }
        List<RemediationRule> matching = nocProperties.getRules().stream()
                .filter(rule -> alarms.stream().anyMatch(rule::matches))
                .toList();
        log.debug("{} of {} rules match {} alarms", matching.size(), nocProperties.getRules().size(), alarms.size());
        return matching;
    }
}
