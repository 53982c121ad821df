package com.z254.noc.anomaly;

import com.z254.noc.config.NocProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Key metrics tracked per signal source.
 */
@Component
public class KeyMetricCatalog {

    private final NocProperties nocProperties;

    public KeyMetricCatalog(NocProperties nocProperties) {
        this.nocProperties = nocProperties;
    }

    public Optional<List<String>> keyMetrics(String service) {
        if (service == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(nocProperties.getAnalysis().getKeyMetrics().get(service))
                .map(List::copyOf);
    }
}
