package com.z254.noc.correlation;

import com.z254.noc.config.NocProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the {@link ResourceRelationship} strategy from configuration.
 */
@Slf4j
@Configuration
public class CorrelationConfig {

    @Bean
    public ResourceRelationship resourceRelationship(NocProperties nocProperties) {
        NocProperties.Correlation correlation = nocProperties.getCorrelation();
        log.info("Using resource relationship strategy: {}", correlation.getRelationshipStrategy());

        return switch (correlation.getRelationshipStrategy()) {
            case NONE -> new NoResourceRelationship();
            case NAMESPACE -> new NamespaceResourceRelationship();
            case TAG -> new TagResourceRelationship(correlation.getRelationshipTags());
            case TOPOLOGY -> new TopologyResourceRelationship(correlation.getTopology());
        };
    }
}
