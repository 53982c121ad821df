package com.z254.noc.correlation;

import com.z254.noc.config.NocProperties;
import com.z254.noc.domain.model.Alarm;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResourceRelationshipTest {

    private final Alarm ec2 = Alarm.builder().alarmName("cpu").namespace("AWS/EC2")
            .dimensions(Map.of("InstanceId", "i-1")).build();
    private final Alarm ebs = Alarm.builder().alarmName("disk").namespace("AWS/EBS")
            .dimensions(Map.of("InstanceId", "i-1", "VolumeId", "v-9")).build();
    private final Alarm rds = Alarm.builder().alarmName("db").namespace("AWS/RDS").build();

    @Test
    @DisplayName("NONE never relates alarms")
    void noneNeverRelates() {
        assertThat(new NoResourceRelationship().related(ec2, ebs)).isFalse();
    }

    @Test
    @DisplayName("NAMESPACE relates equal non-null namespaces")
    void namespaceRelatesEqualNamespaces() {
        NamespaceResourceRelationship relationship = new NamespaceResourceRelationship();

        assertThat(relationship.related(ec2, ec2.toBuilder().alarmName("mem").build())).isTrue();
        assertThat(relationship.related(ec2, ebs)).isFalse();
        assertThat(relationship.related(Alarm.builder().build(), Alarm.builder().build())).isFalse();
    }

    @Test
    @DisplayName("TAG relates alarms sharing a configured dimension value")
    void tagRelatesSharedDimensions() {
        assertThat(new TagResourceRelationship(List.of("InstanceId")).related(ec2, ebs)).isTrue();
        assertThat(new TagResourceRelationship(List.of("VolumeId")).related(ec2, ebs)).isFalse();
        assertThat(new TagResourceRelationship(List.of("InstanceId")).related(ec2, rds)).isFalse();
    }

    @Test
    @DisplayName("TOPOLOGY relates linked namespaces in both directions")
    void topologyIsUndirected() {
        TopologyResourceRelationship relationship =
                new TopologyResourceRelationship(Map.of("AWS/EC2", List.of("AWS/RDS")));

        assertThat(relationship.related(ec2, rds)).isTrue();
        assertThat(relationship.related(rds, ec2)).isTrue();
        assertThat(relationship.related(ec2, ebs)).isFalse();
    }

    @Test
    @DisplayName("Configuration selects the strategy")
    void configSelectsStrategy() {
        NocProperties properties = new NocProperties();
        CorrelationConfig config = new CorrelationConfig();

        assertThat(config.resourceRelationship(properties)).isInstanceOf(NoResourceRelationship.class);

        properties.getCorrelation().setRelationshipStrategy(NocProperties.RelationshipStrategy.TAG);
        assertThat(config.resourceRelationship(properties)).isInstanceOf(TagResourceRelationship.class);
    }
}
