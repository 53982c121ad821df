package com.z254.noc.correlation;

import com.z254.noc.domain.model.Alarm;

import java.util.List;

/**
 * Related when both alarms carry the same value for any of the configured dimension keys,
 * e.g. the same {@code InstanceId} reported under different namespaces.
 */
public class TagResourceRelationship implements ResourceRelationship {

    private final List<String> tagKeys;

    public TagResourceRelationship(List<String> tagKeys) {
        this.tagKeys = List.copyOf(tagKeys);
    }

    @Override
    public boolean related(Alarm previous, Alarm current) {
        for (String key : tagKeys) {
            String value = previous.dimension(key);
            if (value != null && value.equals(current.dimension(key))) {
                return true;
            }
        }
        return false;
    }
}
