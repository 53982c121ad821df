package com.z254.noc.correlation;

import com.z254.noc.domain.model.Alarm;

import java.util.Objects;

/**
 * Related when both alarms carry the same namespace.
 */
public class NamespaceResourceRelationship implements ResourceRelationship {

    @Override
    public boolean related(Alarm previous, Alarm current) {
        return previous.getNamespace() != null
                && Objects.equals(previous.getNamespace(), current.getNamespace());
    }
}
