package com.z254.noc.correlation;

import com.z254.noc.domain.model.Alarm;

/**
 * Alarms in different namespaces are never related.
 */
public class NoResourceRelationship implements ResourceRelationship {

    @Override
    public boolean related(Alarm previous, Alarm current) {
        return false;
    }
}
