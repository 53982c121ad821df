package com.z254.noc.correlation;

import com.z254.noc.domain.model.Alarm;

/**
 * Cross-namespace relatedness check applied by the correlator when two
 * time-adjacent alarms are in different namespaces.
 */
public interface ResourceRelationship {

    boolean related(Alarm previous, Alarm current);
}
