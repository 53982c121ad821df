package com.z254.noc.correlation;

import com.z254.noc.domain.model.Alarm;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Related when the configured topology links the two namespaces.
 * <p>
 * Links are undirected: declaring {@code AWS/EC2 -> [AWS/RDS]} also relates RDS to EC2.
 */
public class TopologyResourceRelationship implements ResourceRelationship {

    private final Map<String, Set<String>> adjacency = new HashMap<>();

    public TopologyResourceRelationship(Map<String, List<String>> topology) {
        topology.forEach((namespace, neighbours) -> {
            for (String neighbour : neighbours) {
                adjacency.computeIfAbsent(namespace, k -> new HashSet<>()).add(neighbour);
                adjacency.computeIfAbsent(neighbour, k -> new HashSet<>()).add(namespace);
            }
        });
    }

    @Override
    public boolean related(Alarm previous, Alarm current) {
        if (previous.getNamespace() == null || current.getNamespace() == null) {
            return false;
        }
        return adjacency.getOrDefault(previous.getNamespace(), Set.of()).contains(current.getNamespace());
    }
}
