package com.nodegraph.topo.core;

import java.util.Map;

/**
 * Point-in-time counts of a registry.
 *
 * @param nodesByType node count per type tag, in first-seen order
 */
public record GraphStats(int nodeCount, int edgeCount, int unconnectedPorts, Map<String, Integer> nodesByType) {

    public GraphStats {
        nodesByType = Map.copyOf(nodesByType);
    }

    public int countOf(String type) {
        return nodesByType.getOrDefault(type, 0);
    }
}
