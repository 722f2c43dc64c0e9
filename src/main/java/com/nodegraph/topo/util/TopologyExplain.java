package com.nodegraph.topo.util;

import com.nodegraph.topo.api.NodeId;
import com.nodegraph.topo.api.PortRole;
import com.nodegraph.topo.core.Edge;
import com.nodegraph.topo.core.GraphStats;
import com.nodegraph.topo.core.Node;
import com.nodegraph.topo.core.Port;
import com.nodegraph.topo.core.TopologyRegistry;

/**
 * Diagnostic utility for inspecting a registry's topology.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions, logging errors, or
 * "toString()" style diagnostics. Allocates strings and walks every entity;
 * keep it out of interactive paths.
 */
public final class TopologyExplain {
    private final TopologyRegistry registry;

    public TopologyExplain(TopologyRegistry registry) {
        this.registry = registry;
    }

    /**
     * Dumps detailed state of a single node.
     */
    public String explainNode(NodeId id) {
        Node node = registry.findNode(id).orElse(null);
        if (node == null)
            return "Node: " + id + " (not found)\n";
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(node.id()).append('\n')
                .append("  Type: ").append(node.type()).append('\n')
                .append("  Position: ").append(node.position().x()).append(", ").append(node.position().y())
                .append('\n')
                .append("  Ports (").append(node.inputCount()).append(" in, ").append(node.outputCount())
                .append(" out):\n");
        for (Port port : node.ports()) {
            sb.append("    [").append(port.index()).append("] ").append(port.role());
            Edge occupant = port.occupant();
            if (occupant != null) {
                NodeId other = port.role() == PortRole.OUTPUT ? occupant.targetNodeId() : occupant.sourceNodeId();
                sb.append(" -> ").append(occupant.id().shortForm()).append(" (").append(other.shortForm())
                        .append(')');
            }
            sb.append('\n');
        }
        return sb.append("  Incident edges: ").append(node.incidentEdgeCount()).append('\n').toString();
    }

    /**
     * One-line summary of counts.
     */
    public String summary() {
        GraphStats stats = registry.stats();
        return "Nodes: " + stats.nodeCount() + ", Edges: " + stats.edgeCount() + ", Free ports: "
                + stats.unconnectedPorts() + ", By type: " + stats.nodesByType();
    }

    /**
     * Generates a Mermaid JS flowchart: one box per node labelled with its type,
     * one arrow per edge labelled with the socket indices.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph LR;\n");

        // 1. Nodes in insertion order
        for (Node node : registry.nodes()) {
            sb.append("  ").append(sanitize(node.id().value()))
                    .append("[\"").append(node.type()).append("<br/>").append(node.id().shortForm())
                    .append("\"];\n");
        }

        // 2. Edges afterwards
        for (Edge edge : registry.edges()) {
            sb.append("  ").append(sanitize(edge.sourceNodeId().value()))
                    .append(" -- \"").append(edge.sourceSocketIndex()).append(':')
                    .append(edge.targetSocketIndex()).append("\" --> ")
                    .append(sanitize(edge.targetNodeId().value())).append(";\n");
        }
        return sb.toString();
    }

    private static String sanitize(String name) {
        return "n_" + name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
