package com.nodegraph.topo.core;

import com.nodegraph.topo.api.ErrorKind;
import com.nodegraph.topo.api.NodeId;
import com.nodegraph.topo.api.PortLayout;
import com.nodegraph.topo.api.PortRole;
import com.nodegraph.topo.api.Position;
import com.nodegraph.topo.api.TopologyException;
import com.nodegraph.topo.io.GraphDocument.NodeElement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A graph vertex: identity, position, type tag and an ordered list of ports.
 *
 * Port Layout:
 * Ports are contiguous and ordered inputs first, then outputs. A node with 2
 * inputs and 1 output has ports {0: INPUT, 1: INPUT, 2: OUTPUT}. The list is
 * only ever replaced as a whole (type change, port count change), never
 * renumbered in place.
 *
 * Incident Edges:
 * The node keeps a back-reference set of every resolved edge that touches it.
 * This is what makes node deletion O(degree) instead of a scan over all edges,
 * and it is the set that must be emptied before the ports are rebuilt or the
 * node is disposed.
 *
 * Mutation:
 * Every mutator is package-private. External code changes nodes only through
 * {@link TopologyRegistry}, which is the single writer path for the canonical
 * maps and for these back-reference sets.
 */
public final class Node {
    private static final Logger log = LogManager.getLogger(Node.class);

    /** Upper bound on inputs plus outputs for a single node. */
    public static final int MAX_PORTS = 1024;

    private final NodeId id;
    private String type;
    private Position position;
    private Position lastNotifiedPosition;
    private List<Port> ports = List.of();
    private int inputCount;
    private int outputCount;
    private final Set<Edge> incidentEdges = new LinkedHashSet<>();

    private TopologyRegistry owner;
    private boolean disposed;

    Node(NodeId id, String type, Position position, int inputCount, int outputCount) {
        this.id = id;
        this.type = type;
        this.position = position;
        this.lastNotifiedPosition = position;
        buildPorts(inputCount, outputCount);
    }

    public NodeId id() {
        return id;
    }

    public String type() {
        return type;
    }

    public Position position() {
        return position;
    }

    public int inputCount() {
        return inputCount;
    }

    public int outputCount() {
        return outputCount;
    }

    public int portCount() {
        return ports.size();
    }

    /** All ports in index order. */
    public List<Port> ports() {
        return ports;
    }

    public List<Port> inputPorts() {
        return ports.subList(0, inputCount);
    }

    public List<Port> outputPorts() {
        return ports.subList(inputCount, ports.size());
    }

    /**
     * Returns the port at the given index.
     *
     * @throws TopologyException PORT_INDEX_OUT_OF_RANGE if the index is
     *                           negative, beyond the current port count, or
     *                           the node has been disposed
     */
    public Port getPort(int index) {
        if (disposed)
            throw new TopologyException(ErrorKind.PORT_INDEX_OUT_OF_RANGE,
                    "Node " + id.shortForm() + " is disposed; port " + index + " is stale");
        if (index < 0 || index >= ports.size())
            throw new TopologyException(ErrorKind.PORT_INDEX_OUT_OF_RANGE,
                    "Port index " + index + " out of range [0," + ports.size() + ") on node " + id.shortForm());
        return ports.get(index);
    }

    /** Read-only view of the resolved edges touching this node. */
    public Set<Edge> incidentEdges() {
        return Collections.unmodifiableSet(incidentEdges);
    }

    public int incidentEdgeCount() {
        return incidentEdges.size();
    }

    public boolean isLive() {
        return !disposed;
    }

    /** True while this node is registered in the given registry. */
    public boolean belongsTo(TopologyRegistry registry) {
        return owner != null && owner == registry;
    }

    TopologyRegistry owner() {
        return owner;
    }

    void attach(TopologyRegistry registry) {
        if (owner != null)
            throw new IllegalStateException("Node " + id.shortForm() + " already belongs to a registry");
        this.owner = registry;
    }

    // ── Ports ───────────────────────────────────────────────────────────

    /**
     * Discards the current ports and builds new ones.
     * The caller must have deleted every incident edge first.
     */
    void rebuildPorts(String newType, int newInputs, int newOutputs) {
        if (!incidentEdges.isEmpty())
            throw new IllegalStateException("Node " + id.shortForm() + " still has "
                    + incidentEdges.size() + " incident edges; delete them before rebuilding ports");
        for (Port p : ports)
            p.release();
        this.type = newType;
        buildPorts(newInputs, newOutputs);
        log.debug("Node {} rebuilt as {} with {} IN {} OUT", id.shortForm(), newType, newInputs, newOutputs);
    }

    /** True if both counts are non-negative and together stay within {@link #MAX_PORTS}. */
    public static boolean isValidPortCounts(int inputs, int outputs) {
        return inputs >= 0 && outputs >= 0 && (long) inputs + outputs <= MAX_PORTS;
    }

    private void buildPorts(int inputs, int outputs) {
        if (!isValidPortCounts(inputs, outputs))
            throw new IllegalArgumentException("Port counts must be non-negative and total at most "
                    + MAX_PORTS + ": " + inputs + "/" + outputs);
        List<Port> next = new ArrayList<>(inputs + outputs);
        int index = 0;
        for (int i = 0; i < inputs; i++)
            next.add(new Port(this, PortRole.INPUT, index++, i));
        for (int i = 0; i < outputs; i++)
            next.add(new Port(this, PortRole.OUTPUT, index++, i));
        this.ports = Collections.unmodifiableList(next);
        this.inputCount = inputs;
        this.outputCount = outputs;
    }

    // ── Incident edges ──────────────────────────────────────────────────

    void registerIncidentEdge(Edge edge) {
        if (!incidentEdges.add(edge))
            throw new IllegalStateException("Edge " + edge.id().shortForm()
                    + " already registered with node " + id.shortForm());
    }

    void unregisterIncidentEdge(Edge edge) {
        if (!incidentEdges.remove(edge))
            throw new IllegalStateException("Edge " + edge.id().shortForm()
                    + " is not registered with node " + id.shortForm());
    }

    // ── Position ────────────────────────────────────────────────────────

    /**
     * Moves the node.
     *
     * @return the previously notified position if the displacement since then
     *         exceeds {@code threshold}, otherwise null
     */
    Position moveTo(Position target, double threshold) {
        this.position = target;
        if (lastNotifiedPosition.manhattanDistance(target) > threshold) {
            Position from = lastNotifiedPosition;
            lastNotifiedPosition = target;
            return from;
        }
        return null;
    }

    void refreshEdgePaths(PortLayout layout) {
        for (Edge edge : incidentEdges)
            edge.updatePath(layout);
    }

    /** Anchor point of one of this node's ports under the given layout. */
    public Position anchorOf(Port port, PortLayout layout) {
        int siblings = port.role() == PortRole.INPUT ? inputCount : outputCount;
        return layout.anchor(position, port.role(), port.roleIndex(), siblings);
    }

    // ── Lifecycle ───────────────────────────────────────────────────────

    /**
     * Releases the node. Any edge still referencing it is invalidated first,
     * then the ports are released.
     */
    void dispose() {
        if (disposed)
            return;
        if (!incidentEdges.isEmpty()) {
            log.error("Node {} disposed with {} live incident edges; invalidating them",
                    id.shortForm(), incidentEdges.size());
            for (Edge edge : new ArrayList<>(incidentEdges))
                edge.invalidate(this);
            incidentEdges.clear();
        }
        for (Port p : ports)
            p.release();
        owner = null;
        disposed = true;
    }

    /**
     * Builds an unregistered node from its document form. Missing position
     * reads as the origin; missing type as TRANSFORM; missing counts fall back
     * to the type's defaults, then to one input and one output.
     *
     * @throws TopologyException MALFORMED_DOCUMENT_ENTITY for a missing id or
     *                           counts outside {@link #isValidPortCounts}
     */
    static Node fromElement(NodeElement element, NodeTypeRegistry types) {
        if (element == null)
            throw malformed("Null node element");
        if (element.getId() == null || element.getId().isBlank())
            throw malformed("Node element has no id");
        NodeId id = NodeId.of(element.getId());

        String type = element.getType() == null ? NodeTypeRegistry.TRANSFORM : element.getType();
        Optional<NodeTypeSpec> spec = types.find(type);
        int inputs = element.getInputCount() != null ? element.getInputCount()
                : spec.map(NodeTypeSpec::inputCount).orElse(1);
        int outputs = element.getOutputCount() != null ? element.getOutputCount()
                : spec.map(NodeTypeSpec::outputCount).orElse(1);
        if (!isValidPortCounts(inputs, outputs))
            throw malformed("Node " + id + " has invalid port counts " + inputs + "/" + outputs
                    + " (limit " + MAX_PORTS + " in total)");

        Position position = new Position(element.getX() == null ? 0.0 : element.getX(),
                element.getY() == null ? 0.0 : element.getY());
        return new Node(id, type, position, inputs, outputs);
    }

    private static TopologyException malformed(String message) {
        return new TopologyException(ErrorKind.MALFORMED_DOCUMENT_ENTITY, message);
    }

    /** Document form: id, position, type and port counts. */
    public NodeElement toElement() {
        return new NodeElement(id.value(), position.x(), position.y(), type, inputCount, outputCount);
    }

    @Override
    public String toString() {
        return "Node[" + id.shortForm() + " " + type + " " + inputCount + "IN/" + outputCount + "OUT]";
    }
}
