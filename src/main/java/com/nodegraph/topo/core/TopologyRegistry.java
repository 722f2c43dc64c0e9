package com.nodegraph.topo.core;

import com.nodegraph.topo.api.EdgeId;
import com.nodegraph.topo.api.ErrorKind;
import com.nodegraph.topo.api.GraphObserver;
import com.nodegraph.topo.api.NodeId;
import com.nodegraph.topo.api.PortLayout;
import com.nodegraph.topo.api.PortRole;
import com.nodegraph.topo.api.Position;
import com.nodegraph.topo.api.TopologyException;
import com.nodegraph.topo.io.GraphDocument;
import com.nodegraph.topo.io.GraphDocument.EdgeElement;
import com.nodegraph.topo.io.GraphDocument.NodeElement;
import com.nodegraph.topo.io.GraphDocument.RejectedElement;
import com.nodegraph.topo.util.CompositeGraphObserver;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Owner of every node and edge in one graph.
 *
 * <p>
 * The registry holds the two canonical identity maps (node id to node, edge id
 * to edge) and is the only code path that inserts into or removes from them.
 * Nodes, ports and edges expose package-private mutators that only this class
 * calls, so the back-reference sets (incident edges per node, occupant per
 * port) can never drift from the maps.
 *
 * <h3>Deletion</h3>
 * <ul>
 * <li>Edge: unregister from both ports and both nodes, remove from the map,
 * notify, dispose.</li>
 * <li>Node: delete every incident edge (found through the node's own incident
 * set, so the cost is the node's degree), remove the node, notify, dispose.</li>
 * </ul>
 * After any public call returns, no live entity references a removed one.
 *
 * <h3>Threading</h3>
 * Not thread-safe. Drive it from one thread, or feed it through
 * {@code GraphCommandPublisher}.
 */
@Log4j2
public final class TopologyRegistry {
    public static final double DEFAULT_MIN_MOVE_DISTANCE = 5.0;

    private final Map<NodeId, Node> nodes = new LinkedHashMap<>();
    private final Map<EdgeId, Edge> edges = new LinkedHashMap<>();
    private final CompositeGraphObserver observers = new CompositeGraphObserver();
    private final NodeTypeRegistry nodeTypes;
    private final PortLayout portLayout;
    private final double minMoveDistance;

    private int batchDepth;
    private ConnectionGesture activeGesture;

    public TopologyRegistry() {
        this(new NodeTypeRegistry(), DefaultPortLayout.INSTANCE, DEFAULT_MIN_MOVE_DISTANCE);
    }

    public TopologyRegistry(NodeTypeRegistry nodeTypes, PortLayout portLayout, double minMoveDistance) {
        if (minMoveDistance < 0)
            throw new IllegalArgumentException("minMoveDistance must be non-negative: " + minMoveDistance);
        this.nodeTypes = nodeTypes;
        this.portLayout = portLayout;
        this.minMoveDistance = minMoveDistance;
    }

    public NodeTypeRegistry nodeTypes() {
        return nodeTypes;
    }

    public PortLayout portLayout() {
        return portLayout;
    }

    public double minMoveDistance() {
        return minMoveDistance;
    }

    // ── Observers & batches ─────────────────────────────────────────────

    public boolean attachObserver(GraphObserver observer) {
        return observers.attach(observer);
    }

    public boolean detachObserver(GraphObserver observer) {
        return observers.detach(observer);
    }

    /** Opens a batch. Only the outermost begin reaches observers. */
    public void beginBatch() {
        if (batchDepth++ == 0)
            observers.onBatchBegin();
    }

    /**
     * Closes a batch. Only the outermost end reaches observers.
     *
     * @throws IllegalStateException if no batch is open
     */
    public void endBatch() {
        if (batchDepth == 0)
            throw new IllegalStateException("endBatch() without a matching beginBatch()");
        if (--batchDepth == 0)
            observers.onBatchEnd();
    }

    public boolean inBatch() {
        return batchDepth > 0;
    }

    // ── Lookups ─────────────────────────────────────────────────────────

    public Optional<Node> findNode(NodeId id) {
        return Optional.ofNullable(id == null ? null : nodes.get(id));
    }

    public Optional<Edge> findEdge(EdgeId id) {
        return Optional.ofNullable(id == null ? null : edges.get(id));
    }

    /** Nodes in insertion order. */
    public Collection<Node> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    /** Edges in insertion order. */
    public Collection<Edge> edges() {
        return Collections.unmodifiableCollection(edges.values());
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    // ── Nodes ───────────────────────────────────────────────────────────

    public Node createNode(String type, Position position) {
        return createNode(type, position, NodeId.random());
    }

    /**
     * Creates a node with the type's default port counts.
     *
     * @throws IllegalArgumentException if the type is unknown or the id is taken
     */
    public Node createNode(String type, Position position, NodeId id) {
        NodeTypeSpec spec = nodeTypes.require(type);
        if (nodes.containsKey(id))
            throw new IllegalArgumentException("Duplicate node id: " + id);
        Node node = new Node(id, spec.name(), position == null ? Position.ORIGIN : position,
                spec.inputCount(), spec.outputCount());
        insertNode(node);
        return node;
    }

    private void insertNode(Node node) {
        node.attach(this);
        nodes.put(node.id(), node);
        log.debug("Node {} added: {} at {}", node.id().shortForm(), node.type(), node.position());
        observers.onNodeAdded(node);
    }

    /**
     * Deletes a node and every edge touching it. The cascade runs inside one
     * batch.
     *
     * @return false if no such node exists
     */
    public boolean deleteNode(NodeId id) {
        Node node = id == null ? null : nodes.get(id);
        if (node == null) {
            log.warn("deleteNode ignored, unknown node {}", id);
            return false;
        }
        beginBatch();
        try {
            cancelGestureOn(node);
            int degree = removeIncidentEdges(node);
            nodes.remove(id);
            observers.onNodeRemoved(node);
            node.dispose();
            log.debug("Node {} deleted with {} incident edges", id.shortForm(), degree);
        } finally {
            endBatch();
        }
        return true;
    }

    private int removeIncidentEdges(Node node) {
        List<Edge> incident = new ArrayList<>(node.incidentEdges());
        for (Edge edge : incident)
            removeEdge(edge);
        return incident.size();
    }

    public boolean moveNode(NodeId id, Position position) {
        Node node = id == null ? null : nodes.get(id);
        if (node == null) {
            log.warn("moveNode ignored, unknown node {}", id);
            return false;
        }
        Position from = node.moveTo(position, minMoveDistance);
        if (from != null) {
            node.refreshEdgePaths(portLayout);
            observers.onNodeMoved(node, from, position);
        }
        return true;
    }

    public boolean translateNode(NodeId id, double dx, double dy) {
        Node node = id == null ? null : nodes.get(id);
        if (node == null) {
            log.warn("translateNode ignored, unknown node {}", id);
            return false;
        }
        return moveNode(id, node.position().translate(dx, dy));
    }

    /**
     * Changes a node's type. Every incident edge is deleted first, then the
     * ports are rebuilt with the new type's counts.
     *
     * @throws IllegalArgumentException if the type is unknown (nothing changes)
     */
    public boolean setNodeType(NodeId id, String type) {
        NodeTypeSpec spec = nodeTypes.require(type);
        return rebuild(id, spec.name(), spec.inputCount(), spec.outputCount());
    }

    /**
     * Changes a node's port counts, keeping its type tag. Same cascade as
     * {@link #setNodeType}.
     *
     * @throws IllegalArgumentException if a count is negative or the total
     *                                  exceeds {@link Node#MAX_PORTS}
     */
    public boolean setPortCounts(NodeId id, int inputCount, int outputCount) {
        if (!Node.isValidPortCounts(inputCount, outputCount))
            throw new IllegalArgumentException("Port counts must be non-negative and total at most "
                    + Node.MAX_PORTS + ": " + inputCount + "/" + outputCount);
        Node node = id == null ? null : nodes.get(id);
        return rebuild(id, node == null ? null : node.type(), inputCount, outputCount);
    }

    private boolean rebuild(NodeId id, String type, int inputCount, int outputCount) {
        Node node = id == null ? null : nodes.get(id);
        if (node == null) {
            log.warn("Port rebuild ignored, unknown node {}", id);
            return false;
        }
        beginBatch();
        try {
            cancelGestureOn(node);
            removeIncidentEdges(node);
            node.rebuildPorts(type, inputCount, outputCount);
            observers.onNodeChanged(node);
        } finally {
            endBatch();
        }
        return true;
    }

    // ── Edges ───────────────────────────────────────────────────────────

    /**
     * Connects two existing nodes. All-or-nothing: on failure no node, port or
     * map is touched.
     *
     * @throws TopologyException with the first failing resolution check
     */
    public Edge createEdge(NodeId sourceId, int sourceIndex, NodeId targetId, int targetIndex) {
        return createEdge(EdgeId.random(), sourceId, sourceIndex, targetId, targetIndex);
    }

    /** Same as the id overload, for callers holding node references. */
    public Edge createEdge(Node source, int sourceIndex, Node target, int targetIndex) {
        requireOwned(source, "Source");
        requireOwned(target, "Target");
        return createEdge(source.id(), sourceIndex, target.id(), targetIndex);
    }

    public Edge createEdge(EdgeId edgeId, NodeId sourceId, int sourceIndex, NodeId targetId, int targetIndex) {
        if (edges.containsKey(edgeId))
            throw new IllegalArgumentException("Duplicate edge id: " + edgeId);
        Edge edge = new Edge(edgeId, sourceId, sourceIndex, targetId, targetIndex);
        edge.resolve(this);
        insertEdge(edge);
        return edge;
    }

    private void requireOwned(Node node, String side) {
        if (node.belongsTo(this))
            return;
        if (node.owner() != null)
            throw new TopologyException(ErrorKind.CROSS_GRAPH_EDGE,
                    side + " node " + node.id().shortForm() + " belongs to another registry");
        throw new TopologyException(ErrorKind.ENDPOINT_NOT_FOUND,
                side + " node " + node.id().shortForm() + " is not registered");
    }

    private void insertEdge(Edge edge) {
        edges.put(edge.id(), edge);
        observers.onEdgeAdded(edge);
    }

    /**
     * Dry run of the resolution checks.
     *
     * @return the failure kind, or empty if the connection would succeed
     */
    public Optional<ErrorKind> canConnect(NodeId sourceId, int sourceIndex, NodeId targetId, int targetIndex) {
        try {
            Edge.check(this, sourceId, sourceIndex, targetId, targetIndex);
            return Optional.empty();
        } catch (TopologyException e) {
            return Optional.of(e.kind());
        }
    }

    public boolean deleteEdge(EdgeId id) {
        Edge edge = id == null ? null : edges.get(id);
        if (edge == null) {
            log.warn("deleteEdge ignored, unknown edge {}", id);
            return false;
        }
        removeEdge(edge);
        return true;
    }

    private void removeEdge(Edge edge) {
        edge.detach();
        edges.remove(edge.id());
        observers.onEdgeRemoved(edge);
        edge.dispose();
        log.debug("Edge {} deleted", edge.id().shortForm());
    }

    // ── Gestures ────────────────────────────────────────────────────────

    /**
     * Starts an interactive connection from a concrete port. Any gesture
     * already in progress is cancelled.
     *
     * @throws TopologyException ENDPOINT_NOT_FOUND or PORT_INDEX_OUT_OF_RANGE
     */
    public ConnectionGesture beginConnection(NodeId nodeId, int portIndex) {
        Node node = findNode(nodeId).orElseThrow(() -> new TopologyException(ErrorKind.ENDPOINT_NOT_FOUND,
                "Cannot start a connection from unknown node " + nodeId));
        Port port = node.getPort(portIndex);
        cancelActiveGesture();
        activeGesture = new ConnectionGesture(this, port);
        return activeGesture;
    }

    public Optional<ConnectionGesture> activeGesture() {
        return Optional.ofNullable(activeGesture);
    }

    void gestureFinished(ConnectionGesture gesture) {
        if (activeGesture == gesture)
            activeGesture = null;
    }

    private void cancelActiveGesture() {
        if (activeGesture != null)
            activeGesture.cancel();
    }

    private void cancelGestureOn(Node node) {
        if (activeGesture != null && activeGesture.sourcePort().parent() == node)
            activeGesture.cancel();
    }

    // ── Whole-graph operations ──────────────────────────────────────────

    /**
     * Drops every node and edge. The maps are emptied before anything is
     * disposed; observers get a single cleared notification.
     */
    public void clear() {
        cancelActiveGesture();
        List<Edge> oldEdges = new ArrayList<>(edges.values());
        List<Node> oldNodes = new ArrayList<>(nodes.values());
        edges.clear();
        nodes.clear();
        for (Edge edge : oldEdges)
            edge.dispose();
        for (Node node : oldNodes)
            node.dispose();
        log.debug("Registry cleared: {} nodes, {} edges", oldNodes.size(), oldEdges.size());
        observers.onGraphCleared();
    }

    /**
     * Replaces the graph with the document's contents.
     *
     * <p>
     * Runs inside one batch. Phase A creates every node and reads every edge
     * as unresolved; phase B resolves the edges against the fully populated
     * node map. A bad element is recorded in the summary and skipped.
     */
    public LoadSummary loadFromDocument(GraphDocument document) {
        String source = document.getSource() == null ? "memory" : document.getSource();
        List<LoadSummary.Failure> failures = new ArrayList<>();
        int nodesLoaded = 0;
        int nodesFailed = 0;
        int edgesResolved = 0;
        int edgesFailed = 0;

        for (RejectedElement rejected : document.getRejected()) {
            failures.add(new LoadSummary.Failure(rejected.label(), ErrorKind.MALFORMED_DOCUMENT_ENTITY,
                    rejected.message()));
            if (rejected.section() == RejectedElement.Section.NODE)
                nodesFailed++;
            else
                edgesFailed++;
        }

        beginBatch();
        try {
            clear();

            // Phase A: nodes
            List<NodeElement> nodeElements = document.getNodes() == null ? List.of() : document.getNodes();
            for (int i = 0; i < nodeElements.size(); i++) {
                NodeElement element = nodeElements.get(i);
                try {
                    Node node = Node.fromElement(element, nodeTypes);
                    if (nodes.containsKey(node.id()))
                        throw new TopologyException(ErrorKind.MALFORMED_DOCUMENT_ENTITY,
                                "Duplicate node id " + node.id());
                    insertNode(node);
                    nodesLoaded++;
                } catch (TopologyException e) {
                    nodesFailed++;
                    failures.add(failure(element == null ? null : element.getId(), "nodes[" + i + "]", e));
                }
            }

            // Phase A: edges, unresolved
            List<EdgeElement> edgeElements = document.getEdges() == null ? List.of() : document.getEdges();
            List<Edge> pending = new ArrayList<>(edgeElements.size());
            Set<EdgeId> seen = new HashSet<>();
            for (int i = 0; i < edgeElements.size(); i++) {
                EdgeElement element = edgeElements.get(i);
                try {
                    Edge edge = Edge.fromElement(element);
                    if (!seen.add(edge.id()))
                        throw new TopologyException(ErrorKind.MALFORMED_DOCUMENT_ENTITY,
                                "Duplicate edge id " + edge.id());
                    pending.add(edge);
                } catch (TopologyException e) {
                    edgesFailed++;
                    failures.add(failure(element == null ? null : element.getId(), "edges[" + i + "]", e));
                }
            }

            // Phase B: resolve against the complete node map
            for (Edge edge : pending) {
                try {
                    edge.resolve(this);
                    insertEdge(edge);
                    edgesResolved++;
                } catch (TopologyException e) {
                    edgesFailed++;
                    failures.add(new LoadSummary.Failure(edge.id().value(), e.kind(), e.getMessage()));
                }
            }

            LoadSummary summary = new LoadSummary(source, nodesLoaded, nodesFailed, edgesResolved, edgesFailed,
                    failures);
            for (LoadSummary.Failure f : summary.failures())
                log.warn("Load {}: skipped {} ({})", source, f.elementId(), f.message());
            log.info("Loaded {}", summary);
            observers.onGraphLoaded(source);
            return summary;
        } finally {
            endBatch();
        }
    }

    private static LoadSummary.Failure failure(String id, String fallbackLabel, TopologyException e) {
        String label = id == null || id.isBlank() ? fallbackLabel : id;
        return new LoadSummary.Failure(label, e.kind(), e.getMessage());
    }

    public GraphDocument saveToDocument() {
        return saveToDocument("memory");
    }

    /**
     * Snapshots the graph as a flat document, nodes then edges, each in
     * insertion order.
     *
     * @param target label passed to observers (file name or caller tag)
     */
    public GraphDocument saveToDocument(String target) {
        GraphDocument document = new GraphDocument();
        document.setSource(target);
        for (Node node : nodes.values())
            document.getNodes().add(node.toElement());
        for (Edge edge : edges.values())
            document.getEdges().add(edge.toElement());
        log.debug("Saved {} nodes, {} edges to {}", nodes.size(), edges.size(), target);
        observers.onGraphSaved(target);
        return document;
    }

    // ── Diagnostics ─────────────────────────────────────────────────────

    public GraphStats stats() {
        Map<String, Integer> byType = new LinkedHashMap<>();
        int freePorts = 0;
        for (Node node : nodes.values()) {
            byType.merge(node.type(), 1, Integer::sum);
            for (Port port : node.ports())
                if (!port.isConnected())
                    freePorts++;
        }
        return new GraphStats(nodes.size(), edges.size(), freePorts, byType);
    }

    /**
     * Cross-checks the identity maps against every back-reference.
     *
     * @return one line per violation; empty when the graph is consistent
     */
    public List<String> validateIntegrity() {
        List<String> violations = new ArrayList<>();
        for (Map.Entry<EdgeId, Edge> entry : edges.entrySet()) {
            Edge edge = entry.getValue();
            if (!entry.getKey().equals(edge.id()))
                violations.add("Edge keyed as " + entry.getKey() + " has id " + edge.id());
            if (!edge.isLive() || !(edge.state() instanceof EdgeState.Resolved r) || !edge.isAttached()) {
                violations.add("Edge " + edge.id() + " in map is not resolved: " + edge.state());
                continue;
            }
            if (nodes.get(edge.sourceNodeId()) != r.source())
                violations.add("Edge " + edge.id() + " source is not the registered node " + edge.sourceNodeId());
            if (nodes.get(edge.targetNodeId()) != r.target())
                violations.add("Edge " + edge.id() + " target is not the registered node " + edge.targetNodeId());
            if (r.sourcePort().role() != PortRole.OUTPUT || r.targetPort().role() != PortRole.INPUT)
                violations.add("Edge " + edge.id() + " connects " + r.sourcePort() + " to " + r.targetPort());
            if (!r.sourcePort().isLive() || r.sourcePort().occupant() != edge)
                violations.add("Edge " + edge.id() + " does not occupy its source port " + r.sourcePort());
            if (!r.targetPort().isLive() || r.targetPort().occupant() != edge)
                violations.add("Edge " + edge.id() + " does not occupy its target port " + r.targetPort());
            if (!r.source().incidentEdges().contains(edge) || !r.target().incidentEdges().contains(edge))
                violations.add("Edge " + edge.id() + " missing from an endpoint's incident set");
        }
        for (Map.Entry<NodeId, Node> entry : nodes.entrySet()) {
            Node node = entry.getValue();
            if (!entry.getKey().equals(node.id()))
                violations.add("Node keyed as " + entry.getKey() + " has id " + node.id());
            if (!node.isLive() || !node.belongsTo(this))
                violations.add("Node " + node.id() + " in map is not live and owned");
            for (Edge edge : node.incidentEdges())
                if (edges.get(edge.id()) != edge || !edge.touches(node.id()))
                    violations.add("Node " + node.id() + " lists stale incident edge " + edge.id());
            for (Port port : node.ports()) {
                Edge occupant = port.occupant();
                if (occupant != null && edges.get(occupant.id()) != occupant)
                    violations.add("Port " + port + " occupied by unregistered edge " + occupant.id());
            }
        }
        if (!violations.isEmpty())
            log.error("Integrity check found {} violations", violations.size());
        return violations;
    }
}
