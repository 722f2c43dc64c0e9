package com.nodegraph.topo.core;

import com.nodegraph.topo.api.EdgeId;
import com.nodegraph.topo.api.EdgePath;
import com.nodegraph.topo.api.ErrorKind;
import com.nodegraph.topo.api.NodeId;
import com.nodegraph.topo.api.PortLayout;
import com.nodegraph.topo.api.PortRole;
import com.nodegraph.topo.api.TopologyException;
import com.nodegraph.topo.io.GraphDocument.EdgeElement;

import lombok.extern.log4j.Log4j2;

/**
 * A directed connection from one OUTPUT port to one INPUT port.
 *
 * Self-description:
 * The edge always keeps the identifiers it was authored with (source node id,
 * source socket index, target node id, target socket index). These are what
 * gets written to the document, and what {@link #resolve} turns into direct
 * references.
 *
 * Lifecycle: Unresolved -> Resolved -> Invalidated
 * - Unresolved: just read from a document, or just built for createEdge.
 * - Resolved: both endpoints validated and registered (incident sets on both
 * nodes, occupancy on both ports).
 * - Invalidated: an endpoint node died, or the registry disposed the edge.
 *
 * The edge never removes itself from the registry. When an endpoint dies the
 * edge only clears its own references; pruning is the registry's job and
 * happens synchronously inside the deletion that killed the endpoint.
 */
@Log4j2
public final class Edge {
    private final EdgeId id;
    private final NodeId sourceNodeId;
    private final int sourceSocketIndex;
    private final NodeId targetNodeId;
    private final int targetSocketIndex;

    private EdgeState state = EdgeState.UNRESOLVED;
    private EdgePath path;
    private boolean attached;
    private boolean disposed;

    Edge(EdgeId id, NodeId sourceNodeId, int sourceSocketIndex, NodeId targetNodeId, int targetSocketIndex) {
        this.id = id;
        this.sourceNodeId = sourceNodeId;
        this.sourceSocketIndex = sourceSocketIndex;
        this.targetNodeId = targetNodeId;
        this.targetSocketIndex = targetSocketIndex;
    }

    public EdgeId id() {
        return id;
    }

    public NodeId sourceNodeId() {
        return sourceNodeId;
    }

    public int sourceSocketIndex() {
        return sourceSocketIndex;
    }

    public NodeId targetNodeId() {
        return targetNodeId;
    }

    public int targetSocketIndex() {
        return targetSocketIndex;
    }

    public EdgeState state() {
        return state;
    }

    public boolean isResolved() {
        return state instanceof EdgeState.Resolved;
    }

    public boolean isLive() {
        return !disposed;
    }

    /** True while registered with its endpoint nodes and ports. */
    public boolean isAttached() {
        return attached;
    }

    /** True if either stored endpoint id equals {@code nodeId}. */
    public boolean touches(NodeId nodeId) {
        return sourceNodeId.equals(nodeId) || targetNodeId.equals(nodeId);
    }

    /** Rendered path, or null while unresolved. */
    public EdgePath path() {
        return path;
    }

    public Node source() {
        return live().source();
    }

    public Port sourcePort() {
        return live().sourcePort();
    }

    public Node target() {
        return live().target();
    }

    public Port targetPort() {
        return live().targetPort();
    }

    /**
     * Returns the resolved state after checking that every reference is still
     * live. A dead reference here is a broken invalidation protocol, not a
     * recoverable condition.
     */
    private EdgeState.Resolved live() {
        if (state instanceof EdgeState.Resolved r) {
            if (!r.source().isLive() || !r.target().isLive()
                    || !r.sourcePort().isLive() || !r.targetPort().isLive())
                throw new IllegalStateException("Edge " + id.shortForm() + " references a disposed endpoint");
            return r;
        }
        throw new IllegalStateException("Edge " + id.shortForm() + " is not resolved: " + state);
    }

    // ── Resolution protocol ─────────────────────────────────────────────

    /**
     * Validates a prospective connection against the registry without touching
     * any state.
     *
     * @return the references the edge would hold once resolved
     * @throws TopologyException with the first failing check
     */
    static EdgeState.Resolved check(TopologyRegistry registry, NodeId sourceId, int sourceIndex,
            NodeId targetId, int targetIndex) {
        // 1. Endpoints
        Node source = registry.findNode(sourceId).orElseThrow(() -> new TopologyException(
                ErrorKind.ENDPOINT_NOT_FOUND, "Source node not found: " + String.valueOf(sourceId)));
        Node target = registry.findNode(targetId).orElseThrow(() -> new TopologyException(
                ErrorKind.ENDPOINT_NOT_FOUND, "Target node not found: " + String.valueOf(targetId)));

        // 2. Ports against the nodes' current port lists
        Port sourcePort = source.getPort(sourceIndex);
        Port targetPort = target.getPort(targetIndex);

        // 3. Direction is never swapped
        if (sourcePort.role() != PortRole.OUTPUT)
            throw new TopologyException(ErrorKind.ROLE_MISMATCH,
                    "Source port " + sourcePort + " must be OUTPUT");
        if (targetPort.role() != PortRole.INPUT)
            throw new TopologyException(ErrorKind.ROLE_MISMATCH,
                    "Target port " + targetPort + " must be INPUT");

        // 4. Single occupancy
        if (sourcePort.isConnected())
            throw new TopologyException(ErrorKind.PORT_ALREADY_CONNECTED,
                    "Source port " + sourcePort + " already hosts edge " + sourcePort.occupant().id().shortForm());
        if (targetPort.isConnected())
            throw new TopologyException(ErrorKind.PORT_ALREADY_CONNECTED,
                    "Target port " + targetPort + " already hosts edge " + targetPort.occupant().id().shortForm());

        // 5. Same registry
        if (!source.belongsTo(registry) || !target.belongsTo(registry))
            throw new TopologyException(ErrorKind.CROSS_GRAPH_EDGE,
                    "Endpoints " + source.id().shortForm() + " and " + target.id().shortForm()
                            + " do not belong to the same registry");

        return new EdgeState.Resolved(source, sourcePort, target, targetPort);
    }

    /**
     * Resolves the stored identifiers into direct references.
     * On failure nothing is modified and the edge stays unresolved.
     */
    void resolve(TopologyRegistry registry) {
        if (!(state instanceof EdgeState.Unresolved))
            throw new IllegalStateException("Edge " + id.shortForm() + " cannot be resolved from " + state);

        EdgeState.Resolved r = check(registry, sourceNodeId, sourceSocketIndex, targetNodeId, targetSocketIndex);

        // 6. Commit
        r.sourcePort().connect(this);
        r.targetPort().connect(this);
        r.source().registerIncidentEdge(this);
        if (r.target() != r.source())
            r.target().registerIncidentEdge(this);
        state = r;
        attached = true;
        updatePath(registry.portLayout());

        log.debug("Edge {} resolved {}:{} -> {}:{}", id.shortForm(),
                sourceNodeId.shortForm(), sourceSocketIndex, targetNodeId.shortForm(), targetSocketIndex);
    }

    void updatePath(PortLayout layout) {
        if (state instanceof EdgeState.Resolved r)
            path = EdgePath.between(r.source().anchorOf(r.sourcePort(), layout),
                    r.target().anchorOf(r.targetPort(), layout));
    }

    /**
     * Clears the references that point at {@code deadNode}. The other side, if
     * any, is kept so the registry can still unregister from it.
     */
    void invalidate(Node deadNode) {
        Node source;
        Port sourcePort;
        Node target;
        Port targetPort;
        if (state instanceof EdgeState.Resolved r) {
            source = r.source();
            sourcePort = r.sourcePort();
            target = r.target();
            targetPort = r.targetPort();
        } else if (state instanceof EdgeState.Invalidated inv) {
            source = inv.source();
            sourcePort = inv.sourcePort();
            target = inv.target();
            targetPort = inv.targetPort();
        } else {
            return;
        }
        if (source != deadNode && target != deadNode)
            return;
        if (source == deadNode) {
            source = null;
            sourcePort = null;
        }
        if (target == deadNode) {
            target = null;
            targetPort = null;
        }
        state = new EdgeState.Invalidated(source, sourcePort, target, targetPort);
        path = null;
        log.debug("Edge {} invalidated by death of node {}", id.shortForm(), deadNode.id().shortForm());
    }

    /**
     * Unregisters from every endpoint still referenced. The references
     * themselves stay readable until {@link #dispose()}, so removal observers
     * can still inspect the edge.
     */
    void detach() {
        if (!attached)
            return;
        if (state instanceof EdgeState.Resolved r) {
            detachFrom(r.source(), r.sourcePort());
            if (r.target() != r.source())
                detachFrom(r.target(), r.targetPort());
            else
                release(r.targetPort());
        } else if (state instanceof EdgeState.Invalidated inv) {
            if (inv.source() != null)
                detachFrom(inv.source(), inv.sourcePort());
            if (inv.target() != null && inv.target() != inv.source())
                detachFrom(inv.target(), inv.targetPort());
        }
        attached = false;
    }

    /** Detaches if still attached and drops all references. */
    void dispose() {
        if (disposed)
            return;
        detach();
        state = EdgeState.Invalidated.DISPOSED;
        path = null;
        disposed = true;
    }

    private void detachFrom(Node node, Port port) {
        release(port);
        if (node.isLive() && node.incidentEdges().contains(this))
            node.unregisterIncidentEdge(this);
    }

    private void release(Port port) {
        if (port.isLive() && port.occupant() == this)
            port.disconnect();
    }

    /**
     * Builds an unresolved edge from its document form. A missing id is
     * replaced by a fresh one.
     *
     * @throws TopologyException MALFORMED_DOCUMENT_ENTITY if an endpoint id or
     *                           socket index is missing
     */
    static Edge fromElement(EdgeElement element) {
        if (element == null)
            throw malformed("Null edge element");
        if (isBlank(element.getSourceNodeId()) || isBlank(element.getTargetNodeId()))
            throw malformed("Edge element is missing an endpoint node id");
        if (element.getSourceSocketIndex() == null || element.getTargetSocketIndex() == null)
            throw malformed("Edge element is missing a socket index");
        EdgeId id = isBlank(element.getId()) ? EdgeId.random() : EdgeId.of(element.getId());
        return new Edge(id, NodeId.of(element.getSourceNodeId()), element.getSourceSocketIndex(),
                NodeId.of(element.getTargetNodeId()), element.getTargetSocketIndex());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static TopologyException malformed(String message) {
        return new TopologyException(ErrorKind.MALFORMED_DOCUMENT_ENTITY, message);
    }

    /** Document form: the stored ids and socket indices, whatever the state. */
    public EdgeElement toElement() {
        return new EdgeElement(id.value(), sourceNodeId.value(), sourceSocketIndex, targetNodeId.value(),
                targetSocketIndex);
    }

    @Override
    public String toString() {
        return "Edge[" + id.shortForm() + " " + sourceNodeId.shortForm() + ":" + sourceSocketIndex
                + " -> " + targetNodeId.shortForm() + ":" + targetSocketIndex + " "
                + state.getClass().getSimpleName() + "]";
    }
}
