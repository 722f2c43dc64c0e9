package com.nodegraph.topo.core;

import com.nodegraph.topo.api.EdgePath;
import com.nodegraph.topo.api.ErrorKind;
import com.nodegraph.topo.api.NodeId;
import com.nodegraph.topo.api.PortRole;
import com.nodegraph.topo.api.Position;
import com.nodegraph.topo.api.TopologyException;

import java.util.Optional;

import lombok.extern.log4j.Log4j2;

/**
 * One press-drag-release interaction that may create an edge.
 *
 * <p>
 * Obtained from {@link TopologyRegistry#beginConnection}. While active,
 * {@link #hover} gives cheap feedback without touching the graph, and
 * {@link #ghostPath} draws the provisional edge towards the pointer. The
 * gesture ends on {@link #release} or {@link #cancel}; afterwards every call
 * except {@link #cancel} throws.
 */
@Log4j2
public final class ConnectionGesture {
    private final TopologyRegistry registry;
    private final Port sourcePort;
    private boolean finished;

    ConnectionGesture(TopologyRegistry registry, Port sourcePort) {
        this.registry = registry;
        this.sourcePort = sourcePort;
    }

    public Port sourcePort() {
        return sourcePort;
    }

    public boolean isActive() {
        return !finished;
    }

    /**
     * Pre-checks a candidate target. Never mutates.
     *
     * @return NONE if there is no such port, otherwise ACCEPT or REJECT
     */
    public GestureFeedback hover(NodeId nodeId, int portIndex) {
        ensureActive();
        Optional<Node> candidate = registry.findNode(nodeId);
        if (candidate.isEmpty() || portIndex < 0 || portIndex >= candidate.get().portCount())
            return GestureFeedback.NONE;
        Node target = candidate.get();
        Port targetPort = target.ports().get(portIndex);

        boolean ok = sourcePort.isLive()
                && sourcePort.role() == PortRole.OUTPUT
                && !sourcePort.isConnected()
                && targetPort.role() == PortRole.INPUT
                && !targetPort.isConnected()
                && targetPort != sourcePort
                && target != sourcePort.parent();
        return ok ? GestureFeedback.ACCEPT : GestureFeedback.REJECT;
    }

    /** Provisional path from the source port to the pointer. */
    public EdgePath ghostPath(Position pointer) {
        ensureActive();
        Position start = sourcePort.parent().anchorOf(sourcePort, registry.portLayout());
        return EdgePath.between(start, pointer);
    }

    /**
     * Ends the gesture by running the full connection protocol once.
     *
     * @return the new edge
     * @throws TopologyException if the connection is refused; the gesture is
     *                           finished either way
     */
    public Edge release(NodeId nodeId, int portIndex) {
        ensureActive();
        finish();
        if (!sourcePort.isLive())
            throw new TopologyException(ErrorKind.PORT_INDEX_OUT_OF_RANGE,
                    "Source port " + sourcePort + " was rebuilt during the gesture");
        Edge edge = registry.createEdge(sourcePort.parent().id(), sourcePort.index(), nodeId, portIndex);
        log.debug("Gesture connected {} -> {}:{}", sourcePort, nodeId, portIndex);
        return edge;
    }

    /** Ends the gesture without connecting. Idempotent. */
    public void cancel() {
        if (!finished) {
            finish();
            log.debug("Gesture from {} cancelled", sourcePort);
        }
    }

    private void finish() {
        finished = true;
        registry.gestureFinished(this);
    }

    private void ensureActive() {
        if (finished)
            throw new IllegalStateException("Connection gesture from " + sourcePort + " already finished");
    }
}
