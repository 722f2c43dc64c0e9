package com.nodegraph.topo.core;

import com.nodegraph.topo.api.PortRole;

/**
 * A typed connection point owned by exactly one {@link Node}.
 *
 * A port has no identity of its own: it is addressed as (parent node, index).
 * Ports are never renumbered individually. When the parent rebuilds its port
 * list every old port is released and new ports take over the indices, which
 * is why edges must be torn down before any rebuild.
 *
 * Occupancy is single-slot. The port does not check whether it is free before
 * connecting; that is the job of the resolution protocol in {@link Edge}.
 */
public final class Port {
    private final Node parent;
    private final PortRole role;
    private final int index;
    private final int roleIndex;
    private Edge occupant;
    private boolean released;

    Port(Node parent, PortRole role, int index, int roleIndex) {
        this.parent = parent;
        this.role = role;
        this.index = index;
        this.roleIndex = roleIndex;
    }

    public Node parent() {
        return parent;
    }

    public PortRole role() {
        return role;
    }

    /** Index within the parent's full port list (inputs first, then outputs). */
    public int index() {
        return index;
    }

    /** Index among the parent's ports of the same role. */
    public int roleIndex() {
        return roleIndex;
    }

    public boolean isConnected() {
        return occupant != null;
    }

    /** The resolved edge occupying this port, or null. */
    public Edge occupant() {
        return occupant;
    }

    /** False once the parent rebuilt its ports or was disposed. */
    public boolean isLive() {
        return !released;
    }

    void connect(Edge edge) {
        if (released)
            throw new IllegalStateException("Cannot connect released port " + this);
        occupant = edge;
    }

    void disconnect() {
        if (occupant == null)
            throw new IllegalStateException("Port " + this + " is not connected");
        occupant = null;
    }

    void release() {
        occupant = null;
        released = true;
    }

    @Override
    public String toString() {
        return parent.id().shortForm() + "[" + index + ":" + role + "]";
    }
}
