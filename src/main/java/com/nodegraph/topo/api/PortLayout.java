package com.nodegraph.topo.api;

/**
 * Places ports relative to their node.
 *
 * Implementations see only the port's role, its index among same-role
 * siblings and the sibling count, so the layout can never depend on edges or
 * other nodes.
 */
@FunctionalInterface
public interface PortLayout {

    /**
     * @param nodePosition top-left corner of the owning node
     * @param role         port direction
     * @param roleIndex    index among ports of the same role (0-based)
     * @param siblingCount number of ports with the same role on the node
     * @return the anchor point edges attach to
     */
    Position anchor(Position nodePosition, PortRole role, int roleIndex, int siblingCount);
}
