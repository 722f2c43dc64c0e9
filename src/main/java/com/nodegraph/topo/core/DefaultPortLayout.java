package com.nodegraph.topo.core;

import com.nodegraph.topo.api.PortLayout;
import com.nodegraph.topo.api.PortRole;
import com.nodegraph.topo.api.Position;

/**
 * Inputs down the left edge, outputs down the right edge, one port every
 * {@code spacing} units below the header.
 */
public final class DefaultPortLayout implements PortLayout {
    public static final double NODE_WIDTH = 160.0;
    public static final double HEADER_HEIGHT = 28.0;
    public static final double PORT_SPACING = 32.0;

    public static final DefaultPortLayout INSTANCE = new DefaultPortLayout(NODE_WIDTH, HEADER_HEIGHT, PORT_SPACING);

    private final double width;
    private final double header;
    private final double spacing;

    public DefaultPortLayout(double width, double header, double spacing) {
        this.width = width;
        this.header = header;
        this.spacing = spacing;
    }

    @Override
    public Position anchor(Position nodePosition, PortRole role, int roleIndex, int siblingCount) {
        double x = role == PortRole.INPUT ? nodePosition.x() : nodePosition.x() + width;
        double y = nodePosition.y() + header + spacing * roleIndex + spacing / 2;
        return new Position(x, y);
    }
}
