package com.nodegraph.topo.api;

/**
 * A point in graph coordinates.
 */
public record Position(double x, double y) {

    public static final Position ORIGIN = new Position(0.0, 0.0);

    public static Position of(double x, double y) {
        return new Position(x, y);
    }

    public Position translate(double dx, double dy) {
        return new Position(x + dx, y + dy);
    }

    /** |dx| + |dy|, the distance used by the move threshold. */
    public double manhattanDistance(Position other) {
        return Math.abs(x - other.x) + Math.abs(y - other.y);
    }
}
