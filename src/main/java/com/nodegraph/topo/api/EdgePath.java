package com.nodegraph.topo.api;

/**
 * Rendered geometry of an edge: a horizontal cubic from the source anchor to
 * the target anchor.
 */
public record EdgePath(Position start, Position control1, Position control2, Position end) {

    private static final double MAX_CONTROL_OFFSET = 100.0;

    public static EdgePath between(Position start, Position end) {
        double offset = Math.min(Math.abs(end.x() - start.x()) * 0.5, MAX_CONTROL_OFFSET);
        return new EdgePath(start,
                start.translate(offset, 0),
                end.translate(-offset, 0),
                end);
    }
}
