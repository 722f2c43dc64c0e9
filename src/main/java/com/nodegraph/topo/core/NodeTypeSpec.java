package com.nodegraph.topo.core;

/** Port counts a node type starts with. */
public record NodeTypeSpec(String name, int inputCount, int outputCount) {

    public NodeTypeSpec {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Node type name must not be blank");
        if (!Node.isValidPortCounts(inputCount, outputCount))
            throw new IllegalArgumentException("Port counts for " + name + " must be non-negative and total at most "
                    + Node.MAX_PORTS);
    }
}
