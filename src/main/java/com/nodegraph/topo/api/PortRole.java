package com.nodegraph.topo.api;

/** Direction of a port. Edges always run from an OUTPUT to an INPUT. */
public enum PortRole {
    INPUT,
    OUTPUT
}
