package com.nodegraph.topo.api;

/**
 * Recoverable failure kinds reported by the topology engine.
 */
public enum ErrorKind {
    /** A referenced node id is not present in the registry. */
    ENDPOINT_NOT_FOUND,
    /** A port index is negative or beyond the node's current port count. */
    PORT_INDEX_OUT_OF_RANGE,
    /** Source port is not an output, or target port is not an input. */
    ROLE_MISMATCH,
    /** One of the ports already hosts a resolved edge. */
    PORT_ALREADY_CONNECTED,
    /** The endpoints belong to different registries. */
    CROSS_GRAPH_EDGE,
    /** A document element could not be mapped to an entity. */
    MALFORMED_DOCUMENT_ENTITY
}
