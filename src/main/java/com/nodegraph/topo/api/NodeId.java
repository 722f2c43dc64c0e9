package com.nodegraph.topo.api;

import java.util.Objects;
import java.util.UUID;

/**
 * Immutable identity of a node.
 *
 * The value doubles as the node's registry key and its document id, so it is
 * fixed for the lifetime of the node.
 */
public record NodeId(String value) {

    public NodeId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank())
            throw new IllegalArgumentException("NodeId must not be blank");
    }

    /** Generates a fresh random id. */
    public static NodeId random() {
        return new NodeId(UUID.randomUUID().toString());
    }

    public static NodeId of(String value) {
        return new NodeId(value);
    }

    /** First eight characters, used in log lines. */
    public String shortForm() {
        return value.length() <= 8 ? value : value.substring(0, 8);
    }

    @Override
    public String toString() {
        return value;
    }
}
