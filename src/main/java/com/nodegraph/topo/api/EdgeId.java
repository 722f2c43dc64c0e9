package com.nodegraph.topo.api;

import java.util.Objects;
import java.util.UUID;

/**
 * Immutable identity of an edge.
 */
public record EdgeId(String value) {

    public EdgeId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank())
            throw new IllegalArgumentException("EdgeId must not be blank");
    }

    public static EdgeId random() {
        return new EdgeId(UUID.randomUUID().toString());
    }

    public static EdgeId of(String value) {
        return new EdgeId(value);
    }

    public String shortForm() {
        return value.length() <= 8 ? value : value.substring(0, 8);
    }

    @Override
    public String toString() {
        return value;
    }
}
