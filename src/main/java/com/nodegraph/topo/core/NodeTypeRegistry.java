package com.nodegraph.topo.core;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Catalogue mapping node type tags to their default port counts.
 *
 * Built-ins:
 * SOURCE (0 in, 1 out), SINK (1, 0), SPLIT (1, 2), MERGE (2, 1),
 * TRANSFORM (1, 1). Further types can be registered from configuration.
 */
public final class NodeTypeRegistry {
    public static final String SOURCE = "SOURCE";
    public static final String SINK = "SINK";
    public static final String SPLIT = "SPLIT";
    public static final String MERGE = "MERGE";
    public static final String TRANSFORM = "TRANSFORM";

    private final Map<String, NodeTypeSpec> types = new LinkedHashMap<>();

    public NodeTypeRegistry() {
        registerBuiltIns();
    }

    public NodeTypeRegistry register(String name, int inputCount, int outputCount) {
        return register(new NodeTypeSpec(name, inputCount, outputCount));
    }

    public NodeTypeRegistry register(NodeTypeSpec spec) {
        types.put(spec.name(), spec);
        return this;
    }

    public Optional<NodeTypeSpec> find(String name) {
        return Optional.ofNullable(name == null ? null : types.get(name));
    }

    /**
     * @throws IllegalArgumentException if the type is not registered
     */
    public NodeTypeSpec require(String name) {
        NodeTypeSpec spec = name == null ? null : types.get(name);
        if (spec == null)
            throw new IllegalArgumentException("Unknown node type: " + name + " (known: " + types.keySet() + ")");
        return spec;
    }

    public boolean contains(String name) {
        return name != null && types.containsKey(name);
    }

    public Collection<NodeTypeSpec> all() {
        return Collections.unmodifiableCollection(types.values());
    }

    private void registerBuiltIns() {
        register(SOURCE, 0, 1);
        register(SINK, 1, 0);
        register(SPLIT, 1, 2);
        register(MERGE, 2, 1);
        register(TRANSFORM, 1, 1);
    }
}
