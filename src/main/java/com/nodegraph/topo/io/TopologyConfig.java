package com.nodegraph.topo.io;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nodegraph.topo.core.DefaultPortLayout;
import com.nodegraph.topo.core.NodeTypeRegistry;
import com.nodegraph.topo.core.TopologyRegistry;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.log4j.Log4j2;

/**
 * Engine settings, read from JSON.
 *
 * <pre>
 * {
 *   "minMoveDistance": 5.0,
 *   "commandBufferSize": 1024,
 *   "layout": { "nodeWidth": 160, "headerHeight": 28, "portSpacing": 32 },
 *   "nodeTypes": { "FILTER": { "inputCount": 1, "outputCount": 1 } }
 * }
 * </pre>
 */
@Data
@Log4j2
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TopologyConfig {
    public static final String DEFAULTS_RESOURCE = "topology-defaults.json";

    private double minMoveDistance = TopologyRegistry.DEFAULT_MIN_MOVE_DISTANCE;
    private int commandBufferSize = 1024;
    private Map<String, Object> layout = new LinkedHashMap<>();
    private Map<String, PortCounts> nodeTypes = new LinkedHashMap<>();

    /** Port counts of a configured node type. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class PortCounts {
        @JsonAlias("inputs")
        private int inputCount;
        @JsonAlias("outputs")
        private int outputCount;
    }

    /** Settings from the classpath resource, or built-in values if it is absent. */
    public static TopologyConfig defaults() {
        try (InputStream in = TopologyConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                log.debug("{} not on classpath, using built-in settings", DEFAULTS_RESOURCE);
                return new TopologyConfig();
            }
            return new ObjectMapper().readValue(in, TopologyConfig.class).validate();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULTS_RESOURCE, e);
        }
    }

    public static TopologyConfig load(Path path) throws IOException {
        return new ObjectMapper().readValue(path.toFile(), TopologyConfig.class).validate();
    }

    /**
     * @throws IllegalArgumentException on a negative move distance or a buffer
     *                                  size that is not a power of two
     */
    public TopologyConfig validate() {
        if (minMoveDistance < 0)
            throw new IllegalArgumentException("minMoveDistance must be non-negative: " + minMoveDistance);
        if (commandBufferSize <= 0 || Integer.bitCount(commandBufferSize) != 1)
            throw new IllegalArgumentException("commandBufferSize must be a power of two: " + commandBufferSize);
        return this;
    }

    public NodeTypeRegistry nodeTypeRegistry() {
        NodeTypeRegistry registry = new NodeTypeRegistry();
        nodeTypes.forEach((name, counts) -> registry.register(name, counts.getInputCount(), counts.getOutputCount()));
        return registry;
    }

    public DefaultPortLayout portLayout() {
        return new DefaultPortLayout(
                getDouble(layout, "nodeWidth", DefaultPortLayout.NODE_WIDTH),
                getDouble(layout, "headerHeight", DefaultPortLayout.HEADER_HEIGHT),
                getDouble(layout, "portSpacing", DefaultPortLayout.PORT_SPACING));
    }

    public TopologyRegistry newRegistry() {
        validate();
        return new TopologyRegistry(nodeTypeRegistry(), portLayout(), minMoveDistance);
    }

    static double getDouble(Map<String, Object> props, String key, double def) {
        Object v = props == null ? null : props.get(key);
        if (v == null)
            return def;
        return v instanceof Number n ? n.doubleValue() : Double.parseDouble(v.toString());
    }
}
