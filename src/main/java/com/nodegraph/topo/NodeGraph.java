package com.nodegraph.topo;

import com.nodegraph.topo.core.LoadSummary;
import com.nodegraph.topo.core.TopologyRegistry;
import com.nodegraph.topo.disruptor.GraphCommandHandler;
import com.nodegraph.topo.disruptor.GraphCommandPublisher;
import com.nodegraph.topo.io.AutosaveObserver;
import com.nodegraph.topo.io.DocumentCodec;
import com.nodegraph.topo.io.GraphDocument;
import com.nodegraph.topo.io.TopologyConfig;
import com.nodegraph.topo.util.TopologyExplain;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A high-level wrapper that wires a {@link TopologyRegistry} to its
 * configuration, the JSON document codec and the optional extras.
 * <p>
 * This class handles:
 * <ul>
 * <li>Reading {@link TopologyConfig} and building the registry from it</li>
 * <li>Loading and saving documents through {@link DocumentCodec}</li>
 * <li>Autosave on change ({@link #enableAutosave(Path)})</li>
 * <li>A Disruptor command pipeline for multi-threaded producers
 * ({@link #startCommandPipeline})</li>
 * </ul>
 * Everything else goes straight to {@link #registry()}.
 */
public class NodeGraph {
    private static final Logger log = LogManager.getLogger(NodeGraph.class);

    private final TopologyConfig config;
    private final TopologyRegistry registry;
    private final DocumentCodec codec = new DocumentCodec();

    private AutosaveObserver autosave;
    private GraphCommandPublisher publisher;

    /** Uses the classpath defaults. */
    public NodeGraph() {
        this(TopologyConfig.defaults());
    }

    /**
     * @param configPath path to a JSON settings file
     */
    public NodeGraph(Path configPath) {
        this(loadConfig(configPath));
    }

    public NodeGraph(TopologyConfig config) {
        this.config = config;
        this.registry = config.newRegistry();
    }

    private static TopologyConfig loadConfig(Path path) {
        try {
            return TopologyConfig.load(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load settings from " + path, e);
        }
    }

    public TopologyRegistry registry() {
        return registry;
    }

    public TopologyConfig config() {
        return config;
    }

    public DocumentCodec codec() {
        return codec;
    }

    /**
     * Replaces the graph with the contents of a document file.
     *
     * @throws IOException if the file cannot be read or is not a graph document
     */
    public LoadSummary load(Path path) throws IOException {
        GraphDocument document = codec.read(path);
        return registry.loadFromDocument(document);
    }

    public LoadSummary loadJson(String json) throws IOException {
        return registry.loadFromDocument(codec.read(json));
    }

    public void save(Path path) throws IOException {
        codec.write(registry.saveToDocument(path.getFileName().toString()), path);
        log.info("Saved {} nodes, {} edges to {}", registry.nodeCount(), registry.edgeCount(), path);
    }

    public String toJson() throws IOException {
        return codec.writeString(registry.saveToDocument());
    }

    /**
     * Writes the graph to {@code target} after every change (once per batch).
     * If already enabled, returns the existing observer.
     */
    public AutosaveObserver enableAutosave(Path target) {
        if (autosave == null) {
            autosave = new AutosaveObserver(registry, codec, target);
            registry.attachObserver(autosave);
        }
        return autosave;
    }

    public void disableAutosave() {
        if (autosave != null) {
            registry.detachObserver(autosave);
            autosave = null;
        }
    }

    /**
     * Starts the command pipeline. From here on the registry belongs to the
     * pipeline's consumer thread until {@link #shutdown()}.
     * If already started, returns the existing publisher.
     */
    public GraphCommandPublisher startCommandPipeline(GraphCommandHandler.CommandFailureCallback onFailure) {
        if (publisher == null)
            publisher = new GraphCommandPublisher(registry, config.getCommandBufferSize(), onFailure).start();
        return publisher;
    }

    /** Drains and stops the command pipeline, if running. */
    public void shutdown() {
        if (publisher != null) {
            publisher.shutdown();
            publisher = null;
        }
    }

    public TopologyExplain explain() {
        return new TopologyExplain(registry);
    }

    public String toMermaid() {
        return explain().toMermaid();
    }
}
