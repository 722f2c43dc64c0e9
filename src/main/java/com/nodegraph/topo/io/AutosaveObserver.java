package com.nodegraph.topo.io;

import com.nodegraph.topo.api.GraphObserver;
import com.nodegraph.topo.api.Position;
import com.nodegraph.topo.core.Edge;
import com.nodegraph.topo.core.Node;
import com.nodegraph.topo.core.TopologyRegistry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

import lombok.extern.log4j.Log4j2;

/**
 * Writes the graph to a file whenever it changes.
 *
 * <p>
 * Outside a batch every mutation is written immediately. Inside a batch the
 * observer only marks itself dirty and writes once when the outermost batch
 * closes. A failed write is rethrown as {@link UncheckedIOException} (the
 * registry logs it) and the dirty flag stays set, so the next change or
 * {@link #flush()} retries.
 */
@Log4j2
public final class AutosaveObserver implements GraphObserver {
    private final TopologyRegistry registry;
    private final DocumentCodec codec;
    private final Path target;

    private boolean inBatch;
    private boolean dirty;
    private int writeCount;

    public AutosaveObserver(TopologyRegistry registry, DocumentCodec codec, Path target) {
        this.registry = registry;
        this.codec = codec;
        this.target = target;
    }

    public boolean isDirty() {
        return dirty;
    }

    public int writeCount() {
        return writeCount;
    }

    /** Writes the current graph now. */
    public void flush() throws IOException {
        codec.write(registry.saveToDocument(target.getFileName().toString()), target);
        dirty = false;
        writeCount++;
        log.debug("Autosaved to {} (write #{})", target, writeCount);
    }

    private void changed() {
        dirty = true;
        if (!inBatch)
            flushUnchecked();
    }

    private void flushUnchecked() {
        try {
            flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Autosave to " + target + " failed", e);
        }
    }

    @Override
    public void onNodeAdded(Node node) {
        changed();
    }

    @Override
    public void onNodeRemoved(Node node) {
        changed();
    }

    @Override
    public void onNodeMoved(Node node, Position from, Position to) {
        changed();
    }

    @Override
    public void onNodeChanged(Node node) {
        changed();
    }

    @Override
    public void onEdgeAdded(Edge edge) {
        changed();
    }

    @Override
    public void onEdgeRemoved(Edge edge) {
        changed();
    }

    @Override
    public void onGraphCleared() {
        changed();
    }

    @Override
    public void onGraphLoaded(String source) {
        changed();
    }

    @Override
    public void onBatchBegin() {
        inBatch = true;
    }

    @Override
    public void onBatchEnd() {
        inBatch = false;
        if (dirty)
            flushUnchecked();
    }
}
