package com.nodegraph.topo.io;

import com.nodegraph.topo.api.Position;
import com.nodegraph.topo.core.Node;
import com.nodegraph.topo.core.NodeTypeRegistry;
import com.nodegraph.topo.core.TopologyRegistry;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class AutosaveObserverTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private TopologyRegistry registry;
    private DocumentCodec codec;
    private Path target;
    private AutosaveObserver autosave;

    @Before
    public void setUp() {
        registry = new TopologyRegistry();
        codec = new DocumentCodec();
        target = folder.getRoot().toPath().resolve("autosave.json");
        autosave = new AutosaveObserver(registry, codec, target);
        registry.attachObserver(autosave);
    }

    @Test
    public void testWritesImmediatelyOutsideBatch() throws IOException {
        Node n = registry.createNode(NodeTypeRegistry.SOURCE, Position.ORIGIN);

        assertEquals(1, autosave.writeCount());
        assertFalse(autosave.isDirty());
        GraphDocument saved = codec.read(target);
        assertEquals(n.id().value(), saved.getNodes().get(0).getId());
    }

    @Test
    public void testWritesOncePerOutermostBatch() throws IOException {
        registry.beginBatch();
        Node a = registry.createNode(NodeTypeRegistry.SOURCE, Position.ORIGIN);
        registry.beginBatch();
        Node b = registry.createNode(NodeTypeRegistry.SINK, Position.of(100, 0));
        registry.createEdge(a, 0, b, 0);
        registry.endBatch();
        assertEquals(0, autosave.writeCount());
        assertTrue(autosave.isDirty());
        registry.endBatch();

        assertEquals(1, autosave.writeCount());
        GraphDocument saved = codec.read(target);
        assertEquals(2, saved.getNodes().size());
        assertEquals(1, saved.getEdges().size());
    }

    @Test
    public void testLoadIsWrittenOnce() {
        TopologyRegistry other = new TopologyRegistry();
        Node s = other.createNode(NodeTypeRegistry.SOURCE, Position.ORIGIN);
        Node t = other.createNode(NodeTypeRegistry.SINK, Position.of(50, 0));
        other.createEdge(s, 0, t, 0);

        registry.loadFromDocument(other.saveToDocument());

        assertEquals(1, autosave.writeCount());
        assertTrue(Files.exists(target));
    }

    @Test
    public void testSmallMovesAreNotWritten() {
        Node n = registry.createNode(NodeTypeRegistry.SOURCE, Position.ORIGIN);
        registry.moveNode(n.id(), Position.of(1, 1));
        assertEquals(1, autosave.writeCount());
        registry.moveNode(n.id(), Position.of(50, 50));
        assertEquals(2, autosave.writeCount());
    }

    @Test
    public void testFailedWriteKeepsDirtyFlag() throws IOException {
        Path blocked = folder.newFolder("blocked").toPath();
        Files.createFile(blocked.resolve("occupant"));
        AutosaveObserver failing = new AutosaveObserver(registry, codec, blocked);
        registry.detachObserver(autosave);
        registry.attachObserver(failing);

        // The observer failure is logged by the registry, the mutation stands
        registry.createNode(NodeTypeRegistry.SOURCE, Position.ORIGIN);

        assertEquals(1, registry.nodeCount());
        assertTrue(failing.isDirty());
        assertEquals(0, failing.writeCount());
    }

    @Test
    public void testExplicitFlush() throws IOException {
        registry.detachObserver(autosave);
        registry.createNode(NodeTypeRegistry.SINK, Position.ORIGIN);
        autosave.flush();
        assertEquals(1, codec.read(target).getNodes().size());
    }
}
