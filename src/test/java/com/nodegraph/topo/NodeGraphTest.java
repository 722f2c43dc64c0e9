package com.nodegraph.topo;

import com.nodegraph.topo.api.NodeId;
import com.nodegraph.topo.api.Position;
import com.nodegraph.topo.core.LoadSummary;
import com.nodegraph.topo.core.Node;
import com.nodegraph.topo.core.NodeTypeRegistry;
import com.nodegraph.topo.core.TopologyRegistry;
import com.nodegraph.topo.disruptor.GraphCommandPublisher;
import com.nodegraph.topo.io.AutosaveObserver;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.Assert.*;

public class NodeGraphTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testSaveAndReload() throws IOException {
        NodeGraph graph = new NodeGraph();
        TopologyRegistry registry = graph.registry();
        Node s = registry.createNode(NodeTypeRegistry.SOURCE, Position.of(0, 0));
        Node k = registry.createNode(NodeTypeRegistry.SINK, Position.of(200, 0));
        registry.createEdge(s, 0, k, 0);

        Path file = folder.getRoot().toPath().resolve("graph.json");
        graph.save(file);

        NodeGraph reloaded = new NodeGraph();
        LoadSummary summary = reloaded.load(file);

        assertTrue(summary.isClean());
        assertEquals("graph.json", summary.source());
        assertEquals(2, reloaded.registry().nodeCount());
        assertEquals(1, reloaded.registry().edgeCount());
        assertEquals(Position.of(200, 0), reloaded.registry().findNode(k.id()).get().position());
        assertTrue(reloaded.toMermaid().contains("-->"));
    }

    @Test
    public void testLoadJsonScenario() throws IOException {
        NodeGraph graph = new NodeGraph();
        LoadSummary summary = graph.loadJson("{\"version\":\"1\",\"nodes\":["
                + "{\"id\":\"s\",\"x\":0,\"y\":0,\"type\":\"SOURCE\",\"inputCount\":0,\"outputCount\":1},"
                + "{\"id\":\"t\",\"x\":100,\"y\":0,\"type\":\"SINK\",\"inputCount\":1,\"outputCount\":0}],"
                + "\"edges\":[{\"id\":\"e\",\"sourceNodeId\":\"s\",\"sourceSocketIndex\":0,"
                + "\"targetNodeId\":\"ghost\",\"targetSocketIndex\":0}]}");

        assertEquals(2, summary.nodesLoaded());
        assertEquals(1, summary.edgesFailed());
        assertEquals(0, graph.registry().edgeCount());
        assertTrue(graph.toJson().contains("\"id\" : \"s\""));
    }

    @Test
    public void testConfigFileDrivesRegistry() throws IOException {
        Path config = folder.getRoot().toPath().resolve("settings.json");
        Files.writeString(config, "{\"minMoveDistance\": 20, \"nodeTypes\": {\"TAP\": {\"inputCount\": 1,"
                + " \"outputCount\": 3}}}", StandardCharsets.UTF_8);

        NodeGraph graph = new NodeGraph(config);

        assertEquals(20.0, graph.registry().minMoveDistance(), 0.0);
        assertEquals(4, graph.registry().createNode("TAP", Position.ORIGIN).portCount());
    }

    @Test
    public void testAutosaveIsEnabledOnce() {
        NodeGraph graph = new NodeGraph();
        Path target = folder.getRoot().toPath().resolve("auto.json");
        AutosaveObserver first = graph.enableAutosave(target);
        assertSame(first, graph.enableAutosave(target));

        graph.registry().createNode(NodeTypeRegistry.TRANSFORM, Position.ORIGIN);
        assertEquals(1, first.writeCount());

        graph.disableAutosave();
        graph.registry().createNode(NodeTypeRegistry.TRANSFORM, Position.ORIGIN);
        assertEquals(1, first.writeCount());
    }

    @Test
    public void testCommandPipeline() {
        NodeGraph graph = new NodeGraph();
        List<String> failures = new CopyOnWriteArrayList<>();
        GraphCommandPublisher publisher = graph.startCommandPipeline(
                (seq, description, error) -> failures.add(description));
        assertSame(publisher, graph.startCommandPipeline(null));

        NodeId a = publisher.createNode(NodeTypeRegistry.SOURCE, 0, 0);
        NodeId b = publisher.createNode(NodeTypeRegistry.SINK, 100, 0);
        publisher.createEdge(a, 0, b, 0);
        graph.shutdown();

        assertEquals(1, graph.registry().edgeCount());
        assertTrue(failures.isEmpty());
    }
}
