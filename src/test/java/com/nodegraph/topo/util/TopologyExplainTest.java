package com.nodegraph.topo.util;

import com.nodegraph.topo.api.EdgeId;
import com.nodegraph.topo.api.NodeId;
import com.nodegraph.topo.api.Position;
import com.nodegraph.topo.core.NodeTypeRegistry;
import com.nodegraph.topo.core.TopologyRegistry;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class TopologyExplainTest {

    private TopologyRegistry registry;
    private TopologyExplain explain;

    @Before
    public void setUp() {
        registry = new TopologyRegistry();
        registry.createNode(NodeTypeRegistry.SOURCE, Position.of(0, 0), NodeId.of("src-1"));
        registry.createNode(NodeTypeRegistry.SINK, Position.of(100, 0), NodeId.of("sink-1"));
        registry.createEdge(EdgeId.of("e-1"), NodeId.of("src-1"), 0, NodeId.of("sink-1"), 0);
        explain = new TopologyExplain(registry);
    }

    @Test
    public void testMermaid() {
        String mermaid = explain.toMermaid();

        assertTrue(mermaid.startsWith("graph LR;\n"));
        assertTrue(mermaid.contains("n_src_1[\"SOURCE<br/>src-1\"];"));
        assertTrue(mermaid.contains("n_src_1 -- \"0:0\" --> n_sink_1;"));
    }

    @Test
    public void testExplainNode() {
        String text = explain.explainNode(NodeId.of("src-1"));

        assertTrue(text.contains("Type: SOURCE"));
        assertTrue(text.contains("[0] OUTPUT -> e-1 (sink-1)"));
        assertTrue(text.contains("Incident edges: 1"));
        assertTrue(explain.explainNode(NodeId.of("nope")).contains("not found"));
    }

    @Test
    public void testSummary() {
        assertTrue(explain.summary().startsWith("Nodes: 2, Edges: 1, Free ports: 0"));
    }
}
