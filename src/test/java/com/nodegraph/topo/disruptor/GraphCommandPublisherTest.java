package com.nodegraph.topo.disruptor;

import com.nodegraph.topo.api.EdgeId;
import com.nodegraph.topo.api.GraphObserver;
import com.nodegraph.topo.api.NodeId;
import com.nodegraph.topo.api.Position;
import com.nodegraph.topo.api.TopologyException;
import com.nodegraph.topo.core.Node;
import com.nodegraph.topo.core.NodeTypeRegistry;
import com.nodegraph.topo.core.TopologyRegistry;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.*;

public class GraphCommandPublisherTest {

    private TopologyRegistry registry;
    private GraphCommandPublisher publisher;
    private List<String> failures;

    @Before
    public void setUp() {
        registry = new TopologyRegistry();
        failures = new CopyOnWriteArrayList<>();
        publisher = new GraphCommandPublisher(registry, 64, (seq, description, error) -> {
            String kind = error instanceof TopologyException te ? te.kind().name() : error.getClass().getSimpleName();
            failures.add(kind + " " + description);
        });
    }

    @After
    public void tearDown() {
        publisher.shutdown();
    }

    @Test
    public void testCommandsFromAnotherThreadAreApplied() throws Exception {
        publisher.start();
        AtomicReference<NodeId> sink = new AtomicReference<>();
        AtomicReference<EdgeId> edge = new AtomicReference<>();

        Thread producer = new Thread(() -> {
            NodeId a = publisher.createNode(NodeTypeRegistry.SOURCE, 0, 0);
            NodeId b = publisher.createNode(NodeTypeRegistry.SINK, 100, 0);
            edge.set(publisher.createEdge(a, 0, b, 0));
            publisher.createEdge(a, 0, b, 0);
            publisher.moveNode(b, 50, 50);
            sink.set(b);
        });
        producer.start();
        producer.join();
        publisher.shutdown();

        assertEquals(2, registry.nodeCount());
        assertEquals(1, registry.edgeCount());
        assertTrue(registry.findEdge(edge.get()).isPresent());
        assertEquals(Position.of(50, 50), registry.findNode(sink.get()).get().position());
        assertEquals(1, failures.size());
        assertTrue(failures.get(0).startsWith("PORT_ALREADY_CONNECTED CREATE_EDGE"));
        assertTrue(registry.validateIntegrity().isEmpty());
    }

    @Test
    public void testCommandsApplyInPublishOrder() throws Exception {
        publisher.start();
        NodeId id = publisher.createNode(NodeTypeRegistry.TRANSFORM, 0, 0);
        for (int i = 1; i <= 200; i++)
            publisher.moveNode(id, i * 10, 0);
        publisher.setNodeType(id, NodeTypeRegistry.MERGE);
        publisher.shutdown();

        Node node = registry.findNode(id).get();
        assertEquals(Position.of(2000, 0), node.position());
        assertEquals(NodeTypeRegistry.MERGE, node.type());
        assertTrue(failures.isEmpty());
    }

    @Test
    public void testEachDeliveryIsOneBalancedBatch() throws Exception {
        AtomicInteger begins = new AtomicInteger();
        AtomicInteger ends = new AtomicInteger();
        registry.attachObserver(new GraphObserver() {
            @Override
            public void onBatchBegin() {
                begins.incrementAndGet();
            }

            @Override
            public void onBatchEnd() {
                ends.incrementAndGet();
            }
        });
        CountDownLatch applied = new CountDownLatch(3);
        publisher.handler().setBatchCallback((seq, count) -> {
            for (int i = 0; i < count; i++)
                applied.countDown();
        });
        publisher.start();

        publisher.createNode(NodeTypeRegistry.SOURCE, 0, 0);
        publisher.createNode(NodeTypeRegistry.SINK, 0, 0);
        publisher.clear();

        assertTrue(applied.await(5, TimeUnit.SECONDS));
        publisher.shutdown();

        assertTrue(begins.get() >= 1);
        assertEquals(begins.get(), ends.get());
        assertFalse(registry.inBatch());
        assertEquals(0, registry.nodeCount());
    }

    @Test
    public void testUnknownTypeIsReportedNotThrown() throws Exception {
        publisher.start();
        publisher.createNode("NOPE", 0, 0);
        publisher.deleteNode(NodeId.of("ghost"));
        publisher.createNode(NodeTypeRegistry.SOURCE, 0, 0);
        publisher.shutdown();

        assertEquals(1, registry.nodeCount());
        assertEquals(1, failures.size());
        assertTrue(failures.get(0).startsWith("IllegalArgumentException CREATE_NODE"));
    }

    @Test(expected = IllegalStateException.class)
    public void testPublishBeforeStartFails() {
        publisher.clear();
    }
}
