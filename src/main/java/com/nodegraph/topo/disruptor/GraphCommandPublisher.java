package com.nodegraph.topo.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.nodegraph.topo.api.EdgeId;
import com.nodegraph.topo.api.NodeId;
import com.nodegraph.topo.core.TopologyRegistry;
import com.nodegraph.topo.io.GraphDocument;

import java.util.function.Consumer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Lets any number of threads mutate one {@link TopologyRegistry}.
 *
 * <h3>Workflow</h3>
 * <ol>
 * <li>A producer thread calls one of the command methods, which claims a ring
 * buffer slot, fills the {@link GraphCommand} flyweight and publishes it.</li>
 * <li>The Disruptor sequences commands from all producers.</li>
 * <li>{@link GraphCommandHandler} applies them in sequence order on its single
 * consumer thread.</li>
 * </ol>
 *
 * Commands are fire-and-forget. Failures surface through the handler's
 * failure callback. Once started, the registry must only be touched from the
 * consumer thread (observers run there too) until {@link #shutdown()}
 * returns.
 */
public final class GraphCommandPublisher implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(GraphCommandPublisher.class);

    private final Disruptor<GraphCommand> disruptor;
    private final GraphCommandHandler handler;
    private RingBuffer<GraphCommand> ringBuffer;

    /**
     * @param bufferSize ring size, a power of two
     */
    public GraphCommandPublisher(TopologyRegistry registry, int bufferSize,
            GraphCommandHandler.CommandFailureCallback onFailure) {
        this.handler = new GraphCommandHandler(registry, onFailure);
        this.disruptor = new Disruptor<>(
                GraphCommand::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(handler);
    }

    public GraphCommandHandler handler() {
        return handler;
    }

    public GraphCommandPublisher start() {
        if (ringBuffer != null)
            throw new IllegalStateException("Publisher already started");
        ringBuffer = disruptor.start();
        log.info("Command pipeline started, buffer size {}", ringBuffer.getBufferSize());
        return this;
    }

    public NodeId createNode(String type, double x, double y) {
        NodeId id = NodeId.random();
        publish(c -> c.setCreateNode(id, type, x, y));
        return id;
    }

    public void deleteNode(NodeId id) {
        publish(c -> c.setDeleteNode(id));
    }

    public void moveNode(NodeId id, double x, double y) {
        publish(c -> c.setMoveNode(id, x, y));
    }

    public void setNodeType(NodeId id, String type) {
        publish(c -> c.setNodeType(id, type));
    }

    public void setPortCounts(NodeId id, int inputs, int outputs) {
        publish(c -> c.setPortCounts(id, inputs, outputs));
    }

    public EdgeId createEdge(NodeId source, int sourceIndex, NodeId target, int targetIndex) {
        EdgeId id = EdgeId.random();
        publish(c -> c.setCreateEdge(id, source, sourceIndex, target, targetIndex));
        return id;
    }

    public void deleteEdge(EdgeId id) {
        publish(c -> c.setDeleteEdge(id));
    }

    public void clear() {
        publish(GraphCommand::setClear);
    }

    public void load(GraphDocument document) {
        publish(c -> c.setLoadDocument(document));
    }

    private void publish(Consumer<GraphCommand> writer) {
        if (ringBuffer == null)
            throw new IllegalStateException("Publisher not started");
        long sequence = ringBuffer.next();
        try {
            writer.accept(ringBuffer.get(sequence));
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    /** Waits until every published command has been applied, then stops. */
    public void shutdown() {
        if (ringBuffer == null)
            return;
        disruptor.shutdown();
        ringBuffer = null;
        log.info("Command pipeline stopped");
    }

    @Override
    public void close() {
        shutdown();
    }
}
