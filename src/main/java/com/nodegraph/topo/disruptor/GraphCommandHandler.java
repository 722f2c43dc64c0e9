package com.nodegraph.topo.disruptor;

import com.lmax.disruptor.EventHandler;
import com.nodegraph.topo.api.Position;
import com.nodegraph.topo.core.TopologyRegistry;

import lombok.extern.log4j.Log4j2;

/**
 * Disruptor EventHandler that applies {@link GraphCommand}s to a registry.
 *
 * <p>
 * Runs on the single consumer thread, which makes it the registry's only
 * writer. Every run of commands the Disruptor delivers together is wrapped in
 * one registry batch: the batch opens with the first command and closes when
 * {@code endOfBatch} is set, so observers such as autosave do their work once
 * per burst instead of once per command.
 *
 * <p>
 * A command that fails is reported to the {@link CommandFailureCallback} and
 * the handler moves on; nothing is thrown back into the Disruptor.
 */
@Log4j2
public final class GraphCommandHandler implements EventHandler<GraphCommand> {
    private final TopologyRegistry registry;
    private final CommandFailureCallback onFailure;
    private BatchCallback onBatchApplied;

    private boolean batchOpen;
    private int appliedInBatch;

    public GraphCommandHandler(TopologyRegistry registry, CommandFailureCallback onFailure) {
        this.registry = registry;
        this.onFailure = onFailure;
    }

    /** Sets a callback invoked on the consumer thread after each batch closes. */
    public void setBatchCallback(BatchCallback cb) {
        this.onBatchApplied = cb;
    }

    @Override
    public void onEvent(GraphCommand command, long sequence, boolean endOfBatch) {
        if (!batchOpen) {
            registry.beginBatch();
            batchOpen = true;
            appliedInBatch = 0;
        }
        try {
            apply(command);
            appliedInBatch++;
        } catch (RuntimeException e) {
            String description = command.toString();
            log.warn("Command #{} {} failed: {}", sequence, description, e.getMessage());
            if (onFailure != null)
                onFailure.onFailure(sequence, description, e);
        } finally {
            command.clear();
        }

        if (endOfBatch) {
            batchOpen = false;
            registry.endBatch();
            if (onBatchApplied != null)
                onBatchApplied.onBatchApplied(sequence, appliedInBatch);
        }
    }

    private void apply(GraphCommand c) {
        switch (c.kind()) {
            case CREATE_NODE -> registry.createNode(c.nodeType(), Position.of(c.x(), c.y()), c.nodeId());
            case DELETE_NODE -> registry.deleteNode(c.nodeId());
            case MOVE_NODE -> registry.moveNode(c.nodeId(), Position.of(c.x(), c.y()));
            case SET_NODE_TYPE -> registry.setNodeType(c.nodeId(), c.nodeType());
            case SET_PORT_COUNTS -> registry.setPortCounts(c.nodeId(), c.inputCount(), c.outputCount());
            case CREATE_EDGE -> registry.createEdge(c.edgeId(), c.nodeId(), c.sourceIndex(), c.targetNodeId(),
                    c.targetIndex());
            case DELETE_EDGE -> registry.deleteEdge(c.edgeId());
            case CLEAR -> registry.clear();
            case LOAD_DOCUMENT -> registry.loadFromDocument(c.document());
            case NONE -> log.debug("Ignoring empty command slot");
        }
    }

    /** Receives commands the registry refused. */
    @FunctionalInterface
    public interface CommandFailureCallback {
        /**
         * @param sequence    ring buffer sequence of the command
         * @param description the command as text (the slot itself is reused)
         * @param error       what the registry threw
         */
        void onFailure(long sequence, String description, RuntimeException error);
    }

    /** Post-batch hook, e.g. for metrics or tests. */
    @FunctionalInterface
    public interface BatchCallback {
        void onBatchApplied(long lastSequence, int commandsApplied);
    }
}
