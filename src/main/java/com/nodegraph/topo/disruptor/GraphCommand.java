package com.nodegraph.topo.disruptor;

import com.nodegraph.topo.api.EdgeId;
import com.nodegraph.topo.api.NodeId;
import com.nodegraph.topo.io.GraphDocument;

/**
 * A mutable mutation request carried by the command ring buffer.
 *
 * <p>
 * <b>Flyweight Pattern:</b> Instances are pre-allocated during RingBuffer
 * construction and reused for the lifetime of the publisher. A producer
 * claims a slot, calls exactly one of the {@code set*} methods and publishes;
 * the handler reads the slot and clears it.
 *
 * <p>
 * Ids are chosen by the producer so that later commands can refer to
 * entities created by earlier ones without waiting for the consumer.
 */
public final class GraphCommand {

    public enum Kind {
        NONE, CREATE_NODE, DELETE_NODE, MOVE_NODE, SET_NODE_TYPE, SET_PORT_COUNTS,
        CREATE_EDGE, DELETE_EDGE, CLEAR, LOAD_DOCUMENT
    }

    private Kind kind = Kind.NONE;
    private NodeId nodeId;
    private String nodeType;
    private double x, y;
    private int inputCount, outputCount;
    private EdgeId edgeId;
    private NodeId targetNodeId;
    private int sourceIndex, targetIndex;
    private GraphDocument document;

    public void setCreateNode(NodeId id, String type, double x, double y) {
        clear();
        this.kind = Kind.CREATE_NODE;
        this.nodeId = id;
        this.nodeType = type;
        this.x = x;
        this.y = y;
    }

    public void setDeleteNode(NodeId id) {
        clear();
        this.kind = Kind.DELETE_NODE;
        this.nodeId = id;
    }

    public void setMoveNode(NodeId id, double x, double y) {
        clear();
        this.kind = Kind.MOVE_NODE;
        this.nodeId = id;
        this.x = x;
        this.y = y;
    }

    public void setNodeType(NodeId id, String type) {
        clear();
        this.kind = Kind.SET_NODE_TYPE;
        this.nodeId = id;
        this.nodeType = type;
    }

    public void setPortCounts(NodeId id, int inputs, int outputs) {
        clear();
        this.kind = Kind.SET_PORT_COUNTS;
        this.nodeId = id;
        this.inputCount = inputs;
        this.outputCount = outputs;
    }

    public void setCreateEdge(EdgeId id, NodeId source, int sourceIndex, NodeId target, int targetIndex) {
        clear();
        this.kind = Kind.CREATE_EDGE;
        this.edgeId = id;
        this.nodeId = source;
        this.sourceIndex = sourceIndex;
        this.targetNodeId = target;
        this.targetIndex = targetIndex;
    }

    public void setDeleteEdge(EdgeId id) {
        clear();
        this.kind = Kind.DELETE_EDGE;
        this.edgeId = id;
    }

    public void setClear() {
        clear();
        this.kind = Kind.CLEAR;
    }

    public void setLoadDocument(GraphDocument document) {
        clear();
        this.kind = Kind.LOAD_DOCUMENT;
        this.document = document;
    }

    public Kind kind() {
        return kind;
    }

    /** Subject node, or the source node of a CREATE_EDGE. */
    public NodeId nodeId() {
        return nodeId;
    }

    public String nodeType() {
        return nodeType;
    }

    public double x() {
        return x;
    }

    public double y() {
        return y;
    }

    public int inputCount() {
        return inputCount;
    }

    public int outputCount() {
        return outputCount;
    }

    public EdgeId edgeId() {
        return edgeId;
    }

    public NodeId targetNodeId() {
        return targetNodeId;
    }

    public int sourceIndex() {
        return sourceIndex;
    }

    public int targetIndex() {
        return targetIndex;
    }

    public GraphDocument document() {
        return document;
    }

    public void clear() {
        kind = Kind.NONE;
        nodeId = null;
        nodeType = null;
        x = 0;
        y = 0;
        inputCount = 0;
        outputCount = 0;
        edgeId = null;
        targetNodeId = null;
        sourceIndex = 0;
        targetIndex = 0;
        document = null;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case CREATE_NODE -> "CREATE_NODE " + nodeId + " " + nodeType + " @(" + x + ", " + y + ")";
            case DELETE_NODE -> "DELETE_NODE " + nodeId;
            case MOVE_NODE -> "MOVE_NODE " + nodeId + " @(" + x + ", " + y + ")";
            case SET_NODE_TYPE -> "SET_NODE_TYPE " + nodeId + " " + nodeType;
            case SET_PORT_COUNTS -> "SET_PORT_COUNTS " + nodeId + " " + inputCount + "/" + outputCount;
            case CREATE_EDGE -> "CREATE_EDGE " + edgeId + " " + nodeId + ":" + sourceIndex + " -> "
                    + targetNodeId + ":" + targetIndex;
            case DELETE_EDGE -> "DELETE_EDGE " + edgeId;
            case CLEAR -> "CLEAR";
            case LOAD_DOCUMENT -> "LOAD_DOCUMENT " + (document == null ? null : document.getSource());
            case NONE -> "NONE";
        };
    }
}
