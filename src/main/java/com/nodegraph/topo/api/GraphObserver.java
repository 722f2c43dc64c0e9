package com.nodegraph.topo.api;

import com.nodegraph.topo.core.Edge;
import com.nodegraph.topo.core.Node;

/**
 * Observer of topology mutations.
 *
 * Observers are attached to a single TopologyRegistry and receive a callback
 * after every mutation has been applied to the registry's canonical maps.
 * Typical consumers are document writers (autosave), automation hosts and
 * diagnostics.
 *
 * Ordering Contract:
 * - Added/moved callbacks fire after the entity is registered and consistent.
 * - Removed callbacks fire after the entity left the maps but before it is
 * disposed, so the observer can still read its final id, type, position and
 * endpoints. The entity must not be retained past the callback.
 * - Deleting a node reports every incident edge removal first, then the node.
 *
 * Batching:
 * onBatchBegin/onBatchEnd bracket bulk operations (document load, queued
 * commands). Every individual event is still delivered inside the bracket;
 * batching only tells the observer it may defer its own expensive work
 * (e.g. a file write) until onBatchEnd.
 *
 * Callbacks run synchronously on the mutating thread. They must not mutate the
 * registry they observe.
 */
public interface GraphObserver {

    default void onNodeAdded(Node node) {
    }

    default void onNodeRemoved(Node node) {
    }

    /**
     * Called when a node moved further than the registry's move threshold.
     *
     * @param node the moved node, already at {@code to}
     * @param from the last notified position
     * @param to   the new position
     */
    default void onNodeMoved(Node node, Position from, Position to) {
    }

    /**
     * The node's type or port counts changed and its ports were rebuilt. Any
     * incident edges were already reported removed.
     */
    default void onNodeChanged(Node node) {
    }

    default void onEdgeAdded(Edge edge) {
    }

    default void onEdgeRemoved(Edge edge) {
    }

    /** The registry dropped every node and edge without per-entity events. */
    default void onGraphCleared() {
    }

    /**
     * A document finished loading.
     *
     * @param source label of the document (file name or caller supplied tag)
     */
    default void onGraphLoaded(String source) {
    }

    default void onGraphSaved(String target) {
    }

    /** Outermost batch opened. */
    default void onBatchBegin() {
    }

    /** Outermost batch closed. */
    default void onBatchEnd() {
    }
}
