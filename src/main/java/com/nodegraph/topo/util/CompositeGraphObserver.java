package com.nodegraph.topo.util;

import com.nodegraph.topo.api.GraphObserver;
import com.nodegraph.topo.api.Position;
import com.nodegraph.topo.core.Edge;
import com.nodegraph.topo.core.Node;

import java.util.Arrays;
import java.util.function.Consumer;

import lombok.extern.log4j.Log4j2;

/**
 * Fans every {@link GraphObserver} callback out to a set of observers.
 *
 * The observer array is copy-on-write: attach/detach swap in a new array, so an
 * observer may detach itself (or another observer) from inside a callback
 * without disturbing the iteration in progress.
 *
 * A throwing observer is logged and skipped. The mutation that triggered the
 * callback has already been applied, and the remaining observers still need to
 * see it.
 */
@Log4j2
public class CompositeGraphObserver implements GraphObserver {
    private GraphObserver[] observers = new GraphObserver[0];

    /**
     * Adds an observer. Attaching the same instance twice is a no-op.
     *
     * @return true if the observer was added
     */
    public boolean attach(GraphObserver observer) {
        if (observer == null)
            throw new IllegalArgumentException("observer must not be null");
        if (indexOf(observer) >= 0)
            return false;
        GraphObserver[] old = observers;
        GraphObserver[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = observer;
        observers = next;
        return true;
    }

    /**
     * Removes an observer.
     *
     * @return true if the observer was attached
     */
    public boolean detach(GraphObserver observer) {
        int idx = indexOf(observer);
        if (idx < 0)
            return false;
        GraphObserver[] old = observers;
        GraphObserver[] next = new GraphObserver[old.length - 1];
        System.arraycopy(old, 0, next, 0, idx);
        System.arraycopy(old, idx + 1, next, idx, old.length - idx - 1);
        observers = next;
        return true;
    }

    public int size() {
        return observers.length;
    }

    private int indexOf(GraphObserver observer) {
        GraphObserver[] current = observers;
        for (int i = 0; i < current.length; i++)
            if (current[i] == observer)
                return i;
        return -1;
    }

    private void fire(String event, Consumer<GraphObserver> call) {
        for (GraphObserver o : observers) {
            try {
                call.accept(o);
            } catch (RuntimeException e) {
                log.error("Observer {} failed on {}", o.getClass().getSimpleName(), event, e);
            }
        }
    }

    @Override
    public void onNodeAdded(Node node) {
        fire("nodeAdded", o -> o.onNodeAdded(node));
    }

    @Override
    public void onNodeRemoved(Node node) {
        fire("nodeRemoved", o -> o.onNodeRemoved(node));
    }

    @Override
    public void onNodeMoved(Node node, Position from, Position to) {
        fire("nodeMoved", o -> o.onNodeMoved(node, from, to));
    }

    @Override
    public void onNodeChanged(Node node) {
        fire("nodeChanged", o -> o.onNodeChanged(node));
    }

    @Override
    public void onEdgeAdded(Edge edge) {
        fire("edgeAdded", o -> o.onEdgeAdded(edge));
    }

    @Override
    public void onEdgeRemoved(Edge edge) {
        fire("edgeRemoved", o -> o.onEdgeRemoved(edge));
    }

    @Override
    public void onGraphCleared() {
        fire("graphCleared", GraphObserver::onGraphCleared);
    }

    @Override
    public void onGraphLoaded(String source) {
        fire("graphLoaded", o -> o.onGraphLoaded(source));
    }

    @Override
    public void onGraphSaved(String target) {
        fire("graphSaved", o -> o.onGraphSaved(target));
    }

    @Override
    public void onBatchBegin() {
        fire("batchBegin", GraphObserver::onBatchBegin);
    }

    @Override
    public void onBatchEnd() {
        fire("batchEnd", GraphObserver::onBatchEnd);
    }
}
