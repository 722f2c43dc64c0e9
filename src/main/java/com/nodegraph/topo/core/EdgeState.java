package com.nodegraph.topo.core;

/**
 * Resolution state of an {@link Edge}.
 *
 * The endpoint references only exist inside {@link Resolved} and
 * {@link Invalidated}, so any code that wants a live node or port has to match
 * on the state first.
 */
public interface EdgeState {

    Unresolved UNRESOLVED = new Unresolved();

    /** Only the stored node ids and socket indices are meaningful. */
    record Unresolved() implements EdgeState {
    }

    /** Validated references, registered with both nodes and both ports. */
    record Resolved(Node source, Port sourcePort, Node target, Port targetPort) implements EdgeState {
    }

    /**
     * One or both endpoints died, or the edge was disposed. A null field is a
     * cleared reference; the remaining ones belong to the surviving side and
     * still have to be unregistered by the registry.
     */
    record Invalidated(Node source, Port sourcePort, Node target, Port targetPort) implements EdgeState {

        static final Invalidated DISPOSED = new Invalidated(null, null, null, null);

        public boolean isFullyCleared() {
            return source == null && target == null;
        }
    }
}
