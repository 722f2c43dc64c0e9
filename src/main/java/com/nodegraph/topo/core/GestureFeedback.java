package com.nodegraph.topo.core;

/** Result of hovering a candidate target during a connection gesture. */
public enum GestureFeedback {
    /** The pre-check passes; releasing here is expected to connect. */
    ACCEPT,
    /** The pre-check fails; releasing here will not connect. */
    REJECT,
    /** Nothing to connect to (no port under the pointer). */
    NONE
}
