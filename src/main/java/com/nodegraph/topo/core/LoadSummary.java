package com.nodegraph.topo.core;

import com.nodegraph.topo.api.ErrorKind;

import java.util.List;

/**
 * Outcome of a best-effort document load.
 *
 * A load never aborts on a bad element; each failure is recorded here with
 * the id of the element (or a positional label when it had none).
 */
public record LoadSummary(String source, int nodesLoaded, int nodesFailed, int edgesResolved, int edgesFailed,
        List<Failure> failures) {

    public LoadSummary {
        failures = List.copyOf(failures);
    }

    public record Failure(String elementId, ErrorKind kind, String message) {
    }

    public boolean isClean() {
        return failures.isEmpty();
    }

    @Override
    public String toString() {
        return "LoadSummary[" + source + ": nodes " + nodesLoaded + " ok/" + nodesFailed + " failed, edges "
                + edgesResolved + " ok/" + edgesFailed + " failed]";
    }
}
