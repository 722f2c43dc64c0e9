package com.nodegraph.topo.api;

/**
 * Signals a recoverable topology failure.
 *
 * Every operation that throws this leaves the registry exactly as it was before
 * the call; the caller decides whether to surface, skip or abort.
 */
public class TopologyException extends RuntimeException {
    private final ErrorKind kind;

    public TopologyException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TopologyException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    @Override
    public String getMessage() {
        return kind + ": " + super.getMessage();
    }
}
