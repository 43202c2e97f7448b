package com.building.rig.api;

/**
 * Raised when a graph description cannot be turned into a graph: unparseable
 * node or edge records, unknown type names, duplicate declarations.
 */
public class GraphParseException extends IllegalArgumentException {
    private final int line;

    public GraphParseException(String message) {
        super(message);
        this.line = -1;
    }

    public GraphParseException(String message, Throwable cause) {
        super(message, cause);
        this.line = -1;
    }

    public GraphParseException(String message, int line) {
        super(message + " at line " + line);
        this.line = line;
    }

    /** 1-based source line, or -1 when the input is not line oriented. */
    public int line() {
        return line;
    }
}
