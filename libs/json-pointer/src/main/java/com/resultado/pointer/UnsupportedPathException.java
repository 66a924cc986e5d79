package com.resultado.pointer;

/**
 * Thrown when a path contains a node that cannot be turned into a pointer segment.
 *
 * <p>This is a defect in the calling code (the path was built from something other than property
 * reads and literal indexes), not a data error.
 */
public class UnsupportedPathException extends RuntimeException {

    private final PathExpression node;

    public UnsupportedPathException(PathExpression node) {
        super("%s (at %s) not supported".formatted(node.nodeKind(), node));
        this.node = node;
    }

    /** The offending node. */
    public PathExpression node() {
        return node;
    }
}
