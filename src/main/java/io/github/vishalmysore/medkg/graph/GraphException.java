package io.github.vishalmysore.medkg.graph;

/**
 * Base class for failures of a single graph store operation.
 */
public class GraphException extends RuntimeException {

    public GraphException(String message) {
        super(message);
    }
}
