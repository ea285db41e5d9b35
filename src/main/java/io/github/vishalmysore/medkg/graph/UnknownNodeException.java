package io.github.vishalmysore.medkg.graph;

/**
 * Thrown when an operation addresses a node index the store does not hold.
 */
public class UnknownNodeException extends GraphException {
    private final int index;

    public UnknownNodeException(int index) {
        super("Unknown node index: " + index);
        this.index = index;
    }

    public int getIndex() {
        return index;
    }
}
