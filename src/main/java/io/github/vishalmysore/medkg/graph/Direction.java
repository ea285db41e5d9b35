package io.github.vishalmysore.medkg.graph;

/**
 * Which incident edges a neighbor lookup follows.
 */
public enum Direction {
    OUT, // edges leaving the node
    IN, // edges entering the node
    BOTH // every incident edge, ignoring direction
}
