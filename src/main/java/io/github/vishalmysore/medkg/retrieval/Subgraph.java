package io.github.vishalmysore.medkg.retrieval;

import io.github.vishalmysore.medkg.domain.KgEdge;
import io.github.vishalmysore.medkg.domain.KgNode;
import lombok.Value;

import java.util.List;

/**
 * A node set with its induced edges. Parallel edges with different
 * relations are all included. {@code unresolved} lists requested names that
 * matched no node.
 */
@Value
public class Subgraph {
    List<KgNode> nodes;
    List<KgEdge> edges;
    List<String> unresolved;

    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
