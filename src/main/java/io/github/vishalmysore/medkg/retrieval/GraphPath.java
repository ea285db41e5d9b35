package io.github.vishalmysore.medkg.retrieval;

import io.github.vishalmysore.medkg.domain.KgNode;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An ordered node sequence from a path query, endpoints included.
 */
@Value
public class GraphPath {
    List<KgNode> nodes;

    public List<Integer> getIndices() {
        return nodes.stream().map(KgNode::getIndex).collect(Collectors.toList());
    }

    public List<String> getNames() {
        return nodes.stream().map(KgNode::getName).collect(Collectors.toList());
    }

    /**
     * Number of edges along the path.
     */
    public int length() {
        return nodes.size() - 1;
    }

    @Override
    public String toString() {
        return String.join(" -> ", getNames());
    }
}
