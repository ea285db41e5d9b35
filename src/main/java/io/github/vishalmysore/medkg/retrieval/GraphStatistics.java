package io.github.vishalmysore.medkg.retrieval;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Health-check figures for a built graph.
 */
@Data
@Builder
public class GraphStatistics {
    private int nodeCount;
    private int edgeCount;
    private Map<String, Long> nodeTypeCounts;
    private Map<String, Long> relationCounts;
    private int minDegree;
    private int maxDegree;
    private double averageDegree;
    private int weaklyConnectedComponents;
}
