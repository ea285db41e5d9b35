package io.github.vishalmysore.medkg.actions;

import io.github.vishalmysore.medkg.domain.DerivedRelation;
import io.github.vishalmysore.medkg.domain.KgNode;
import io.github.vishalmysore.medkg.domain.NodeType;
import io.github.vishalmysore.medkg.graph.Direction;
import io.github.vishalmysore.medkg.retrieval.GraphPath;
import io.github.vishalmysore.medkg.retrieval.GraphQueryEngine;
import io.github.vishalmysore.medkg.retrieval.GraphStatistics;
import io.github.vishalmysore.medkg.retrieval.QueryResult;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Text renderings of the graph queries for a command line or chat front
 * end. Every action returns a printable string; unknown names produce a
 * "not found" line instead of an error.
 */
public class KnowledgeGraphActions {
    private static final Logger log = Logger.getLogger(KnowledgeGraphActions.class.getName());

    private static final int MAX_LISTED = 10;

    private final GraphQueryEngine engine;

    public KnowledgeGraphActions(GraphQueryEngine engine) {
        this.engine = engine;
    }

    public String graphStatistics() {
        log.info("graphStatistics invoked");
        GraphStatistics stats = engine.statistics();
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Graph Size: %,d nodes, %,d edges%n", stats.getNodeCount(), stats.getEdgeCount()));
        sb.append("Node Type Counts:\n");
        for (Map.Entry<String, Long> entry : stats.getNodeTypeCounts().entrySet()) {
            sb.append(String.format("  - %s: %,d%n", entry.getKey(), entry.getValue()));
        }
        sb.append("Relation Counts:\n");
        for (Map.Entry<String, Long> entry : stats.getRelationCounts().entrySet()) {
            sb.append(String.format("  - %s: %,d%n", entry.getKey(), entry.getValue()));
        }
        sb.append(String.format("Weakly Connected Components: %d%n", stats.getWeaklyConnectedComponents()));
        sb.append(String.format("Degree: min %d, max %d, average %.2f%n",
                stats.getMinDegree(), stats.getMaxDegree(), stats.getAverageDegree()));
        return sb.toString();
    }

    public String drugsForDisease(String disease) {
        log.info("drugsForDisease invoked for: " + disease);
        return renderNames("Drugs used for '" + disease + "'", engine.drugsForDisease(disease));
    }

    public String genesForDisease(String disease) {
        log.info("genesForDisease invoked for: " + disease);
        return renderNames("Genes linked to '" + disease + "'", engine.genesForDisease(disease));
    }

    public String similarDiseases(String disease) {
        log.info("similarDiseases invoked for: " + disease);
        return renderNames("BERT-similar diseases to '" + disease + "'",
                engine.neighborsByRelation(disease, DerivedRelation.CLUSTER_APPROX.getRelation()));
    }

    public String sharedSideEffects(String drug) {
        log.info("sharedSideEffects invoked for: " + drug);
        QueryResult<Set<String>> result = engine.sharedSecondOrder(drug,
                NodeType.EFFECT_PHENOTYPE.getLabel(), NodeType.DRUG.getLabel());
        return renderNames("Drugs that share side effects with '" + drug + "'", result);
    }

    public String shortestPath(String from, String to) {
        log.info("shortestPath invoked: " + from + " -> " + to);
        QueryResult<GraphPath> result = engine.shortestPath(from, to);
        if (!result.isOk()) {
            return "No path found between '" + from + "' and '" + to + "': " + result.getMessage() + "\n";
        }
        GraphPath path = result.getValue();
        return "Shortest path (" + path.length() + " edges): " + path + "\n";
    }

    public String expandNode(String name) {
        log.info("expandNode invoked for: " + name);
        OptionalInt index = engine.resolve(name);
        if (index.isEmpty()) {
            return "Node not found: " + name + "\n";
        }
        KgNode node = engine.getGraph().getNode(index.getAsInt());
        List<Integer> neighbors = engine.getGraph().neighbors(node.getIndex(), Direction.BOTH);

        StringBuilder sb = new StringBuilder();
        sb.append("Node: ").append(node.getName()).append(" (").append(node.getType()).append(")\n");
        sb.append("Neighbors (").append(neighbors.size()).append("):\n");
        for (int neighbor : neighbors.subList(0, Math.min(neighbors.size(), MAX_LISTED))) {
            KgNode other = engine.getGraph().getNode(neighbor);
            sb.append("  -> ").append(other.getName()).append(" (").append(other.getType()).append(")\n");
        }
        if (neighbors.size() > MAX_LISTED) {
            sb.append("  ... ").append(neighbors.size() - MAX_LISTED).append(" more\n");
        }
        return sb.toString();
    }

    private String renderNames(String title, QueryResult<? extends Collection<String>> result) {
        if (!result.isOk()) {
            return title + ": " + result.getMessage() + "\n";
        }
        Collection<String> names = result.getValue();
        if (names.isEmpty()) {
            return title + ": none found\n";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(title).append(" (").append(names.size()).append("):\n");
        names.stream().limit(MAX_LISTED).forEach(name -> sb.append("  - ").append(name).append("\n"));
        if (names.size() > MAX_LISTED) {
            sb.append("  ... ").append(names.size() - MAX_LISTED).append(" more\n");
        }
        return sb.toString();
    }
}
