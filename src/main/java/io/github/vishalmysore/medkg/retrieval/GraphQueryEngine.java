package io.github.vishalmysore.medkg.retrieval;

import io.github.vishalmysore.medkg.domain.KgEdge;
import io.github.vishalmysore.medkg.domain.KgNode;
import io.github.vishalmysore.medkg.domain.NodeType;
import io.github.vishalmysore.medkg.graph.Direction;
import io.github.vishalmysore.medkg.graph.KnowledgeGraph;

import java.util.*;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Read-only queries over a built {@link KnowledgeGraph}: name resolution,
 * typed neighbors, shortest paths, induced subgraphs and two-hop joins.
 *
 * Names resolve to the first node, in insertion order, whose name matches
 * ignoring case. Traversals treat edges as undirected since the questions
 * are about relatedness. Unknown names and missing paths come back as
 * {@link QueryResult} statuses, never as exceptions.
 *
 * Each call keeps its scratch state on the stack, so one engine can serve
 * concurrent readers of a sealed graph.
 */
public class GraphQueryEngine {
    private static final Logger log = Logger.getLogger(GraphQueryEngine.class.getName());

    private final KnowledgeGraph graph;

    public GraphQueryEngine(KnowledgeGraph graph) {
        this.graph = graph;
    }

    public KnowledgeGraph getGraph() {
        return graph;
    }

    public OptionalInt resolve(String name) {
        if (name == null || name.isBlank()) {
            return OptionalInt.empty();
        }
        return graph.findByName(name);
    }

    /**
     * Names of the entity's neighbors of one type, in neighbor order. A
     * neighbor joined by several relations is listed once per edge.
     */
    public QueryResult<List<String>> typedNeighbors(String entityName, String nodeType) {
        OptionalInt entity = resolve(entityName);
        if (entity.isEmpty()) {
            return QueryResult.notFound(entityName);
        }
        List<String> names = graph.neighbors(entity.getAsInt(), Direction.BOTH).stream()
                .map(graph::getNode)
                .filter(node -> node.isOfType(nodeType))
                .map(KgNode::getName)
                .collect(Collectors.toList());
        return QueryResult.ok(names);
    }

    public QueryResult<List<String>> drugsForDisease(String diseaseName) {
        return typedNeighbors(diseaseName, NodeType.DRUG.getLabel());
    }

    public QueryResult<List<String>> genesForDisease(String diseaseName) {
        return typedNeighbors(diseaseName, NodeType.GENE_PROTEIN.getLabel());
    }

    /**
     * Targets of the entity's outgoing edges with the given relation, e.g.
     * the diseases linked to it by "bert_related".
     */
    public QueryResult<List<String>> neighborsByRelation(String entityName, String relation) {
        OptionalInt entity = resolve(entityName);
        if (entity.isEmpty()) {
            return QueryResult.notFound(entityName);
        }
        List<String> names = new ArrayList<>();
        for (int position : graph.outgoingEdges(entity.getAsInt())) {
            KgEdge edge = graph.getEdge(position);
            if (edge.getRelation().equals(relation)) {
                names.add(graph.getNode(edge.getTargetIndex()).getName());
            }
        }
        return QueryResult.ok(names);
    }

    /**
     * One minimum-edge path between two named entities over the undirected
     * view of the graph. Among equally short paths the one found first by
     * breadth-first expansion in edge-insertion order wins.
     */
    public QueryResult<GraphPath> shortestPath(String fromName, String toName) {
        OptionalInt from = resolve(fromName);
        OptionalInt to = resolve(toName);
        if (from.isEmpty() || to.isEmpty()) {
            String missing = from.isEmpty() ? fromName : toName;
            return QueryResult.noPath("Entity not found: " + missing);
        }
        return pathBetween(from.getAsInt(), to.getAsInt());
    }

    /**
     * Diagnostic: shortest path between a random node of each type.
     */
    public QueryResult<GraphPath> randomPath(String fromType, String toType, Random random) {
        List<Integer> sources = indicesOfType(fromType);
        List<Integer> targets = indicesOfType(toType);
        if (sources.isEmpty() || targets.isEmpty()) {
            return QueryResult.notFound("a node of type " + (sources.isEmpty() ? fromType : toType));
        }
        int from = sources.get(random.nextInt(sources.size()));
        int to = targets.get(random.nextInt(targets.size()));
        log.fine("Random path check: " + graph.getNode(from).getName() + " -> " + graph.getNode(to).getName());
        return pathBetween(from, to);
    }

    /**
     * The induced subgraph of the named entities: every edge whose two
     * endpoints are both among them. Unknown names are skipped and reported.
     */
    public Subgraph subgraph(Collection<String> names) {
        Set<Integer> indices = new LinkedHashSet<>();
        List<String> unresolved = new ArrayList<>();
        for (String name : names) {
            OptionalInt index = resolve(name);
            if (index.isPresent()) {
                indices.add(index.getAsInt());
            } else {
                unresolved.add(name);
            }
        }
        return induced(indices, unresolved);
    }

    /**
     * The entity, all of its neighbors and the edges among them.
     */
    public QueryResult<Subgraph> neighborhood(String entityName) {
        OptionalInt entity = resolve(entityName);
        if (entity.isEmpty()) {
            return QueryResult.notFound(entityName);
        }
        Set<Integer> indices = new LinkedHashSet<>();
        indices.add(entity.getAsInt());
        indices.addAll(graph.neighbors(entity.getAsInt(), Direction.BOTH));
        return QueryResult.ok(induced(indices, Collections.emptyList()));
    }

    /**
     * Two-hop join: entities of {@code targetType} that share a
     * {@code bridgeType} neighbor with the given entity, e.g. drugs sharing
     * a side effect with a drug. The entity itself is never part of the
     * answer.
     */
    public QueryResult<Set<String>> sharedSecondOrder(String entityName, String bridgeType, String targetType) {
        OptionalInt resolved = resolve(entityName);
        if (resolved.isEmpty()) {
            return QueryResult.notFound(entityName);
        }
        int entity = resolved.getAsInt();

        Set<Integer> visitedBridges = new HashSet<>();
        Set<String> shared = new LinkedHashSet<>();
        for (int bridge : graph.neighbors(entity, Direction.BOTH)) {
            if (!graph.getNode(bridge).isOfType(bridgeType) || !visitedBridges.add(bridge)) {
                continue;
            }
            for (int candidate : graph.neighbors(bridge, Direction.BOTH)) {
                KgNode node = graph.getNode(candidate);
                if (candidate != entity && node.isOfType(targetType)) {
                    shared.add(node.getName());
                }
            }
        }
        return QueryResult.ok(Collections.unmodifiableSet(shared));
    }

    public GraphStatistics statistics() {
        Map<String, Long> typeCounts = new LinkedHashMap<>();
        for (KgNode node : graph.getAllNodes()) {
            typeCounts.merge(node.getType(), 1L, Long::sum);
        }
        Map<String, Long> relationCounts = new LinkedHashMap<>();
        for (KgEdge edge : graph.getAllEdges()) {
            relationCounts.merge(edge.getRelation(), 1L, Long::sum);
        }

        int nodeCount = graph.nodeCount();
        int minDegree = nodeCount == 0 ? 0 : Integer.MAX_VALUE;
        int maxDegree = 0;
        long degreeSum = 0;
        for (int index = 0; index < nodeCount; index++) {
            int degree = graph.degree(index);
            minDegree = Math.min(minDegree, degree);
            maxDegree = Math.max(maxDegree, degree);
            degreeSum += degree;
        }

        return GraphStatistics.builder()
                .nodeCount(nodeCount)
                .edgeCount(graph.edgeCount())
                .nodeTypeCounts(typeCounts)
                .relationCounts(relationCounts)
                .minDegree(minDegree)
                .maxDegree(maxDegree)
                .averageDegree(nodeCount == 0 ? 0.0 : (double) degreeSum / nodeCount)
                .weaklyConnectedComponents(countWeakComponents())
                .build();
    }

    private QueryResult<GraphPath> pathBetween(int from, int to) {
        int[] parent = new int[graph.nodeCount()];
        Arrays.fill(parent, -1);
        parent[from] = from;

        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(from);
        while (!queue.isEmpty() && parent[to] == -1) {
            int current = queue.poll();
            for (int position : graph.incidentEdges(current)) {
                KgEdge edge = graph.getEdge(position);
                int next = edge.getSourceIndex() == current ? edge.getTargetIndex() : edge.getSourceIndex();
                if (parent[next] == -1) {
                    parent[next] = current;
                    if (next == to) {
                        break;
                    }
                    queue.add(next);
                }
            }
        }

        if (parent[to] == -1) {
            return QueryResult.noPath("No path between '" + graph.getNode(from).getName()
                    + "' and '" + graph.getNode(to).getName() + "'");
        }
        LinkedList<KgNode> path = new LinkedList<>();
        for (int step = to; step != from; step = parent[step]) {
            path.addFirst(graph.getNode(step));
        }
        path.addFirst(graph.getNode(from));
        return QueryResult.ok(new GraphPath(new ArrayList<>(path)));
    }

    private Subgraph induced(Set<Integer> indices, List<String> unresolved) {
        SortedSet<Integer> positions = new TreeSet<>();
        for (int index : indices) {
            for (int position : graph.incidentEdges(index)) {
                KgEdge edge = graph.getEdge(position);
                if (indices.contains(edge.getSourceIndex()) && indices.contains(edge.getTargetIndex())) {
                    positions.add(position);
                }
            }
        }
        List<KgNode> nodes = indices.stream().map(graph::getNode).collect(Collectors.toList());
        List<KgEdge> edges = positions.stream().map(graph::getEdge).collect(Collectors.toList());
        return new Subgraph(nodes, edges, List.copyOf(unresolved));
    }

    private List<Integer> indicesOfType(String type) {
        return graph.getAllNodes().stream()
                .filter(node -> node.isOfType(type))
                .map(KgNode::getIndex)
                .collect(Collectors.toList());
    }

    private int countWeakComponents() {
        int[] root = new int[graph.nodeCount()];
        for (int i = 0; i < root.length; i++) {
            root[i] = i;
        }
        int components = root.length;
        for (KgEdge edge : graph.getAllEdges()) {
            int a = find(root, edge.getSourceIndex());
            int b = find(root, edge.getTargetIndex());
            if (a != b) {
                root[a] = b;
                components--;
            }
        }
        return components;
    }

    private static int find(int[] root, int node) {
        while (root[node] != node) {
            root[node] = root[root[node]];
            node = root[node];
        }
        return node;
    }
}
