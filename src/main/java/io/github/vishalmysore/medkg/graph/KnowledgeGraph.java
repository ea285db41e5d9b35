package io.github.vishalmysore.medkg.graph;

import io.github.vishalmysore.medkg.domain.KgEdge;
import io.github.vishalmysore.medkg.domain.KgNode;
import lombok.Value;

import java.util.*;
import java.util.logging.Logger;

/**
 * The typed, attributed, directed multigraph. Nodes are addressed by their
 * dense insertion index; edges by their insertion position. Each node keeps
 * out, in and incident lists of edge positions, so adjacency lookups cost
 * O(1) per neighbor and always come back in edge-insertion order.
 *
 * The store is built by a single writer. After {@link #seal()} it rejects
 * every mutation and may be shared between concurrent readers.
 */
public class KnowledgeGraph {
    private static final Logger log = Logger.getLogger(KnowledgeGraph.class.getName());

    private final List<KgNode> nodes = new ArrayList<>();
    private final List<Map<String, Object>> attributes = new ArrayList<>();
    private final List<KgEdge> edges = new ArrayList<>();

    private final List<List<Integer>> outEdges = new ArrayList<>();
    private final List<List<Integer>> inEdges = new ArrayList<>();
    private final List<List<Integer>> incidentEdges = new ArrayList<>();

    private final Map<NodeKey, Integer> indexByTypedId = new HashMap<>();
    private final Map<Long, Integer> firstIndexById = new HashMap<>();
    private final Map<String, Integer> firstIndexByName = new HashMap<>();
    private final Set<EdgeKey> edgeKeys = new HashSet<>();

    private volatile boolean sealed;

    public int addNode(long id, String type, String name, String source) {
        return addNode(id, type, name, source, null);
    }

    /**
     * Inserts a node and returns its index. A node is identified by its
     * external id within its type: inserting the same (type, id) again keeps
     * the first node untouched and returns its index.
     */
    public int addNode(long id, String type, String name, String source, String sourceId) {
        checkWritable();
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Node " + id + " has no type");
        }
        NodeKey key = new NodeKey(type, id);
        Integer existing = indexByTypedId.get(key);
        if (existing != null) {
            log.fine("Node " + type + ":" + id + " already present at index " + existing);
            return existing;
        }

        int index = nodes.size();
        Map<String, Object> nodeAttributes = new LinkedHashMap<>();
        nodes.add(KgNode.builder()
                .index(index)
                .id(id)
                .type(type)
                .name(name != null ? name : "")
                .source(source)
                .sourceId(sourceId)
                .attributes(nodeAttributes)
                .build());
        attributes.add(nodeAttributes);
        outEdges.add(new ArrayList<>());
        inEdges.add(new ArrayList<>());
        incidentEdges.add(new ArrayList<>());

        indexByTypedId.put(key, index);
        firstIndexById.putIfAbsent(id, index);
        if (name != null) {
            firstIndexByName.putIfAbsent(normalizeName(name), index);
        }
        return index;
    }

    /**
     * Adds a directed edge. Returns false, leaving the store unchanged, when
     * an edge with the same endpoints and relation already exists.
     *
     * @throws UnknownNodeException if either endpoint is not in the store
     */
    public boolean addEdge(int sourceIndex, int targetIndex, String relation, String displayRelation) {
        checkWritable();
        checkNode(sourceIndex);
        checkNode(targetIndex);
        if (relation == null || relation.isBlank()) {
            throw new IllegalArgumentException("Edge " + sourceIndex + "->" + targetIndex + " has no relation");
        }
        if (!edgeKeys.add(new EdgeKey(sourceIndex, targetIndex, relation))) {
            return false;
        }

        int position = edges.size();
        edges.add(KgEdge.builder()
                .sourceIndex(sourceIndex)
                .targetIndex(targetIndex)
                .relation(relation)
                .displayRelation(displayRelation != null ? displayRelation : relation)
                .build());
        outEdges.get(sourceIndex).add(position);
        inEdges.get(targetIndex).add(position);
        incidentEdges.get(sourceIndex).add(position);
        if (targetIndex != sourceIndex) {
            incidentEdges.get(targetIndex).add(position);
        }
        return true;
    }

    public boolean hasEdge(int sourceIndex, int targetIndex, String relation) {
        return edgeKeys.contains(new EdgeKey(sourceIndex, targetIndex, relation));
    }

    /**
     * Sets (or overwrites) a feature attribute. Values are String, Long,
     * Double or Boolean. Core node fields are not attributes and cannot be
     * reached through this method.
     */
    public void setAttribute(int index, String key, Object value) {
        checkWritable();
        checkNode(index);
        if (key == null || value == null) {
            throw new IllegalArgumentException("Attribute key and value are required");
        }
        if (!isAttributeValue(value)) {
            throw new IllegalArgumentException("Unsupported attribute type " + value.getClass().getSimpleName()
                    + " for '" + key + "'");
        }
        attributes.get(index).put(key, value);
    }

    /**
     * Whether a value can be stored as an attribute: String, Long, Double or
     * Boolean.
     */
    public static boolean isAttributeValue(Object value) {
        return value instanceof String || value instanceof Long || value instanceof Double
                || value instanceof Boolean;
    }

    /**
     * Neighbor indices in edge-insertion order. Not deduplicated: a node
     * reached through two relations appears twice.
     */
    public List<Integer> neighbors(int index, Direction direction) {
        checkNode(index);
        List<Integer> positions;
        switch (direction) {
            case OUT:
                positions = outEdges.get(index);
                break;
            case IN:
                positions = inEdges.get(index);
                break;
            default:
                positions = incidentEdges.get(index);
        }

        List<Integer> result = new ArrayList<>(positions.size());
        for (int position : positions) {
            KgEdge edge = edges.get(position);
            result.add(edge.getSourceIndex() == index ? edge.getTargetIndex() : edge.getSourceIndex());
        }
        return result;
    }

    /**
     * Out-degree plus in-degree. A self-loop counts twice.
     */
    public int degree(int index) {
        checkNode(index);
        return outEdges.get(index).size() + inEdges.get(index).size();
    }

    /**
     * Edge positions touching the node, in insertion order.
     */
    public List<Integer> incidentEdges(int index) {
        checkNode(index);
        return Collections.unmodifiableList(incidentEdges.get(index));
    }

    public List<Integer> outgoingEdges(int index) {
        checkNode(index);
        return Collections.unmodifiableList(outEdges.get(index));
    }

    public List<Integer> incomingEdges(int index) {
        checkNode(index);
        return Collections.unmodifiableList(inEdges.get(index));
    }

    public KgNode getNode(int index) {
        checkNode(index);
        return nodes.get(index);
    }

    public KgEdge getEdge(int position) {
        if (position < 0 || position >= edges.size()) {
            throw new IndexOutOfBoundsException("Unknown edge position: " + position);
        }
        return edges.get(position);
    }

    public boolean containsNode(int index) {
        return index >= 0 && index < nodes.size();
    }

    /**
     * Index of the first node inserted with this external id, of any type.
     */
    public OptionalInt indexOf(long id) {
        Integer index = firstIndexById.get(id);
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }

    public OptionalInt indexOf(long id, String type) {
        if (type == null) {
            return OptionalInt.empty();
        }
        Integer index = indexByTypedId.get(new NodeKey(type, id));
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }

    /**
     * Index of the first node, in insertion order, whose name equals the
     * given one ignoring case.
     */
    public OptionalInt findByName(String name) {
        if (name == null) {
            return OptionalInt.empty();
        }
        Integer index = firstIndexByName.get(normalizeName(name));
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public List<KgNode> getAllNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<KgEdge> getAllEdges() {
        return Collections.unmodifiableList(edges);
    }

    /**
     * Ends the build phase. Any later mutation fails with
     * {@link IllegalStateException}.
     */
    public void seal() {
        sealed = true;
        log.info("Graph sealed: " + nodes.size() + " nodes, " + edges.size() + " edges");
    }

    public boolean isSealed() {
        return sealed;
    }

    private void checkWritable() {
        if (sealed) {
            throw new IllegalStateException("Graph is sealed and can no longer be modified");
        }
    }

    private void checkNode(int index) {
        if (!containsNode(index)) {
            throw new UnknownNodeException(index);
        }
    }

    /**
     * Case-folds code point by code point, matching the rules of
     * {@link String#equalsIgnoreCase}.
     */
    private static String normalizeName(String name) {
        StringBuilder folded = new StringBuilder(name.length());
        name.codePoints()
                .map(c -> Character.toLowerCase(Character.toUpperCase(c)))
                .forEach(folded::appendCodePoint);
        return folded.toString();
    }

    @Value
    private static class NodeKey {
        String type;
        long id;
    }

    @Value
    private static class EdgeKey {
        int source;
        int target;
        String relation;
    }
}
