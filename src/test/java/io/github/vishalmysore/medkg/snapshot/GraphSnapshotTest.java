package io.github.vishalmysore.medkg.snapshot;

import io.github.vishalmysore.medkg.domain.KgEdge;
import io.github.vishalmysore.medkg.domain.KgNode;
import io.github.vishalmysore.medkg.graph.Direction;
import io.github.vishalmysore.medkg.graph.KnowledgeGraph;
import io.github.vishalmysore.medkg.retrieval.GraphQueryEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class GraphSnapshotTest {

    @TempDir
    Path tempDir;

    private final GraphSnapshot snapshot = new GraphSnapshot();
    private KnowledgeGraph graph;

    @BeforeEach
    void setUp() {
        graph = new KnowledgeGraph();
        int tp53 = graph.addNode(0, "gene/protein", "TP53", "NCBI", "7157");
        int cancer = graph.addNode(1, "disease", "Li-Fraumeni syndrome", "MONDO");
        int drug = graph.addNode(2, "drug", "Nutlin-3", "DrugBank");
        int sameId = graph.addNode(2, "disease", "Other disease", null);
        graph.addEdge(tp53, cancer, "disease_protein", "associated with");
        graph.addEdge(drug, tp53, "drug_protein", "target");
        graph.addEdge(drug, tp53, "drug_protein_carrier", null);
        graph.addEdge(cancer, cancer, "disease_disease", "parent-child");
        graph.addEdge(sameId, cancer, "bert_group", "BERT similarity");
        graph.setAttribute(drug, "molecular_weight", 581.5);
        graph.setAttribute(drug, "approved", Boolean.FALSE);
        graph.setAttribute(drug, "drugbank_id", "DB11727");
        graph.setAttribute(cancer, "orphanet_prevalence", 42L);
    }

    @Test
    void roundTripPreservesNodesEdgesAndAttributes() throws Exception {
        KnowledgeGraph restored = snapshot.fromBytes(snapshot.toBytes(graph));

        assertEquals(graph.nodeCount(), restored.nodeCount());
        assertEquals(graph.edgeCount(), restored.edgeCount());
        for (int i = 0; i < graph.nodeCount(); i++) {
            KgNode original = graph.getNode(i);
            KgNode copy = restored.getNode(i);
            assertEquals(original.getId(), copy.getId());
            assertEquals(original.getType(), copy.getType());
            assertEquals(original.getName(), copy.getName());
            assertEquals(original.getSource(), copy.getSource());
            assertEquals(original.getSourceId(), copy.getSourceId());
            assertEquals(original.getAttributes(), copy.getAttributes());
            assertEquals(graph.neighbors(i, Direction.OUT), restored.neighbors(i, Direction.OUT));
            assertEquals(graph.neighbors(i, Direction.IN), restored.neighbors(i, Direction.IN));
        }
        for (int p = 0; p < graph.edgeCount(); p++) {
            KgEdge original = graph.getEdge(p);
            assertEquals(original, restored.getEdge(p));
        }
        assertEquals(581.5, restored.getNode(2).getAttribute("molecular_weight"));
        assertEquals(42L, restored.getNode(1).getAttribute("orphanet_prevalence"));
        assertEquals(Boolean.FALSE, restored.getNode(2).getAttribute("approved"));
    }

    @Test
    void restoredGraphAnswersQueriesIdentically() throws Exception {
        KnowledgeGraph restored = snapshot.fromBytes(snapshot.toBytes(graph));

        GraphQueryEngine before = new GraphQueryEngine(graph);
        GraphQueryEngine after = new GraphQueryEngine(restored);
        assertEquals(before.shortestPath("Nutlin-3", "Other disease").getValue().getIndices(),
                after.shortestPath("Nutlin-3", "Other disease").getValue().getIndices());
        assertEquals(before.statistics(), after.statistics());
        assertEquals(3, restored.indexOf(2, "disease").getAsInt());
        assertEquals(2, restored.indexOf(2).getAsInt());
    }

    @Test
    void restoredGraphIsWritableAndDeduplicates() throws Exception {
        KnowledgeGraph restored = snapshot.fromBytes(snapshot.toBytes(graph));

        assertFalse(restored.addEdge(0, 1, "disease_protein", "associated with"));
        assertEquals(0, restored.addNode(0, "gene/protein", "TP53", "NCBI"));
        assertTrue(restored.addEdge(1, 0, "disease_protein", "associated with"));
    }

    @Test
    void emptyGraphRoundTrips() throws Exception {
        KnowledgeGraph restored = snapshot.fromBytes(snapshot.toBytes(new KnowledgeGraph()));

        assertEquals(0, restored.nodeCount());
        assertEquals(0, restored.edgeCount());
    }

    @Test
    void saveAndLoadThroughFile() throws Exception {
        Path file = tempDir.resolve("nested/dir/graph.bin");

        snapshot.save(graph, file);
        KnowledgeGraph restored = snapshot.load(file);

        assertTrue(Files.size(file) > 0);
        assertEquals(5, restored.edgeCount());
    }

    @Test
    void rejectsForeignBytes() {
        byte[] bytes = "nodes.csv,not a snapshot".getBytes();

        SnapshotFormatException e = assertThrows(SnapshotFormatException.class, () -> snapshot.fromBytes(bytes));
        assertTrue(e.getMessage().contains("magic"));
    }

    @Test
    void rejectsUnknownVersion() {
        byte[] bytes = snapshot.toBytes(graph);
        ByteBuffer.wrap(bytes).putInt(4, 99);

        SnapshotFormatException e = assertThrows(SnapshotFormatException.class, () -> snapshot.fromBytes(bytes));
        assertTrue(e.getMessage().contains("99"));
    }

    @Test
    void rejectsTruncatedSnapshot() {
        byte[] bytes = snapshot.toBytes(graph);

        assertThrows(SnapshotFormatException.class,
                () -> snapshot.fromBytes(Arrays.copyOf(bytes, bytes.length - 6)));
        assertThrows(SnapshotFormatException.class,
                () -> snapshot.fromBytes(Arrays.copyOf(bytes, 10)));
    }

    @Test
    void rejectsMissingEndMarker() {
        byte[] bytes = snapshot.toBytes(graph);
        ByteBuffer.wrap(bytes).putInt(bytes.length - 4, 0);

        SnapshotFormatException e = assertThrows(SnapshotFormatException.class, () -> snapshot.fromBytes(bytes));
        assertTrue(e.getMessage().contains("end marker"));
    }

    @Test
    void rejectsAdjacencyThatDisagreesWithEdges() {
        byte[] bytes = snapshot.toBytes(graph);
        // the int before the end marker is the incoming adjacency count of the last node
        ByteBuffer.wrap(bytes).putInt(bytes.length - 8, 1234);

        assertThrows(SnapshotFormatException.class, () -> snapshot.fromBytes(bytes));
    }

    @Test
    void rejectsEdgeReferencingMissingNode() {
        KnowledgeGraph small = new KnowledgeGraph();
        int a = small.addNode(1, "drug", "A", "test");
        int b = small.addNode(2, "drug", "B", "test");
        small.addEdge(a, b, "r", "r");
        byte[] bytes = snapshot.toBytes(small);

        // the edge table starts with its count, then source and target indices
        int edgeSection = indexOfEdgeSection(bytes, small);
        ByteBuffer.wrap(bytes).putInt(edgeSection + 8, 7);

        SnapshotFormatException e = assertThrows(SnapshotFormatException.class, () -> snapshot.fromBytes(bytes));
        assertTrue(e.getMessage().startsWith("Inconsistent snapshot"));
    }

    private static int indexOfEdgeSection(byte[] bytes, KnowledgeGraph graph) {
        // header (magic, version, node count) followed by fixed-shape node entries
        int offset = 12;
        for (KgNode node : graph.getAllNodes()) {
            offset += 8;
            offset += 4 + node.getType().length();
            offset += 4 + node.getName().length();
            offset += 4 + node.getSource().length();
            offset += 4;
            offset += 4;
        }
        return offset;
    }
}
