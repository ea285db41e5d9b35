package io.github.vishalmysore.medkg.ingest;

import io.github.vishalmysore.medkg.domain.KgNode;
import io.github.vishalmysore.medkg.graph.KnowledgeGraph;
import io.github.vishalmysore.medkg.source.EdgeRecord;
import io.github.vishalmysore.medkg.source.FeatureRecord;
import io.github.vishalmysore.medkg.source.NodeRecord;
import io.github.vishalmysore.medkg.source.TableFormatException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IngestionPipelineTest {

    static final String NODES = "node_index,node_id,node_type,node_name,node_source\n"
            + "0,9796,gene/protein,PHYHIP,NCBI\n"
            + "1,DB00945,drug,Aspirin,DrugBank\n"
            + "2,5044,disease,asthma,MONDO\n"
            + "3,,,nameless,MONDO\n"
            + "x,1,drug,broken id,DrugBank\n"
            + "4,HP:0002315,effect/phenotype,Headache,HPO\n";

    static final String EDGES = "relation,display_relation,x_index,y_index\n"
            + "indication,indication,1,2\n"
            + "drug_effect,side effect,1,4\n"
            + "disease_protein,associated with,2,0\n"
            + "indication,indication,1,99\n"
            + "indication,indication,1,2\n";

    static final String DRUG_FEATURES = "node_index,description,molecular_weight\n"
            + "1,\"Aspirin, an NSAID\",180.16\n"
            + "2,not a drug,0\n"
            + "77,unknown,1\n";

    @TempDir
    Path tmp;

    private KnowledgeGraph graph;
    private IngestionPipeline pipeline;

    @BeforeEach
    void setUp() throws Exception {
        Files.writeString(tmp.resolve("nodes.csv"), NODES);
        Files.writeString(tmp.resolve("kg.csv"), EDGES);
        Files.writeString(tmp.resolve("drug_features.csv"), DRUG_FEATURES);
        graph = new KnowledgeGraph();
        pipeline = new IngestionPipeline(graph);
    }

    @Test
    void nodeLoadSkipsAndCountsBadRows() throws Exception {
        LoadReport report = pipeline.loadNodes(tmp.resolve("nodes.csv"));

        assertEquals("nodes.csv", report.getTableName());
        assertEquals(6, report.getRowsRead());
        assertEquals(4, report.getAdded());
        assertEquals(1, report.getSkipped(SkipReason.MISSING_FIELD));
        assertEquals(1, report.getSkipped(SkipReason.PARSE_ERROR));
        assertEquals(4, graph.nodeCount());
        assertEquals("DB00945", graph.getNode(graph.indexOf(1).getAsInt()).getSourceId());
    }

    @Test
    void edgeLoadResolvesExternalIdsAndCountsUnresolvedAndDuplicates() throws Exception {
        pipeline.loadNodes(tmp.resolve("nodes.csv"));
        LoadReport report = pipeline.loadEdges(tmp.resolve("kg.csv"));

        assertEquals(5, report.getRowsRead());
        assertEquals(3, report.getAdded());
        assertEquals(1, report.getDuplicates());
        assertEquals(1, report.getSkipped(SkipReason.UNRESOLVED));
        assertEquals(3, graph.edgeCount());
        assertEquals("side effect", graph.getEdge(1).getDisplayRelation());
    }

    @Test
    void featuresOnlyReachNodesOfTheTargetType() throws Exception {
        pipeline.loadNodes(tmp.resolve("nodes.csv"));
        LoadReport report = pipeline.loadFeatures(new FeatureTable(tmp.resolve("drug_features.csv"), "drug"));

        assertEquals(1, report.getAdded());
        assertEquals(1, report.getSkipped(SkipReason.TYPE_MISMATCH));
        assertEquals(1, report.getSkipped(SkipReason.UNRESOLVED));

        KgNode aspirin = graph.getNode(graph.indexOf(1).getAsInt());
        assertEquals("Aspirin, an NSAID", aspirin.getAttribute("description"));
        assertEquals(180.16, aspirin.getAttribute("molecular_weight"));
        assertEquals("drug", aspirin.getType());
        assertEquals("Aspirin", aspirin.getName());

        KgNode asthma = graph.getNode(graph.indexOf(2).getAsInt());
        assertTrue(asthma.getAttributes().isEmpty());
    }

    @Test
    void ingestingTwiceLeavesTheStoreUnchanged() throws Exception {
        ingestAll();
        int nodes = graph.nodeCount();
        int edges = graph.edgeCount();
        Object weight = graph.getNode(1).getAttribute("molecular_weight");

        ingestAll();

        assertEquals(nodes, graph.nodeCount());
        assertEquals(edges, graph.edgeCount());
        assertEquals(weight, graph.getNode(1).getAttribute("molecular_weight"));
        assertEquals(2, graph.getNode(1).getAttributes().size());
    }

    @Test
    void missingRequiredColumnAbortsOnlyThatTable() throws Exception {
        pipeline.loadNodes(tmp.resolve("nodes.csv"));
        Path badEdges = tmp.resolve("bad_edges.csv");
        Files.writeString(badEdges, "x_index,y_index\n1,2\n");

        TableFormatException ex = assertThrows(TableFormatException.class, () -> pipeline.loadEdges(badEdges));

        assertTrue(ex.getMessage().contains("relation"));
        assertEquals(4, graph.nodeCount());
        assertEquals(0, graph.edgeCount());
    }

    @Test
    void typedEndpointsDisambiguateSharedIds() {
        pipeline.loadNodes(List.of(
                NodeRecord.builder().id(10).type("drug").name("Shared drug").build(),
                NodeRecord.builder().id(10).type("disease").name("Shared disease").build(),
                NodeRecord.builder().id(11).type("gene/protein").name("GENE1").build()));

        LoadReport report = pipeline.loadEdges(List.of(EdgeRecord.builder()
                .fromId(11).toId(10).toType("disease")
                .relation("disease_protein").displayRelation("associated with")
                .build()));

        assertEquals(1, report.getAdded());
        assertEquals("Shared disease", graph.getNode(graph.getEdge(0).getTargetIndex()).getName());
    }

    @Test
    void recordLoadsCountDuplicatesAndMissingTypes() {
        LoadReport report = pipeline.loadNodes(List.of(
                NodeRecord.builder().id(1).type("drug").name("Aspirin").build(),
                NodeRecord.builder().id(1).type("drug").name("Aspirin again").build(),
                NodeRecord.builder().id(2).type(" ").name("blank type").build()));

        assertEquals(3, report.getRowsRead());
        assertEquals(1, report.getAdded());
        assertEquals(1, report.getDuplicates());
        assertEquals(1, report.getSkipped(SkipReason.MISSING_FIELD));

        LoadReport features = pipeline.loadFeatures("drug",
                List.of(FeatureRecord.builder().id(1).value("half_life", 3.5).build()));
        assertEquals(1, features.getAdded());
        assertEquals(3.5, graph.getNode(0).getAttribute("half_life"));
    }

    @Test
    void edgeWithoutRelationIsSkippedAndTheBatchContinues() {
        pipeline.loadNodes(List.of(
                NodeRecord.builder().id(1).type("drug").name("Aspirin").build(),
                NodeRecord.builder().id(2).type("disease").name("Headache").build()));

        LoadReport report = pipeline.loadEdges(List.of(
                EdgeRecord.builder().fromId(1).toId(2).relation("indication").build(),
                EdgeRecord.builder().fromId(1).toId(2).relation(null).build(),
                EdgeRecord.builder().fromId(1).toId(2).relation(" ").build(),
                EdgeRecord.builder().fromId(2).toId(1).relation("contraindication").build()));

        assertEquals(4, report.getRowsRead());
        assertEquals(2, report.getAdded());
        assertEquals(2, report.getSkipped(SkipReason.MISSING_FIELD));
        assertEquals(2, graph.edgeCount());
        assertEquals("contraindication", graph.getEdge(1).getRelation());
    }

    @Test
    void featureRowWithUnsupportedValueIsSkippedWhole() {
        pipeline.loadNodes(List.of(
                NodeRecord.builder().id(1).type("drug").name("Aspirin").build(),
                NodeRecord.builder().id(2).type("drug").name("Ibuprofen").build(),
                NodeRecord.builder().id(3).type("drug").name("Naproxen").build()));

        LoadReport report = pipeline.loadFeatures("drug", List.of(
                FeatureRecord.builder().id(1).value("weight", 180L).build(),
                FeatureRecord.builder().id(2).value("label", "NSAID").value("weight", 206).build(),
                FeatureRecord.builder().id(3).value("weight", 230L).build()));

        assertEquals(3, report.getRowsRead());
        assertEquals(2, report.getAdded());
        assertEquals(1, report.getSkipped(SkipReason.PARSE_ERROR));
        assertEquals(180L, graph.getNode(0).getAttribute("weight"));
        assertTrue(graph.getNode(1).getAttributes().isEmpty());
        assertEquals(230L, graph.getNode(2).getAttribute("weight"));
    }

    private void ingestAll() throws Exception {
        pipeline.loadNodes(tmp.resolve("nodes.csv"));
        pipeline.loadEdges(tmp.resolve("kg.csv"));
        pipeline.loadFeatures(new FeatureTable(tmp.resolve("drug_features.csv"), "drug"));
    }
}
