package io.github.vishalmysore.medkg.actions;

import io.github.vishalmysore.medkg.domain.DerivedRelation;
import io.github.vishalmysore.medkg.graph.KnowledgeGraph;
import io.github.vishalmysore.medkg.retrieval.GraphQueryEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KnowledgeGraphActionsTest {

    private KnowledgeGraph graph;
    private KnowledgeGraphActions actions;
    private int asthma;

    @BeforeEach
    void setUp() {
        graph = new KnowledgeGraph();
        asthma = graph.addNode(1, "disease", "asthma", "MONDO");
        int copd = graph.addNode(2, "disease", "COPD", "MONDO");
        int albuterol = graph.addNode(3, "drug", "Albuterol", "DrugBank");
        int salmeterol = graph.addNode(4, "drug", "Salmeterol", "DrugBank");
        int tremor = graph.addNode(5, "effect/phenotype", "Tremor", "HPO");
        int adrb2 = graph.addNode(6, "gene/protein", "ADRB2", "NCBI");
        graph.addEdge(asthma, albuterol, "indication", "indication");
        graph.addEdge(asthma, salmeterol, "indication", "indication");
        graph.addEdge(albuterol, tremor, "drug_effect", "side effect");
        graph.addEdge(salmeterol, tremor, "drug_effect", "side effect");
        graph.addEdge(adrb2, asthma, "disease_protein", "associated with");
        graph.addEdge(asthma, copd, DerivedRelation.CLUSTER_APPROX.getRelation(),
                DerivedRelation.CLUSTER_APPROX.getDisplayRelation());
        actions = new KnowledgeGraphActions(new GraphQueryEngine(graph));
    }

    @Test
    void drugsForDiseaseListsNames() {
        String text = actions.drugsForDisease("Asthma");

        assertTrue(text.startsWith("Drugs used for 'Asthma' (2):"));
        assertTrue(text.contains("  - Albuterol\n"));
        assertTrue(text.contains("  - Salmeterol\n"));
    }

    @Test
    void unknownEntityRendersNotFoundLine() {
        assertEquals("Genes linked to 'flu': Entity not found: flu\n", actions.genesForDisease("flu"));
        assertEquals("Node not found: flu\n", actions.expandNode("flu"));
        assertTrue(actions.shortestPath("flu", "asthma").startsWith("No path found between 'flu' and 'asthma'"));
    }

    @Test
    void emptyAnswerRendersNoneFound() {
        assertEquals("Drugs used for 'COPD': none found\n", actions.drugsForDisease("COPD"));
    }

    @Test
    void similarDiseasesFollowClusterApproxEdges() {
        String text = actions.similarDiseases("asthma");

        assertTrue(text.contains("(1):"));
        assertTrue(text.contains("  - COPD\n"));
    }

    @Test
    void sharedSideEffects() {
        String text = actions.sharedSideEffects("albuterol");

        assertTrue(text.contains("  - Salmeterol\n"));
        assertFalse(text.contains("  - Albuterol\n"));
    }

    @Test
    void shortestPathShowsEdgeCount() {
        assertEquals("Shortest path (2 edges): ADRB2 -> asthma -> Albuterol\n",
                actions.shortestPath("ADRB2", "Albuterol"));
    }

    @Test
    void expandNodeTruncatesLongNeighborLists() {
        for (int i = 0; i < 12; i++) {
            int drug = graph.addNode(100 + i, "drug", "Drug " + i, "DrugBank");
            graph.addEdge(asthma, drug, "off-label use", "off-label use");
        }

        String text = actions.expandNode("asthma");

        assertTrue(text.startsWith("Node: asthma (disease)\nNeighbors (16):\n"));
        assertTrue(text.endsWith("  ... 6 more\n"));
    }

    @Test
    void graphStatisticsSummary() {
        String text = actions.graphStatistics();

        assertTrue(text.startsWith("Graph Size: 6 nodes, 6 edges"));
        assertTrue(text.contains("  - drug: 2"));
        assertTrue(text.contains("Weakly Connected Components: 1"));
    }
}
