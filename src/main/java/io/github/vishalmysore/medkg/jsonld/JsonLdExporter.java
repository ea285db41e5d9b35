package io.github.vishalmysore.medkg.jsonld;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.vishalmysore.medkg.domain.KgEdge;
import io.github.vishalmysore.medkg.domain.KgNode;
import io.github.vishalmysore.medkg.graph.KnowledgeGraph;
import io.github.vishalmysore.medkg.retrieval.GraphPath;
import io.github.vishalmysore.medkg.retrieval.GraphStatistics;
import io.github.vishalmysore.medkg.retrieval.Subgraph;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Exports query results as JSON-LD documents using Schema.org terms plus a
 * small medkg vocabulary, so a rendering layer or semantic web tool can
 * consume them without knowing the graph's internals.
 */
public class JsonLdExporter {
    private static final Logger log = Logger.getLogger(JsonLdExporter.class.getName());
    private static final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final KnowledgeGraph graph;

    public JsonLdExporter(KnowledgeGraph graph) {
        this.graph = graph;
    }

    /**
     * Export a subgraph (nodes first, then relationships) as a JSON-LD string.
     */
    public String exportSubgraph(Subgraph subgraph, String title) {
        Map<String, Object> doc = newDocument("medkg:Subgraph");
        doc.put("name", title);

        List<Map<String, Object>> graphItems = new ArrayList<>();
        for (KgNode node : subgraph.getNodes()) {
            graphItems.add(node.toJsonLd());
        }
        for (KgEdge edge : subgraph.getEdges()) {
            graphItems.add(edgeToJsonLd(edge));
        }
        doc.put("@graph", graphItems);

        if (!subgraph.getUnresolved().isEmpty()) {
            doc.put("medkg:unresolved", subgraph.getUnresolved());
        }
        doc.put("medkg:statistics", Map.of(
                "nodeCount", subgraph.getNodes().size(),
                "edgeCount", subgraph.getEdges().size()));
        return write(doc);
    }

    /**
     * Export a path as an ordered item list.
     */
    public String exportPath(GraphPath path) {
        Map<String, Object> doc = newDocument("ItemList");
        doc.put("name", path.toString());
        doc.put("medkg:length", path.length());

        List<Map<String, Object>> items = new ArrayList<>();
        int position = 1;
        for (KgNode node : path.getNodes()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("@type", "ListItem");
            item.put("position", position++);
            item.put("item", node.toJsonLd());
            items.add(item);
        }
        doc.put("itemListElement", items);
        return write(doc);
    }

    public String exportStatistics(GraphStatistics statistics) {
        Map<String, Object> doc = newDocument("medkg:GraphStatistics");
        doc.put("medkg:nodeCount", statistics.getNodeCount());
        doc.put("medkg:edgeCount", statistics.getEdgeCount());
        doc.put("medkg:nodeTypeCounts", statistics.getNodeTypeCounts());
        doc.put("medkg:relationCounts", statistics.getRelationCounts());
        doc.put("medkg:degree", Map.of(
                "min", statistics.getMinDegree(),
                "max", statistics.getMaxDegree(),
                "average", statistics.getAverageDegree()));
        doc.put("medkg:weaklyConnectedComponents", statistics.getWeaklyConnectedComponents());
        return write(doc);
    }

    /**
     * Names only, for results that are plain name lists or sets.
     */
    public String exportNames(String title, Collection<String> names) {
        Map<String, Object> doc = newDocument("ItemList");
        doc.put("name", title);
        doc.put("numberOfItems", names.size());
        doc.put("itemListElement", names.stream()
                .map(name -> Map.of("@type", "Thing", "name", name))
                .collect(Collectors.toList()));
        return write(doc);
    }

    private Map<String, Object> edgeToJsonLd(KgEdge edge) {
        return edge.toJsonLd(graph.getNode(edge.getSourceIndex()).getJsonLdId(),
                graph.getNode(edge.getTargetIndex()).getJsonLdId());
    }

    private Map<String, Object> newDocument(String type) {
        Map<String, Object> doc = new LinkedHashMap<>();

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("schema", "https://schema.org/");
        context.put("medkg", "urn:medkg:ontology:");
        context.put("name", "schema:name");
        context.put("identifier", "schema:identifier");
        context.put("additionalProperty", "schema:additionalProperty");
        context.put("source", Map.of("@type", "@id"));
        context.put("target", Map.of("@type", "@id"));
        doc.put("@context", context);
        doc.put("@type", type);
        return doc;
    }

    private String write(Map<String, Object> doc) {
        try {
            return mapper.writeValueAsString(doc);
        } catch (JsonProcessingException e) {
            log.log(Level.SEVERE, "Failed to export JSON-LD document", e);
            return "{}";
        }
    }
}
