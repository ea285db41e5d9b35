package io.github.vishalmysore.medkg.ingest;

import io.github.vishalmysore.medkg.graph.KnowledgeGraph;
import io.github.vishalmysore.medkg.source.EdgeRecord;
import io.github.vishalmysore.medkg.source.FeatureRecord;
import io.github.vishalmysore.medkg.source.NodeRecord;
import io.github.vishalmysore.medkg.source.SourceRecords;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.OptionalInt;
import java.util.logging.Logger;

/**
 * Populates a {@link KnowledgeGraph} from node, edge and feature tables.
 * Every load returns a {@link LoadReport}; bad rows are skipped and counted.
 * Loads are independent, so a failed table leaves the rows loaded so far
 * in place.
 */
public class IngestionPipeline {
    private static final Logger log = Logger.getLogger(IngestionPipeline.class.getName());

    private final KnowledgeGraph graph;

    public IngestionPipeline(KnowledgeGraph graph) {
        this.graph = graph;
    }

    public KnowledgeGraph getGraph() {
        return graph;
    }

    public LoadReport loadNodes(Path file) throws IOException {
        LoadReport report = new LoadReport(file.getFileName().toString());
        TableScanner.scan(file, SourceRecords::nodes, report, record -> addNode(record, report));
        return finish(report);
    }

    public LoadReport loadNodes(Iterable<NodeRecord> records) {
        LoadReport report = new LoadReport("nodes");
        for (NodeRecord record : records) {
            report.rowRead();
            addNode(record, report);
        }
        return finish(report);
    }

    public LoadReport loadEdges(Path file) throws IOException {
        LoadReport report = new LoadReport(file.getFileName().toString());
        TableScanner.scan(file, SourceRecords::edges, report, record -> addEdge(record, report));
        return finish(report);
    }

    public LoadReport loadEdges(Iterable<EdgeRecord> records) {
        LoadReport report = new LoadReport("edges");
        for (EdgeRecord record : records) {
            report.rowRead();
            addEdge(record, report);
        }
        return finish(report);
    }

    public LoadReport loadFeatures(FeatureTable table) throws IOException {
        LoadReport report = new LoadReport(table.getFile().getFileName().toString());
        TableScanner.scan(table.getFile(), SourceRecords::features, report,
                record -> mergeFeatures(table.getTargetType(), record, report));
        return finish(report);
    }

    /**
     * Attaches feature rows to nodes of the given type. Rows for unknown ids
     * or for nodes of another type are skipped.
     */
    public LoadReport loadFeatures(String targetType, Iterable<FeatureRecord> records) {
        LoadReport report = new LoadReport(targetType + " features");
        for (FeatureRecord record : records) {
            report.rowRead();
            mergeFeatures(targetType, record, report);
        }
        return finish(report);
    }

    private void addNode(NodeRecord record, LoadReport report) {
        if (record.getType() == null || record.getType().isBlank()) {
            report.skip(SkipReason.MISSING_FIELD);
            return;
        }
        int before = graph.nodeCount();
        graph.addNode(record.getId(), record.getType(), record.getName(), record.getSource(), record.getSourceId());
        if (graph.nodeCount() > before) {
            report.added();
        } else {
            report.duplicate();
        }
    }

    private void addEdge(EdgeRecord record, LoadReport report) {
        if (record.getRelation() == null || record.getRelation().isBlank()) {
            report.skip(SkipReason.MISSING_FIELD);
            return;
        }
        OptionalInt from = resolve(record.getFromId(), record.getFromType());
        OptionalInt to = resolve(record.getToId(), record.getToType());
        if (from.isEmpty() || to.isEmpty()) {
            report.skip(SkipReason.UNRESOLVED);
            log.fine("Edge " + record.getFromId() + " -[" + record.getRelation() + "]-> " + record.getToId()
                    + " references an unknown node");
            return;
        }
        if (graph.addEdge(from.getAsInt(), to.getAsInt(), record.getRelation(), record.getDisplayRelation())) {
            report.added();
        } else {
            report.duplicate();
        }
    }

    private void mergeFeatures(String targetType, FeatureRecord record, LoadReport report) {
        OptionalInt index = graph.indexOf(record.getId(), targetType);
        if (index.isEmpty()) {
            report.skip(graph.indexOf(record.getId()).isPresent() ? SkipReason.TYPE_MISMATCH : SkipReason.UNRESOLVED);
            return;
        }
        for (Map.Entry<String, Object> value : record.getValues().entrySet()) {
            if (value.getKey() == null || !KnowledgeGraph.isAttributeValue(value.getValue())) {
                report.skip(SkipReason.PARSE_ERROR);
                log.fine("Feature row " + record.getId() + ": unsupported value for '" + value.getKey() + "'");
                return;
            }
        }
        for (Map.Entry<String, Object> value : record.getValues().entrySet()) {
            graph.setAttribute(index.getAsInt(), value.getKey(), value.getValue());
        }
        report.added();
    }

    /**
     * Typed lookup when the edge table names the endpoint's type, falling
     * back to the first node carrying the id.
     */
    private OptionalInt resolve(long id, String type) {
        OptionalInt typed = graph.indexOf(id, type);
        return typed.isPresent() ? typed : graph.indexOf(id);
    }

    private LoadReport finish(LoadReport report) {
        log.info(report.summary());
        if (report.getSkipped() > 0) {
            log.warning(report.getTableName() + ": skipped " + report.getSkipped() + " rows " + report.getSkips());
        }
        return report;
    }
}
