package io.github.vishalmysore.medkg.similarity;

import io.github.vishalmysore.medkg.domain.DerivedRelation;
import io.github.vishalmysore.medkg.graph.KnowledgeGraph;
import io.github.vishalmysore.medkg.ingest.LoadReport;
import io.github.vishalmysore.medkg.ingest.SkipReason;
import io.github.vishalmysore.medkg.ingest.TableScanner;
import io.github.vishalmysore.medkg.source.ClusterRecord;
import io.github.vishalmysore.medkg.source.RowParseException;
import io.github.vishalmysore.medkg.source.SourceRecords;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.logging.Logger;

/**
 * Synthesizes similarity edges from an externally computed clustering
 * (PrimeKG's BERT grouping of diseases). Each cluster row names an entity
 * and its co-cluster members; the linker joins the entity to every member
 * the graph holds.
 *
 * Linking relies on the graph's duplicate-edge suppression, so running it
 * twice over the same rows adds nothing the second time.
 */
public class ClusterLinker {
    private static final Logger log = Logger.getLogger(ClusterLinker.class.getName());

    public static final String DEFAULT_MEMBER_DELIMITER = "_";

    private final KnowledgeGraph graph;
    private final String memberDelimiter;
    private final String relation;
    private final String displayRelation;

    /**
     * Creates a linker with PrimeKG's defaults: underscore-joined member ids
     * and the "bert_group" relation.
     */
    public ClusterLinker(KnowledgeGraph graph) {
        this(graph, DEFAULT_MEMBER_DELIMITER, DerivedRelation.CLUSTER_SIMILARITY.getRelation(),
                DerivedRelation.CLUSTER_SIMILARITY.getDisplayRelation());
    }

    public ClusterLinker(KnowledgeGraph graph, String memberDelimiter, String relation, String displayRelation) {
        this.graph = graph;
        this.memberDelimiter = memberDelimiter;
        this.relation = relation;
        this.displayRelation = displayRelation;
    }

    public LoadReport linkClusters(Path file) throws IOException {
        LoadReport report = new LoadReport(file.getFileName().toString());
        TableScanner.scan(file, header -> SourceRecords.clusters(header, memberDelimiter), report,
                record -> linkRow(record, report));
        return finish(report);
    }

    /**
     * Bulk mode: links every row's entity to each of its co-cluster members.
     * Self-references are ignored; unknown or unparsable members are
     * counted as skips.
     */
    public LoadReport linkClusters(Iterable<ClusterRecord> rows) {
        LoadReport report = new LoadReport("clusters");
        for (ClusterRecord row : rows) {
            report.rowRead();
            linkRow(row, report);
        }
        return finish(report);
    }

    /**
     * Reads every row of a cluster table, for repeated label linking.
     */
    public List<ClusterRecord> readClusters(Path file) throws IOException {
        List<ClusterRecord> rows = new ArrayList<>();
        LoadReport report = new LoadReport(file.getFileName().toString());
        TableScanner.scan(file, header -> SourceRecords.clusters(header, memberDelimiter), report, rows::add);
        if (report.getSkipped() > 0) {
            log.warning(report.summary());
        }
        return rows;
    }

    /**
     * Ad hoc mode: links one named entity to the entity of every cluster row
     * whose label contains the given text, ignoring case. Uses the
     * "bert_related" relation. When the entity name is unknown nothing is
     * linked and the report carries a single unresolved skip.
     */
    public LoadReport linkByLabel(String entityName, String labelFragment, Iterable<ClusterRecord> rows) {
        LoadReport report = new LoadReport("label '" + labelFragment + "' -> " + entityName);
        OptionalInt entity = graph.findByName(entityName);
        if (entity.isEmpty()) {
            report.skip(SkipReason.UNRESOLVED);
            log.warning("Cannot link clusters: entity '" + entityName + "' not found");
            return report;
        }

        String needle = labelFragment.toLowerCase(Locale.ROOT);
        for (ClusterRecord row : rows) {
            if (row.getLabel() == null || !row.getLabel().toLowerCase(Locale.ROOT).contains(needle)) {
                continue;
            }
            report.rowRead();
            OptionalInt target = graph.indexOf(row.getEntityId());
            if (target.isEmpty()) {
                report.skip(SkipReason.UNRESOLVED);
                continue;
            }
            link(entity.getAsInt(), target.getAsInt(), DerivedRelation.CLUSTER_APPROX.getRelation(),
                    DerivedRelation.CLUSTER_APPROX.getDisplayRelation(), report);
        }
        return finish(report);
    }

    private void linkRow(ClusterRecord row, LoadReport report) {
        OptionalInt entity = graph.indexOf(row.getEntityId());
        if (entity.isEmpty()) {
            report.skip(SkipReason.UNRESOLVED);
            return;
        }
        for (String member : row.getMemberIds()) {
            long memberId;
            try {
                memberId = SourceRecords.parseId(member);
            } catch (RowParseException e) {
                report.skip(SkipReason.PARSE_ERROR);
                log.fine("Cluster row " + row.getEntityId() + ": bad member id '" + member + "'");
                continue;
            }
            if (memberId == row.getEntityId()) {
                continue;
            }
            OptionalInt target = graph.indexOf(memberId);
            if (target.isEmpty()) {
                report.skip(SkipReason.UNRESOLVED);
                continue;
            }
            link(entity.getAsInt(), target.getAsInt(), relation, displayRelation, report);
        }
    }

    private void link(int source, int target, String edgeRelation, String edgeDisplay, LoadReport report) {
        if (source == target) {
            return;
        }
        if (graph.addEdge(source, target, edgeRelation, edgeDisplay)) {
            report.added();
        } else {
            report.duplicate();
        }
    }

    private LoadReport finish(LoadReport report) {
        log.info("Cluster linking " + report.summary());
        return report;
    }
}
