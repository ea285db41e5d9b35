package io.github.vishalmysore.medkg.retrieval;

import io.github.vishalmysore.medkg.domain.KgEdge;
import io.github.vishalmysore.medkg.domain.KgNode;
import io.github.vishalmysore.medkg.graph.KnowledgeGraph;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Writes the edges of a subgraph as flat CSV records, one row per edge with
 * both endpoints spelled out, for spreadsheet or plotting tools.
 */
public class NeighborhoodCsvWriter {
    private static final Logger log = Logger.getLogger(NeighborhoodCsvWriter.class.getName());

    static final String HEADER = "source_id,source_name,source_type,target_id,target_name,target_type,relation";

    private final KnowledgeGraph graph;

    public NeighborhoodCsvWriter(KnowledgeGraph graph) {
        this.graph = graph;
    }

    public void write(Subgraph subgraph, Writer out) throws IOException {
        PrintWriter writer = new PrintWriter(out);
        writer.println(HEADER);
        for (KgEdge edge : subgraph.getEdges()) {
            KgNode source = graph.getNode(edge.getSourceIndex());
            KgNode target = graph.getNode(edge.getTargetIndex());
            writer.println(source.getId() + "," + quote(source.getName()) + "," + quote(source.getType()) + ","
                    + target.getId() + "," + quote(target.getName()) + "," + quote(target.getType()) + ","
                    + quote(edge.getRelation()));
        }
        writer.flush();
        if (writer.checkError()) {
            throw new IOException("Failed to write neighborhood records");
        }
    }

    /**
     * Writes to {@code <entity>_neighbors.csv} inside the directory and
     * returns the file.
     */
    public Path write(String entityName, Subgraph subgraph, Path directory) throws IOException {
        Files.createDirectories(directory);
        String safeName = entityName.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
        Path file = directory.resolve(safeName + "_neighbors.csv");
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(subgraph, out);
        }
        log.info("Wrote " + subgraph.getEdges().size() + " neighborhood edges to " + file);
        return file;
    }

    static String quote(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
