package io.github.vishalmysore.medkg.examples;

import io.github.vishalmysore.medkg.actions.KnowledgeGraphActions;
import io.github.vishalmysore.medkg.config.KgConfig;
import io.github.vishalmysore.medkg.domain.NodeType;
import io.github.vishalmysore.medkg.graph.KnowledgeGraph;
import io.github.vishalmysore.medkg.ingest.KnowledgeGraphLoader;
import io.github.vishalmysore.medkg.ingest.LoadReport;
import io.github.vishalmysore.medkg.jsonld.JsonLdExporter;
import io.github.vishalmysore.medkg.retrieval.GraphPath;
import io.github.vishalmysore.medkg.retrieval.GraphQueryEngine;
import io.github.vishalmysore.medkg.retrieval.NeighborhoodCsvWriter;
import io.github.vishalmysore.medkg.retrieval.QueryResult;
import io.github.vishalmysore.medkg.retrieval.Subgraph;
import io.github.vishalmysore.medkg.similarity.ClusterLinker;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * End-to-end run over a PrimeKG download:
 * 1. Build the graph from the source tables, or restore the snapshot
 * 2. Link the demo disease to its BERT cluster neighbors
 * 3. Health check and sample queries
 * 4. JSON-LD and neighborhood CSV export
 *
 * Usage: {@code KnowledgeGraphRunner [config.properties]}
 */
public class KnowledgeGraphRunner {
        private static final Logger log = Logger.getLogger(KnowledgeGraphRunner.class.getName());

        public static void main(String[] args) throws IOException {
                configureLogging();
                KgConfig config = KgConfig.load(args.length > 0 ? Paths.get(args[0]) : null);

                System.out.println("=== PHASE 1: GRAPH CONSTRUCTION ===\n");
                KnowledgeGraphLoader.BuildResult build = new KnowledgeGraphLoader(config).load();
                KnowledgeGraph graph = build.getGraph();
                if (build.isRestored()) {
                        System.out.println("Graph restored from snapshot " + config.getSnapshotFile());
                }
                for (LoadReport report : build.getReports()) {
                        System.out.println("  " + report.summary());
                }

                String entity = config.getDemoEntity();
                LoadReport linked = linkDemoEntity(graph, config);
                if (linked != null) {
                        System.out.println("Linked '" + entity + "' to " + linked.getAdded()
                                        + " BERT-clustered diseases.");
                }
                graph.seal();

                GraphQueryEngine engine = new GraphQueryEngine(graph);
                KnowledgeGraphActions actions = new KnowledgeGraphActions(engine);

                System.out.println("\n=== PHASE 2: HEALTH CHECK ===\n");
                System.out.println(actions.graphStatistics());
                QueryResult<GraphPath> random = engine.randomPath(NodeType.GENE_PROTEIN.getLabel(),
                                NodeType.DISEASE.getLabel(), new Random());
                System.out.println("Random gene -> disease path: "
                                + (random.isOk() ? random.getValue().toString() : random.getMessage()));

                System.out.println("\n=== PHASE 3: QUERIES ===\n");
                System.out.println(actions.drugsForDisease(entity));
                System.out.println(actions.genesForDisease(entity));
                System.out.println(actions.shortestPath(config.getDemoGene(), entity));
                System.out.println(actions.similarDiseases(entity));
                System.out.println(actions.sharedSideEffects(config.getDemoDrug()));
                System.out.println(actions.expandNode(entity));

                System.out.println("\n=== PHASE 4: EXPORT ===\n");
                exportResults(engine, config, entity);
        }

        /**
         * Links the demo entity to the cluster rows whose label mentions it.
         * Returns null when no cluster table is available.
         */
        static LoadReport linkDemoEntity(KnowledgeGraph graph, KgConfig config) throws IOException {
                Path clusters = config.clustersPath();
                if (clusters == null || !Files.exists(clusters)) {
                        return null;
                }
                ClusterLinker linker = new ClusterLinker(graph, config.getClusterDelimiter(),
                                config.getClusterRelation(), config.getClusterDisplayRelation());
                String entity = config.getDemoEntity();
                return linker.linkByLabel(entity, entity, linker.readClusters(clusters));
        }

        private static void exportResults(GraphQueryEngine engine, KgConfig config, String entity)
                        throws IOException {
                Path outputDir = config.getOutputDir();
                Files.createDirectories(outputDir);
                JsonLdExporter exporter = new JsonLdExporter(engine.getGraph());

                QueryResult<Subgraph> neighborhood = engine.neighborhood(entity);
                if (!neighborhood.isOk()) {
                        System.out.println(neighborhood.getMessage());
                        return;
                }
                Path csv = new NeighborhoodCsvWriter(engine.getGraph())
                                .write(entity, neighborhood.getValue(), outputDir);
                System.out.println("Neighborhood records written to " + csv);

                List<String> names = new ArrayList<>();
                names.add(entity);
                names.addAll(engine.drugsForDisease(entity).orElse(List.of()));
                String jsonLd = exporter.exportSubgraph(engine.subgraph(names), "Drugs for " + entity);
                Path jsonFile = outputDir.resolve("drugs_for_disease.jsonld");
                Files.writeString(jsonFile, jsonLd, StandardCharsets.UTF_8);
                System.out.println("JSON-LD subgraph written to " + jsonFile);

                Files.writeString(outputDir.resolve("graph_statistics.jsonld"),
                                exporter.exportStatistics(engine.statistics()), StandardCharsets.UTF_8);
                log.info("Export complete");
        }

        private static void configureLogging() {
                if (System.getProperty("java.util.logging.config.file") != null) {
                        return;
                }
                try (InputStream is = KnowledgeGraphRunner.class.getClassLoader()
                                .getResourceAsStream("logging.properties")) {
                        if (is != null) {
                                LogManager.getLogManager().readConfiguration(is);
                        }
                } catch (IOException e) {
                        System.err.println("Warning: Could not load logging.properties: " + e.getMessage());
                }
        }
}
