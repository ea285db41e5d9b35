package io.github.vishalmysore.medkg.config;

import io.github.vishalmysore.medkg.ingest.FeatureTable;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Where the source tables live and how to build, link and persist the
 * graph. Built from {@code medkg.properties} on the classpath, then an
 * optional external properties file, then JVM system properties with the
 * same keys, each layer overriding the previous one.
 */
@Data
@Builder
public class KgConfig {
    private static final Logger log = Logger.getLogger(KgConfig.class.getName());

    public static final String DEFAULTS_RESOURCE = "medkg.properties";

    private Path dataDir;
    private String nodesFile;
    private String edgesFile;

    // Feature table file name -> node type it describes
    @Singular
    private Map<String, String> featureFiles;

    private String clustersFile;
    @Builder.Default
    private String clusterDelimiter = "_";
    @Builder.Default
    private String clusterRelation = "bert_group";
    @Builder.Default
    private String clusterDisplayRelation = "BERT similarity";

    private Path snapshotFile;
    private boolean rebuildSnapshot;
    private Path outputDir;

    private String demoEntity;
    private String demoDrug;
    private String demoGene;

    public Path nodesPath() {
        return dataDir.resolve(nodesFile);
    }

    public Path edgesPath() {
        return dataDir.resolve(edgesFile);
    }

    /**
     * Cluster table path, or null when no cluster table is configured.
     */
    public Path clustersPath() {
        return isBlank(clustersFile) ? null : dataDir.resolve(clustersFile);
    }

    public List<FeatureTable> featureTables() {
        List<FeatureTable> tables = new ArrayList<>();
        featureFiles.forEach((file, type) -> tables.add(new FeatureTable(dataDir.resolve(file), type)));
        return tables;
    }

    public static KgConfig load() throws IOException {
        return load(null);
    }

    /**
     * @param overrides external properties file, may be null
     */
    public static KgConfig load(Path overrides) throws IOException {
        Properties props = new Properties();
        try (InputStream is = KgConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (is != null) {
                props.load(is);
            } else {
                log.warning("No " + DEFAULTS_RESOURCE + " on the classpath, using built-in defaults");
            }
        }
        if (overrides != null) {
            try (Reader reader = Files.newBufferedReader(overrides, StandardCharsets.UTF_8)) {
                props.load(reader);
            }
            log.info("Loaded configuration overrides from " + overrides);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("medkg.")) {
                props.setProperty(key, System.getProperty(key));
            }
        }
        return fromProperties(props);
    }

    public static KgConfig fromProperties(Properties props) {
        Path dataDir = Paths.get(props.getProperty("medkg.data.dir", "data/primekg"));
        return KgConfig.builder()
                .dataDir(dataDir)
                .nodesFile(props.getProperty("medkg.nodes.file", "nodes.csv"))
                .edgesFile(props.getProperty("medkg.edges.file", "kg.csv"))
                .featureFiles(parseFeatureFiles(props.getProperty("medkg.features", "")))
                .clustersFile(props.getProperty("medkg.clusters.file", ""))
                .clusterDelimiter(props.getProperty("medkg.clusters.delimiter", "_"))
                .clusterRelation(props.getProperty("medkg.clusters.relation", "bert_group"))
                .clusterDisplayRelation(props.getProperty("medkg.clusters.displayRelation", "BERT similarity"))
                .snapshotFile(Paths.get(props.getProperty("medkg.snapshot.file", "outputs/primekg_graph.bin")))
                .rebuildSnapshot(Boolean.parseBoolean(props.getProperty("medkg.snapshot.rebuild", "false")))
                .outputDir(Paths.get(props.getProperty("medkg.output.dir", "outputs")))
                .demoEntity(props.getProperty("medkg.demo.entity", "asthma"))
                .demoDrug(props.getProperty("medkg.demo.drug", "albuterol"))
                .demoGene(props.getProperty("medkg.demo.gene", "TP53"))
                .build();
    }

    /**
     * Parses "drug_features.csv:drug,disease_features.csv:disease". The type
     * follows the first colon, so types may contain slashes.
     */
    static Map<String, String> parseFeatureFiles(String value) {
        Map<String, String> files = new LinkedHashMap<>();
        for (String entry : value.split(",")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int colon = trimmed.indexOf(':');
            if (colon <= 0 || colon == trimmed.length() - 1) {
                throw new IllegalArgumentException("Feature table entry must be file:type, got '" + trimmed + "'");
            }
            files.put(trimmed.substring(0, colon).trim(), trimmed.substring(colon + 1).trim());
        }
        return files;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
