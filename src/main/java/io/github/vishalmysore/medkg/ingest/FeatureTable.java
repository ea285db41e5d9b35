package io.github.vishalmysore.medkg.ingest;

import lombok.Value;

import java.nio.file.Path;

/**
 * A feature table file and the node type its rows describe.
 */
@Value
public class FeatureTable {
    Path file;
    String targetType;
}
