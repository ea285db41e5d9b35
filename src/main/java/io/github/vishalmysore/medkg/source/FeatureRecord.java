package io.github.vishalmysore.medkg.source;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * A row of a per-type feature table: the node id plus every non-blank
 * feature cell, keyed by column name.
 */
@Value
@Builder
public class FeatureRecord {
    long id;

    @Singular
    Map<String, Object> values;
}
