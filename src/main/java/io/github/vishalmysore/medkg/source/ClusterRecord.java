package io.github.vishalmysore.medkg.source;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A row of a similarity-cluster table: an entity, the raw ids of its
 * co-cluster members and the cluster's human-readable label.
 */
@Value
@Builder
public class ClusterRecord {
    long entityId;

    // Kept as text so unparsable members can be skipped one by one
    @Singular
    List<String> memberIds;

    String label;
}
