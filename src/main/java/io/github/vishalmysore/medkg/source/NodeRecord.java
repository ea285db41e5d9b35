package io.github.vishalmysore.medkg.source;

import lombok.Builder;
import lombok.Value;

/**
 * A row of the node table.
 */
@Value
@Builder
public class NodeRecord {
    long id;
    String type;
    String name;
    String source;
    String sourceId;
}
