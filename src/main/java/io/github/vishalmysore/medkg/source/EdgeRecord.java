package io.github.vishalmysore.medkg.source;

import lombok.Builder;
import lombok.Value;

/**
 * A row of the edge table. Endpoints are external node ids; the endpoint
 * types are only known when the table carries x_type / y_type columns.
 */
@Value
@Builder
public class EdgeRecord {
    long fromId;
    long toId;
    String relation;
    String displayRelation;
    String fromType;
    String toType;
}
