package io.github.vishalmysore.medkg.ingest;

/**
 * Why a row (or a single cluster member) was left out of a bulk load.
 */
public enum SkipReason {
    MISSING_FIELD, // blank id, type or other required cell
    PARSE_ERROR, // malformed row or non-integer id
    UNRESOLVED, // references an id or name the graph does not hold
    TYPE_MISMATCH // feature row for a node of another type
}
