package io.github.vishalmysore.medkg.retrieval;

/**
 * Outcome of a query. Failures are ordinary values so callers can branch
 * without exception handling.
 */
public enum QueryStatus {
    OK,
    NOT_FOUND, // a requested entity name is unknown
    NO_PATH // no connecting path, or an endpoint is unknown
}
