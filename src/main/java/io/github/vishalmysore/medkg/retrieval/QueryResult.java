package io.github.vishalmysore.medkg.retrieval;

import lombok.Getter;
import lombok.ToString;

/**
 * A query answer together with its status. {@code value} is only set for
 * {@link QueryStatus#OK}; {@code message} explains the other outcomes.
 */
@Getter
@ToString
public final class QueryResult<T> {
    private final QueryStatus status;
    private final T value;
    private final String message;

    private QueryResult(QueryStatus status, T value, String message) {
        this.status = status;
        this.value = value;
        this.message = message;
    }

    public static <T> QueryResult<T> ok(T value) {
        return new QueryResult<>(QueryStatus.OK, value, null);
    }

    public static <T> QueryResult<T> notFound(String name) {
        return new QueryResult<>(QueryStatus.NOT_FOUND, null, "Entity not found: " + name);
    }

    public static <T> QueryResult<T> noPath(String message) {
        return new QueryResult<>(QueryStatus.NO_PATH, null, message);
    }

    public boolean isOk() {
        return status == QueryStatus.OK;
    }

    public T orElse(T fallback) {
        return isOk() ? value : fallback;
    }
}
