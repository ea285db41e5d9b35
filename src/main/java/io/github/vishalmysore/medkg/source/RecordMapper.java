package io.github.vishalmysore.medkg.source;

/**
 * Turns a table row into a typed record.
 */
@FunctionalInterface
public interface RecordMapper<T> {

    T map(TableRow row) throws RowParseException;
}
