package io.github.vishalmysore.medkg.source;

/**
 * A single row that cannot be turned into a record. Bulk loaders skip the
 * row and count it.
 */
public class RowParseException extends Exception {
    private final long lineNumber;

    public RowParseException(long lineNumber, String message) {
        super("line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    public long getLineNumber() {
        return lineNumber;
    }
}
