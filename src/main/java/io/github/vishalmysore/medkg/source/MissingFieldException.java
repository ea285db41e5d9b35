package io.github.vishalmysore.medkg.source;

/**
 * A row whose required cell is blank.
 */
public class MissingFieldException extends RowParseException {

    public MissingFieldException(long lineNumber, String column) {
        super(lineNumber, "missing value for column '" + column + "'");
    }
}
