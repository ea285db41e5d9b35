package io.github.vishalmysore.medkg.source;

import java.io.IOException;

/**
 * A source table whose structure makes it unusable, such as a missing
 * required column. Aborts the load of that table.
 */
public class TableFormatException extends IOException {

    public TableFormatException(String message) {
        super(message);
    }
}
