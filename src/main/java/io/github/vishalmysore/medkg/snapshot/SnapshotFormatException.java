package io.github.vishalmysore.medkg.snapshot;

import java.io.IOException;

/**
 * A snapshot that is truncated, corrupt or written by an incompatible
 * format version.
 */
public class SnapshotFormatException extends IOException {

    public SnapshotFormatException(String message) {
        super(message);
    }

    public SnapshotFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
