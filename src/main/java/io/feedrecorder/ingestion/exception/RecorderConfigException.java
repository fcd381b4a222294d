package io.feedrecorder.ingestion.exception;

/**
 * The run cannot start: unreadable feed config or an unsupported output format.
 */
public class RecorderConfigException extends RuntimeException {

    public RecorderConfigException(String message) {
        super(message);
    }

    public RecorderConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
