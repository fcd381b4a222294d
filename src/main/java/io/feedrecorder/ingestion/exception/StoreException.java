package io.feedrecorder.ingestion.exception;

import java.nio.file.Path;

/**
 * The output store could not be read, locked or written. Aborts the run.
 */
public class StoreException extends RuntimeException {

    public enum Operation { READ, WRITE, LOCK }

    private final Operation operation;
    private final Path path;

    public StoreException(Operation operation, Path path, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.path = path;
    }

    public static StoreException read(Path path, Throwable cause) {
        return new StoreException(Operation.READ, path,
                "Existing output file is unreadable or corrupt: " + path + " (" + cause.getMessage() + ")", cause);
    }

    public static StoreException write(Path path, Throwable cause) {
        return new StoreException(Operation.WRITE, path,
                "Failed to write output file: " + path + " (" + cause.getMessage() + ")", cause);
    }

    public static StoreException locked(Path path) {
        return new StoreException(Operation.LOCK, path,
                "Output file is locked by another run: " + path, null);
    }

    public Operation getOperation() {
        return operation;
    }

    public Path getPath() {
        return path;
    }
}
