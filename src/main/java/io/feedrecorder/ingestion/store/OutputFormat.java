package io.feedrecorder.ingestion.store;

import io.feedrecorder.ingestion.exception.RecorderConfigException;

import java.nio.file.Path;
import java.util.Locale;

public enum OutputFormat {
    JSON(".json"),
    CSV(".csv");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Selects the format from the file extension, case-insensitively.
     *
     * @throws RecorderConfigException for any other extension
     */
    public static OutputFormat fromPath(Path path) {
        String extension = extensionOf(path);
        for (OutputFormat format : values()) {
            if (format.extension.equals(extension)) {
                return format;
            }
        }
        throw new RecorderConfigException("Unsupported output format: " + (extension.isEmpty() ? "(none)" : extension));
    }

    private static String extensionOf(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) return "";

        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot).toLowerCase(Locale.ROOT) : "";
    }
}
