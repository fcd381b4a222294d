package io.feedrecorder.ingestion.store;

import io.feedrecorder.ingestion.dto.FeedRecord;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Physical encoding of a persisted record collection.
 */
public interface RecordCodec {

    OutputFormat format();

    List<FeedRecord> read(Path path) throws IOException;

    void write(List<FeedRecord> records, Path path) throws IOException;
}
