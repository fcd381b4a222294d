package io.feedrecorder.ingestion.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.feedrecorder.ingestion.dto.FeedRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * A single UTF-8 JSON array, pretty-printed with two-space indentation.
 */
@Component
public class JsonRecordCodec implements RecordCodec {

    private static final TypeReference<List<FeedRecord>> RECORD_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ObjectWriter writer;

    public JsonRecordCodec() {
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withSeparators(Separators.createDefaultInstance()
                        .withObjectFieldValueSpacing(Separators.Spacing.AFTER));
        printer.indentArraysWith(indenter);
        printer.indentObjectsWith(indenter);

        this.writer = objectMapper.writerFor(RECORD_LIST).with(printer);
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.JSON;
    }

    @Override
    public List<FeedRecord> read(Path path) throws IOException {
        List<FeedRecord> records = objectMapper.readValue(path.toFile(), RECORD_LIST);
        if (records == null) {
            throw new IOException("Expected a JSON array of records but found null");
        }
        if (records.contains(null)) {
            throw new IOException("JSON array contains a null record at index " + records.indexOf(null));
        }
        return records;
    }

    @Override
    public void write(List<FeedRecord> records, Path path) throws IOException {
        writer.writeValue(path.toFile(), records);
    }
}
