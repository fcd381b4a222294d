package io.feedrecorder.ingestion.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.feedrecorder.ingestion.dto.FeedRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Header plus one row per record. Topics are flattened into one cell joined with ", " and split
 * on the same separator when read back, so a topic that itself contains ", " does not survive
 * a round trip.
 */
@Component
public class CsvRecordCodec implements RecordCodec {

    static final String TOPIC_SEPARATOR = ", ";

    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.FAIL_ON_MISSING_HEADER_COLUMNS)
            .build();

    private final CsvSchema rowSchema = csvMapper.schemaFor(CsvRow.class);

    private final ObjectWriter writer = csvMapper.writerFor(CsvRow.class)
            .with(rowSchema.withHeader());

    private final ObjectReader reader = csvMapper.readerFor(CsvRow.class)
            .with(rowSchema.withHeader().withColumnReordering(true));

    @Override
    public OutputFormat format() {
        return OutputFormat.CSV;
    }

    @Override
    public List<FeedRecord> read(Path path) throws IOException {
        try (MappingIterator<CsvRow> rows = reader.readValues(path.toFile())) {
            List<CsvRow> parsed = rows.readAll();
            requireAllColumns((CsvSchema) rows.getParserSchema(), path);

            return parsed.stream()
                    .map(CsvRow::toRecord)
                    .toList();
        }
    }

    private void requireAllColumns(CsvSchema header, Path path) throws IOException {
        List<String> missing = new ArrayList<>();
        for (CsvSchema.Column column : rowSchema) {
            if (header == null || header.column(column.getName()) == null) {
                missing.add(column.getName());
            }
        }
        if (!missing.isEmpty()) {
            throw new IOException("CSV header of " + path + " is missing columns " + missing);
        }
    }

    @Override
    public void write(List<FeedRecord> records, Path path) throws IOException {
        try (SequenceWriter rows = writer.writeValues(path.toFile())) {
            rows.writeAll(records.stream().map(CsvRow::of).toList());
        }
    }

    static String joinTopics(List<String> topics) {
        return String.join(TOPIC_SEPARATOR, topics);
    }

    static List<String> splitTopics(String topics) {
        if (topics == null || topics.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(topics.split(TOPIC_SEPARATOR, -1));
    }

    @JsonPropertyOrder({"timestamp", "title", "author", "feed_url", "entry_url", "topics"})
    record CsvRow(
            @JsonProperty("timestamp") String timestamp,
            @JsonProperty("title") String title,
            @JsonProperty("author") String author,
            @JsonProperty("feed_url") String feedUrl,
            @JsonProperty("entry_url") String entryUrl,
            @JsonProperty("topics") String topics
    ) {
        static CsvRow of(FeedRecord record) {
            return new CsvRow(record.timestamp(), record.title(), record.author(),
                    record.feedUrl(), record.entryUrl(), joinTopics(record.topics()));
        }

        FeedRecord toRecord() {
            return new FeedRecord(timestamp, title, author, feedUrl, entryUrl, splitTopics(topics));
        }
    }
}
