package io.feedrecorder.ingestion.service;

import io.feedrecorder.ingestion.dto.FeedRecord;
import io.feedrecorder.ingestion.dto.FeedTag;
import io.feedrecorder.ingestion.dto.RawFeedEntry;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class EntryNormalizer {

    static final String DEFAULT_TITLE = "No title";
    static final String DEFAULT_AUTHOR = "Unknown";

    private final DateNormalizer dateNormalizer;

    public EntryNormalizer(DateNormalizer dateNormalizer) {
        this.dateNormalizer = dateNormalizer;
    }

    /**
     * Maps a raw entry to the record that gets persisted. The feed URL is taken as given,
     * never from the entry itself.
     */
    public FeedRecord normalize(RawFeedEntry entry, String feedUrl) {
        var title = entry.title() != null ? entry.title() : DEFAULT_TITLE;
        var author = entry.author() != null
                ? entry.author()
                : entry.creator() != null ? entry.creator() : DEFAULT_AUTHOR;
        var entryUrl = entry.link() != null ? entry.link() : "";

        return new FeedRecord(
                dateNormalizer.normalize(entry),
                title,
                author,
                feedUrl,
                entryUrl,
                extractTopics(entry)
        );
    }

    private List<String> extractTopics(RawFeedEntry entry) {
        if (entry.tags() != null) {
            return entry.tags().stream()
                    .map(this::topicOf)
                    .toList();
        }
        if (entry.categories() != null) {
            return entry.categories();
        }
        return List.of();
    }

    private String topicOf(FeedTag tag) {
        if (tag == null) return "";
        if (tag.term() != null) return tag.term();
        return tag.label() != null ? tag.label() : "";
    }
}
