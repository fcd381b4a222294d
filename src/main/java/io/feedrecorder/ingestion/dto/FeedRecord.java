package io.feedrecorder.ingestion.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"timestamp", "title", "author", "feed_url", "entry_url", "topics"})
public record FeedRecord(
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("title") String title,
        @JsonProperty("author") String author,
        @JsonProperty("feed_url") String feedUrl,
        @JsonProperty("entry_url") String entryUrl,
        @JsonProperty("topics") List<String> topics
) {
    public FeedRecord {
        timestamp = timestamp != null ? timestamp : "";
        title = title != null ? title : "";
        author = author != null ? author : "";
        feedUrl = feedUrl != null ? feedUrl : "";
        entryUrl = entryUrl != null ? entryUrl : "";
        topics = topics != null
                ? topics.stream().map(topic -> topic != null ? topic : "").toList()
                : List.of();
    }

    public boolean hasEntryUrl() {
        return !entryUrl.isEmpty();
    }
}
