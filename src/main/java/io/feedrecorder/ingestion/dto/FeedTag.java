package io.feedrecorder.ingestion.dto;

public record FeedTag(
        String term,
        String label
) {}
