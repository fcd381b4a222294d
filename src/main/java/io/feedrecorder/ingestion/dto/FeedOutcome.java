package io.feedrecorder.ingestion.dto;

import io.feedrecorder.ingestion.exception.ErrorCategory;

public record FeedOutcome(
        String feedUrl,
        boolean success,
        int entryCount,
        boolean malformed,
        ErrorCategory errorCategory,
        String errorMessage
) {
    public static FeedOutcome succeeded(String feedUrl, int entryCount, boolean malformed) {
        return new FeedOutcome(feedUrl, true, entryCount, malformed, null, null);
    }

    public static FeedOutcome failed(String feedUrl, ErrorCategory category, String message) {
        return new FeedOutcome(feedUrl, false, 0, false, category, message);
    }
}
