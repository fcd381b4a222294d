package io.feedrecorder.ingestion.dto;

import java.util.List;

/**
 * Outcome of parsing one feed document. A malformed feed may still carry usable entries.
 */
public record FeedParseResult(
        boolean malformed,
        String diagnostic,
        List<RawFeedEntry> entries
) {
    public FeedParseResult {
        entries = entries != null ? List.copyOf(entries) : List.of();
    }

    public static FeedParseResult wellFormed(List<RawFeedEntry> entries) {
        return new FeedParseResult(false, null, entries);
    }

    public static FeedParseResult malformed(String diagnostic, List<RawFeedEntry> entries) {
        return new FeedParseResult(true, diagnostic, entries);
    }
}
