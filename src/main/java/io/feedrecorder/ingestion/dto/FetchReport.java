package io.feedrecorder.ingestion.dto;

import java.util.List;

public record FetchReport(
        List<FeedRecord> records,
        List<FeedOutcome> outcomes
) {
    public FetchReport {
        records = List.copyOf(records);
        outcomes = List.copyOf(outcomes);
    }

    public List<FeedOutcome> failures() {
        return outcomes.stream()
                .filter(outcome -> !outcome.success())
                .toList();
    }

    public int getSucceededFeedCount() {
        return outcomes.size() - failures().size();
    }
}
