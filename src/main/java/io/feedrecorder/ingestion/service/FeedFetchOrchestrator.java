package io.feedrecorder.ingestion.service;

import io.feedrecorder.ingestion.config.RecorderConfig;
import io.feedrecorder.ingestion.dto.FeedOutcome;
import io.feedrecorder.ingestion.dto.FeedParseResult;
import io.feedrecorder.ingestion.dto.FeedRecord;
import io.feedrecorder.ingestion.dto.FetchReport;
import io.feedrecorder.ingestion.dto.RawFeedEntry;
import io.feedrecorder.ingestion.exception.ErrorCategory;
import io.feedrecorder.ingestion.exception.FeedFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Fetches the configured feeds one after another and normalizes their entries.
 * A feed that fails is logged and skipped; it never aborts the batch.
 */
@Service
public class FeedFetchOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(FeedFetchOrchestrator.class);

    private final FeedFetcher feedFetcher;
    private final EntryNormalizer entryNormalizer;
    private final Sleeper pacingSleeper;
    private final Duration pacingDelay;

    public FeedFetchOrchestrator(FeedFetcher feedFetcher,
                                 EntryNormalizer entryNormalizer,
                                 Sleeper pacingSleeper,
                                 RecorderConfig recorderConfig) {
        this.feedFetcher = feedFetcher;
        this.entryNormalizer = entryNormalizer;
        this.pacingSleeper = pacingSleeper;
        this.pacingDelay = recorderConfig.processing().getEffectivePacingDelay();
    }

    public List<FeedRecord> fetchAll(List<String> feedUrls) {
        return fetchAllWithReport(feedUrls).records();
    }

    /**
     * Records of all feeds that did not fail, in feed-then-entry order, plus one outcome per feed.
     */
    public FetchReport fetchAllWithReport(List<String> feedUrls) {
        List<FeedRecord> records = new ArrayList<>();
        List<FeedOutcome> outcomes = new ArrayList<>();

        for (String feedUrl : feedUrls) {
            logger.info("Fetching feed: {}", feedUrl);

            if (!pace()) {
                logger.warn("Feed fetching interrupted, stopping before {}", feedUrl);
                break;
            }

            try {
                FeedParseResult result = feedFetcher.fetch(feedUrl);

                if (result.malformed()) {
                    logger.warn("Parsing error for {}: {}", feedUrl, result.diagnostic());
                }

                for (RawFeedEntry entry : result.entries()) {
                    records.add(entryNormalizer.normalize(entry, feedUrl));
                }

                outcomes.add(FeedOutcome.succeeded(feedUrl, result.entries().size(), result.malformed()));
                logger.info("Processed {} entries from {}", result.entries().size(), feedUrl);

            } catch (FeedFetchException e) {
                logger.error("Error processing feed {}: {} (category: {})", feedUrl, e.getMessage(), e.getCategory());
                outcomes.add(FeedOutcome.failed(feedUrl, e.getCategory(), e.getMessage()));

            } catch (RuntimeException e) {
                logger.error("Error processing feed {}: {}", feedUrl, e.getMessage(), e);
                outcomes.add(FeedOutcome.failed(feedUrl, ErrorCategory.UNKNOWN, e.getMessage()));
            }
        }

        return new FetchReport(records, outcomes);
    }

    private boolean pace() {
        try {
            pacingSleeper.sleep(pacingDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
