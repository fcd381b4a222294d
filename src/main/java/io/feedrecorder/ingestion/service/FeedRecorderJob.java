package io.feedrecorder.ingestion.service;

import io.feedrecorder.ingestion.dto.FeedOutcome;
import io.feedrecorder.ingestion.dto.FetchReport;
import io.feedrecorder.ingestion.exception.RecorderConfigException;
import io.feedrecorder.ingestion.exception.StoreException;
import io.feedrecorder.ingestion.store.MergeStore;
import io.feedrecorder.ingestion.store.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * One recording run: load the feed list, fetch every feed and merge the result into the output file.
 */
@Service
public class FeedRecorderJob {
    private static final Logger logger = LoggerFactory.getLogger(FeedRecorderJob.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_STORE_ERROR = 1;
    public static final int EXIT_CONFIG_ERROR = 2;

    private final FeedConfigLoader configLoader;
    private final FeedFetchOrchestrator orchestrator;
    private final MergeStore mergeStore;

    public FeedRecorderJob(FeedConfigLoader configLoader,
                           FeedFetchOrchestrator orchestrator,
                           MergeStore mergeStore) {
        this.configLoader = configLoader;
        this.orchestrator = orchestrator;
        this.mergeStore = mergeStore;
    }

    /**
     * @return process exit code: 0 on success or when there was nothing to record,
     * 1 when the output file could not be read or written, 2 on configuration errors
     */
    public int run(Path configPath, Path outputPath) {
        try {
            createParentDirectories(outputPath);
            OutputFormat.fromPath(outputPath);

            List<String> feedUrls = configLoader.load(configPath);
            if (feedUrls.isEmpty()) {
                logger.error("No feed URLs found in config file");
                return EXIT_OK;
            }

            logger.info("Starting feed fetching process for {} feeds", feedUrls.size());
            FetchReport report = orchestrator.fetchAllWithReport(feedUrls);
            logFailures(report);

            if (report.records().isEmpty()) {
                logger.warn("No entries found in any feeds");
                return EXIT_OK;
            }

            int count = mergeStore.merge(outputPath, report.records());

            logger.info("Successfully processed {} entries from {} feeds", report.records().size(), feedUrls.size());
            logger.info("Output file now contains {} entries: {}", count, outputPath);
            return EXIT_OK;

        } catch (RecorderConfigException e) {
            logger.error("Configuration error: {}", e.getMessage());
            return EXIT_CONFIG_ERROR;

        } catch (StoreException e) {
            logger.error("Output store error ({}): {}", e.getOperation(), e.getMessage(), e);
            return EXIT_STORE_ERROR;
        }
    }

    private void createParentDirectories(Path outputPath) {
        Path parent = outputPath.toAbsolutePath().getParent();
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new StoreException(StoreException.Operation.WRITE, outputPath,
                    "Could not create output directory " + parent + ": " + e.getMessage(), e);
        }
    }

    private void logFailures(FetchReport report) {
        List<FeedOutcome> failures = report.failures();
        if (failures.isEmpty()) return;

        logger.warn("{} of {} feeds failed and were skipped: {}", failures.size(), report.outcomes().size(),
                failures.stream().map(FeedOutcome::feedUrl).toList());
    }
}
