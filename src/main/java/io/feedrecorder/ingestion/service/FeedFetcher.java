package io.feedrecorder.ingestion.service;

import io.feedrecorder.ingestion.dto.FeedParseResult;
import io.feedrecorder.ingestion.exception.FeedFetchException;

/**
 * Retrieves and parses one feed.
 */
public interface FeedFetcher {

    /**
     * @param feedUrl http(s) URL, file URL or local path of the feed
     * @return parsed entries, flagged as malformed when the document needed repairs
     * @throws FeedFetchException when the feed cannot be retrieved or parsed at all
     */
    FeedParseResult fetch(String feedUrl) throws FeedFetchException;
}
