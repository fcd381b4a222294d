package io.feedrecorder.ingestion.util;

import io.feedrecorder.ingestion.config.RecorderConfig;
import org.springframework.stereotype.Component;

/**
 * Flat view of the retry settings, referenced from {@code @Retryable} expressions.
 */
@Component
public class RecorderProps {
    private final int maxAttempts;
    private final long retryDelay;

    public RecorderProps(RecorderConfig config) {
        this.maxAttempts = Math.max(1, config.http().maxRetries());
        this.retryDelay = config.http().retryDelay().toMillis();
    }

    // retry
    public int getMaxAttempts() { return maxAttempts; }
    public long getRetryDelay() { return retryDelay; }
}
