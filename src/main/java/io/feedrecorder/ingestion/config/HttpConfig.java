package io.feedrecorder.ingestion.config;

import java.time.Duration;
import java.util.List;

public record HttpConfig(
        Duration connectTimeout,
        Duration readTimeout,
        int maxRetries,
        Duration retryDelay,
        List<String> userAgents
) {
    public int getConnectTimeoutMs() {
        return (int) connectTimeout.toMillis();
    }

    public int getReadTimeoutMs() {
        return (int) readTimeout.toMillis();
    }
}
