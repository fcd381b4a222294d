package io.feedrecorder.ingestion.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "recorder")
public record RecorderConfig(
        String configPath,
        String outputPath,
        ProcessingConfig processing,
        HttpConfig http
) {}
