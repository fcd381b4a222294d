package io.feedrecorder.ingestion.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.feedrecorder.ingestion.dto.FeedSourcesFile;
import io.feedrecorder.ingestion.exception.RecorderConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Reads the list of feed URLs from a YAML file with a top-level {@code feed_urls} key.
 */
@Service
public class FeedConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(FeedConfigLoader.class);

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * @return configured feed URLs in file order, empty when the key is missing or empty
     * @throws RecorderConfigException when the file is missing or not valid YAML
     */
    public List<String> load(Path configPath) {
        if (!Files.isRegularFile(configPath)) {
            throw new RecorderConfigException("Config file not found: " + configPath);
        }

        try {
            FeedSourcesFile sources = yamlMapper.readValue(configPath.toFile(), FeedSourcesFile.class);
            logger.info("Loaded configuration from {}", configPath);

            if (sources == null || sources.feedUrls() == null) {
                return List.of();
            }
            return sources.feedUrls().stream()
                    .filter(Objects::nonNull)
                    .map(String::trim)
                    .filter(url -> !url.isEmpty())
                    .toList();

        } catch (IOException e) {
            throw new RecorderConfigException("Error loading config file " + configPath + ": " + e.getMessage(), e);
        }
    }
}
