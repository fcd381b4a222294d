package io.feedrecorder.ingestion.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FeedSourcesFile(
        @JsonProperty("feed_urls") List<String> feedUrls
) {}
