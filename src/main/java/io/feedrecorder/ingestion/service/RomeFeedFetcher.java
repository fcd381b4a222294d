package io.feedrecorder.ingestion.service;

import com.rometools.rome.feed.module.DCModule;
import com.rometools.rome.feed.synd.SyndCategory;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import io.feedrecorder.ingestion.config.HttpConfig;
import io.feedrecorder.ingestion.config.RecorderConfig;
import io.feedrecorder.ingestion.dto.FeedParseResult;
import io.feedrecorder.ingestion.dto.FeedTag;
import io.feedrecorder.ingestion.dto.RawFeedEntry;
import io.feedrecorder.ingestion.exception.ErrorCategory;
import io.feedrecorder.ingestion.exception.FeedFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.net.ConnectException;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.URL;
import java.net.URLConnection;
import java.net.UnknownHostException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.zip.GZIPInputStream;

@Service
public class RomeFeedFetcher implements FeedFetcher {

    private static final Logger logger = LoggerFactory.getLogger(RomeFeedFetcher.class);

    private static final String DEFAULT_USER_AGENT = "FeedRecorder/1.0";

    private static final Pattern BARE_AMPERSAND =
            Pattern.compile("&(?!(?:[a-zA-Z][a-zA-Z0-9]*|#[0-9]+|#x[0-9a-fA-F]+);)");
    private static final Pattern INVALID_XML_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F]");

    private int userAgentIndex = 0;
    private final HttpConfig httpConfig;

    public RomeFeedFetcher(RecorderConfig recorderConfig) {
        this.httpConfig = recorderConfig.http();
    }

    /**
     * Fetch and parse a feed. Transient failures (timeouts, refused connections, 429, 5xx gateway
     * errors) are retried with exponential backoff before the exception reaches the caller.
     */
    @Retryable(
            retryFor = FeedFetchException.class,
            exceptionExpression = "retryable",
            maxAttemptsExpression = "#{@recorderProps.maxAttempts}",
            backoff = @Backoff(delayExpression = "#{@recorderProps.retryDelay}", multiplier = 2.0, maxDelay = 10000)
    )
    @Override
    public FeedParseResult fetch(String feedUrl) throws FeedFetchException {
        if (feedUrl == null || feedUrl.isBlank()) {
            throw new FeedFetchException("Feed URL is null or empty", ErrorCategory.INVALID_URL);
        }

        logger.debug("Reading feed document from: {}", feedUrl);
        byte[] document = readDocument(feedUrl.trim());
        return parseDocument(feedUrl, document);
    }

    /**
     * Parse a feed document. A document that only parses after repairs is returned flagged as
     * malformed, with the strict parser's complaint as diagnostic.
     */
    FeedParseResult parseDocument(String feedUrl, byte[] document) throws FeedFetchException {
        try {
            return FeedParseResult.wellFormed(toRawEntries(parseStrict(document)));
        } catch (FeedException | IOException | IllegalArgumentException strictFailure) {
            logger.debug("Strict parse failed for {}: {}", feedUrl, strictFailure.getMessage());

            try {
                List<RawFeedEntry> entries = toRawEntries(parseLenient(document));
                return FeedParseResult.malformed(strictFailure.getMessage(), entries);
            } catch (FeedException | IOException | IllegalArgumentException e) {
                throw new FeedFetchException("Feed parsing error for " + feedUrl + ": " + e.getMessage(),
                        e, ErrorCategory.PARSE_ERROR);
            }
        }
    }

    private byte[] readDocument(String feedUrl) throws FeedFetchException {
        URLConnection connection = null;

        try {
            connection = toUrl(feedUrl).openConnection();

            if (connection instanceof HttpURLConnection http) {
                configureConnection(http);
                http.connect();
                validateHttpResponse(http, feedUrl);
            }

            InputStream inputStream = connection.getInputStream();
            if ("gzip".equalsIgnoreCase(connection.getContentEncoding())) {
                inputStream = new GZIPInputStream(inputStream);
            }

            try (InputStream body = inputStream) {
                return body.readAllBytes();
            }

        } catch (MalformedURLException | IllegalArgumentException e) {
            throw new FeedFetchException("Invalid feed URL or path: " + feedUrl, e, ErrorCategory.INVALID_URL);

        } catch (SocketTimeoutException e) {
            throw new FeedFetchException("Connection timeout for: " + feedUrl, e, ErrorCategory.TIMEOUT);

        } catch (ConnectException e) {
            throw new FeedFetchException("Connection refused: " + feedUrl, e, ErrorCategory.CONNECTION_REFUSED);

        } catch (UnknownHostException e) {
            throw new FeedFetchException("Unknown host: " + feedUrl, e, ErrorCategory.DNS_ERROR);

        } catch (FileNotFoundException | NoSuchFileException e) {
            throw new FeedFetchException("Feed not found: " + feedUrl, e, ErrorCategory.NOT_FOUND);

        } catch (SocketException e) {
            throw new FeedFetchException("Network error: " + feedUrl, e, ErrorCategory.NETWORK_ERROR);

        } catch (IOException e) {
            throw new FeedFetchException("I/O error reading: " + feedUrl, e, ErrorCategory.IO_ERROR);

        } finally {
            if (connection instanceof HttpURLConnection http) {
                http.disconnect();
            }
        }
    }

    private URL toUrl(String feedUrl) throws MalformedURLException {
        if (feedUrl.contains("://") || feedUrl.startsWith("file:")) {
            return new URL(feedUrl);
        }
        return Path.of(feedUrl).toUri().toURL();
    }

    /**
     * Configure HTTP connection with proper headers and timeouts
     */
    private void configureConnection(HttpURLConnection connection) {
        connection.setConnectTimeout(httpConfig.getConnectTimeoutMs());
        connection.setReadTimeout(httpConfig.getReadTimeoutMs());

        connection.setRequestProperty("User-Agent", getNextUserAgent());
        connection.setRequestProperty("Accept",
                "application/rss+xml, application/atom+xml, application/xml, text/xml, */*");
        connection.setRequestProperty("Accept-Encoding", "gzip");
        connection.setRequestProperty("Connection", "close");

        connection.setInstanceFollowRedirects(true);
        connection.setUseCaches(false);
    }

    /**
     * Map non-success status codes to error categories
     */
    private void validateHttpResponse(HttpURLConnection connection, String feedUrl)
            throws IOException, FeedFetchException {
        int responseCode = connection.getResponseCode();

        switch (responseCode) {
            case HttpURLConnection.HTTP_OK:
                String contentType = connection.getContentType();
                if (contentType != null && !isFeedContentType(contentType)) {
                    logger.warn("Unexpected content type for {}: {}", feedUrl, contentType);
                }
                break;

            case HttpURLConnection.HTTP_NOT_FOUND:
                throw new FeedFetchException("Feed not found (404): " + feedUrl, ErrorCategory.NOT_FOUND);

            case HttpURLConnection.HTTP_FORBIDDEN:
                throw new FeedFetchException("Access forbidden (403): " + feedUrl, ErrorCategory.ACCESS_FORBIDDEN);

            case HttpURLConnection.HTTP_UNAUTHORIZED:
                throw new FeedFetchException("Authentication required (401): " + feedUrl, ErrorCategory.AUTH_REQUIRED);

            case 429:
                throw new FeedFetchException("Rate limited (429): " + feedUrl, ErrorCategory.RATE_LIMITED);

            case HttpURLConnection.HTTP_INTERNAL_ERROR:
                throw new FeedFetchException("Server error (500): " + feedUrl, ErrorCategory.SERVER_ERROR);

            case HttpURLConnection.HTTP_BAD_GATEWAY:
            case HttpURLConnection.HTTP_UNAVAILABLE:
            case HttpURLConnection.HTTP_GATEWAY_TIMEOUT:
                throw new FeedFetchException("Server temporarily unavailable (" + responseCode + "): " + feedUrl,
                        ErrorCategory.SERVER_UNAVAILABLE);

            default:
                if (responseCode >= 400) {
                    throw new FeedFetchException(
                            String.format("HTTP error %d (%s): %s", responseCode, connection.getResponseMessage(), feedUrl),
                            ErrorCategory.HTTP_ERROR
                    );
                }
        }
    }

    private SyndFeed parseStrict(byte[] document) throws IOException, FeedException {
        var input = new SyndFeedInput();
        input.setXmlHealerOn(false);

        try (XmlReader reader = new XmlReader(new ByteArrayInputStream(document), false)) {
            return input.build(reader);
        }
    }

    private SyndFeed parseLenient(byte[] document) throws IOException, FeedException {
        var text = new StringWriter();
        try (XmlReader reader = new XmlReader(new ByteArrayInputStream(document), true)) {
            reader.transferTo(text);
        }

        String repaired = INVALID_XML_CHARS.matcher(text.toString()).replaceAll("");
        repaired = BARE_AMPERSAND.matcher(repaired).replaceAll("&amp;");

        var input = new SyndFeedInput();
        input.setXmlHealerOn(true);
        return input.build(new StringReader(repaired));
    }

    private List<RawFeedEntry> toRawEntries(SyndFeed feed) {
        if (feed.getEntries() == null || feed.getEntries().isEmpty()) {
            logger.warn("Feed has no entries: {}", feed.getTitle());
            return List.of();
        }

        return feed.getEntries().stream()
                .filter(Objects::nonNull)
                .map(this::toRawEntry)
                .toList();
    }

    private RawFeedEntry toRawEntry(SyndEntry entry) {
        var dc = (DCModule) entry.getModule(DCModule.URI);

        return RawFeedEntry.builder()
                .title(entry.getTitle())
                .author(blankToNull(entry.getAuthor()))
                .creator(dc != null ? blankToNull(dc.getCreator()) : null)
                .link(entry.getLink() != null ? entry.getLink().trim() : null)
                .published(formatDate(entry.getPublishedDate()))
                .updated(formatDate(entry.getUpdatedDate()))
                .date(dc != null ? formatDate(dc.getDate()) : null)
                .tags(toTags(entry.getCategories()))
                .build();
    }

    private List<FeedTag> toTags(List<SyndCategory> categories) {
        if (categories == null || categories.isEmpty()) {
            return null;
        }
        return categories.stream()
                .map(category -> new FeedTag(blankToNull(category.getName()), null))
                .toList();
    }

    // Rome keeps only the instant, dates come out in UTC
    private String formatDate(Date date) {
        if (date == null) return null;
        return DateTimeFormatter.RFC_1123_DATE_TIME.format(date.toInstant().atOffset(ZoneOffset.UTC));
    }

    private String blankToNull(String text) {
        return text == null || text.isBlank() ? null : text.trim();
    }

    private String getNextUserAgent() {
        List<String> userAgents = httpConfig.userAgents();
        if (userAgents == null || userAgents.isEmpty()) {
            return DEFAULT_USER_AGENT;
        }
        String userAgent = userAgents.get(userAgentIndex % userAgents.size());
        userAgentIndex = (userAgentIndex + 1) % userAgents.size();
        return userAgent;
    }

    private boolean isFeedContentType(String contentType) {
        String lowerContentType = contentType.toLowerCase();
        return lowerContentType.contains("xml") ||
                lowerContentType.contains("rss") ||
                lowerContentType.contains("atom") ||
                lowerContentType.contains("text");
    }
}
