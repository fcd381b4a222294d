package io.feedrecorder.ingestion;

import ch.qos.logback.classic.Level;
import io.feedrecorder.ingestion.dto.RawFeedEntry;
import io.feedrecorder.ingestion.service.DateNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DateNormalizerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private DateNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new DateNormalizer(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should parse RFC 2822 published date")
    void shouldParseRfc2822PublishedDate() {
        RawFeedEntry entry = RawFeedEntry.builder()
                .published("Mon, 02 Jan 2006 15:04:05 +0000")
                .build();

        assertThat(normalizer.normalize(entry)).isEqualTo("2006-01-02T15:04:05+00:00");
    }

    @Test
    @DisplayName("Should keep the original offset")
    void shouldKeepOriginalOffset() {
        RawFeedEntry entry = RawFeedEntry.builder()
                .published("Mon, 02 Jan 2006 15:04:05 -0700")
                .build();

        assertThat(normalizer.normalize(entry)).isEqualTo("2006-01-02T15:04:05-07:00");
    }

    @Test
    @DisplayName("Should prefer published over updated")
    void shouldPreferPublishedOverUpdated() {
        RawFeedEntry entry = RawFeedEntry.builder()
                .published("2020-01-01T00:00:00Z")
                .updated("2021-01-01T00:00:00Z")
                .build();

        assertThat(normalizer.normalize(entry)).isEqualTo("2020-01-01T00:00:00+00:00");
    }

    @Test
    @DisplayName("Should fall through to next field when a present field cannot be parsed")
    void shouldFallThroughUnparseableField() {
        RawFeedEntry entry = RawFeedEntry.builder()
                .published("sometime last week")
                .updated("not a date either")
                .pubDate("Tue, 10 Jun 2003 04:00:00 GMT")
                .date("2001-01-01")
                .build();

        assertThat(normalizer.normalize(entry)).isEqualTo("2003-06-10T04:00:00+00:00");
    }

    @Test
    @DisplayName("Should treat blank date fields as absent")
    void shouldTreatBlankFieldsAsAbsent() {
        RawFeedEntry entry = RawFeedEntry.builder()
                .published("")
                .updated("   ")
                .date("2019-07-04")
                .build();

        assertThat(normalizer.normalize(entry)).isEqualTo("2019-07-04T00:00:00+00:00");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "2006-01-02T15:04:05Z                | 2006-01-02T15:04:05+00:00",
            "2006-01-02T15:04:05.250+02:00       | 2006-01-02T15:04:05.250000+02:00",
            "2006-01-02T15:04:05                 | 2006-01-02T15:04:05+00:00",
            "2006-01-02 15:04:05                 | 2006-01-02T15:04:05+00:00",
            "02 Jan 06 15:04:05 +0100            | 2006-01-02T15:04:05+01:00",
            "Mon, 02 Jan 2006 15:04:05 EST       | 2006-01-02T15:04:05-05:00",
            "Mon, 2 Jan 2006 15:04 UT            | 2006-01-02T15:04:00+00:00",
            "Fri, 02 Jan 2006 15:04:05 +0000     | 2006-01-02T15:04:05+00:00",
            "January 2, 2006                     | 2006-01-02T00:00:00+00:00",
            "2 january 2006 15:04                | 2006-01-02T15:04:00+00:00",
            "Mon Jan 2 15:04:05 2006             | 2006-01-02T15:04:05+00:00",
            "2006/01/02                          | 2006-01-02T00:00:00+00:00",
            "01/02/99                            | 1999-01-02T00:00:00+00:00",
            "2006-01-02T15:04:05+0000            | 2006-01-02T15:04:05+00:00",
            "2006-01-02T15:04:05.5-0700          | 2006-01-02T15:04:05.500000-07:00",
            "Monday, 02-Jan-06 15:04:05 GMT      | 2006-01-02T15:04:05+00:00",
            "Mon, 02 Jan 2006 15:04:05 CET       | 2006-01-02T15:04:05+01:00",
            "Sun, 02 Jul 2006 15:04:05 CEST      | 2006-07-02T15:04:05+02:00",
            "Sun, 02 Jul 2006 15:04:05 BST       | 2006-07-02T15:04:05+01:00"
    })
    @DisplayName("Should parse loosely formatted dates")
    void shouldParseLooselyFormattedDates(String raw, String expected) {
        RawFeedEntry entry = RawFeedEntry.builder().updated(raw).build();

        assertThat(normalizer.normalize(entry)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should fall back to current time and warn when no date is usable")
    void shouldFallBackToNowAndWarn() {
        RawFeedEntry entry = RawFeedEntry.builder()
                .title("Dateless post")
                .published("garbage")
                .build();

        try (LogCapture logs = LogCapture.forClass(DateNormalizer.class)) {
            String timestamp = normalizer.normalize(entry);

            assertThat(timestamp).isEqualTo("2024-05-01T12:00:00+00:00");
            assertThat(logs.messages(Level.WARN)).containsExactly("No valid date found for entry: Dateless post");
        }
    }

    @Test
    @DisplayName("Should name an untitled entry Unknown in the fallback warning")
    void shouldNameUntitledEntryUnknown() {
        try (LogCapture logs = LogCapture.forClass(DateNormalizer.class)) {
            normalizer.normalize(RawFeedEntry.builder().build());

            assertThat(logs.messages(Level.WARN)).containsExactly("No valid date found for entry: Unknown");
        }
    }

    @Test
    @DisplayName("Should return a timestamp close to the system clock when nothing parses")
    void shouldReturnTimestampCloseToSystemClock() {
        DateNormalizer systemNormalizer = new DateNormalizer(Clock.systemDefaultZone());

        String timestamp = systemNormalizer.normalize(RawFeedEntry.builder().build());

        OffsetDateTime parsed = OffsetDateTime.parse(timestamp);
        assertThat(parsed.toInstant()).isCloseTo(Instant.now(), within(Duration.ofSeconds(5)));
    }
}
