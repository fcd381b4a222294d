package io.feedrecorder.ingestion.service;

import io.feedrecorder.ingestion.dto.RawFeedEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.SignStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Turns the date fields of a feed entry into a single ISO-8601 timestamp with offset,
 * e.g. {@code 2006-01-02T15:04:05+00:00}.
 */
@Component
public class DateNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(DateNormalizer.class);

    private static final Map<String, Function<RawFeedEntry, String>> DATE_FIELDS = new LinkedHashMap<>();

    static {
        DATE_FIELDS.put("published", RawFeedEntry::published);
        DATE_FIELDS.put("updated", RawFeedEntry::updated);
        DATE_FIELDS.put("pubDate", RawFeedEntry::pubDate);
        DATE_FIELDS.put("date", RawFeedEntry::date);
    }

    private static final DateTimeFormatter OUTPUT_SECONDS =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ssxxx", Locale.ROOT);
    private static final DateTimeFormatter OUTPUT_MICROS =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSxxx", Locale.ROOT);

    // RFC 2822 obsolete zone names, the usual US and European abbreviations
    private static final Map<String, String> ZONE_ABBREVIATIONS = Map.ofEntries(
            Map.entry("UT", "+0000"), Map.entry("UTC", "+0000"), Map.entry("GMT", "+0000"),
            Map.entry("Z", "+0000"),
            Map.entry("EST", "-0500"), Map.entry("EDT", "-0400"),
            Map.entry("CST", "-0600"), Map.entry("CDT", "-0500"),
            Map.entry("MST", "-0700"), Map.entry("MDT", "-0600"),
            Map.entry("PST", "-0800"), Map.entry("PDT", "-0700"),
            Map.entry("WET", "+0000"), Map.entry("WEST", "+0100"), Map.entry("BST", "+0100"),
            Map.entry("CET", "+0100"), Map.entry("CEST", "+0200"),
            Map.entry("EET", "+0200"), Map.entry("EEST", "+0300")
    );

    private static final Pattern LEADING_WEEKDAY =
            Pattern.compile("^(?:mon|tue|wed|thu|fri|sat|sun)[a-z]*,?\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_ZONE_NAME = Pattern.compile("\\s+([A-Za-z]{1,4})$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final List<DateTimeFormatter> LOOSE_FORMATS = List.of(
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ISO_LOCAL_DATE,
            // 2006-01-02T15:04:05.123+0000, offset without colon
            new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    .append(DateTimeFormatter.ISO_LOCAL_DATE)
                    .appendLiteral('T')
                    .appendPattern("HH:mm[:ss]")
                    .optionalStart()
                    .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
                    .optionalEnd()
                    .appendPattern("[XXX][XX]")
                    .toFormatter(Locale.ENGLISH),
            // 2 Jan 2006 15:04:05 +0000, 02 January 06 15:04
            new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    .appendValue(ChronoField.DAY_OF_MONTH, 1, 2, SignStyle.NOT_NEGATIVE)
                    .appendLiteral(' ')
                    .appendPattern("[MMMM][MMM]")
                    .appendLiteral(' ')
                    .appendValueReduced(ChronoField.YEAR, 2, 4, 1950)
                    .appendPattern("[ HH:mm[:ss]][ XXX][ XX]")
                    .toFormatter(Locale.ENGLISH),
            // 02-Jan-06 15:04:05 +0000 (RFC 850, weekday already stripped)
            new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    .appendValue(ChronoField.DAY_OF_MONTH, 1, 2, SignStyle.NOT_NEGATIVE)
                    .appendPattern("-MMM-")
                    .appendValueReduced(ChronoField.YEAR, 2, 4, 1950)
                    .appendPattern("[ HH:mm[:ss]][ XXX][ XX]")
                    .toFormatter(Locale.ENGLISH),
            // January 2, 2006 15:04:05
            new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    .appendPattern("[MMMM][MMM] d[,] ")
                    .appendValueReduced(ChronoField.YEAR, 2, 4, 1950)
                    .appendPattern("[ HH:mm[:ss]][ XXX][ XX]")
                    .toFormatter(Locale.ENGLISH),
            // Jan 2 15:04:05 2006 (asctime)
            new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    .appendPattern("MMM d HH:mm:ss[ XX] yyyy")
                    .toFormatter(Locale.ENGLISH),
            new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    .appendPattern("yyyy-MM-dd HH:mm[:ss][.SSS][ XXX][ XX][XXX][XX]")
                    .toFormatter(Locale.ENGLISH),
            new DateTimeFormatterBuilder()
                    .appendPattern("yyyy/MM/dd[ HH:mm[:ss]]")
                    .toFormatter(Locale.ENGLISH),
            new DateTimeFormatterBuilder()
                    .appendPattern("MM/dd/")
                    .appendValueReduced(ChronoField.YEAR, 2, 4, 1950)
                    .appendPattern("[ HH:mm[:ss]]")
                    .toFormatter(Locale.ENGLISH),
            new DateTimeFormatterBuilder()
                    .appendPattern("yyyyMMdd['T'HHmmss][XX]")
                    .toFormatter(Locale.ENGLISH)
    );

    private final Clock clock;

    public DateNormalizer(Clock clock) {
        this.clock = clock;
    }

    /**
     * Returns the first parseable date among {@code published, updated, pubDate, date},
     * or the current time when none of them parses. Never fails.
     */
    public String normalize(RawFeedEntry entry) {
        for (Map.Entry<String, Function<RawFeedEntry, String>> field : DATE_FIELDS.entrySet()) {
            String value = field.getValue().apply(entry);
            if (value == null || value.isBlank()) {
                continue;
            }

            Optional<OffsetDateTime> parsed = parse(value);
            if (parsed.isPresent()) {
                return format(parsed.get());
            }
            logger.debug("Failed to parse date {} from field '{}'", value, field.getKey());
        }

        String title = entry.title() != null ? entry.title() : "Unknown";
        logger.warn("No valid date found for entry: {}", title);
        return format(OffsetDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS));
    }

    /**
     * Parses a single date string, RFC 2822 first and then the looser formats.
     */
    public Optional<OffsetDateTime> parse(String value) {
        String trimmed = WHITESPACE.matcher(value.trim()).replaceAll(" ");

        Optional<OffsetDateTime> rfc2822 = tryParse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
        if (rfc2822.isPresent()) {
            return rfc2822;
        }

        String loose = replaceZoneName(LEADING_WEEKDAY.matcher(trimmed).replaceFirst(""));
        return LOOSE_FORMATS.stream()
                .map(formatter -> tryParse(loose, formatter))
                .flatMap(Optional::stream)
                .findFirst();
    }

    private static Optional<OffsetDateTime> tryParse(String value, DateTimeFormatter formatter) {
        try {
            TemporalAccessor parsed = formatter.parseBest(value,
                    OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            return Optional.of(toOffsetDateTime(parsed));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static String replaceZoneName(String value) {
        var matcher = TRAILING_ZONE_NAME.matcher(value);
        if (matcher.find()) {
            String offset = ZONE_ABBREVIATIONS.get(matcher.group(1).toUpperCase(Locale.ROOT));
            if (offset != null) {
                return value.substring(0, matcher.start()) + " " + offset;
            }
        }
        return value;
    }

    private static OffsetDateTime toOffsetDateTime(TemporalAccessor parsed) {
        if (parsed instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime;
        }
        if (parsed instanceof LocalDateTime localDateTime) {
            return localDateTime.atOffset(ZoneOffset.UTC);
        }
        return ((LocalDate) parsed).atStartOfDay().atOffset(ZoneOffset.UTC);
    }

    private static String format(OffsetDateTime dateTime) {
        OffsetDateTime micros = dateTime.truncatedTo(ChronoUnit.MICROS);
        return micros.getNano() == 0 ? OUTPUT_SECONDS.format(micros) : OUTPUT_MICROS.format(micros);
    }
}
