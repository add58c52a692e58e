package org.iceforge.pruner.catalog;

import org.iceforge.pruner.storage.StoredObject;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the timestamp out of the object key.
 * <p>
 * The pattern must contain a named group {@code ts}; its text is parsed with the given formatter pattern.
 * Formats without a time of day are taken as midnight, formats without an offset are read in {@code zone}.
 * Example: pattern {@code db-(?<ts>\d{8}-\d{6})\.sql\.gz}, format {@code yyyyMMdd-HHmmss}.
 * <p>
 * The format must resolve to a calendar date; formats such as {@code yyyyMM} or {@code HHmmss} are rejected
 * up front.
 */
public final class KeyPatternTimestampRule implements TimestampRule {

    static final String GROUP = "ts";

    private final Pattern pattern;
    private final DateTimeFormatter formatter;
    private final String format;
    private final ZoneId zone;

    public KeyPatternTimestampRule(String regex, String format, ZoneId zone) {
        Objects.requireNonNull(regex, "regex");
        this.format = Objects.requireNonNull(format, "format");
        this.zone = Objects.requireNonNull(zone, "zone");
        if (!regex.contains("(?<" + GROUP + ">")) {
            throw new IllegalArgumentException("Key pattern must define a named group '" + GROUP + "': " + regex);
        }
        this.pattern = Pattern.compile(regex);
        this.formatter = DateTimeFormatter.ofPattern(format, Locale.ROOT);
        requireFullDate();
    }

    private void requireFullDate() {
        ZonedDateTime sample = ZonedDateTime.of(2001, 2, 3, 4, 5, 6, 0, zone);
        try {
            toInstant(formatter.parse(formatter.format(sample)));
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Key format does not determine a date: " + format, e);
        }
    }

    @Override
    public Optional<Instant> timestampOf(StoredObject object) {
        Matcher m = pattern.matcher(object.key());
        if (!m.find()) {
            return Optional.empty();
        }
        String text = m.group(GROUP);
        try {
            return Optional.of(toInstant(formatter.parse(text)));
        } catch (DateTimeException e) {
            // covers parse errors and text that parses but does not resolve to an instant
            return Optional.empty();
        }
    }

    private Instant toInstant(TemporalAccessor parsed) {
        if (parsed.isSupported(ChronoField.INSTANT_SECONDS)) {
            return Instant.from(parsed);
        }
        if (parsed.isSupported(ChronoField.HOUR_OF_DAY)) {
            return ZonedDateTime.of(LocalDateTime.from(parsed), zone).toInstant();
        }
        return LocalDate.from(parsed).atStartOfDay(zone).toInstant();
    }

    @Override
    public String describe() {
        return "key pattern " + pattern.pattern() + " (" + format + ")";
    }
}
