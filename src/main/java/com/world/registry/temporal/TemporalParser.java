package com.world.registry.temporal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.Year;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses validity-scoped attribute values of the form {@code "<text> (<start>:<end>)"}.
 *
 * <p>Bounds accept {@code YYYY}, {@code YYYY-MM} and {@code YYYY-MM-DD}. A start bound
 * expands to the first instant of its period, an end bound to the last instant of its
 * period (UTC). Unparseable or empty fragments become {@code null} bounds.</p>
 */
public final class TemporalParser {
    private static final Logger log = LoggerFactory.getLogger(TemporalParser.class);

    private static final Pattern SCOPED_VALUE = Pattern.compile(
            "^(.*?)\\s*\\(\\s*([^():]*?)\\s*:\\s*([^():]*?)\\s*\\)\\s*$", Pattern.DOTALL);
    private static final Pattern YEAR = Pattern.compile("\\d{4}");
    private static final Pattern YEAR_MONTH = Pattern.compile("\\d{4}-\\d{1,2}");
    private static final Pattern DATE = Pattern.compile("\\d{4}-\\d{1,2}-\\d{1,2}");

    private TemporalParser() {
        // Utility class
    }

    /**
     * Parses a raw value. Never throws for malformed dates.
     */
    public static TemporalValue parse(String raw) {
        if (raw == null) {
            return TemporalValue.unscoped("");
        }
        String trimmed = raw.trim();
        Matcher matcher = SCOPED_VALUE.matcher(trimmed);
        if (!matcher.matches()) {
            return TemporalValue.unscoped(trimmed);
        }

        String text = matcher.group(1).trim();
        Instant from = parseStartBound(matcher.group(2));
        Instant to = parseEndBound(matcher.group(3));

        if (from != null && to != null && from.isAfter(to)) {
            log.warn("temporal.range.inverted value='{}' from={} to={}", trimmed, from, to);
            return TemporalValue.unscoped(text);
        }
        if (from == null && to == null) {
            log.warn("temporal.range.unparseable value='{}'", trimmed);
            return TemporalValue.unscoped(text);
        }
        return new TemporalValue(text, from, to, true);
    }

    /**
     * Expands a partial date to the first instant of its period.
     */
    public static Instant parseStartBound(String fragment) {
        String value = fragment == null ? "" : fragment.trim();
        if (value.isEmpty()) {
            return null;
        }
        try {
            if (DATE.matcher(value).matches()) {
                return toDate(value).atStartOfDay().toInstant(ZoneOffset.UTC);
            }
            if (YEAR_MONTH.matcher(value).matches()) {
                return toYearMonth(value).atDay(1).atStartOfDay().toInstant(ZoneOffset.UTC);
            }
            if (YEAR.matcher(value).matches()) {
                return Year.parse(value).atDay(1).atStartOfDay().toInstant(ZoneOffset.UTC);
            }
        } catch (DateTimeException e) {
            log.debug("temporal.bound.unparseable fragment='{}' error={}", value, e.getMessage());
            return null;
        }
        log.debug("temporal.bound.unparseable fragment='{}'", value);
        return null;
    }

    /**
     * Expands a partial date to the last instant of its period.
     */
    public static Instant parseEndBound(String fragment) {
        String value = fragment == null ? "" : fragment.trim();
        if (value.isEmpty()) {
            return null;
        }
        try {
            LocalDate lastDay;
            if (DATE.matcher(value).matches()) {
                lastDay = toDate(value);
            } else if (YEAR_MONTH.matcher(value).matches()) {
                lastDay = toYearMonth(value).atEndOfMonth();
            } else if (YEAR.matcher(value).matches()) {
                Year year = Year.parse(value);
                lastDay = year.atDay(year.length());
            } else {
                log.debug("temporal.bound.unparseable fragment='{}'", value);
                return null;
            }
            return lastDay.atTime(LocalTime.MAX).toInstant(ZoneOffset.UTC);
        } catch (DateTimeException e) {
            log.debug("temporal.bound.unparseable fragment='{}' error={}", value, e.getMessage());
            return null;
        }
    }

    private static LocalDate toDate(String value) {
        String[] parts = value.split("-");
        return LocalDate.of(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]), Integer.parseInt(parts[2]));
    }

    private static YearMonth toYearMonth(String value) {
        String[] parts = value.split("-");
        return YearMonth.of(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
    }
}
