package com.resume.network.ingestion;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Month;
import java.time.format.TextStyle;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient parser for resume dates and date ranges.
 *
 * <p>Accepted single dates: {@code MM/YYYY}, {@code MM/DD/YYYY}, {@code YYYY-MM},
 * {@code YYYY-MM-DD}, {@code YYYY/MM}, {@code Month YYYY}, {@code Mon YYYY}, bare {@code YYYY},
 * and the open-ended markers {@code Present}, {@code Current}, {@code Now}. Month precision
 * resolves to the first of the month, year precision to January 1. The precision is kept so
 * that a range such as {@code 2019 - 2019} can be read as the whole year.</p>
 *
 * <p>Ranges are split on en/em dashes, a spaced hyphen, "to" or "until", or a bare hyphen
 * between two years ({@code 2019-2021}). Anything else is reported as unparseable rather than
 * raising.</p>
 */
public class FlexibleDateParser {

    private static final int MIN_YEAR = 1900;
    private static final int MAX_YEAR = 2100;

    private static final Set<String> OPEN_ENDED = Set.of(
            "present", "current", "now", "ongoing", "today", "till date", "to date");

    private static final Pattern MONTH_SLASH_YEAR = Pattern.compile("^(\\d{1,2})\\s*/\\s*(\\d{4})$");
    private static final Pattern US_DATE = Pattern.compile("^(\\d{1,2})/(\\d{1,2})/(\\d{4})$");
    private static final Pattern ISO_MONTH = Pattern.compile("^(\\d{4})[-/.](\\d{1,2})$");
    private static final Pattern ISO_DATE = Pattern.compile("^(\\d{4})-(\\d{1,2})-(\\d{1,2})$");
    private static final Pattern MONTH_NAME_YEAR = Pattern.compile("^([\\p{L}]+)\\.?,?\\s+(\\d{4})$");
    private static final Pattern YEAR = Pattern.compile("^(\\d{4})$");

    private static final Pattern RANGE_SEPARATOR = Pattern.compile(
            "\\s*(?:[\u2013\u2014]|\\s-\\s|\\s+to\\s+|\\s+until\\s+|\\s+through\\s+)\\s*",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern BARE_HYPHEN_RANGE = Pattern.compile(
            "^(.*?\\d{4})\\s*-\\s*(\\d{4}|\\d{1,2}/\\d{4}|present|current|now|[\\p{L}]+\\.?\\s+\\d{4})$",
            Pattern.CASE_INSENSITIVE);

    private static final Map<String, Month> MONTHS = new HashMap<>();

    static {
        for (Month month : Month.values()) {
            String full = month.getDisplayName(TextStyle.FULL, Locale.ENGLISH).toLowerCase(Locale.ROOT);
            MONTHS.put(full, month);
            MONTHS.put(full.substring(0, 3), month);
        }
        MONTHS.put("sept", Month.SEPTEMBER);
    }

    /**
     * Parses a single date expression.
     */
    public ParsedDate parse(String text) {
        if (text == null || text.isBlank()) {
            return ParsedDate.missing();
        }
        String cleaned = text.trim()
                .replaceAll("^[(\\[]+|[)\\].,;]+$", "")
                .replaceAll("\\s+", " ")
                .toLowerCase(Locale.ROOT)
                .replaceFirst("^(?:from|since)\\s+", "");
        if (cleaned.isEmpty()) {
            return ParsedDate.missing();
        }
        if (OPEN_ENDED.contains(cleaned)) {
            return ParsedDate.openEnded(text);
        }
        try {
            Matcher m = MONTH_SLASH_YEAR.matcher(cleaned);
            if (m.matches()) {
                return dated(text, Precision.MONTH, year(m.group(2)), Integer.parseInt(m.group(1)), 1);
            }
            m = US_DATE.matcher(cleaned);
            if (m.matches()) {
                return dated(text, Precision.DAY, year(m.group(3)), Integer.parseInt(m.group(1)),
                        Integer.parseInt(m.group(2)));
            }
            m = ISO_DATE.matcher(cleaned);
            if (m.matches()) {
                return dated(text, Precision.DAY, year(m.group(1)), Integer.parseInt(m.group(2)),
                        Integer.parseInt(m.group(3)));
            }
            m = ISO_MONTH.matcher(cleaned);
            if (m.matches()) {
                return dated(text, Precision.MONTH, year(m.group(1)), Integer.parseInt(m.group(2)), 1);
            }
            m = MONTH_NAME_YEAR.matcher(cleaned);
            if (m.matches()) {
                Month month = MONTHS.get(m.group(1));
                if (month == null) {
                    return ParsedDate.unparseable(text);
                }
                return dated(text, Precision.MONTH, year(m.group(2)), month.getValue(), 1);
            }
            m = YEAR.matcher(cleaned);
            if (m.matches()) {
                return dated(text, Precision.YEAR, year(m.group(1)), 1, 1);
            }
        } catch (DateTimeException | NumberFormatException e) {
            return ParsedDate.unparseable(text);
        }
        return ParsedDate.unparseable(text);
    }

    /**
     * Parses a range such as {@code "Jan 2019 – Present"} or {@code "2019-2021"}.
     * A single date yields a range with a missing end.
     */
    public ParsedRange parseRange(String text) {
        if (text == null || text.isBlank()) {
            return new ParsedRange(ParsedDate.missing(), ParsedDate.missing());
        }
        String trimmed = text.trim().replaceAll("^[(\\[]+|[)\\]]+$", "");
        String[] parts = RANGE_SEPARATOR.split(trimmed, 2);
        if (parts.length == 2) {
            return new ParsedRange(parse(parts[0]), parse(parts[1]));
        }
        Matcher bare = BARE_HYPHEN_RANGE.matcher(trimmed);
        if (bare.matches()) {
            return new ParsedRange(parse(bare.group(1)), parse(bare.group(2)));
        }
        return new ParsedRange(parse(trimmed), ParsedDate.missing());
    }

    private static int year(String digits) {
        int year = Integer.parseInt(digits);
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw new DateTimeException("Year out of range: " + year);
        }
        return year;
    }

    private static ParsedDate dated(String raw, Precision precision, int year, int month, int day) {
        return ParsedDate.of(LocalDate.of(year, month, day), precision, raw);
    }

    /**
     * Granularity the date was written at.
     */
    public enum Precision {
        DAY(ChronoUnit.DAYS),
        MONTH(ChronoUnit.MONTHS),
        YEAR(ChronoUnit.YEARS);

        private final ChronoUnit unit;

        Precision(ChronoUnit unit) {
            this.unit = unit;
        }

        /**
         * First date of the period following the one starting at {@code date}.
         */
        public LocalDate next(LocalDate date) {
            return date.plus(1, unit);
        }
    }

    /**
     * Outcome of parsing one date expression.
     *
     * @param date       the parsed date, or null
     * @param precision  granularity of {@code date}, or null without a date
     * @param openEnded  true for "Present"-style markers
     * @param recognized false when text was present but could not be parsed
     * @param raw        the original text, or null when absent
     */
    public record ParsedDate(LocalDate date, Precision precision, boolean openEnded, boolean recognized, String raw) {

        static ParsedDate of(LocalDate date, Precision precision, String raw) {
            return new ParsedDate(date, precision, false, true, raw);
        }

        static ParsedDate openEnded(String raw) {
            return new ParsedDate(null, null, true, true, raw);
        }

        static ParsedDate unparseable(String raw) {
            return new ParsedDate(null, null, false, false, raw);
        }

        static ParsedDate missing() {
            return new ParsedDate(null, null, false, true, null);
        }

        public boolean isPresent() {
            return raw != null;
        }

        public boolean hasDate() {
            return date != null;
        }
    }

    /**
     * Start and end of a parsed range.
     */
    public record ParsedRange(ParsedDate start, ParsedDate end) {
    }
}
