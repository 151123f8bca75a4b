package com.resume.network.query;

import java.time.LocalDate;

/**
 * Half-open date range {@code [from, to)}; either bound may be null for an open side.
 */
public record DateRange(LocalDate from, LocalDate to) {

    public static DateRange between(LocalDate from, LocalDate to) {
        return new DateRange(from, to);
    }

    public static DateRange since(LocalDate from) {
        return new DateRange(from, null);
    }

    public static DateRange until(LocalDate to) {
        return new DateRange(null, to);
    }

    /**
     * The whole calendar year.
     */
    public static DateRange year(int year) {
        return new DateRange(LocalDate.of(year, 1, 1), LocalDate.of(year + 1, 1, 1));
    }

    public boolean isUnbounded() {
        return from == null && to == null;
    }

    /**
     * Whether {@code [start, end)} shares at least one day with this range.
     */
    public boolean intersects(LocalDate start, LocalDate end) {
        boolean startsBeforeRangeEnds = to == null || start.isBefore(to);
        boolean endsAfterRangeStarts = from == null || from.isBefore(end);
        return start.isBefore(end) && startsBeforeRangeEnds && endsAfterRangeStarts;
    }
}
