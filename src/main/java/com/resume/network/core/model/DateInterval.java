package com.resume.network.core.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * Half-open date interval {@code [start, end)}.
 * Two intervals that only touch at a boundary do not overlap.
 *
 * @param start inclusive start
 * @param end   exclusive end
 */
public record DateInterval(LocalDate start, LocalDate end) {

    public DateInterval {
        Objects.requireNonNull(start, "start is required");
        Objects.requireNonNull(end, "end is required");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end must not be before start: " + start + " > " + end);
        }
    }

    public static DateInterval of(LocalDate start, LocalDate end) {
        return new DateInterval(start, end);
    }

    /**
     * Returns the intersection of both intervals, or empty when they do not overlap.
     * Overlap requires {@code max(starts) < min(ends)}.
     */
    public Optional<DateInterval> overlap(DateInterval other) {
        LocalDate overlapStart = start.isAfter(other.start) ? start : other.start;
        LocalDate overlapEnd = end.isBefore(other.end) ? end : other.end;
        if (overlapStart.isBefore(overlapEnd)) {
            return Optional.of(new DateInterval(overlapStart, overlapEnd));
        }
        return Optional.empty();
    }

    public boolean overlaps(DateInterval other) {
        return overlap(other).isPresent();
    }

    public boolean isEmpty() {
        return start.equals(end);
    }

    public long days() {
        return ChronoUnit.DAYS.between(start, end);
    }

    /**
     * Whole months covered by this interval.
     */
    public long months() {
        return ChronoUnit.MONTHS.between(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
