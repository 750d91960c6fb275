package io.meteofetch.core;

import io.meteofetch.error.InvalidRangeException;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;

/**
 * Inclusive range of calendar days, {@code start <= end}.
 */
public record DateSpan(LocalDate start, LocalDate end) {
    public DateSpan {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (start.isAfter(end)) {
            throw new InvalidRangeException("start " + start + " is after end " + end);
        }
    }

    public static DateSpan of(LocalDate start, LocalDate end) { return new DateSpan(start, end); }

    public static DateSpan single(LocalDate day) { return new DateSpan(day, day); }

    /** Number of days covered, at least 1. */
    public long days() { return ChronoUnit.DAYS.between(start, end) + 1; }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }

    public List<LocalDate> dates() {
        return start.datesUntil(end.plusDays(1)).toList();
    }

    @Override
    public String toString() { return start + ".." + end; }
}
