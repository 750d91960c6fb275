package io.meteofetch.core;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * The assembled series for a requested range: ascending records plus the dates no provider delivered.
 */
public final class MergedSeries {
    private final DateSpan range;
    private final List<DailyRecord> records;
    private final NavigableMap<LocalDate, GapReason> gaps;

    public MergedSeries(DateSpan range, List<DailyRecord> records, Map<LocalDate, GapReason> gaps) {
        this.range = Objects.requireNonNull(range, "range");
        this.records = List.copyOf(records);
        this.gaps = Collections.unmodifiableNavigableMap(new TreeMap<>(gaps));
    }

    public DateSpan range() { return range; }
    public List<DailyRecord> records() { return records; }
    public NavigableMap<LocalDate, GapReason> gaps() { return gaps; }

    public boolean isComplete() { return gaps.isEmpty(); }

    /** Share of requested days that have a record, 0..1. */
    public double coverage() { return (double) records.size() / range.days(); }

    /** Consecutive missing dates collapsed into ranges, one per reason run. */
    public List<GapRange> gapRanges() {
        List<GapRange> out = new ArrayList<>();
        LocalDate runStart = null;
        LocalDate prev = null;
        GapReason runReason = null;
        for (Map.Entry<LocalDate, GapReason> e : gaps.entrySet()) {
            LocalDate d = e.getKey();
            boolean continues = prev != null && prev.plusDays(1).equals(d) && runReason == e.getValue();
            if (!continues) {
                if (runStart != null) out.add(new GapRange(DateSpan.of(runStart, prev), runReason));
                runStart = d;
                runReason = e.getValue();
            }
            prev = d;
        }
        if (runStart != null) out.add(new GapRange(DateSpan.of(runStart, prev), runReason));
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MergedSeries that)) return false;
        return range.equals(that.range) && records.equals(that.records) && gaps.equals(that.gaps);
    }

    @Override
    public int hashCode() { return Objects.hash(range, records, gaps); }

    @Override
    public String toString() {
        return "MergedSeries{" + range + ", records=" + records.size() + ", gaps=" + gaps.size() + '}';
    }
}
