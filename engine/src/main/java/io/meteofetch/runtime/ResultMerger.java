package io.meteofetch.runtime;

import io.meteofetch.core.DailyRecord;
import io.meteofetch.core.DateSpan;
import io.meteofetch.core.GapReason;
import io.meteofetch.core.MergedSeries;
import io.meteofetch.core.SegmentOutcome;
import io.meteofetch.core.WeatherParameter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;

/**
 * Assembles segment outcomes into one ascending series over the requested range.
 * <p>
 * Dates of failed or cancelled segments become gaps. Records are taken in segment order and the first record
 * seen for a date wins, so a boundary date returned by two adjacent segments keeps the earlier segment's value.
 * Dates of successful segments that received no record are reported as {@link GapReason#NO_DATA}.
 */
public class ResultMerger {

    public MergedSeries merge(List<SegmentOutcome> outcomes, DateSpan requested) {
        return merge(outcomes, requested, Set.of());
    }

    /**
     * Same as {@link #merge(List, DateSpan)}, additionally requiring every record to carry every requested key.
     */
    public MergedSeries merge(List<SegmentOutcome> outcomes, DateSpan requested, Set<WeatherParameter> parameters) {
        TreeMap<LocalDate, GapReason> gaps = new TreeMap<>();
        for (SegmentOutcome o : outcomes) {
            if (o.isSuccess()) continue;
            GapReason reason = o.gapReason();
            for (LocalDate d : o.segment().span().dates()) {
                if (requested.contains(d)) gaps.putIfAbsent(d, reason);
            }
        }

        TreeMap<LocalDate, DailyRecord> byDate = new TreeMap<>();
        for (SegmentOutcome o : outcomes) {
            if (!o.isSuccess()) continue;
            for (DailyRecord r : o.records()) {
                LocalDate d = r.date();
                if (!requested.contains(d) || gaps.containsKey(d)) continue;
                byDate.putIfAbsent(d, r);
            }
        }

        for (SegmentOutcome o : outcomes) {
            if (!o.isSuccess()) continue;
            for (LocalDate d : o.segment().span().dates()) {
                if (requested.contains(d) && !byDate.containsKey(d)) gaps.putIfAbsent(d, GapReason.NO_DATA);
            }
        }
        // dates no segment covered at all; a correct plan never leaves any
        for (LocalDate d : requested.dates()) {
            if (!byDate.containsKey(d) && !gaps.containsKey(d)) gaps.put(d, GapReason.ALL_PROVIDERS_FAILED);
        }

        verify(requested, byDate, gaps, parameters);
        return new MergedSeries(requested, new ArrayList<>(byDate.values()), gaps);
    }

    private static void verify(DateSpan range, TreeMap<LocalDate, DailyRecord> records, TreeMap<LocalDate, GapReason> gaps,
                               Set<WeatherParameter> parameters) {
        for (LocalDate d : records.keySet()) {
            if (gaps.containsKey(d)) throw new IllegalStateException("date " + d + " is both a record and a gap");
        }
        if (records.size() + gaps.size() != range.days()) {
            throw new IllegalStateException("merged series covers " + (records.size() + gaps.size()) + " dates, range has " + range.days());
        }
        for (DailyRecord r : records.values()) {
            for (WeatherParameter p : parameters) {
                if (!r.hasKey(p)) throw new IllegalStateException("record " + r.date() + " lacks key " + p.key());
            }
        }
    }
}
