package io.meteofetch.runtime;

import io.meteofetch.core.DateSpan;
import io.meteofetch.core.FetchRequest;
import io.meteofetch.core.ProviderProfile;
import io.meteofetch.core.Segment;
import io.meteofetch.error.InvalidRangeException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a requested range into consecutive, non-overlapping segments no longer than the first candidate
 * provider accepts per call. Spans are filled greedily, so only the last one may be shorter.
 */
public class BatchPlanner {
    private final int maxRangeYears;

    public BatchPlanner(int maxRangeYears) {
        this.maxRangeYears = Math.max(1, maxRangeYears);
    }

    public List<Segment> plan(FetchRequest request, List<ProviderProfile> providerOrder) {
        if (providerOrder == null || providerOrder.isEmpty()) {
            throw new IllegalArgumentException("at least one candidate provider is required");
        }
        DateSpan range = request.range();
        LocalDate ceiling = range.start().plusYears(maxRangeYears).minusDays(1);
        if (range.end().isAfter(ceiling)) {
            throw new InvalidRangeException("range " + range + " exceeds the maximum of " + maxRangeYears + " years");
        }
        List<String> candidates = providerOrder.stream().map(ProviderProfile::id).toList();
        List<DateSpan> spans = split(range, providerOrder.get(0).maxSpanDays());
        List<Segment> out = new ArrayList<>(spans.size());
        for (int i = 0; i < spans.size(); i++) {
            out.add(new Segment(i, spans.get(i), candidates));
        }
        return out;
    }

    /** Greedy split of {@code span} into pieces of at most {@code maxDays} days, oldest first. */
    public static List<DateSpan> split(DateSpan span, int maxDays) {
        int step = Math.max(1, maxDays);
        List<DateSpan> out = new ArrayList<>();
        LocalDate s = span.start();
        while (!s.isAfter(span.end())) {
            LocalDate e = s.plusDays(step - 1L);
            if (e.isAfter(span.end())) e = span.end();
            out.add(DateSpan.of(s, e));
            s = e.plusDays(1);
        }
        return out;
    }

    public int maxRangeYears() { return maxRangeYears; }
}
