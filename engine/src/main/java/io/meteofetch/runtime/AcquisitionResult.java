package io.meteofetch.runtime;

import io.meteofetch.core.FetchRequest;
import io.meteofetch.core.GapRange;
import io.meteofetch.core.MergedSeries;
import io.meteofetch.core.SegmentOutcome;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Terminal result of an acquisition. A partial or cancelled result still carries every record that was fetched,
 * with the missing dates listed as gaps.
 */
public record AcquisitionResult(FetchRequest request,
                                Status status,
                                MergedSeries series,
                                List<SegmentOutcome> outcomes) {

    public enum Status { COMPLETE, PARTIAL, CANCELLED }

    public AcquisitionResult {
        outcomes = List.copyOf(outcomes);
    }

    static AcquisitionResult of(FetchRequest request, MergedSeries series, List<SegmentOutcome> outcomes, boolean cancelled) {
        Status status = cancelled ? Status.CANCELLED : series.isComplete() ? Status.COMPLETE : Status.PARTIAL;
        return new AcquisitionResult(request, status, series, outcomes);
    }

    public List<GapRange> gapRanges() { return series.gapRanges(); }

    /** Number of segments each provider served. */
    public Map<String, Long> servedBy() {
        Map<String, Long> out = new LinkedHashMap<>();
        for (SegmentOutcome o : outcomes) {
            if (o.isSuccess()) out.merge(o.servedBy(), 1L, Long::sum);
        }
        return out;
    }
}
