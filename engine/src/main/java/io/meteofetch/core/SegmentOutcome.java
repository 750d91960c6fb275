package io.meteofetch.core;

import io.meteofetch.error.ErrorKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of fetching one segment: which provider served it, or why none did.
 */
public record SegmentOutcome(Segment segment,
                             Status status,
                             List<DailyRecord> records,
                             String servedBy,
                             ErrorKind error,
                             Map<String, ErrorKind> providerFailures) {

    public enum Status { SUCCESS, FAILED, CANCELLED }

    public SegmentOutcome {
        Objects.requireNonNull(segment, "segment");
        Objects.requireNonNull(status, "status");
        records = records == null ? List.of() : List.copyOf(records);
        providerFailures = providerFailures == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(providerFailures));
    }

    public static SegmentOutcome success(Segment segment, String provider, List<DailyRecord> records, Map<String, ErrorKind> failures) {
        return new SegmentOutcome(segment, Status.SUCCESS, records, provider, null, failures);
    }

    public static SegmentOutcome failed(Segment segment, ErrorKind error, Map<String, ErrorKind> failures) {
        return new SegmentOutcome(segment, Status.FAILED, List.of(), null, error, failures);
    }

    public static SegmentOutcome cancelled(Segment segment) {
        return new SegmentOutcome(segment, Status.CANCELLED, List.of(), null, null, Map.of());
    }

    public boolean isSuccess() { return status == Status.SUCCESS; }

    /** Gap category for the dates of this segment when it did not succeed. */
    public GapReason gapReason() {
        return switch (status) {
            case SUCCESS -> GapReason.NO_DATA;
            case CANCELLED -> GapReason.CANCELLED;
            case FAILED -> (!providerFailures.isEmpty() && providerFailures.values().stream().allMatch(k -> k == ErrorKind.QUOTA_EXCEEDED))
                    ? GapReason.QUOTA_EXHAUSTED : GapReason.ALL_PROVIDERS_FAILED;
        };
    }
}
