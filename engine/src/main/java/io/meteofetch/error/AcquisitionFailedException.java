package io.meteofetch.error;

import io.meteofetch.core.GapRange;

import java.util.List;

/**
 * Request-level failure: no provider could be used, or every segment failed on every provider.
 */
public class AcquisitionFailedException extends RuntimeException {
    private final List<GapRange> gaps;

    public AcquisitionFailedException(String message, List<GapRange> gaps) {
        super(message);
        this.gaps = gaps == null ? List.of() : List.copyOf(gaps);
    }

    public List<GapRange> gaps() { return gaps; }
}
