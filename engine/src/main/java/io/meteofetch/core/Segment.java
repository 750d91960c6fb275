package io.meteofetch.core;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * A planned sub-range of a request together with the providers to try, in order.
 */
public record Segment(int index, DateSpan span, List<String> candidates) {
    public Segment {
        Objects.requireNonNull(span, "span");
        candidates = List.copyOf(candidates);
    }

    public LocalDate start() { return span.start(); }
    public LocalDate end() { return span.end(); }

    /** Same segment restricted to a narrower span, used when a fallback provider needs smaller calls. */
    public Segment withSpan(DateSpan narrower) { return new Segment(index, narrower, candidates); }

    @Override
    public String toString() { return "Segment#" + index + "[" + span + "]"; }
}
