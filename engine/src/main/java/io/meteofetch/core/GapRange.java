package io.meteofetch.core;

/** A maximal run of consecutive missing dates sharing one reason. */
public record GapRange(DateSpan span, GapReason reason) {
    @Override
    public String toString() { return span + " (" + reason.label() + ")"; }
}
