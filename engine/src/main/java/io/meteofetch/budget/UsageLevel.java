package io.meteofetch.budget;

/** Coarse quota consumption level used for usage warnings. */
public enum UsageLevel {
    NORMAL, WARNING, CRITICAL;

    static final double WARNING_THRESHOLD = 0.80;
    static final double CRITICAL_THRESHOLD = 0.95;

    public static UsageLevel of(long used, long capacity) {
        if (capacity <= 0) return used > 0 ? CRITICAL : NORMAL;
        double ratio = (double) used / capacity;
        if (ratio >= CRITICAL_THRESHOLD) return CRITICAL;
        if (ratio >= WARNING_THRESHOLD) return WARNING;
        return NORMAL;
    }
}
