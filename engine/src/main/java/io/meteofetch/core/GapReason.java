package io.meteofetch.core;

/** Why a date of the requested range has no record. */
public enum GapReason {
    QUOTA_EXHAUSTED("quota exhausted"),
    ALL_PROVIDERS_FAILED("all providers failed"),
    CANCELLED("cancelled"),
    NO_DATA("provider returned no data");

    private final String label;

    GapReason(String label) { this.label = label; }

    public String label() { return label; }
}
