package io.meteofetch.budget;

import java.time.Instant;

/**
 * Point-in-time copy of a provider's usage counters.
 *
 * @param capacity          calls allowed per window, or -1 when the provider has no periodic ceiling
 * @param used              calls recorded in the current window
 * @param inFlight          permits currently held
 * @param unrecorded        held permits whose call is not yet counted in {@code used}
 * @param resetAt           when the window frees budget again, null if unknown or unlimited
 * @param reportedRemaining remaining budget last reported by the provider itself, null if never reported
 */
public record QuotaState(String providerId,
                         long capacity,
                         long used,
                         int inFlight,
                         int unrecorded,
                         Instant resetAt,
                         Long reportedRemaining) {

    public boolean isLimited() { return capacity >= 0; }

    /** Calls that may still be started in this window. */
    public long remaining() {
        long r = isLimited() ? capacity - used - unrecorded : Long.MAX_VALUE;
        if (reportedRemaining != null) r = Math.min(r, reportedRemaining - unrecorded);
        return Math.max(0, r);
    }

    public boolean isExhausted() { return remaining() == 0; }

    public UsageLevel level() {
        if (!isLimited()) return reportedRemaining != null && reportedRemaining <= 0 ? UsageLevel.CRITICAL : UsageLevel.NORMAL;
        return UsageLevel.of(used, capacity);
    }
}
