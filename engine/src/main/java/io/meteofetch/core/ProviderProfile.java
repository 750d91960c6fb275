package io.meteofetch.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Static limits of one provider. Read-only and shared by all acquisitions.
 * {@code minRequestInterval} is the least time between the starts of two calls to the provider, zero for no pacing.
 */
public record ProviderProfile(String id,
                              int maxSpanDays,
                              int maxConcurrent,
                              QuotaPeriod quotaPeriod,
                              Duration quotaWindow,
                              long quotaCapacity,
                              Duration baseRetryDelay,
                              Duration maxRetryDelay,
                              int maxAttempts,
                              Duration requestTimeout,
                              Duration minRequestInterval) {

    /** How a provider counts its call budget. */
    public enum QuotaPeriod {
        /** No periodic ceiling. */
        NONE,
        /** Calls within the trailing {@code quotaWindow}. */
        ROLLING,
        /** Calls since the first day of the current UTC month. */
        CALENDAR_MONTH
    }

    public ProviderProfile {
        Objects.requireNonNull(id, "id");
        if (maxSpanDays < 1) throw new IllegalArgumentException("maxSpanDays must be >= 1");
        if (maxConcurrent < 1) throw new IllegalArgumentException("maxConcurrent must be >= 1");
        quotaPeriod = quotaPeriod == null ? QuotaPeriod.NONE : quotaPeriod;
        if (quotaPeriod == QuotaPeriod.ROLLING && (quotaWindow == null || quotaWindow.isZero() || quotaWindow.isNegative())) {
            throw new IllegalArgumentException("rolling quota needs a positive window");
        }
        if (quotaPeriod != QuotaPeriod.NONE && quotaCapacity < 0) {
            throw new IllegalArgumentException("quotaCapacity must be >= 0");
        }
        baseRetryDelay = baseRetryDelay == null ? Duration.ofSeconds(1) : baseRetryDelay;
        maxRetryDelay = maxRetryDelay == null ? Duration.ofSeconds(30) : maxRetryDelay;
        maxAttempts = Math.max(1, maxAttempts);
        requestTimeout = requestTimeout == null ? Duration.ofSeconds(30) : requestTimeout;
        minRequestInterval = minRequestInterval == null ? Duration.ZERO : minRequestInterval;
        if (minRequestInterval.isNegative()) throw new IllegalArgumentException("minRequestInterval must be >= 0");
    }

    public boolean hasQuota() { return quotaPeriod != QuotaPeriod.NONE; }

    public static Builder builder(String id) { return new Builder(id); }

    public static final class Builder {
        private final String id;
        private int maxSpanDays = 90;
        private int maxConcurrent = 4;
        private QuotaPeriod quotaPeriod = QuotaPeriod.NONE;
        private Duration quotaWindow;
        private long quotaCapacity;
        private Duration baseRetryDelay = Duration.ofSeconds(1);
        private Duration maxRetryDelay = Duration.ofSeconds(30);
        private int maxAttempts = 3;
        private Duration requestTimeout = Duration.ofSeconds(30);
        private Duration minRequestInterval = Duration.ZERO;

        private Builder(String id) { this.id = id; }

        public Builder maxSpanDays(int v) { this.maxSpanDays = v; return this; }
        public Builder maxConcurrent(int v) { this.maxConcurrent = v; return this; }
        public Builder unlimited() { this.quotaPeriod = QuotaPeriod.NONE; this.quotaWindow = null; this.quotaCapacity = 0; return this; }
        public Builder rollingQuota(Duration window, long capacity) { this.quotaPeriod = QuotaPeriod.ROLLING; this.quotaWindow = window; this.quotaCapacity = capacity; return this; }
        public Builder monthlyQuota(long capacity) { this.quotaPeriod = QuotaPeriod.CALENDAR_MONTH; this.quotaWindow = null; this.quotaCapacity = capacity; return this; }
        public Builder baseRetryDelay(Duration v) { this.baseRetryDelay = v; return this; }
        public Builder maxRetryDelay(Duration v) { this.maxRetryDelay = v; return this; }
        public Builder maxAttempts(int v) { this.maxAttempts = v; return this; }
        public Builder requestTimeout(Duration v) { this.requestTimeout = v; return this; }
        public Builder minRequestInterval(Duration v) { this.minRequestInterval = v; return this; }

        public ProviderProfile build() {
            return new ProviderProfile(id, maxSpanDays, maxConcurrent, quotaPeriod, quotaWindow, quotaCapacity,
                    baseRetryDelay, maxRetryDelay, maxAttempts, requestTimeout, minRequestInterval);
        }
    }
}
