package io.meteofetch.retry;

import io.meteofetch.core.ProviderProfile;
import io.meteofetch.error.ErrorKind;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Retries transient failures with exponentially growing, jittered delays capped at {@code maxMillis}.
 * Invalid requests, auth errors, malformed responses and exhausted quotas are never retried.
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;
    private final long maxMillis;
    private final double multiplier;
    private final double jitter;
    private final DoubleSupplier random;

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis) {
        this(maxAttempts, baseMillis, maxMillis, 2.0, 0.2, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param jitter fraction of the computed delay added at random, 0 disables jitter
     * @param random source of values in [0, 1)
     */
    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis,
                                         double multiplier, double jitter, DoubleSupplier random) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(0, baseMillis);
        this.maxMillis = Math.max(this.baseMillis, maxMillis);
        this.multiplier = Math.max(1.0, multiplier);
        this.jitter = Math.max(0.0, jitter);
        this.random = random;
    }

    public static ExponentialBackoffRetryPolicy forProfile(ProviderProfile profile) {
        return new ExponentialBackoffRetryPolicy(profile.maxAttempts(),
                profile.baseRetryDelay().toMillis(), profile.maxRetryDelay().toMillis());
    }

    @Override
    public RetryDecision shouldRetry(int attempt, ErrorKind kind) {
        if (kind == null || !kind.isTransient()) return RetryDecision.giveUp();
        if (attempt >= maxAttempts) return RetryDecision.giveUp();
        return RetryDecision.after(Duration.ofMillis(backoffMillis(attempt)));
    }

    @Override
    public long backoffMillis(int attempt) {
        double delay = baseMillis * Math.pow(multiplier, Math.min(30, Math.max(0, attempt - 1)));
        delay = Math.min(delay, maxMillis);
        if (jitter > 0) delay += delay * jitter * random.getAsDouble();
        return Math.min((long) delay, maxMillis);
    }

    @Override
    public int maxAttempts() { return maxAttempts; }
}
