package io.meteofetch.retry;

import io.meteofetch.error.ErrorKind;

public interface RetryPolicy {
    /**
     * Decides whether a call that failed on its {@code attempt}-th try (1-based) should be repeated on the same provider.
     */
    RetryDecision shouldRetry(int attempt, ErrorKind kind);

    long backoffMillis(int attempt);

    int maxAttempts();
}
