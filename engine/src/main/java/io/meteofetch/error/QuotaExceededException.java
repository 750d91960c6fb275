package io.meteofetch.error;

import java.time.Instant;

/**
 * The provider's periodic call budget is used up; it stays unavailable until {@link #resetAt()}.
 */
public class QuotaExceededException extends FetchException {
    private final Instant resetAt;

    public QuotaExceededException(String providerId, Instant resetAt) {
        super(providerId, ErrorKind.QUOTA_EXCEEDED,
                "quota exhausted for " + providerId + (resetAt == null ? "" : ", resets at " + resetAt));
        this.resetAt = resetAt;
    }

    public Instant resetAt() { return resetAt; }
}
