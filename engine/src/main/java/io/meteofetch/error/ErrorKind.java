package io.meteofetch.error;

/**
 * Failure categories of a single provider call.
 */
public enum ErrorKind {
    TIMEOUT(true),
    CONNECTION(true),
    SERVER_ERROR(true),
    RATE_LIMITED(true),
    INVALID_REQUEST(false),
    AUTH_ERROR(false),
    MALFORMED_RESPONSE(false),
    QUOTA_EXCEEDED(false);

    private final boolean transientFailure;

    ErrorKind(boolean transientFailure) { this.transientFailure = transientFailure; }

    /** Transient failures may succeed when the same call is repeated later. */
    public boolean isTransient() { return transientFailure; }

    /** Maps an HTTP status of a non-successful response. */
    public static ErrorKind fromHttpStatus(int status) {
        if (status == 429) return RATE_LIMITED;
        if (status == 401 || status == 403) return AUTH_ERROR;
        if (status >= 500) return SERVER_ERROR;
        return INVALID_REQUEST;
    }
}
