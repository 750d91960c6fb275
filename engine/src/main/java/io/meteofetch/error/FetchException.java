package io.meteofetch.error;

/**
 * A provider call failed. The kind decides whether it is retried or the next provider is tried.
 */
public class FetchException extends Exception {
    private final ErrorKind kind;
    private final String providerId;

    public FetchException(String providerId, ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
        this.providerId = providerId;
    }

    public FetchException(String providerId, ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.providerId = providerId;
    }

    public ErrorKind kind() { return kind; }
    public String providerId() { return providerId; }
}
