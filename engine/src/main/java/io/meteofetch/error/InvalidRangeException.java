package io.meteofetch.error;

/**
 * Precondition violation of a requested date range. Never retried.
 */
public class InvalidRangeException extends IllegalArgumentException {
    public InvalidRangeException(String message) {
        super(message);
    }
}
