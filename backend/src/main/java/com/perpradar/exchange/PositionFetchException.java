package com.perpradar.exchange;

import lombok.Getter;

/**
 * Thrown when the position API call fails. {@code retryable} covers rate limits (429), server errors
 * (5xx), timeouts and connection failures; anything else fails the call immediately.
 */
@Getter
public class PositionFetchException extends RuntimeException {

    /** HTTP status, 0 when no response was received. */
    private final int status;
    private final boolean retryable;

    public PositionFetchException(String message, int status, boolean retryable) {
        super(message);
        this.status = status;
        this.retryable = retryable;
    }

    public PositionFetchException(String message, Throwable cause, int status, boolean retryable) {
        super(message, cause);
        this.status = status;
        this.retryable = retryable;
    }

    static boolean isRetryableStatus(int status) {
        return status == 429 || status >= 500;
    }
}
