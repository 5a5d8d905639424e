package com.jay.marketpulse.layer3_ai;

/**
 * Failure taxonomy for calls to the text-generation service.
 * Only {@link #QUOTA_EXCEEDED} and {@link #TRANSIENT_SERVICE_ERROR} are retried.
 */
public enum ErrorKind {
    /** HTTP 429 from the service. */
    QUOTA_EXCEEDED(true),
    /** HTTP 408 / 5xx, timeouts and I/O failures. */
    TRANSIENT_SERVICE_ERROR(true),
    /** Other 4xx, or a response body without usable text. */
    INVALID_REQUEST(false),
    /** HTTP 401 / 403, or no API key configured. */
    AUTH_FAILURE(false),
    /** The local daily request budget is used up. */
    BUDGET_EXHAUSTED(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /** Maps an HTTP status code from the service to an error kind. */
    public static ErrorKind fromHttpStatus(int status) {
        if (status == 429) return QUOTA_EXCEEDED;
        if (status == 401 || status == 403) return AUTH_FAILURE;
        if (status == 408 || status >= 500) return TRANSIENT_SERVICE_ERROR;
        return INVALID_REQUEST;
    }
}
