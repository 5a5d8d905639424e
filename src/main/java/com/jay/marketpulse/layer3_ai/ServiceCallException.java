package com.jay.marketpulse.layer3_ai;

import lombok.Getter;

import java.time.Duration;
import java.util.Optional;

/**
 * Raised by a {@link TextGenerationBackend} when a single call fails.
 * Carries the classified {@link ErrorKind} and, for quota errors, the server's retry hint.
 */
@Getter
public class ServiceCallException extends RuntimeException {

    private final ErrorKind kind;
    private final Duration retryAfter;

    public ServiceCallException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public ServiceCallException(ErrorKind kind, String message, Duration retryAfter) {
        this(kind, message, retryAfter, null);
    }

    public ServiceCallException(ErrorKind kind, String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.retryAfter = retryAfter;
    }

    public Optional<Duration> retryHint() {
        return Optional.ofNullable(retryAfter);
    }
}
