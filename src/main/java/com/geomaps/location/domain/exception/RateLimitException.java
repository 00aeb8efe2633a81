package com.geomaps.location.domain.exception;

import java.time.Duration;
import java.util.Optional;

/**
 * The vendor signalled quota exhaustion (HTTP 429 or equivalent).
 * Nothing retries on the caller's behalf; use {@link #getRetryAfter()} to back off.
 */
public class RateLimitException extends LocationSdkException {

    private final Duration retryAfter;

    public RateLimitException(String message, Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter;
    }

    /**
     * @return the vendor's retry hint, empty when the vendor did not send one
     */
    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
