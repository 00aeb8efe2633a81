package com.geomaps.location.domain.exception;

/**
 * Caller-supplied input violates a precondition (empty query, out-of-range
 * coordinate, unsupported travel mode, matrix too large).
 * Always raised before any network call.
 */
public class ValidationException extends LocationSdkException {

    public ValidationException(String message) {
        super(message);
    }
}
