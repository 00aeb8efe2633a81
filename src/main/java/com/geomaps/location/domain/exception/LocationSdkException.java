package com.geomaps.location.domain.exception;

/**
 * Common ancestor of every failure raised by a location provider.
 * Catch this to handle any provider-originated failure uniformly, or catch one
 * of the concrete kinds for targeted handling.
 */
public abstract class LocationSdkException extends RuntimeException {

    protected LocationSdkException(String message) {
        super(message);
    }

    protected LocationSdkException(String message, Throwable cause) {
        super(message, cause);
    }
}
