package com.geomaps.location.domain.exception;

import lombok.Getter;

/**
 * The vendor rejected the configured credentials (HTTP 401/403 or equivalent).
 */
@Getter
public class AuthenticationException extends LocationSdkException {

    private final int status;

    public AuthenticationException(String message, int status) {
        super(message);
        this.status = status;
    }
}
