package com.geomaps.location.infrastructure.http;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * Raw vendor answer: status code, body text and the Retry-After header if sent.
 */
@Getter
@AllArgsConstructor
@ToString
public class TransportResponse {

    private final int status;
    private final String body;
    private final String retryAfter;

    public static TransportResponse of(int status, String body) {
        return new TransportResponse(status, body, null);
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    public Optional<String> getRetryAfterHeader() {
        return Optional.ofNullable(retryAfter);
    }
}
