package com.geomaps.location.domain.exception;

import java.util.Optional;

/**
 * Catch-all for vendor-side failures: 5xx, unexpected 4xx, malformed bodies,
 * unexpected schemas and transport failures (timeout, DNS, connection refused).
 * Transport failures keep the original exception as the cause.
 */
public class ApiException extends LocationSdkException {

    private final Integer status;
    private final String vendorCode;

    public ApiException(String message) {
        this(message, null, null, null);
    }

    public ApiException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public ApiException(String message, Integer status, String vendorCode) {
        this(message, status, vendorCode, null);
    }

    public ApiException(String message, Integer status, String vendorCode, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.vendorCode = vendorCode;
    }

    /**
     * @return vendor HTTP status, empty for transport and parsing failures
     */
    public Optional<Integer> getStatus() {
        return Optional.ofNullable(status);
    }

    /**
     * @return vendor error code or message, when the vendor sent one
     */
    public Optional<String> getVendorCode() {
        return Optional.ofNullable(vendorCode);
    }
}
