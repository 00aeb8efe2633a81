package com.geomaps.location.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Blocking HTTP handle used by vendor adapters.
 *
 * Non-2xx answers are returned, not thrown, so the adapter can classify them.
 * Failures to get any answer at all (timeout, DNS, refused connection) are raised
 * as {@link com.geomaps.location.domain.exception.ApiException} with the
 * transport failure as the cause.
 */
public interface HttpTransport extends AutoCloseable {

    TransportResponse get(String path, Map<String, String> queryParams);

    TransportResponse post(String path, Map<String, String> queryParams, JsonNode body);

    boolean isOpen();

    /**
     * Releases pooled connections. Idempotent.
     */
    @Override
    void close();
}
