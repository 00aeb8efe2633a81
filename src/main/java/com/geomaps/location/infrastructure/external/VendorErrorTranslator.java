package com.geomaps.location.infrastructure.external;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geomaps.location.domain.exception.ApiException;
import com.geomaps.location.domain.exception.AuthenticationException;
import com.geomaps.location.domain.exception.LocationSdkException;
import com.geomaps.location.domain.exception.RateLimitException;
import com.geomaps.location.infrastructure.http.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Classifies non-2xx vendor answers into the canonical error kinds.
 *
 * 401/403 -> {@link AuthenticationException}, 429 -> {@link RateLimitException},
 * anything else -> {@link ApiException} carrying the status and the vendor's
 * own message when the body has one.
 */
public class VendorErrorTranslator {

    private static final Logger logger = LoggerFactory.getLogger(VendorErrorTranslator.class);
    private static final int MAX_BODY_EXCERPT = 200;

    private final String vendor;
    private final ObjectMapper objectMapper;

    public VendorErrorTranslator(String vendor, ObjectMapper objectMapper) {
        this.vendor = vendor;
        this.objectMapper = objectMapper;
    }

    /**
     * Returns normally for 2xx answers, otherwise throws the classified error.
     */
    public void raiseIfFailed(TransportResponse response, String operation) {
        if (!response.isSuccessful()) {
            throw translate(response, operation);
        }
    }

    public LocationSdkException translate(TransportResponse response, String operation) {
        int status = response.getStatus();
        String vendorMessage = extractVendorMessage(response.getBody());

        if (status == 401 || status == 403) {
            logger.error("{} rejected credentials for {}: {}", vendor, operation, status);
            return new AuthenticationException(
                vendor + " rejected the API key or lacks permission (HTTP " + status + ")", status);
        }
        if (status == 429) {
            Duration retryAfter = response.getRetryAfterHeader()
                .map(VendorErrorTranslator::parseRetryAfter)
                .orElse(null);
            logger.warn("{} rate limit exceeded for {}, retry after {}", vendor, operation, retryAfter);
            return new RateLimitException(vendor + " rate limit exceeded", retryAfter);
        }

        logger.error("{} {} failed with status {}: {}", vendor, operation, status, vendorMessage);
        String message = vendor + " " + operation + " failed with status " + status
            + (vendorMessage != null ? ": " + vendorMessage : "");
        return new ApiException(message, status, vendorMessage);
    }

    /**
     * Parses a Retry-After header given either as delta-seconds or as an HTTP date.
     *
     * @return the wait, or null when the header cannot be understood
     */
    static Duration parseRetryAfter(String header) {
        String value = header.trim();
        if (!value.isEmpty() && value.chars().allMatch(Character::isDigit)) {
            try {
                return Duration.ofSeconds(Long.parseLong(value));
            } catch (NumberFormatException e) {
                logger.debug("Retry-After value out of range: {}", value);
                return null;
            }
        }
        try {
            ZonedDateTime until = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
            Duration wait = Duration.between(ZonedDateTime.now(until.getZone()), until);
            return wait.isNegative() ? Duration.ZERO : wait;
        } catch (DateTimeParseException e) {
            logger.debug("Unparseable Retry-After header: {}", value);
            return null;
        }
    }

    private String extractVendorMessage(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            for (String field : new String[] {"message", "error"}) {
                JsonNode node = root.get(field);
                if (node != null && node.isTextual() && !node.asText().isBlank()) {
                    return node.asText();
                }
            }
        } catch (JsonProcessingException e) {
            logger.debug("{} error body is not JSON", vendor);
        }
        return body.length() > MAX_BODY_EXCERPT ? body.substring(0, MAX_BODY_EXCERPT) : body;
    }
}
