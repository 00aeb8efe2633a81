package com.geomaps.location.infrastructure.external.geoapify;

import com.geomaps.location.domain.exception.ValidationException;
import lombok.Getter;

import java.time.Duration;

/**
 * Immutable configuration handed to {@link GeoapifyProvider} at construction.
 */
@Getter
public final class GeoapifySettings {

    public static final String DEFAULT_BASE_URL = "https://api.geoapify.com/v1";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final String apiKey;
    private final String baseUrl;
    private final Duration timeout;

    private GeoapifySettings(String apiKey, String baseUrl, Duration timeout) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ValidationException("API key must be a non-empty string");
        }
        if (timeout.isZero() || timeout.isNegative()) {
            throw new ValidationException("Timeout must be positive, got " + timeout);
        }
        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
        this.timeout = timeout;
    }

    public static GeoapifySettings of(String apiKey) {
        return builder().apiKey(apiKey).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "GeoapifySettings(baseUrl=" + baseUrl + ", timeout=" + timeout + ")";
    }

    public static final class Builder {
        private String apiKey;
        private String baseUrl = DEFAULT_BASE_URL;
        private Duration timeout = DEFAULT_TIMEOUT;

        private Builder() {
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        /**
         * Overrides the vendor endpoint, e.g. to point at a mock server. Blank keeps the default.
         */
        public Builder baseUrl(String baseUrl) {
            if (baseUrl != null && !baseUrl.isBlank()) {
                this.baseUrl = baseUrl;
            }
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout != null) {
                this.timeout = timeout;
            }
            return this;
        }

        public GeoapifySettings build() {
            return new GeoapifySettings(apiKey, baseUrl, timeout);
        }
    }
}
