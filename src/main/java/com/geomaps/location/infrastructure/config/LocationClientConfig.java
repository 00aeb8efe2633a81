package com.geomaps.location.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.geomaps.location.application.port.out.LocationProvider;
import com.geomaps.location.application.service.LocationClient;
import com.geomaps.location.infrastructure.external.geoapify.GeoapifyProvider;
import com.geomaps.location.infrastructure.external.geoapify.GeoapifySettings;
import com.geomaps.location.infrastructure.http.HttpTransport;
import com.geomaps.location.infrastructure.http.WebClientHttpTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the Geoapify adapter behind the {@link LocationClient} facade.
 *
 * The facade owns the transport lifecycle: the transport and provider beans have
 * no destroy method of their own, and closing the client on shutdown releases
 * the connection pool.
 */
@Configuration
public class LocationClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(LocationClientConfig.class);

    @Bean
    public GeoapifySettings geoapifySettings(
            @Value("${app.geoapify.api-key:}") String apiKey,
            @Value("${app.geoapify.base-url:" + GeoapifySettings.DEFAULT_BASE_URL + "}") String baseUrl,
            @Value("${app.geoapify.timeout-seconds:10}") int timeoutSeconds) {
        GeoapifySettings settings = GeoapifySettings.builder()
                .apiKey(apiKey)
                .baseUrl(baseUrl)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .build();
        logger.info("Configured location provider: {}", settings);
        return settings;
    }

    @Bean(destroyMethod = "")
    public HttpTransport geoapifyTransport(WebClient.Builder webClientBuilder, GeoapifySettings settings) {
        return WebClientHttpTransport.create(webClientBuilder.clone(), settings.getBaseUrl(), settings.getTimeout());
    }

    @Bean(destroyMethod = "")
    public LocationProvider locationProvider(GeoapifySettings settings, HttpTransport geoapifyTransport,
                                             ObjectMapper objectMapper) {
        return new GeoapifyProvider(settings, geoapifyTransport, objectMapper);
    }

    @Bean(destroyMethod = "close")
    public LocationClient locationClient(LocationProvider locationProvider) {
        return new LocationClient(locationProvider);
    }
}
