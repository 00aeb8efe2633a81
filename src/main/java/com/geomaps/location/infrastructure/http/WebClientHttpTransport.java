package com.geomaps.location.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.geomaps.location.domain.exception.ApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.util.UriBuilder;
import reactor.core.Exceptions;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link HttpTransport} backed by Spring's WebClient over a dedicated Reactor
 * Netty connection pool. Calls block until the answer arrives or the per-request
 * timeout elapses. Safe for concurrent use until {@link #close()}.
 */
public class WebClientHttpTransport implements HttpTransport {

    private static final Logger logger = LoggerFactory.getLogger(WebClientHttpTransport.class);

    private final WebClient webClient;
    private final Duration timeout;
    private final ConnectionProvider connectionProvider;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public WebClientHttpTransport(WebClient webClient, Duration timeout, ConnectionProvider connectionProvider) {
        this.webClient = webClient;
        this.timeout = timeout;
        this.connectionProvider = connectionProvider;
    }

    /**
     * Creates a transport with its own connection pool, closed by {@link #close()}.
     */
    public static WebClientHttpTransport create(WebClient.Builder webClientBuilder, String baseUrl, Duration timeout) {
        ConnectionProvider connectionProvider = ConnectionProvider.builder("location-provider")
            .maxIdleTime(Duration.ofSeconds(30))
            .build();
        HttpClient httpClient = HttpClient.create(connectionProvider)
            .responseTimeout(timeout);
        WebClient webClient = webClientBuilder
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
        return new WebClientHttpTransport(webClient, timeout, connectionProvider);
    }

    @Override
    public TransportResponse get(String path, Map<String, String> queryParams) {
        ensureOpen(path);
        return exchange(path, webClient.get().uri(uriBuilder -> buildUri(uriBuilder, path, queryParams)));
    }

    @Override
    public TransportResponse post(String path, Map<String, String> queryParams, JsonNode body) {
        ensureOpen(path);
        return exchange(path, webClient.post()
            .uri(uriBuilder -> buildUri(uriBuilder, path, queryParams))
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body));
    }

    @Override
    public boolean isOpen() {
        return !closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            logger.info("Releasing HTTP connection pool");
            connectionProvider.dispose();
        }
    }

    private TransportResponse exchange(String path, WebClient.RequestHeadersSpec<?> request) {
        try {
            TransportResponse response = request
                .accept(MediaType.APPLICATION_JSON)
                .exchangeToMono(clientResponse -> clientResponse.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .map(body -> new TransportResponse(
                        clientResponse.statusCode().value(),
                        body,
                        clientResponse.headers().asHttpHeaders().getFirst(HttpHeaders.RETRY_AFTER))))
                .timeout(timeout)
                .block();
            if (response == null) {
                throw new ApiException("Empty response from " + path);
            }
            logger.debug("{} answered {}", path, response.getStatus());
            return response;
        } catch (WebClientException e) {
            logger.error("Failed to connect to location provider at {}", path, e);
            throw new ApiException("Failed to connect to location provider: " + e.getMessage(), e);
        } catch (ApiException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                logger.error("Request to {} timed out after {}", path, timeout);
                throw new ApiException("Request timed out after " + timeout.toMillis() + " ms", cause);
            }
            logger.error("Transport failure calling {}", path, cause);
            throw new ApiException("Request failed: " + cause.getMessage(), cause);
        }
    }

    private void ensureOpen(String path) {
        if (closed.get()) {
            throw new ApiException("Transport is closed, cannot call " + path);
        }
    }

    // Values are bound as URI variables so that '|', ',' and braces get encoded.
    private static URI buildUri(UriBuilder uriBuilder, String path, Map<String, String> queryParams) {
        UriBuilder builder = uriBuilder.path(path);
        Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<String, String> param : queryParams.entrySet()) {
            String variable = "p" + values.size();
            builder.queryParam(param.getKey(), "{" + variable + "}");
            values.put(variable, param.getValue());
        }
        return builder.build(values);
    }
}
