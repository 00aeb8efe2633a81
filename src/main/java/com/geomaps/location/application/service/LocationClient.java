package com.geomaps.location.application.service;

import com.geomaps.location.application.port.out.LocationProvider;
import com.geomaps.location.domain.exception.ValidationException;
import com.geomaps.location.domain.model.Address;
import com.geomaps.location.domain.model.AutocompleteResult;
import com.geomaps.location.domain.model.Coordinate;
import com.geomaps.location.domain.model.DistanceMatrixResult;
import com.geomaps.location.domain.model.DistanceUnit;
import com.geomaps.location.domain.model.GeocodingResult;
import com.geomaps.location.domain.model.RouteInfo;
import com.geomaps.location.domain.model.TravelMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Application-facing entry point for location services.
 *
 * Holds exactly one {@link LocationProvider}, chosen by whoever constructs the
 * client, and forwards every call to it unchanged. Validation and error
 * translation stay in the provider; exceptions it raises propagate as-is.
 *
 * Thread safety: operations are as thread-safe as the provider's transport.
 * The WebClient transport shipped here can be shared between threads, but
 * {@link #close()} must not run while calls are still in flight.
 *
 * <pre>
 * try (LocationClient client = new LocationClient(provider)) {
 *     List&lt;GeocodingResult&gt; results = client.geocode("Paris, France");
 * }
 * </pre>
 */
public class LocationClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(LocationClient.class);

    private final LocationProvider provider;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public LocationClient(LocationProvider provider) {
        if (provider == null) {
            throw new ValidationException("Provider must not be null");
        }
        this.provider = provider;
    }

    /**
     * Opens a client over {@code provider}, runs {@code body} and closes the
     * client on every exit path, including when {@code body} throws.
     */
    public static <T> T using(LocationProvider provider, Function<LocationClient, T> body) {
        try (LocationClient client = new LocationClient(provider)) {
            return body.apply(client);
        }
    }

    public List<GeocodingResult> geocode(String query) {
        logger.debug("geocode via {}", provider.getProviderName());
        return provider.geocode(query);
    }

    public List<Address> reverseGeocode(Coordinate point) {
        logger.debug("reverseGeocode {} via {}", point, provider.getProviderName());
        return provider.reverseGeocode(point);
    }

    public List<AutocompleteResult> autocomplete(String query) {
        return autocomplete(query, LocationProvider.DEFAULT_AUTOCOMPLETE_LIMIT);
    }

    public List<AutocompleteResult> autocomplete(String query, int limit) {
        logger.debug("autocomplete limit={} via {}", limit, provider.getProviderName());
        return provider.autocomplete(query, limit);
    }

    public DistanceMatrixResult distanceMatrix(List<Coordinate> sources, List<Coordinate> targets) {
        return distanceMatrix(sources, targets, TravelMode.DRIVING, DistanceUnit.KILOMETERS);
    }

    public DistanceMatrixResult distanceMatrix(List<Coordinate> sources, List<Coordinate> targets,
                                               TravelMode mode, DistanceUnit units) {
        logger.debug("distanceMatrix mode={} units={} via {}", mode, units, provider.getProviderName());
        return provider.distanceMatrix(sources, targets, mode, units);
    }

    public RouteInfo route(Coordinate source, Coordinate target) {
        return route(source, target, TravelMode.DRIVING);
    }

    public RouteInfo route(Coordinate source, Coordinate target, TravelMode mode) {
        logger.debug("route {} -> {} mode={} via {}", source, target, mode, provider.getProviderName());
        return provider.route(source, target, mode);
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Releases the provider's transport. Safe to call more than once.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            logger.info("Closing location client for provider {}", provider.getProviderName());
            provider.close();
        }
    }
}
