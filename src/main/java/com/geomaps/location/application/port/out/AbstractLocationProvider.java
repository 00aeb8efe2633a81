package com.geomaps.location.application.port.out;

import com.geomaps.location.domain.exception.ValidationException;
import com.geomaps.location.domain.model.Address;
import com.geomaps.location.domain.model.AutocompleteResult;
import com.geomaps.location.domain.model.Coordinate;
import com.geomaps.location.domain.model.DistanceMatrixResult;
import com.geomaps.location.domain.model.DistanceUnit;
import com.geomaps.location.domain.model.GeocodingResult;
import com.geomaps.location.domain.model.RouteInfo;
import com.geomaps.location.domain.model.TravelMode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Skeleton provider that enforces the input contract.
 *
 * The public operations are final: each one validates its arguments and only
 * then calls the matching {@code do*} hook, so an adapter is never reached with
 * a blank query, a null coordinate, an oversized matrix or an unsupported mode.
 */
public abstract class AbstractLocationProvider implements LocationProvider {

    private final Map<TravelMode, String> travelModeTokens;

    /**
     * @param travelModeTokens vendor token for every supported mode; modes left out are rejected
     */
    protected AbstractLocationProvider(Map<TravelMode, String> travelModeTokens) {
        this.travelModeTokens = travelModeTokens.isEmpty()
                ? new EnumMap<>(TravelMode.class)
                : new EnumMap<>(travelModeTokens);
    }

    @Override
    public final List<GeocodingResult> geocode(String query) {
        requireQuery(query);
        return doGeocode(query.trim());
    }

    @Override
    public final List<Address> reverseGeocode(Coordinate point) {
        requireCoordinate(point, "location");
        return doReverseGeocode(point);
    }

    @Override
    public final List<AutocompleteResult> autocomplete(String query, int limit) {
        requireQuery(query);
        if (limit < 1 || limit > getMaxAutocompleteLimit()) {
            throw new ValidationException(
                    "Limit must be between 1 and " + getMaxAutocompleteLimit() + ", got " + limit);
        }
        List<AutocompleteResult> results = doAutocomplete(query.trim(), limit);
        return results.size() > limit ? List.copyOf(results.subList(0, limit)) : results;
    }

    @Override
    public final DistanceMatrixResult distanceMatrix(List<Coordinate> sources, List<Coordinate> targets,
                                                     TravelMode mode, DistanceUnit units) {
        requireCoordinates(sources, "sources", getMaxMatrixSources());
        requireCoordinates(targets, "targets", getMaxMatrixTargets());
        String modeToken = vendorMode(mode);
        if (units == null) {
            throw new ValidationException("Distance unit must not be null");
        }
        return doDistanceMatrix(List.copyOf(sources), List.copyOf(targets), modeToken, units);
    }

    @Override
    public final RouteInfo route(Coordinate source, Coordinate target, TravelMode mode) {
        requireCoordinate(source, "source");
        requireCoordinate(target, "target");
        return doRoute(source, target, vendorMode(mode));
    }

    @Override
    public Set<TravelMode> getSupportedTravelModes() {
        return Collections.unmodifiableSet(travelModeTokens.keySet());
    }

    protected abstract List<GeocodingResult> doGeocode(String query);

    protected abstract List<Address> doReverseGeocode(Coordinate point);

    protected abstract List<AutocompleteResult> doAutocomplete(String query, int limit);

    /**
     * @param modeToken the vendor token mapped from the caller's {@link TravelMode}
     */
    protected abstract DistanceMatrixResult doDistanceMatrix(List<Coordinate> sources, List<Coordinate> targets,
                                                             String modeToken, DistanceUnit units);

    protected abstract RouteInfo doRoute(Coordinate source, Coordinate target, String modeToken);

    private String vendorMode(TravelMode mode) {
        if (mode == null) {
            throw new ValidationException("Travel mode must not be null");
        }
        String token = travelModeTokens.get(mode);
        if (token == null) {
            throw new ValidationException(getProviderName() + " does not support travel mode " + mode);
        }
        return token;
    }

    private static void requireQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("Query must be a non-empty string");
        }
    }

    private static void requireCoordinate(Coordinate coordinate, String name) {
        if (coordinate == null) {
            throw new ValidationException(name + " must not be null");
        }
    }

    private static void requireCoordinates(List<Coordinate> coordinates, String name, int ceiling) {
        if (coordinates == null || coordinates.isEmpty()) {
            throw new ValidationException(name + " must not be empty");
        }
        if (coordinates.size() > ceiling) {
            throw new ValidationException(
                    "At most " + ceiling + " " + name + " are supported per request, got " + coordinates.size());
        }
        for (int i = 0; i < coordinates.size(); i++) {
            requireCoordinate(coordinates.get(i), name + "[" + i + "]");
        }
    }
}
