package com.geomaps.location.application.port.out;

import com.geomaps.location.domain.model.Address;
import com.geomaps.location.domain.model.AutocompleteResult;
import com.geomaps.location.domain.model.Coordinate;
import com.geomaps.location.domain.model.DistanceMatrixResult;
import com.geomaps.location.domain.model.DistanceUnit;
import com.geomaps.location.domain.model.GeocodingResult;
import com.geomaps.location.domain.model.RouteInfo;
import com.geomaps.location.domain.model.TravelMode;

import java.util.List;
import java.util.Set;

/**
 * Output port implemented by every mapping-vendor adapter.
 *
 * Implementations translate the canonical inputs into one vendor's wire format
 * and normalize the vendor's answer back into the canonical model. Every failure
 * surfaces as a {@link com.geomaps.location.domain.exception.LocationSdkException}
 * subtype; vendor and transport exception types never cross this boundary.
 *
 * Adapters should extend {@link AbstractLocationProvider}, which runs all input
 * validation before the adapter is asked to perform any I/O.
 */
public interface LocationProvider extends AutoCloseable {

    int DEFAULT_AUTOCOMPLETE_LIMIT = 5;

    /**
     * Convert address text to coordinates.
     *
     * @param query free-form address or place name, must not be blank
     * @return matches in the vendor's relevance order
     */
    List<GeocodingResult> geocode(String query);

    /**
     * Convert a coordinate to the addresses found at that point.
     */
    List<Address> reverseGeocode(Coordinate point);

    /**
     * Suggestions for a partially typed address.
     *
     * @param limit maximum number of suggestions, between 1 and {@link #getMaxAutocompleteLimit()}
     * @return at most {@code limit} suggestions, in vendor order
     */
    List<AutocompleteResult> autocomplete(String query, int limit);

    default List<AutocompleteResult> autocomplete(String query) {
        return autocomplete(query, DEFAULT_AUTOCOMPLETE_LIMIT);
    }

    /**
     * Travel distance and time from every source to every target.
     *
     * @param units display unit recorded on the result; tables are always meters and seconds
     * @return a {@code sources.size()} x {@code targets.size()} result
     */
    DistanceMatrixResult distanceMatrix(List<Coordinate> sources, List<Coordinate> targets,
                                        TravelMode mode, DistanceUnit units);

    default DistanceMatrixResult distanceMatrix(List<Coordinate> sources, List<Coordinate> targets) {
        return distanceMatrix(sources, targets, TravelMode.DRIVING, DistanceUnit.KILOMETERS);
    }

    /**
     * Distance and duration of the best route between two points.
     *
     * @throws com.geomaps.location.domain.exception.NoRouteException if the vendor finds no route
     */
    RouteInfo route(Coordinate source, Coordinate target, TravelMode mode);

    default RouteInfo route(Coordinate source, Coordinate target) {
        return route(source, target, TravelMode.DRIVING);
    }

    String getProviderName();

    Set<TravelMode> getSupportedTravelModes();

    int getMaxMatrixSources();

    int getMaxMatrixTargets();

    int getMaxAutocompleteLimit();

    /**
     * Release the transport handle. Further calls after the first are no-ops.
     */
    @Override
    void close();
}
