package com.geomaps.location.infrastructure.external.geoapify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.geomaps.location.application.port.out.AbstractLocationProvider;
import com.geomaps.location.domain.exception.ApiException;
import com.geomaps.location.domain.exception.NoRouteException;
import com.geomaps.location.domain.exception.ValidationException;
import com.geomaps.location.domain.model.Address;
import com.geomaps.location.domain.model.AutocompleteResult;
import com.geomaps.location.domain.model.Coordinate;
import com.geomaps.location.domain.model.DistanceMatrixResult;
import com.geomaps.location.domain.model.DistanceUnit;
import com.geomaps.location.domain.model.GeocodingResult;
import com.geomaps.location.domain.model.RouteInfo;
import com.geomaps.location.domain.model.TravelMode;
import com.geomaps.location.infrastructure.external.VendorErrorTranslator;
import com.geomaps.location.infrastructure.http.HttpTransport;
import com.geomaps.location.infrastructure.http.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Geoapify implementation of the location provider contract.
 * Handles request construction, HTTP calls and response normalization.
 *
 * API reference: https://apidocs.geoapify.com/
 */
public class GeoapifyProvider extends AbstractLocationProvider {

    private static final Logger logger = LoggerFactory.getLogger(GeoapifyProvider.class);

    public static final String PROVIDER_NAME = "Geoapify";
    public static final int MAX_MATRIX_SOURCES = 10;
    public static final int MAX_MATRIX_TARGETS = 10;
    public static final int MAX_AUTOCOMPLETE_LIMIT = 50;

    static final String GEOCODE_PATH = "/geocode/search";
    static final String REVERSE_GEOCODE_PATH = "/geocode/reverse";
    static final String AUTOCOMPLETE_PATH = "/geocode/autocomplete";
    static final String ROUTE_MATRIX_PATH = "/routematrix";
    static final String ROUTING_PATH = "/routing";

    private final GeoapifySettings settings;
    private final HttpTransport transport;
    private final ObjectMapper objectMapper;
    private final VendorErrorTranslator errorTranslator;

    public GeoapifyProvider(GeoapifySettings settings, HttpTransport transport, ObjectMapper objectMapper) {
        super(travelModeTokens());
        this.settings = settings;
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.errorTranslator = new VendorErrorTranslator(PROVIDER_NAME, objectMapper);
    }

    private static Map<TravelMode, String> travelModeTokens() {
        Map<TravelMode, String> tokens = new EnumMap<>(TravelMode.class);
        tokens.put(TravelMode.DRIVING, "drive");
        tokens.put(TravelMode.WALKING, "walk");
        tokens.put(TravelMode.CYCLING, "bicycle");
        tokens.put(TravelMode.TRUCK, "truck");
        return tokens;
    }

    @Override
    protected List<GeocodingResult> doGeocode(String query) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("text", query);
        JsonNode root = call("geocode", transport.get(GEOCODE_PATH, withApiKey(params)));

        List<GeocodingResult> results = new ArrayList<>();
        for (JsonNode feature : requireArray(root, "features", "geocode")) {
            Coordinate location = parseLocation(feature);
            if (location == null) {
                logger.warn("Skipping geocode feature without geometry");
                continue;
            }
            JsonNode props = feature.path("properties");
            JsonNode rank = props.path("rank");
            results.add(GeocodingResult.builder()
                .location(location)
                .address(parseAddress(props))
                .confidence(normalizeConfidence(rank.get("confidence")))
                .buildingLevelConfidence(normalizeConfidence(rank.get("confidence_building_level")))
                .streetLevelConfidence(normalizeConfidence(rank.get("confidence_street_level")))
                .cityLevelConfidence(normalizeConfidence(rank.get("confidence_city_level")))
                .build());
        }
        logger.debug("Parsed {} geocoding results", results.size());
        return results;
    }

    @Override
    protected List<Address> doReverseGeocode(Coordinate point) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("lat", plain(point.getLatitude()));
        params.put("lon", plain(point.getLongitude()));
        JsonNode root = call("reverse geocode", transport.get(REVERSE_GEOCODE_PATH, withApiKey(params)));

        List<Address> addresses = new ArrayList<>();
        for (JsonNode feature : requireArray(root, "features", "reverse geocode")) {
            addresses.add(parseAddress(feature.path("properties")));
        }
        logger.debug("Parsed {} addresses for {}", addresses.size(), point);
        return addresses;
    }

    @Override
    protected List<AutocompleteResult> doAutocomplete(String query, int limit) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("text", query);
        params.put("limit", Integer.toString(limit));
        JsonNode root = call("autocomplete", transport.get(AUTOCOMPLETE_PATH, withApiKey(params)));

        List<AutocompleteResult> results = new ArrayList<>();
        for (JsonNode feature : requireArray(root, "features", "autocomplete")) {
            JsonNode props = feature.path("properties");
            JsonNode rank = props.path("rank");
            results.add(AutocompleteResult.builder()
                .address(parseAddress(props))
                .rank(results.size())
                .location(parseLocation(feature))
                .confidence(normalizeConfidence(rank.get("confidence")))
                .matchType(text(rank, "match_type"))
                .build());
        }
        logger.debug("Parsed {} autocomplete suggestions", results.size());
        return results;
    }

    @Override
    protected DistanceMatrixResult doDistanceMatrix(List<Coordinate> sources, List<Coordinate> targets,
                                                    String modeToken, DistanceUnit units) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("mode", modeToken);
        body.put("units", "metric");
        body.set("sources", waypoints(sources));
        body.set("targets", waypoints(targets));
        JsonNode root = call("route matrix", transport.post(ROUTE_MATRIX_PATH, withApiKey(new LinkedHashMap<>()), body));

        double[][] distances = DistanceMatrixResult.unreachable(sources.size(), targets.size());
        double[][] durations = DistanceMatrixResult.unreachable(sources.size(), targets.size());
        boolean[][] covered = new boolean[sources.size()][targets.size()];
        JsonNode rows = requireArray(root, "sources_to_targets", "route matrix");
        if (rows.size() != sources.size()) {
            throw new ApiException("Geoapify route matrix returned " + rows.size()
                + " rows for " + sources.size() + " sources");
        }
        for (int i = 0; i < rows.size(); i++) {
            JsonNode row = rows.get(i);
            if (!row.isArray() || row.size() != targets.size()) {
                throw new ApiException("Geoapify route matrix row " + i + " does not hold "
                    + targets.size() + " cells");
            }
            for (int j = 0; j < row.size(); j++) {
                JsonNode cell = row.get(j);
                int sourceIndex = cell.path("source_index").asInt(i);
                int targetIndex = cell.path("target_index").asInt(j);
                if (sourceIndex < 0 || sourceIndex >= sources.size()
                    || targetIndex < 0 || targetIndex >= targets.size()) {
                    throw new ApiException("Geoapify route matrix cell [" + sourceIndex + "][" + targetIndex
                        + "] is outside " + sources.size() + "x" + targets.size());
                }
                if (covered[sourceIndex][targetIndex]) {
                    throw new ApiException("Geoapify route matrix repeats cell [" + sourceIndex + "][" + targetIndex + "]");
                }
                covered[sourceIndex][targetIndex] = true;
                // Present cell without a value: the pair is unreachable.
                distances[sourceIndex][targetIndex] = numberOrNaN(cell.get("distance"));
                durations[sourceIndex][targetIndex] = numberOrNaN(cell.get("time"));
            }
        }
        return new DistanceMatrixResult(distances, durations, sources, targets, units);
    }

    @Override
    protected RouteInfo doRoute(Coordinate source, Coordinate target, String modeToken) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("waypoints", waypoint(source) + "|" + waypoint(target));
        params.put("mode", modeToken);
        JsonNode root = call("routing", transport.get(ROUTING_PATH, withApiKey(params)));

        JsonNode features = requireArray(root, "features", "routing");
        if (features.isEmpty()) {
            logger.info("No route found between {} and {}", source, target);
            throw new NoRouteException(source, target);
        }
        JsonNode props = features.get(0).path("properties");
        JsonNode distance = props.get("distance");
        JsonNode time = props.get("time");
        if (distance == null || !distance.isNumber() || time == null || !time.isNumber()) {
            throw new ApiException("Geoapify routing response is missing distance or time");
        }
        try {
            return new RouteInfo(distance.asDouble(), time.asDouble());
        } catch (ValidationException e) {
            throw new ApiException("Geoapify returned an invalid route: " + e.getMessage(), e);
        }
    }

    @Override
    public String getProviderName() {
        return PROVIDER_NAME;
    }

    @Override
    public int getMaxMatrixSources() {
        return MAX_MATRIX_SOURCES;
    }

    @Override
    public int getMaxMatrixTargets() {
        return MAX_MATRIX_TARGETS;
    }

    @Override
    public int getMaxAutocompleteLimit() {
        return MAX_AUTOCOMPLETE_LIMIT;
    }

    @Override
    public void close() {
        transport.close();
    }

    private Map<String, String> withApiKey(Map<String, String> params) {
        params.put("apiKey", settings.getApiKey());
        return params;
    }

    /**
     * Classify the status, then parse the body.
     */
    private JsonNode call(String operation, TransportResponse response) {
        errorTranslator.raiseIfFailed(response, operation);
        try {
            return objectMapper.readTree(response.getBody() == null ? "" : response.getBody());
        } catch (JsonProcessingException e) {
            logger.error("Failed to parse Geoapify {} response", operation, e);
            throw new ApiException("Failed to parse Geoapify " + operation + " response",
                response.getStatus(), null, e);
        }
    }

    private static JsonNode requireArray(JsonNode root, String field, String operation) {
        JsonNode node = root == null ? null : root.get(field);
        if (node == null || !node.isArray()) {
            throw new ApiException("Geoapify " + operation + " response has no '" + field + "' array");
        }
        return node;
    }

    private ArrayNode waypoints(List<Coordinate> coordinates) {
        ArrayNode array = objectMapper.createArrayNode();
        for (Coordinate coordinate : coordinates) {
            ObjectNode waypoint = array.addObject();
            waypoint.putArray("location")
                .add(coordinate.getLongitude())
                .add(coordinate.getLatitude());
        }
        return array;
    }

    /**
     * GeoJSON point geometry, ordered [lon, lat]. Null when the feature has none.
     */
    private static Coordinate parseLocation(JsonNode feature) {
        JsonNode coords = feature.path("geometry").path("coordinates");
        if (!coords.isArray() || coords.size() < 2 || !coords.get(0).isNumber() || !coords.get(1).isNumber()) {
            return null;
        }
        try {
            return new Coordinate(coords.get(1).asDouble(), coords.get(0).asDouble());
        } catch (ValidationException e) {
            throw new ApiException("Geoapify returned an invalid coordinate: " + e.getMessage(), e);
        }
    }

    private static Address parseAddress(JsonNode props) {
        return Address.builder()
            .street(text(props, "street"))
            .houseNumber(text(props, "housenumber"))
            .city(text(props, "city"))
            .postcode(text(props, "postcode"))
            .state(text(props, "state"))
            .country(text(props, "country"))
            .countryCode(text(props, "country_code"))
            .formattedAddress(text(props, "formatted"))
            .build();
    }

    /**
     * Geoapify reports confidence in [0, 1]; anything outside is clamped, NaN is dropped.
     */
    static Double normalizeConfidence(JsonNode node) {
        if (node == null || !node.isNumber()) {
            return null;
        }
        double value = node.asDouble();
        if (Double.isNaN(value)) {
            return null;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static String waypoint(Coordinate coordinate) {
        return plain(coordinate.getLatitude()) + "," + plain(coordinate.getLongitude());
    }

    /**
     * Plain decimal notation; {@link Double#toString} switches to "1.0E-4" below 1e-3.
     */
    static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static double numberOrNaN(JsonNode node) {
        return node != null && node.isNumber() ? node.asDouble() : Double.NaN;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
