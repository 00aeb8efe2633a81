package com.geomaps.location.infrastructure.external.geoapify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.geomaps.location.domain.exception.ApiException;
import com.geomaps.location.domain.exception.AuthenticationException;
import com.geomaps.location.domain.exception.NoRouteException;
import com.geomaps.location.domain.exception.RateLimitException;
import com.geomaps.location.domain.exception.ValidationException;
import com.geomaps.location.domain.model.Address;
import com.geomaps.location.domain.model.AutocompleteResult;
import com.geomaps.location.domain.model.ConfidenceTier;
import com.geomaps.location.domain.model.Coordinate;
import com.geomaps.location.domain.model.DistanceMatrixResult;
import com.geomaps.location.domain.model.DistanceUnit;
import com.geomaps.location.domain.model.GeocodingResult;
import com.geomaps.location.domain.model.RouteInfo;
import com.geomaps.location.domain.model.TravelMode;
import com.geomaps.location.infrastructure.http.TransportResponse;
import com.geomaps.location.module.test.support.StubHttpTransport;
import com.geomaps.location.module.test.support.StubHttpTransport.RecordedCall;
import com.geomaps.location.module.test.support.TestFixtures.Coordinates;
import com.geomaps.location.module.test.support.TestFixtures.Geoapify;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeoapifyProviderTest {

    private StubHttpTransport transport;
    private GeoapifyProvider provider;

    @BeforeEach
    void setUp() {
        transport = new StubHttpTransport();
        provider = new GeoapifyProvider(GeoapifySettings.of(Geoapify.API_KEY), transport, new ObjectMapper());
    }

    @Test
    void testGeocode_Paris_ReturnsBuildingTierResult() {
        transport.respondWith(200, Geoapify.PARIS_GEOCODE);

        List<GeocodingResult> results = provider.geocode("Paris, France");

        assertThat(results).hasSize(1);
        GeocodingResult paris = results.get(0);
        assertThat(paris.getLocation()).isEqualTo(new Coordinate(48.8566, 2.3522));
        assertThat(paris.getAddress().getCity()).isEqualTo("Paris");
        assertThat(paris.getAddress().getCountryCode()).isEqualTo("fr");
        assertThat(paris.getAddress().getFormatted()).isEqualTo("Paris, France");
        assertThat(paris.getConfidence()).contains(0.95);
        assertThat(paris.getCityLevelConfidence()).contains(1.0);
        assertThat(paris.getStreetLevelConfidence()).isEmpty();
        assertThat(paris.getConfidenceTier()).isEqualTo(ConfidenceTier.BUILDING);
    }

    @Test
    void testGeocode_SendsTextAndApiKey() {
        transport.respondWith(200, Geoapify.PARIS_GEOCODE);

        provider.geocode("  Paris, France ");

        RecordedCall call = transport.lastCall();
        assertThat(call.method()).isEqualTo("GET");
        assertThat(call.path()).isEqualTo(GeoapifyProvider.GEOCODE_PATH);
        assertThat(call.params())
                .containsEntry("text", "Paris, France")
                .containsEntry("apiKey", Geoapify.API_KEY);
    }

    @Test
    void testGeocode_NoMatches_ReturnsEmptyList() {
        transport.respondWith(200, Geoapify.NO_ROUTE);

        assertThat(provider.geocode("Atlantis")).isEmpty();
    }

    @Test
    void testGeocode_FeatureWithoutGeometry_Skipped() {
        transport.respondWith(200, """
                {"features": [
                  {"properties": {"city": "Nowhere"}},
                  {"geometry": {"coordinates": [2.3522, 48.8566]}, "properties": {"city": "Paris"}}
                ]}
                """);

        List<GeocodingResult> results = provider.geocode("Paris");

        assertThat(results).hasSize(1);
        assertThat(results.get(0).getAddress().getCity()).isEqualTo("Paris");
        assertThat(results.get(0).getConfidenceTier()).isEqualTo(ConfidenceTier.UNKNOWN);
    }

    @Test
    void testGeocode_VendorCoordinateOutOfRange_ReportedAsApiError() {
        transport.respondWith(200, """
                {"features": [{"geometry": {"coordinates": [2.3522, 123.0]}, "properties": {}}]}
                """);

        assertThatThrownBy(() -> provider.geocode("Paris"))
                .isInstanceOf(ApiException.class)
                .isNotInstanceOf(ValidationException.class)
                .hasMessageContaining("invalid coordinate");
    }

    @Test
    void testGeocode_BlankQuery_NoNetworkCall() {
        assertThatThrownBy(() -> provider.geocode("   ")).isInstanceOf(ValidationException.class);
        assertThat(transport.getCallCount()).isZero();
    }

    @ParameterizedTest
    @ValueSource(ints = {401, 403})
    void testGeocode_RejectedKey_ThrowsAuthentication(int status) {
        transport.respondWith(status, Geoapify.UNAUTHORIZED);

        assertThatThrownBy(() -> provider.geocode("Paris"))
                .isInstanceOfSatisfying(AuthenticationException.class,
                        e -> assertThat(e.getStatus()).isEqualTo(status));
    }

    @Test
    void testGeocode_RateLimited_CarriesRetryHint() {
        transport.respondWith(new TransportResponse(429, "{}", "30"));

        assertThatThrownBy(() -> provider.geocode("Paris"))
                .isInstanceOfSatisfying(RateLimitException.class,
                        e -> assertThat(e.getRetryAfter()).contains(Duration.ofSeconds(30)));
    }

    @Test
    void testGeocode_RateLimitedWithoutHeader_NoRetryHint() {
        transport.respondWith(429, "");

        assertThatThrownBy(() -> provider.geocode("Paris"))
                .isInstanceOfSatisfying(RateLimitException.class,
                        e -> assertThat(e.getRetryAfter()).isEmpty());
    }

    @Test
    void testGeocode_ServerError_ThrowsApiWithStatusAndVendorMessage() {
        transport.respondWith(500, Geoapify.SERVER_ERROR);

        assertThatThrownBy(() -> provider.geocode("Paris"))
                .isInstanceOfSatisfying(ApiException.class, e -> {
                    assertThat(e.getStatus()).contains(500);
                    assertThat(e.getVendorCode()).contains("Upstream unavailable");
                    assertThat(e.getMessage()).contains("500");
                });
    }

    @Test
    void testGeocode_MalformedJson_ThrowsApi() {
        transport.respondWith(200, "{\"features\": [");

        assertThatThrownBy(() -> provider.geocode("Paris"))
                .isInstanceOf(ApiException.class)
                .hasMessageContaining("Failed to parse");
    }

    @Test
    void testGeocode_MissingFeatures_ThrowsApi() {
        transport.respondWith(200, "{\"type\": \"FeatureCollection\"}");

        assertThatThrownBy(() -> provider.geocode("Paris"))
                .isInstanceOf(ApiException.class)
                .hasMessageContaining("'features'");
    }

    @Test
    void testGeocode_EmptyBody_ThrowsApi() {
        transport.respondWith(200, "");

        assertThatThrownBy(() -> provider.geocode("Paris")).isInstanceOf(ApiException.class);
    }

    @Test
    void testReverseGeocode_EiffelTower_MapsAddressFields() {
        transport.respondWith(200, Geoapify.EIFFEL_REVERSE);

        List<Address> addresses = provider.reverseGeocode(Coordinates.EIFFEL_TOWER);

        assertThat(addresses).hasSize(2);
        Address first = addresses.get(0);
        assertThat(first.getStreet()).isEqualTo("Avenue Gustave Eiffel");
        assertThat(first.getHouseNumber()).isEqualTo("5");
        assertThat(first.getPostcode()).isEqualTo("75007");
        assertThat(first.getState()).isEqualTo("Ile-de-France");
        assertThat(first.getFormatted()).isEqualTo("5 Avenue Gustave Eiffel, 75007 Paris, Ile-de-France, France");

        RecordedCall call = transport.lastCall();
        assertThat(call.path()).isEqualTo(GeoapifyProvider.REVERSE_GEOCODE_PATH);
        assertThat(call.params())
                .containsEntry("lat", "48.8584")
                .containsEntry("lon", "2.2945");
    }

    @Test
    void testReverseGeocode_MissingFields_LeftAbsent() {
        transport.respondWith(200, Geoapify.EIFFEL_REVERSE);

        Address sparse = provider.reverseGeocode(Coordinates.EIFFEL_TOWER).get(1);

        assertThat(sparse.getCity()).isEqualTo("Paris");
        assertThat(sparse.getStreet()).isNull();
        assertThat(sparse.getCountry()).isNull();
        assertThat(sparse.toMap()).containsOnlyKeys("city");
    }

    @Test
    void testAutocomplete_TruncatesToLimitAndRanksInOrder() {
        transport.respondWith(200, Geoapify.autocomplete(8));

        List<AutocompleteResult> results = provider.autocomplete("Str", 5);

        assertThat(results).hasSize(5);
        assertThat(results).extracting(AutocompleteResult::getRank).containsExactly(0, 1, 2, 3, 4);
        assertThat(results.get(2).getAddress().getStreet()).isEqualTo("Street 2");
        assertThat(results.get(0).getMatchType()).contains("inner_part");
        assertThat(results.get(0).getConfidence()).contains(0.8);
        assertThat(results.get(0).getLocation()).contains(new Coordinate(48.85, 2.35));
        assertThat(transport.lastCall().params()).containsEntry("limit", "5");
    }

    @Test
    void testAutocomplete_SuggestionWithoutPoint_HasNoLocation() {
        transport.respondWith(200, "{\"features\": [{\"properties\": {\"street\": \"Rue de Rivoli\"}}]}");

        AutocompleteResult only = provider.autocomplete("Rue de R", 3).get(0);

        assertThat(only.getLocation()).isEmpty();
        assertThat(only.getConfidence()).isEmpty();
    }

    @Test
    void testAutocomplete_LimitAboveVendorMaximum_NoNetworkCall() {
        assertThatThrownBy(() -> provider.autocomplete("Str", GeoapifyProvider.MAX_AUTOCOMPLETE_LIMIT + 1))
                .isInstanceOf(ValidationException.class);
        assertThat(transport.getCallCount()).isZero();
    }

    @Test
    void testDistanceMatrix_ShapeAndValues() {
        List<Coordinate> sources = List.of(Coordinates.NEW_YORK, Coordinates.LOS_ANGELES);
        List<Coordinate> targets = List.of(Coordinates.DENVER, Coordinates.PARIS, Coordinates.EIFFEL_TOWER);
        transport.respondWith(200, Geoapify.routeMatrix(2, 3));

        DistanceMatrixResult result = provider.distanceMatrix(sources, targets, TravelMode.DRIVING, DistanceUnit.MILES);

        assertThat(result.getRowCount()).isEqualTo(2);
        assertThat(result.getColumnCount()).isEqualTo(3);
        assertThat(result.getDistance(0, 0)).isEqualTo(1000.0);
        assertThat(result.getDistance(1, 2)).isEqualTo(2002.0);
        assertThat(result.getDuration(1, 2)).isEqualTo(200.2);
        assertThat(result.getUnit()).isEqualTo(DistanceUnit.MILES);
        assertThat(result.getSources()).containsExactlyElementsOf(sources);
    }

    @Test
    void testDistanceMatrix_PostsLonLatWaypointsAndModeToken() {
        transport.respondWith(200, Geoapify.routeMatrix(1, 1));

        provider.distanceMatrix(List.of(Coordinates.NEW_YORK), List.of(Coordinates.DENVER),
                TravelMode.WALKING, DistanceUnit.KILOMETERS);

        RecordedCall call = transport.lastCall();
        assertThat(call.method()).isEqualTo("POST");
        assertThat(call.path()).isEqualTo(GeoapifyProvider.ROUTE_MATRIX_PATH);
        assertThat(call.params()).containsEntry("apiKey", Geoapify.API_KEY);
        JsonNode body = call.body();
        assertThat(body.get("mode").asText()).isEqualTo("walk");
        assertThat(body.get("units").asText()).isEqualTo("metric");
        JsonNode source = body.get("sources").get(0).get("location");
        assertThat(source.get(0).asDouble()).isEqualTo(-74.0060);
        assertThat(source.get(1).asDouble()).isEqualTo(40.7128);
    }

    @Test
    void testDistanceMatrix_UnroutablePairs_AreNaN() {
        transport.respondWith(200, """
                {"sources_to_targets": [[
                  {"distance": 5000, "time": 400, "source_index": 0, "target_index": 0},
                  {"distance": null, "time": null, "source_index": 0, "target_index": 1}
                ]]}
                """);

        DistanceMatrixResult result = provider.distanceMatrix(List.of(Coordinates.LOS_ANGELES),
                List.of(Coordinates.DENVER, Coordinates.HONOLULU));

        assertThat(result.isReachable(0, 0)).isTrue();
        assertThat(result.isReachable(0, 1)).isFalse();
        assertThat(result.getDistance(0, 1)).isNaN();
        assertThat(result.getDuration(0, 1)).isNaN();
    }

    @Test
    void testDistanceMatrix_CellIndexOutOfBounds_ThrowsApi() {
        transport.respondWith(200, """
                {"sources_to_targets": [[{"distance": 1, "time": 1, "source_index": 0, "target_index": 4}]]}
                """);

        assertThatThrownBy(() -> provider.distanceMatrix(List.of(Coordinates.NEW_YORK), List.of(Coordinates.DENVER)))
                .isInstanceOf(ApiException.class);
    }

    @Test
    void testDistanceMatrix_NoRows_ThrowsApi() {
        transport.respondWith(200, "{\"sources_to_targets\": []}");

        assertThatThrownBy(() -> provider.distanceMatrix(List.of(Coordinates.NEW_YORK, Coordinates.LOS_ANGELES),
                List.of(Coordinates.DENVER, Coordinates.HONOLULU)))
                .isInstanceOf(ApiException.class)
                .hasMessageContaining("0 rows for 2 sources");
    }

    @Test
    void testDistanceMatrix_ShortRow_ThrowsApi() {
        transport.respondWith(200, """
                {"sources_to_targets": [
                  [{"distance": 5, "time": 1, "source_index": 0, "target_index": 0}],
                  [{"distance": 7, "time": 2, "source_index": 1, "target_index": 0},
                   {"distance": 9, "time": 3, "source_index": 1, "target_index": 1}]
                ]}
                """);

        assertThatThrownBy(() -> provider.distanceMatrix(List.of(Coordinates.NEW_YORK, Coordinates.LOS_ANGELES),
                List.of(Coordinates.DENVER, Coordinates.HONOLULU)))
                .isInstanceOf(ApiException.class)
                .hasMessageContaining("row 0");
    }

    @Test
    void testDistanceMatrix_RepeatedCell_ThrowsApi() {
        transport.respondWith(200, """
                {"sources_to_targets": [[
                  {"distance": 5, "time": 1, "source_index": 0, "target_index": 0},
                  {"distance": 6, "time": 1, "source_index": 0, "target_index": 0}
                ]]}
                """);

        assertThatThrownBy(() -> provider.distanceMatrix(List.of(Coordinates.NEW_YORK),
                List.of(Coordinates.DENVER, Coordinates.HONOLULU)))
                .isInstanceOf(ApiException.class)
                .hasMessageContaining("repeats");
    }

    @Test
    void testDistanceMatrix_TooManySources_NoNetworkCall() {
        List<Coordinate> eleven = IntStream.range(0, GeoapifyProvider.MAX_MATRIX_SOURCES + 1)
                .mapToObj(i -> new Coordinate(40 + i * 0.1, -74))
                .toList();

        assertThatThrownBy(() -> provider.distanceMatrix(eleven, List.of(Coordinates.DENVER)))
                .isInstanceOf(ValidationException.class);
        assertThat(transport.getCallCount()).isZero();
    }

    @Test
    void testRoute_LosAngelesToDenver() {
        transport.respondWith(200, Geoapify.ROUTE_LA_DENVER);

        RouteInfo route = provider.route(Coordinates.LOS_ANGELES, Coordinates.DENVER);

        assertThat(route.getDistanceMeters()).isEqualTo(1641250.0);
        assertThat(route.getDurationSeconds()).isEqualTo(54060.0);
        assertThat(route.getDistanceKilometers()).isEqualTo(1641.25);
        assertThat(route.getDurationMinutes()).isEqualTo(901.0);

        RecordedCall call = transport.lastCall();
        assertThat(call.path()).isEqualTo(GeoapifyProvider.ROUTING_PATH);
        assertThat(call.params())
                .containsEntry("waypoints", "34.0522,-118.2437|39.7392,-104.9903")
                .containsEntry("mode", "drive");
    }

    @Test
    void testRoute_Cycling_SendsBicycleToken() {
        transport.respondWith(200, Geoapify.ROUTE_LA_DENVER);

        provider.route(Coordinates.LOS_ANGELES, Coordinates.DENVER, TravelMode.CYCLING);

        assertThat(transport.lastCall().params()).containsEntry("mode", "bicycle");
    }

    @Test
    void testRoute_SmallCoordinates_SentInPlainNotation() {
        transport.respondWith(200, Geoapify.ROUTE_LA_DENVER);

        provider.route(new Coordinate(0.0001, -0.0005), new Coordinate(1.0, 1.0));

        assertThat(transport.lastCall().params()).containsEntry("waypoints", "0.0001,-0.0005|1,1");
    }

    @Test
    void testReverseGeocode_SmallCoordinates_SentInPlainNotation() {
        transport.respondWith(200, Geoapify.NO_ROUTE);

        provider.reverseGeocode(new Coordinate(0.00012, -0.0000034));

        assertThat(transport.lastCall().params())
                .containsEntry("lat", "0.00012")
                .containsEntry("lon", "-0.0000034");
    }

    @Test
    void testRoute_NoFeatures_ThrowsNoRoute() {
        transport.respondWith(200, Geoapify.NO_ROUTE);

        assertThatThrownBy(() -> provider.route(Coordinates.NEW_YORK, Coordinates.HONOLULU))
                .isInstanceOfSatisfying(NoRouteException.class, e -> {
                    assertThat(e.getSource()).isEqualTo(Coordinates.NEW_YORK);
                    assertThat(e.getTarget()).isEqualTo(Coordinates.HONOLULU);
                })
                .isInstanceOf(ApiException.class);
    }

    @Test
    void testRoute_MissingDistance_ThrowsApi() {
        transport.respondWith(200, "{\"features\": [{\"properties\": {\"time\": 10}}]}");

        assertThatThrownBy(() -> provider.route(Coordinates.LOS_ANGELES, Coordinates.DENVER))
                .isInstanceOf(ApiException.class)
                .isNotInstanceOf(NoRouteException.class);
    }

    @Test
    void testRoute_TransportFailure_Propagates() {
        ApiException timeout = new ApiException("Request timed out after 2000 ms");
        transport.failWith(timeout);

        assertThatThrownBy(() -> provider.route(Coordinates.LOS_ANGELES, Coordinates.DENVER)).isSameAs(timeout);
    }

    @Test
    void testClose_ClosesTransport() {
        provider.close();

        assertThat(transport.getCloseCount()).isEqualTo(1);
        assertThat(transport.isOpen()).isFalse();
    }

    @Test
    void testSupportedModes_AllFour() {
        assertThat(provider.getSupportedTravelModes()).containsExactlyInAnyOrder(TravelMode.values());
        assertThat(provider.getProviderName()).isEqualTo("Geoapify");
    }

    @Test
    void testNormalizeConfidence_ClampsAndDropsNonNumbers() {
        assertThat(GeoapifyProvider.normalizeConfidence(DoubleNode.valueOf(1.7))).isEqualTo(1.0);
        assertThat(GeoapifyProvider.normalizeConfidence(DoubleNode.valueOf(-0.2))).isEqualTo(0.0);
        assertThat(GeoapifyProvider.normalizeConfidence(DoubleNode.valueOf(0.42))).isEqualTo(0.42);
        assertThat(GeoapifyProvider.normalizeConfidence(IntNode.valueOf(1))).isEqualTo(1.0);
        assertThat(GeoapifyProvider.normalizeConfidence(DoubleNode.valueOf(Double.NaN))).isNull();
        assertThat(GeoapifyProvider.normalizeConfidence(TextNode.valueOf("high"))).isNull();
        assertThat(GeoapifyProvider.normalizeConfidence(null)).isNull();
    }
}
