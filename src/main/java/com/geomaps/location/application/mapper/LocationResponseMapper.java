package com.geomaps.location.application.mapper;

import com.geomaps.location.api.dto.AddressDto;
import com.geomaps.location.api.dto.AutocompleteResultDto;
import com.geomaps.location.api.dto.CoordinateDto;
import com.geomaps.location.api.dto.DistanceMatrixResponseDto;
import com.geomaps.location.api.dto.GeocodingResultDto;
import com.geomaps.location.api.dto.RouteResponseDto;
import com.geomaps.location.domain.model.Address;
import com.geomaps.location.domain.model.AutocompleteResult;
import com.geomaps.location.domain.model.Coordinate;
import com.geomaps.location.domain.model.DistanceMatrixResult;
import com.geomaps.location.domain.model.GeocodingResult;
import com.geomaps.location.domain.model.RouteInfo;
import com.geomaps.location.domain.model.TravelMode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Mapper for converting canonical model objects to response DTOs.
 */
@Component
public class LocationResponseMapper {

    public GeocodingResultDto toDto(GeocodingResult result) {
        return new GeocodingResultDto(
            result.getLocation().getLatitude(),
            result.getLocation().getLongitude(),
            toDto(result.getAddress()),
            result.getConfidence().orElse(null),
            result.getConfidenceTier().name());
    }

    public AddressDto toDto(Address address) {
        return new AddressDto(
            address.getStreet(),
            address.getHouseNumber(),
            address.getCity(),
            address.getPostcode(),
            address.getState(),
            address.getCountry(),
            address.getCountryCode(),
            address.isEmpty() ? null : address.getFormatted());
    }

    public AutocompleteResultDto toDto(AutocompleteResult result) {
        Coordinate location = result.getLocation().orElse(null);
        return new AutocompleteResultDto(
            result.getRank(),
            toDto(result.getAddress()),
            location != null ? location.getLatitude() : null,
            location != null ? location.getLongitude() : null,
            result.getConfidence().orElse(null),
            result.getMatchType().orElse(null));
    }

    public RouteResponseDto toDto(RouteInfo route, TravelMode mode) {
        return new RouteResponseDto(
            mode.name(),
            route.getDistanceMeters(),
            route.getDurationSeconds(),
            route.getDistanceKilometers(),
            route.getDurationMinutes());
    }

    public DistanceMatrixResponseDto toDto(DistanceMatrixResult matrix) {
        return new DistanceMatrixResponseDto(
            matrix.getSources().stream().map(this::toDto).toList(),
            matrix.getTargets().stream().map(this::toDto).toList(),
            toRows(matrix.getDistances()),
            toRows(matrix.getDurations()),
            matrix.getUnit().getSymbol(),
            toRows(matrix.getDisplayDistances()));
    }

    public CoordinateDto toDto(Coordinate coordinate) {
        return new CoordinateDto(coordinate.getLatitude(), coordinate.getLongitude());
    }

    public Coordinate toCoordinate(CoordinateDto dto) {
        return new Coordinate(dto.getLat(), dto.getLng());
    }

    /**
     * NaN cells become null so the JSON stays valid and unreachable pairs stay explicit.
     */
    private static List<List<Double>> toRows(double[][] table) {
        List<List<Double>> rows = new ArrayList<>(table.length);
        for (double[] row : table) {
            List<Double> cells = new ArrayList<>(row.length);
            for (double cell : row) {
                cells.add(Double.isNaN(cell) ? null : cell);
            }
            rows.add(cells);
        }
        return rows;
    }
}
