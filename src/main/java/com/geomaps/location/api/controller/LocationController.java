package com.geomaps.location.api.controller;

import com.geomaps.location.api.dto.AddressDto;
import com.geomaps.location.api.dto.AutocompleteResultDto;
import com.geomaps.location.api.dto.CoordinateDto;
import com.geomaps.location.api.dto.DistanceMatrixRequestDto;
import com.geomaps.location.api.dto.DistanceMatrixResponseDto;
import com.geomaps.location.api.dto.GeocodingResultDto;
import com.geomaps.location.api.dto.RouteQueryDto;
import com.geomaps.location.api.dto.RouteResponseDto;
import com.geomaps.location.application.mapper.LocationResponseMapper;
import com.geomaps.location.application.service.LocationClient;
import com.geomaps.location.domain.model.Coordinate;
import com.geomaps.location.domain.model.DistanceMatrixResult;
import com.geomaps.location.domain.model.RouteInfo;
import com.geomaps.location.domain.model.TravelMode;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * HTTP surface over {@link LocationClient}. Input rules beyond basic typing are
 * left to the provider so that the REST and library callers see the same errors.
 */
@RestController
@RequestMapping("/api/v1")
@Validated
public class LocationController {

    private static final Logger logger = LoggerFactory.getLogger(LocationController.class);

    private final LocationClient locationClient;
    private final LocationResponseMapper mapper;

    public LocationController(LocationClient locationClient, LocationResponseMapper mapper) {
        this.locationClient = locationClient;
        this.mapper = mapper;
    }

    /**
     * GET /api/v1/geocode?query=...
     */
    @GetMapping("/geocode")
    public ResponseEntity<List<GeocodingResultDto>> geocode(@RequestParam("query") String query) {
        logger.info("Geocoding query of {} chars", query.length());
        return ResponseEntity.ok(locationClient.geocode(query).stream()
                .map(mapper::toDto)
                .toList());
    }

    /**
     * GET /api/v1/reverse-geocode?lat=X&lng=Y
     */
    @GetMapping("/reverse-geocode")
    public ResponseEntity<List<AddressDto>> reverseGeocode(@Valid @ModelAttribute CoordinateDto coordinate) {
        logger.info("Reverse geocoding: lat={}, lng={}", coordinate.getLat(), coordinate.getLng());
        return ResponseEntity.ok(locationClient.reverseGeocode(mapper.toCoordinate(coordinate)).stream()
                .map(mapper::toDto)
                .toList());
    }

    /**
     * GET /api/v1/autocomplete?query=...&limit=5
     */
    @GetMapping("/autocomplete")
    public ResponseEntity<List<AutocompleteResultDto>> autocomplete(
            @RequestParam("query") String query,
            @RequestParam(value = "limit", defaultValue = "5") int limit) {
        return ResponseEntity.ok(locationClient.autocomplete(query, limit).stream()
                .map(mapper::toDto)
                .toList());
    }

    /**
     * GET /api/v1/route?fromLat=..&fromLng=..&toLat=..&toLng=..&mode=DRIVING
     */
    @GetMapping("/route")
    public ResponseEntity<RouteResponseDto> route(@Valid @ModelAttribute RouteQueryDto query) {
        TravelMode mode = query.getMode() != null ? query.getMode() : TravelMode.DRIVING;
        Coordinate source = new Coordinate(query.getFromLat(), query.getFromLng());
        Coordinate target = new Coordinate(query.getToLat(), query.getToLng());
        logger.info("Routing {} -> {} by {}", source, target, mode);

        RouteInfo route = locationClient.route(source, target, mode);
        return ResponseEntity.ok(mapper.toDto(route, mode));
    }

    /**
     * POST /api/v1/distance-matrix
     */
    @PostMapping("/distance-matrix")
    public ResponseEntity<DistanceMatrixResponseDto> distanceMatrix(
            @Valid @RequestBody DistanceMatrixRequestDto request) {
        List<Coordinate> sources = request.getSources().stream().map(mapper::toCoordinate).toList();
        List<Coordinate> targets = request.getTargets().stream().map(mapper::toCoordinate).toList();
        logger.info("Distance matrix {}x{} by {}", sources.size(), targets.size(), request.getMode());

        DistanceMatrixResult matrix = locationClient.distanceMatrix(
                sources, targets, request.getMode(), request.getUnits());
        return ResponseEntity.ok(mapper.toDto(matrix));
    }
}
