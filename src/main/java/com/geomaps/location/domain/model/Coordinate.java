package com.geomaps.location.domain.model;

import com.geomaps.location.domain.exception.ValidationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Value object representing a WGS-84 coordinate pair.
 */
@Getter
@EqualsAndHashCode
public final class Coordinate {

    private final double latitude;
    private final double longitude;

    public Coordinate(double latitude, double longitude) {
        if (Double.isNaN(latitude) || latitude < -90 || latitude > 90) {
            throw new ValidationException("Latitude must be between -90 and 90, got " + latitude);
        }
        if (Double.isNaN(longitude) || longitude < -180 || longitude > 180) {
            throw new ValidationException("Longitude must be between -180 and 180, got " + longitude);
        }
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public static Coordinate of(double latitude, double longitude) {
        return new Coordinate(latitude, longitude);
    }

    /**
     * Parses the {@code "lat,lon"} form produced by {@link #toString()}.
     *
     * @throws ValidationException if the text is not two comma-separated numbers in range
     */
    public static Coordinate parse(String text) {
        if (text == null) {
            throw new ValidationException("Coordinate text must not be null");
        }
        String[] parts = text.split(",");
        if (parts.length != 2) {
            throw new ValidationException("Coordinate must have the form 'lat,lon', got '" + text + "'");
        }
        try {
            return new Coordinate(Double.parseDouble(parts[0].trim()), Double.parseDouble(parts[1].trim()));
        } catch (NumberFormatException e) {
            throw new ValidationException("Coordinate must have the form 'lat,lon', got '" + text + "'");
        }
    }

    public Map<String, Double> toMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put("latitude", latitude);
        map.put("longitude", longitude);
        return map;
    }

    @Override
    public String toString() {
        return latitude + "," + longitude;
    }
}
