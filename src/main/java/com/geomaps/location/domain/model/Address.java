package com.geomaps.location.domain.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured postal address. Every field is optional; blank values are stored
 * as absent ({@code null}) so that {@link #toMap()} only carries real data.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Address {

    private final String street;
    private final String houseNumber;
    private final String city;
    private final String postcode;
    private final String state;
    private final String country;
    private final String countryCode;
    private final String formattedAddress;

    @Builder
    public Address(String street, String houseNumber, String city, String postcode,
                   String state, String country, String countryCode, String formattedAddress) {
        this.street = clean(street);
        this.houseNumber = clean(houseNumber);
        this.city = clean(city);
        this.postcode = clean(postcode);
        this.state = clean(state);
        this.country = clean(country);
        this.countryCode = clean(countryCode);
        this.formattedAddress = clean(formattedAddress);
    }

    /**
     * Human-readable single line. Uses the vendor's own formatting when present,
     * otherwise composes "houseNumber street, postcode city, state, country".
     */
    public String getFormatted() {
        if (formattedAddress != null) {
            return formattedAddress;
        }
        List<String> parts = new ArrayList<>();
        addIfPresent(parts, join(houseNumber, street));
        addIfPresent(parts, join(postcode, city));
        addIfPresent(parts, state);
        addIfPresent(parts, country);
        return String.join(", ", parts);
    }

    public boolean isEmpty() {
        return toMap().isEmpty();
    }

    /**
     * Present fields only, keyed by field name.
     */
    public Map<String, String> toMap() {
        Map<String, String> map = new LinkedHashMap<>();
        putIfPresent(map, "street", street);
        putIfPresent(map, "houseNumber", houseNumber);
        putIfPresent(map, "city", city);
        putIfPresent(map, "postcode", postcode);
        putIfPresent(map, "state", state);
        putIfPresent(map, "country", country);
        putIfPresent(map, "countryCode", countryCode);
        putIfPresent(map, "formattedAddress", formattedAddress);
        return map;
    }

    /**
     * Structured-search query parameters for the present fields.
     */
    public Map<String, String> toQueryParams() {
        Map<String, String> params = new LinkedHashMap<>();
        putIfPresent(params, "street", street);
        putIfPresent(params, "housenumber", houseNumber);
        putIfPresent(params, "city", city);
        putIfPresent(params, "postcode", postcode);
        putIfPresent(params, "state", state);
        putIfPresent(params, "country", country);
        return params;
    }

    private static String clean(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String join(String first, String second) {
        if (first == null) {
            return second;
        }
        return second == null ? first : first + " " + second;
    }

    private static void addIfPresent(List<String> parts, String value) {
        if (value != null) {
            parts.add(value);
        }
    }

    private static void putIfPresent(Map<String, String> map, String key, String value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
