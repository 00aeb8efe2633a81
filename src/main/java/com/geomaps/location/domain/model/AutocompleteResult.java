package com.geomaps.location.domain.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;
import java.util.Optional;

/**
 * A suggestion for a partially typed address, with its position in the
 * vendor's ranking. Vendors do not always return a point for suggestions.
 */
@EqualsAndHashCode
@ToString
public final class AutocompleteResult {

    @Getter
    private final Address address;
    @Getter
    private final int rank;
    private final Coordinate location;
    private final Double confidence;
    private final String matchType;

    @Builder
    public AutocompleteResult(Address address, int rank, Coordinate location, Double confidence, String matchType) {
        this.address = Objects.requireNonNull(address, "address");
        this.rank = rank;
        this.location = location;
        this.confidence = confidence;
        this.matchType = matchType;
    }

    public Optional<Coordinate> getLocation() {
        return Optional.ofNullable(location);
    }

    public Optional<Double> getConfidence() {
        return Optional.ofNullable(confidence);
    }

    public Optional<String> getMatchType() {
        return Optional.ofNullable(matchType);
    }
}
