package com.geomaps.location.domain.model;

import com.geomaps.location.domain.exception.ValidationException;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;
import java.util.Optional;

/**
 * One geocoding match: where it is, what address it resolved to and how sure
 * the vendor is about it.
 */
@EqualsAndHashCode
@ToString
public final class GeocodingResult {

    @Getter
    private final Coordinate location;
    @Getter
    private final Address address;
    private final Double confidence;
    private final Double buildingLevelConfidence;
    private final Double streetLevelConfidence;
    private final Double cityLevelConfidence;

    @Builder
    public GeocodingResult(Coordinate location, Address address, Double confidence,
                           Double buildingLevelConfidence, Double streetLevelConfidence,
                           Double cityLevelConfidence) {
        this.location = Objects.requireNonNull(location, "location");
        this.address = address != null ? address : Address.builder().build();
        this.confidence = checkScore("confidence", confidence);
        this.buildingLevelConfidence = checkScore("buildingLevelConfidence", buildingLevelConfidence);
        this.streetLevelConfidence = checkScore("streetLevelConfidence", streetLevelConfidence);
        this.cityLevelConfidence = checkScore("cityLevelConfidence", cityLevelConfidence);
    }

    /**
     * @return overall confidence in [0, 1], empty when the vendor did not report one
     */
    public Optional<Double> getConfidence() {
        return Optional.ofNullable(confidence);
    }

    public Optional<Double> getBuildingLevelConfidence() {
        return Optional.ofNullable(buildingLevelConfidence);
    }

    public Optional<Double> getStreetLevelConfidence() {
        return Optional.ofNullable(streetLevelConfidence);
    }

    public Optional<Double> getCityLevelConfidence() {
        return Optional.ofNullable(cityLevelConfidence);
    }

    /**
     * Derived from {@link #getConfidence()} on every call, never stored.
     */
    public ConfidenceTier getConfidenceTier() {
        return ConfidenceTier.fromConfidence(confidence);
    }

    private static Double checkScore(String name, Double value) {
        if (value == null) {
            return null;
        }
        if (value.isNaN() || value < 0.0 || value > 1.0) {
            throw new ValidationException(name + " must be between 0.0 and 1.0, got " + value);
        }
        return value;
    }
}
