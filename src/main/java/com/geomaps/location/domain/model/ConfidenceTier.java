package com.geomaps.location.domain.model;

/**
 * Coarse precision class derived from a geocoding confidence score.
 * Declared from coarsest to finest; {@link #isFinerThan} relies on that order.
 *
 * Thresholds are fixed for every provider:
 * BUILDING >= 0.9, STREET >= 0.7, CITY >= 0.4, REGION below 0.4.
 */
public enum ConfidenceTier {
    UNKNOWN,
    REGION,
    CITY,
    STREET,
    BUILDING;

    static final double BUILDING_THRESHOLD = 0.9;
    static final double STREET_THRESHOLD = 0.7;
    static final double CITY_THRESHOLD = 0.4;

    public static ConfidenceTier fromConfidence(Double confidence) {
        if (confidence == null || confidence.isNaN()) {
            return UNKNOWN;
        }
        if (confidence >= BUILDING_THRESHOLD) {
            return BUILDING;
        }
        if (confidence >= STREET_THRESHOLD) {
            return STREET;
        }
        if (confidence >= CITY_THRESHOLD) {
            return CITY;
        }
        return REGION;
    }

    public boolean isFinerThan(ConfidenceTier other) {
        return ordinal() > other.ordinal();
    }
}
