package com.geomaps.location.domain.model;

/**
 * Closed set of travel modes understood by every caller. Each provider owns the
 * mapping from these values to its own vendor tokens.
 */
public enum TravelMode {
    DRIVING,
    WALKING,
    CYCLING,
    TRUCK
}
