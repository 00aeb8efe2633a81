package com.geomaps.location.domain.model;

/**
 * Display units. Canonical results always hold meters; conversion happens only
 * when a caller asks for a presentation value.
 */
public enum DistanceUnit {
    METERS("m", 1.0),
    KILOMETERS("km", 1_000.0),
    MILES("mi", 1_609.344);

    private final String symbol;
    private final double metersPerUnit;

    DistanceUnit(String symbol, double metersPerUnit) {
        this.symbol = symbol;
        this.metersPerUnit = metersPerUnit;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * NaN (unreachable) stays NaN.
     */
    public double fromMeters(double meters) {
        return meters / metersPerUnit;
    }
}
