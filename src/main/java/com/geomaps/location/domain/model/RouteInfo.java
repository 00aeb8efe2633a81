package com.geomaps.location.domain.model;

import com.geomaps.location.domain.exception.ValidationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Distance and travel time of a single route.
 * Meters and seconds are the stored values; kilometers and minutes are always
 * computed from them.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class RouteInfo {

    private final double distanceMeters;
    private final double durationSeconds;

    public RouteInfo(double distanceMeters, double durationSeconds) {
        if (!Double.isFinite(distanceMeters) || distanceMeters < 0) {
            throw new ValidationException("Route distance must be a non-negative number of meters, got " + distanceMeters);
        }
        if (!Double.isFinite(durationSeconds) || durationSeconds < 0) {
            throw new ValidationException("Route duration must be a non-negative number of seconds, got " + durationSeconds);
        }
        this.distanceMeters = distanceMeters;
        this.durationSeconds = durationSeconds;
    }

    public double getDistanceKilometers() {
        return distanceMeters / 1000.0;
    }

    public double getDurationMinutes() {
        return durationSeconds / 60.0;
    }

    public double distanceIn(DistanceUnit unit) {
        return unit.fromMeters(distanceMeters);
    }
}
