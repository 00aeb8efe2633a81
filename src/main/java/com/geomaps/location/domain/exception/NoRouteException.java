package com.geomaps.location.domain.exception;

import com.geomaps.location.domain.model.Coordinate;
import lombok.Getter;

/**
 * The vendor answered normally but reported that no route exists between the
 * two points. A legitimate outcome rather than a transport failure.
 */
@Getter
public class NoRouteException extends ApiException {

    private final Coordinate source;
    private final Coordinate target;

    public NoRouteException(Coordinate source, Coordinate target) {
        super("No route found between " + source + " and " + target);
        this.source = source;
        this.target = target;
    }
}
