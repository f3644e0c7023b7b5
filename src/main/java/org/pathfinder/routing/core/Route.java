package org.pathfinder.routing.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.pathfinder.core.geo.Coordinate;

import java.util.List;

/**
 * Route geometry and estimates for one query. Values are unrounded; use the
 * {@code rounded*} accessors for display.
 */
@Value
@Builder
public class Route {
    /** Node coordinates from start to goal, never empty. */
    @Singular("point")
    List<Coordinate> geometry;
    /** Sum of great-circle distances between consecutive points. */
    double distanceKm;
    /** Travel time at the mode's reference speed. */
    double timeMinutes;
    TravelMode travelMode;

    /**
     * Distance rounded to two decimals.
     */
    public double roundedDistanceKm() {
        return DisplayRounding.toHundredths(distanceKm);
    }

    /**
     * Time rounded to the nearest minute.
     */
    public long roundedTimeMinutes() {
        return DisplayRounding.toWhole(timeMinutes);
    }
}
