package org.pathfinder.routing.core;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.pathfinder.routing.graph.NetworkType;

import java.util.Locale;

/**
 * Travel mode with its fixed reference speed.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum TravelMode {
    CAR(50.0d, NetworkType.DRIVE, 0.08d),
    WALK(5.0d, NetworkType.WALK, 0.0d),
    BIKE(15.0d, NetworkType.WALK, 0.0d);

    private static final double MINUTES_PER_HOUR = 60.0d;

    private final double referenceSpeedKmh;
    /** Network the mode's graph is loaded with. Bikes share the walking network. */
    private final NetworkType networkType;
    /** Fuel burn in litres per km; zero for modes without fuel. */
    private final double fuelLitresPerKm;

    /**
     * Unrounded travel time in minutes at the reference speed.
     */
    public double minutesFor(double distanceKm) {
        return distanceKm / referenceSpeedKmh * MINUTES_PER_HOUR;
    }

    public boolean hasFuelEstimate() {
        return fuelLitresPerKm > 0.0d;
    }

    /**
     * Case-insensitive lookup by name.
     *
     * @throws IllegalArgumentException for unknown names.
     */
    public static TravelMode parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("travel mode must be non-blank");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown travel mode '" + name + "', expected car, walk or bike", ex);
        }
    }
}
