package org.pathfinder.core.geo;

import lombok.Value;
import lombok.experimental.Accessors;

import java.util.Locale;

/**
 * Immutable geodetic coordinate in degrees.
 */
@Value
@Accessors(fluent = true)
public class Coordinate {
    double latitude;
    double longitude;

    /**
     * Creates a validated coordinate.
     *
     * @param latitude latitude in degrees, within {@code [-90, 90]}.
     * @param longitude longitude in degrees, within {@code [-180, 180]}.
     * @throws IllegalArgumentException when a component is non-finite or out of range.
     */
    public Coordinate(double latitude, double longitude) {
        if (!Double.isFinite(latitude) || latitude < -90.0d || latitude > 90.0d) {
            throw new IllegalArgumentException("latitude must be within [-90, 90], got " + latitude);
        }
        if (!Double.isFinite(longitude) || longitude < -180.0d || longitude > 180.0d) {
            throw new IllegalArgumentException("longitude must be within [-180, 180], got " + longitude);
        }
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public static Coordinate of(double latitude, double longitude) {
        return new Coordinate(latitude, longitude);
    }

    /**
     * Parses a {@code "lat,lon"} pair.
     *
     * @throws IllegalArgumentException when the text is not two comma-separated numbers.
     */
    public static Coordinate parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("coordinate text cannot be null");
        }
        String[] parts = text.split(",");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Expected 'lat,lon', got '" + text + "'");
        }
        try {
            return new Coordinate(Double.parseDouble(parts[0].trim()), Double.parseDouble(parts[1].trim()));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Expected 'lat,lon', got '" + text + "'", ex);
        }
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%.6f, %.6f", latitude, longitude);
    }
}
