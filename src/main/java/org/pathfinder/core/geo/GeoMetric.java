package org.pathfinder.core.geo;

import lombok.experimental.UtilityClass;

/**
 * Great-circle distance helpers shared by edge weighting, the A* heuristic and route totals.
 *
 * <p>All distances use the haversine formulation on a sphere of mean Earth radius, which makes
 * the metric symmetric and a true metric (triangle inequality holds).</p>
 */
@UtilityClass
public final class GeoMetric {
    public static final double EARTH_MEAN_RADIUS_KM = 6_371.0088d;
    public static final double METERS_PER_KM = 1_000.0d;

    /**
     * Computes great-circle distance in kilometers.
     */
    public static double distanceKm(Coordinate a, Coordinate b) {
        return distanceKm(a.latitude(), a.longitude(), b.latitude(), b.longitude());
    }

    /**
     * Computes great-circle distance in kilometers from raw degree values.
     */
    public static double distanceKm(double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
        double lat1Rad = Math.toRadians(lat1Deg);
        double lat2Rad = Math.toRadians(lat2Deg);
        double deltaLatRad = Math.toRadians(lat2Deg - lat1Deg);
        double deltaLonRad = Math.toRadians(normalizeDeltaLongitudeDegrees(lon2Deg - lon1Deg));

        double sinHalfLat = Math.sin(deltaLatRad * 0.5d);
        double sinHalfLon = Math.sin(deltaLonRad * 0.5d);

        double a = sinHalfLat * sinHalfLat
                + Math.cos(lat1Rad) * Math.cos(lat2Rad) * sinHalfLon * sinHalfLon;
        double clampedA = clamp(a, 0.0d, 1.0d);
        double c = 2.0d * Math.asin(Math.sqrt(clampedA));
        return EARTH_MEAN_RADIUS_KM * c;
    }

    /**
     * Computes great-circle distance in meters, the unit of stored edge lengths.
     */
    public static double distanceMeters(double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
        return distanceKm(lat1Deg, lon1Deg, lat2Deg, lon2Deg) * METERS_PER_KM;
    }

    /**
     * Projects a coordinate onto the unit sphere.
     *
     * <p>Squared chord length between two unit vectors is {@code 2 - 2cos(c)} for central angle
     * {@code c}, so ordering by chord length is the same as ordering by great-circle distance.</p>
     *
     * @param target array of length at least {@code offset + 3} receiving x, y, z.
     */
    public static void toUnitVector(double latDeg, double lonDeg, double[] target, int offset) {
        double latRad = Math.toRadians(latDeg);
        double lonRad = Math.toRadians(lonDeg);
        double cosLat = Math.cos(latRad);
        target[offset] = cosLat * Math.cos(lonRad);
        target[offset + 1] = cosLat * Math.sin(lonRad);
        target[offset + 2] = Math.sin(latRad);
    }

    /**
     * Normalizes delta-longitude into the principal range {@code (-180, 180]}.
     */
    static double normalizeDeltaLongitudeDegrees(double deltaLonDeg) {
        if (deltaLonDeg > -180.0d && deltaLonDeg <= 180.0d) {
            return deltaLonDeg;
        }
        double normalized = ((deltaLonDeg + 540.0d) % 360.0d) - 180.0d;
        if (normalized == -180.0d) {
            return 180.0d;
        }
        return normalized;
    }

    private static double clamp(double value, double min, double max) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }
}
