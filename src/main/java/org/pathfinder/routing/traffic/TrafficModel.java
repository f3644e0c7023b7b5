package org.pathfinder.routing.traffic;

import lombok.experimental.UtilityClass;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Simulated traffic as a fixed hour-of-day lookup table.
 *
 * <p>Pure functions only: the model never reads a clock. Callers that start from an instant
 * choose the zone explicitly through {@link #hourOfDay(Instant, ZoneId)}.</p>
 */
@UtilityClass
public final class TrafficModel {

    /**
     * Applies the traffic window of {@code hourOfDay} to a base time.
     *
     * @param baseTimeMinutes non-negative base travel time.
     * @param hourOfDay hour on the 24-hour clock.
     * @throws IllegalArgumentException for negative/non-finite time or an hour outside {@code [0, 23]}.
     */
    public static TrafficAdjustment adjust(double baseTimeMinutes, int hourOfDay) {
        if (!Double.isFinite(baseTimeMinutes) || baseTimeMinutes < 0.0d) {
            throw new IllegalArgumentException("baseTimeMinutes must be finite and >= 0, got " + baseTimeMinutes);
        }
        TrafficWindow window = TrafficWindow.forHour(hourOfDay);
        long adjusted = Math.round(baseTimeMinutes * window.multiplier());
        return new TrafficAdjustment(window, window.multiplier(), adjusted);
    }

    /**
     * Local hour of an instant in the given zone.
     */
    public static int hourOfDay(Instant instant, ZoneId zoneId) {
        Objects.requireNonNull(instant, "instant");
        Objects.requireNonNull(zoneId, "zoneId");
        return instant.atZone(zoneId).getHour();
    }
}
