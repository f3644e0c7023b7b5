package org.pathfinder.routing.traffic;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Arrays;

/**
 * Time-of-day traffic category and its delay multiplier.
 */
@Getter
@Accessors(fluent = true)
public enum TrafficWindow {
    HEAVY("Heavy", 1.5d, 7, 8, 9, 16, 17, 18),
    MODERATE("Moderate", 1.2d, 10, 11, 14, 15, 19, 20),
    LIGHT("Light", 1.0d);

    private static final TrafficWindow[] BY_HOUR = new TrafficWindow[24];

    static {
        Arrays.fill(BY_HOUR, LIGHT);
        for (TrafficWindow window : values()) {
            for (int hour : window.hours) {
                BY_HOUR[hour] = window;
            }
        }
    }

    private final String label;
    private final double multiplier;
    @Getter(AccessLevel.NONE)
    private final int[] hours;

    TrafficWindow(String label, double multiplier, int... hours) {
        this.label = label;
        this.multiplier = multiplier;
        this.hours = hours;
    }

    /**
     * Returns the window an hour of the 24-hour clock falls into.
     *
     * @throws IllegalArgumentException when the hour is outside {@code [0, 23]}.
     */
    public static TrafficWindow forHour(int hourOfDay) {
        if (hourOfDay < 0 || hourOfDay > 23) {
            throw new IllegalArgumentException("hourOfDay must be within [0, 23], got " + hourOfDay);
        }
        return BY_HOUR[hourOfDay];
    }
}
