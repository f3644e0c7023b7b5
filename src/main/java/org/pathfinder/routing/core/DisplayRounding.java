package org.pathfinder.routing.core;

import lombok.experimental.UtilityClass;

/**
 * Half-up rounding used for user-facing figures.
 */
@UtilityClass
final class DisplayRounding {

    static double toHundredths(double value) {
        return Math.round(value * 100.0d) / 100.0d;
    }

    static long toWhole(double value) {
        return Math.round(value);
    }
}
