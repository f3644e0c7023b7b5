package org.pathfinder.routing.traffic;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Result of applying a traffic window to a base travel time.
 */
@Value
@Accessors(fluent = true)
public class TrafficAdjustment {
    TrafficWindow window;
    double multiplier;
    /** {@code round(baseTime * multiplier)}. */
    long adjustedTimeMinutes;
}
