package org.pathfinder.routing.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.pathfinder.core.geo.Coordinate;
import org.pathfinder.routing.traffic.TrafficWindow;

import java.util.List;

/**
 * Client-facing point-to-point route response.
 *
 * <p>When {@code reachable=false}, path, geometry and estimates are empty/zero and
 * {@code failureReason} holds the reason code.</p>
 */
@Value
@Builder
public class RouteResponse {
    /** Whether a path was found from start to goal. */
    boolean reachable;
    /** Reason code when unreachable, otherwise null. */
    String failureReason;
    TravelMode travelMode;
    /** Requested endpoints, echoed for reporting. */
    Coordinate requestedStart;
    Coordinate requestedGoal;
    /** Node the start coordinate snapped to. */
    long startNodeId;
    /** Node the goal coordinate snapped to. */
    long goalNodeId;
    /** Path in external node ids from start to goal. */
    @Singular("pathNode")
    List<Long> pathNodeIds;
    /** Route geometry from start to goal. */
    @Singular("point")
    List<Coordinate> geometry;
    /** Network cost minimized by the search, in meters. */
    double networkCostMeters;
    /** Unrounded great-circle route length. */
    double distanceKm;
    /** Route length rounded to two decimals. */
    double displayDistanceKm;
    /** Unrounded base time at the mode's reference speed. */
    double baseTimeMinutes;
    /** Base time rounded to the nearest minute. */
    long displayTimeMinutes;
    TrafficWindow trafficWindow;
    double trafficMultiplier;
    /** Rounded base time scaled by the traffic multiplier. */
    long adjustedTimeMinutes;
    /** Fuel estimate in litres for modes that burn fuel, otherwise null. */
    Double estimatedFuelLitres;
    /** Number of nodes settled by the search. */
    int expandedNodes;
}
