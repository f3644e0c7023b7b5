package org.pathfinder.routing.core;

import lombok.Builder;
import lombok.Value;
import org.pathfinder.core.geo.Coordinate;

/**
 * Client-facing point-to-point route request.
 *
 * <p>Endpoints are free coordinates; they are snapped to the nearest graph nodes by the
 * engine.</p>
 */
@Value
@Builder
public class RouteRequest {
    /** Route origin. */
    Coordinate start;
    /** Route destination. */
    Coordinate goal;
    /** Travel mode used for time and fuel estimates. */
    TravelMode travelMode;
    /** Hour of day (0-23) for the traffic table; when null the engine's clock and zone decide. */
    Integer hourOfDay;
    /** Optional cooperative cancellation, polled once per node expansion. */
    SearchCancellation cancellation;
}
