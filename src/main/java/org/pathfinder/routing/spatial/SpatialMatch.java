package org.pathfinder.routing.spatial;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.pathfinder.core.geo.Coordinate;

/**
 * Immutable nearest-node match for a snapped query coordinate.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class SpatialMatch {
    /** Internal graph index of the matched node. */
    private final int nodeIndex;
    /** External id of the matched node. */
    private final long nodeId;
    private final Coordinate nodeCoordinate;
    /** Great-circle distance from the query to the matched node. */
    private final double distanceKm;
}
