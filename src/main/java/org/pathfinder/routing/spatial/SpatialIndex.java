package org.pathfinder.routing.spatial;

import org.pathfinder.core.geo.Coordinate;
import org.pathfinder.core.geo.GeoMetric;
import org.pathfinder.routing.core.RoutingException;
import org.pathfinder.routing.graph.RoadGraph;

/**
 * Nearest-node lookup bound to one immutable graph.
 *
 * <p>Implementations are immutable after construction and safe for concurrent reads.
 * The nearest node minimizes great-circle distance; equal distances resolve to the lowest
 * node id.</p>
 */
public interface SpatialIndex {

    /**
     * Graph this index was built over.
     */
    RoadGraph graph();

    /**
     * Finds the internal index of the node nearest to the given position.
     *
     * @throws RoutingException with {@link RoutingException#REASON_EMPTY_GRAPH} when the graph has no nodes.
     */
    int nearestNodeIndex(double latitude, double longitude);

    /**
     * Snaps a coordinate to its nearest graph node.
     *
     * @throws RoutingException with {@link RoutingException#REASON_EMPTY_GRAPH} when the graph has no nodes.
     */
    default SpatialMatch nearest(Coordinate coordinate) {
        int nodeIndex = nearestNodeIndex(coordinate.latitude(), coordinate.longitude());
        RoadGraph graph = graph();
        Coordinate nodeCoordinate = graph.coordinate(nodeIndex);
        return new SpatialMatch(
                nodeIndex,
                graph.nodeId(nodeIndex),
                nodeCoordinate,
                GeoMetric.distanceKm(coordinate, nodeCoordinate)
        );
    }

    /**
     * Shared empty-graph failure.
     */
    static RoutingException emptyGraph() {
        return new RoutingException(RoutingException.REASON_EMPTY_GRAPH, "graph has no nodes to snap to");
    }
}
