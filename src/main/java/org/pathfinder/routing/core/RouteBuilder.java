package org.pathfinder.routing.core;

import org.pathfinder.core.geo.Coordinate;
import org.pathfinder.core.geo.GeoMetric;
import org.pathfinder.routing.graph.RoadGraph;

import java.util.Objects;

/**
 * Turns a node path into route geometry, distance and base travel time.
 *
 * <p>Distance is recomputed from node coordinates rather than summed from stored edge lengths,
 * so it can differ slightly from the search cost.</p>
 */
public final class RouteBuilder {
    private final RoadGraph graph;

    public RouteBuilder(RoadGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    /**
     * Builds a route from external node ids.
     *
     * @throws IllegalArgumentException when the path is empty.
     * @throws RoutingException         {@code INVALID_NODE} when an id is not in the graph.
     */
    public Route build(long[] nodePath, TravelMode travelMode) {
        Objects.requireNonNull(nodePath, "nodePath");
        int[] indices = new int[nodePath.length];
        for (int i = 0; i < nodePath.length; i++) {
            if (!graph.containsNode(nodePath[i])) {
                throw new RoutingException(
                        RoutingException.REASON_INVALID_NODE,
                        "path[" + i + "] node " + nodePath[i] + " is not part of the graph"
                );
            }
            indices[i] = graph.indexOf(nodePath[i]);
        }
        return buildFromIndices(indices, travelMode);
    }

    public Route build(PathResult path, TravelMode travelMode) {
        return buildFromIndices(path.nodeIndices(), travelMode);
    }

    Route buildFromIndices(int[] nodeIndices, TravelMode travelMode) {
        Objects.requireNonNull(travelMode, "travelMode");
        if (nodeIndices.length == 0) {
            throw new IllegalArgumentException("node path must contain at least one node");
        }

        Route.RouteBuilder route = Route.builder().travelMode(travelMode);
        double distanceKm = 0.0d;
        Coordinate previous = null;
        for (int nodeIndex : nodeIndices) {
            if (!graph.containsIndex(nodeIndex)) {
                throw new RoutingException(
                        RoutingException.REASON_INVALID_NODE,
                        "node index " + nodeIndex + " out of bounds [0, " + graph.nodeCount() + ")"
                );
            }
            Coordinate current = graph.coordinate(nodeIndex);
            if (previous != null) {
                distanceKm += GeoMetric.distanceKm(previous, current);
            }
            route.point(current);
            previous = current;
        }

        return route
                .distanceKm(distanceKm)
                .timeMinutes(travelMode.minutesFor(distanceKm))
                .build();
    }
}
