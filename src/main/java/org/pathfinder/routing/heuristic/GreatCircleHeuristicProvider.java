package org.pathfinder.routing.heuristic;

import org.pathfinder.core.geo.GeoMetric;
import org.pathfinder.routing.graph.RoadGraph;

import java.util.Objects;

/**
 * Great-circle heuristic provider.
 *
 * <p>Estimates remaining cost as the haversine distance in meters between a node and the goal,
 * multiplied by {@link RoadGraph#greatCircleScale()}. The scale is the lowest length-to-straight-line
 * ratio of any edge, so {@code scale * d(u, v) <= w(u, v)} holds on every edge. With the triangle
 * inequality of the haversine metric this keeps the estimate admissible and consistent even when
 * stored lengths are shorter than the straight line between their endpoints.</p>
 */
public final class GreatCircleHeuristicProvider implements HeuristicProvider {
    private final RoadGraph graph;

    public GreatCircleHeuristicProvider(RoadGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    /**
     * Binds this provider to one target node and returns a reusable estimator.
     *
     * @param goalNodeIndex target node index in internal graph space.
     * @return goal-bound heuristic estimator.
     */
    @Override
    public GoalBoundHeuristic bindGoal(int goalNodeIndex) {
        if (!graph.containsIndex(goalNodeIndex)) {
            throw new IllegalArgumentException(
                    "goalNodeIndex out of bounds: " + goalNodeIndex + " [0, " + graph.nodeCount() + ")"
            );
        }
        return new BoundGreatCircleHeuristic(
                graph,
                graph.latitude(goalNodeIndex),
                graph.longitude(goalNodeIndex),
                graph.greatCircleScale()
        );
    }

    private static final class BoundGreatCircleHeuristic implements GoalBoundHeuristic {
        private final RoadGraph graph;
        private final double goalLatDeg;
        private final double goalLonDeg;
        private final double scale;

        private BoundGreatCircleHeuristic(RoadGraph graph, double goalLatDeg, double goalLonDeg, double scale) {
            this.graph = graph;
            this.goalLatDeg = goalLatDeg;
            this.goalLonDeg = goalLonDeg;
            this.scale = scale;
        }

        @Override
        public double estimateFromNode(int nodeIndex) {
            if (!graph.containsIndex(nodeIndex)) {
                throw new IllegalArgumentException(
                        "nodeIndex out of bounds: " + nodeIndex + " [0, " + graph.nodeCount() + ")"
                );
            }
            return scale * GeoMetric.distanceMeters(
                    graph.latitude(nodeIndex),
                    graph.longitude(nodeIndex),
                    goalLatDeg,
                    goalLonDeg
            );
        }
    }
}
