package org.pathfinder.routing.spatial;

import org.pathfinder.core.geo.GeoMetric;
import org.pathfinder.routing.graph.RoadGraph;

import java.util.Objects;

/**
 * Brute-force nearest-node index.
 *
 * <p>Each query is an O(n) scan over every node. Only suitable for small graphs, where building a
 * tree costs more than it saves; {@link SpatialIndexFactory} selects it below a node-count
 * threshold. Uses the same unit-sphere chord metric as {@link KdTreeSpatialIndex}, so both
 * return identical nodes.</p>
 */
public final class LinearScanSpatialIndex implements SpatialIndex {
    private final RoadGraph graph;
    private final double[] vectors;

    public LinearScanSpatialIndex(RoadGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.vectors = new double[graph.nodeCount() * 3];
        for (int i = 0; i < graph.nodeCount(); i++) {
            GeoMetric.toUnitVector(graph.latitude(i), graph.longitude(i), vectors, i * 3);
        }
    }

    @Override
    public RoadGraph graph() {
        return graph;
    }

    @Override
    public int nearestNodeIndex(double latitude, double longitude) {
        if (!Double.isFinite(latitude) || !Double.isFinite(longitude)) {
            throw new IllegalArgumentException("query coordinate must be finite");
        }
        if (graph.isEmpty()) {
            throw SpatialIndex.emptyGraph();
        }

        double[] query = new double[3];
        GeoMetric.toUnitVector(latitude, longitude, query, 0);

        int bestNode = 0;
        double bestDistanceSquared = KdTreeSpatialIndex.chordSquared(vectors, 0, query);
        // Ascending scan with strict comparison keeps the lowest index on ties.
        for (int i = 1; i < graph.nodeCount(); i++) {
            double distanceSquared = KdTreeSpatialIndex.chordSquared(vectors, i, query);
            if (distanceSquared < bestDistanceSquared) {
                bestDistanceSquared = distanceSquared;
                bestNode = i;
            }
        }
        return bestNode;
    }

    @Override
    public String toString() {
        return "LinearScanSpatialIndex[nodes=" + graph.nodeCount() + "]";
    }
}
