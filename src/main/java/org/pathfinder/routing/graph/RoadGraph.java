package org.pathfinder.routing.graph;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.pathfinder.core.geo.Coordinate;
import org.pathfinder.core.geo.GeoMetric;
import org.pathfinder.core.id.NodeIdMapper;

/**
 * Immutable node-based road graph in CSR (Compressed Sparse Row) layout.
 * <p>
 * Nodes carry geodetic coordinates and an external id. Edges are directed and carry a length in
 * meters; undirected connections are stored as two directed edges.
 * <p>
 * Features:
 * - SoA (Structure of Arrays) layout for cache locality.
 * - O(1) neighbor range lookup per node.
 * - Internal node indices follow ascending external id order, so index comparisons double as
 *   deterministic "lowest node id" tie-breaks.
 * <p>
 * The graph is read-only after {@link Builder#build()} and safe for concurrent readers.
 */
public final class RoadGraph {

    // ========================================================================
    // DATA BUFFERS (SoA Layout)
    // ========================================================================

    // CSR Index: firstEdge[node] -> start index in edge arrays, firstEdge[nodeCount] == edgeCount
    private final int[] firstEdge;
    private final int[] edgeTarget;
    private final double[] edgeLengthMeters;

    private final double[] latitudes;
    private final double[] longitudes;

    private final NodeIdMapper nodeIdMapper;

    @Getter
    @Accessors(fluent = true)
    private final int nodeCount;
    @Getter
    @Accessors(fluent = true)
    private final int edgeCount;
    /**
     * Lowest ratio of stored length to great-circle length over all edges, capped at 1.
     * Scaling great-circle estimates by this factor keeps them below every edge's length.
     */
    @Getter
    @Accessors(fluent = true)
    private final double greatCircleScale;

    private RoadGraph(
            NodeIdMapper nodeIdMapper,
            double[] latitudes,
            double[] longitudes,
            int[] firstEdge,
            int[] edgeTarget,
            double[] edgeLengthMeters,
            double greatCircleScale
    ) {
        this.nodeIdMapper = nodeIdMapper;
        this.latitudes = latitudes;
        this.longitudes = longitudes;
        this.firstEdge = firstEdge;
        this.edgeTarget = edgeTarget;
        this.edgeLengthMeters = edgeLengthMeters;
        this.nodeCount = latitudes.length;
        this.edgeCount = edgeTarget.length;
        this.greatCircleScale = greatCircleScale;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // NODE ACCESS
    // ========================================================================

    public boolean isEmpty() {
        return nodeCount == 0;
    }

    /**
     * UNCHECKED - caller must ensure nodeIndex is valid.
     */
    public double latitude(int nodeIndex) {
        assert nodeIndex >= 0 && nodeIndex < nodeCount : "Node " + nodeIndex + " out of bounds";
        return latitudes[nodeIndex];
    }

    public double longitude(int nodeIndex) {
        assert nodeIndex >= 0 && nodeIndex < nodeCount : "Node " + nodeIndex + " out of bounds";
        return longitudes[nodeIndex];
    }

    public Coordinate coordinate(int nodeIndex) {
        validateNodeIndex(nodeIndex);
        return new Coordinate(latitudes[nodeIndex], longitudes[nodeIndex]);
    }

    /**
     * Returns the external id of an internal node index.
     */
    public long nodeId(int nodeIndex) {
        return nodeIdMapper.toExternal(nodeIndex);
    }

    /**
     * Resolves an external node id to its internal index.
     *
     * @throws NodeIdMapper.UnknownNodeException when the id is not part of this graph.
     */
    public int indexOf(long nodeId) {
        return nodeIdMapper.toInternal(nodeId);
    }

    public boolean containsNode(long nodeId) {
        return nodeIdMapper.containsExternal(nodeId);
    }

    public boolean containsIndex(int nodeIndex) {
        return nodeIndex >= 0 && nodeIndex < nodeCount;
    }

    // ========================================================================
    // EDGE ACCESS (CSR)
    // ========================================================================

    /**
     * First outgoing edge index of a node (inclusive).
     */
    public int firstEdge(int nodeIndex) {
        assert nodeIndex >= 0 && nodeIndex < nodeCount;
        return firstEdge[nodeIndex];
    }

    /**
     * End of the outgoing edge range of a node (exclusive).
     */
    public int lastEdge(int nodeIndex) {
        assert nodeIndex >= 0 && nodeIndex < nodeCount;
        return firstEdge[nodeIndex + 1];
    }

    public int outDegree(int nodeIndex) {
        validateNodeIndex(nodeIndex);
        return firstEdge[nodeIndex + 1] - firstEdge[nodeIndex];
    }

    public int edgeTarget(int edgeIndex) {
        assert edgeIndex >= 0 && edgeIndex < edgeCount : "Edge " + edgeIndex + " out of bounds";
        return edgeTarget[edgeIndex];
    }

    public double edgeLengthMeters(int edgeIndex) {
        assert edgeIndex >= 0 && edgeIndex < edgeCount;
        return edgeLengthMeters[edgeIndex];
    }

    private void validateNodeIndex(int nodeIndex) {
        if (nodeIndex < 0 || nodeIndex >= nodeCount) {
            throw new IndexOutOfBoundsException(
                    "node index out of bounds: " + nodeIndex + " [0, " + nodeCount + ")");
        }
    }

    @Override
    public String toString() {
        return "RoadGraph[nodes=" + nodeCount + ", edges=" + edgeCount + "]";
    }

    /**
     * Mutable collector for nodes and edges. Not thread-safe.
     */
    public static final class Builder {
        private final LongArrayList nodeIds = new LongArrayList();
        private final DoubleArrayList nodeLatitudes = new DoubleArrayList();
        private final DoubleArrayList nodeLongitudes = new DoubleArrayList();

        private final LongArrayList edgeSources = new LongArrayList();
        private final LongArrayList edgeTargets = new LongArrayList();
        private final DoubleArrayList edgeLengths = new DoubleArrayList();

        private Builder() {
        }

        /**
         * Adds one node. Coordinates are validated eagerly.
         */
        public Builder addNode(long id, double latitude, double longitude) {
            Coordinate validated = new Coordinate(latitude, longitude);
            nodeIds.add(id);
            nodeLatitudes.add(validated.latitude());
            nodeLongitudes.add(validated.longitude());
            return this;
        }

        public Builder addNode(long id, Coordinate coordinate) {
            return addNode(id, coordinate.latitude(), coordinate.longitude());
        }

        /**
         * Adds one directed edge. Endpoint existence is checked at {@link #build()}.
         */
        public Builder addEdge(long sourceId, long targetId, double lengthMeters) {
            if (!Double.isFinite(lengthMeters) || lengthMeters < 0.0d) {
                throw new IllegalArgumentException(
                        "edge " + sourceId + "->" + targetId + " length must be finite and >= 0, got " + lengthMeters);
            }
            edgeSources.add(sourceId);
            edgeTargets.add(targetId);
            edgeLengths.add(lengthMeters);
            return this;
        }

        /**
         * Adds the edge in both directions.
         */
        public Builder addUndirectedEdge(long firstId, long secondId, double lengthMeters) {
            addEdge(firstId, secondId, lengthMeters);
            return addEdge(secondId, firstId, lengthMeters);
        }

        /**
         * Freezes the collected topology.
         *
         * @throws IllegalArgumentException on duplicate node ids or edges referencing unknown nodes.
         */
        public RoadGraph build() {
            int nodeCount = nodeIds.size();
            NodeIdMapper mapper = NodeIdMapper.createSorted(nodeIds.toLongArray());

            double[] latitudes = new double[nodeCount];
            double[] longitudes = new double[nodeCount];
            for (int i = 0; i < nodeCount; i++) {
                int index = mapper.toInternal(nodeIds.getLong(i));
                latitudes[index] = nodeLatitudes.getDouble(i);
                longitudes[index] = nodeLongitudes.getDouble(i);
            }

            int edgeCount = edgeSources.size();
            int[] sources = new int[edgeCount];
            int[] targets = new int[edgeCount];
            int[] firstEdge = new int[nodeCount + 1];
            for (int e = 0; e < edgeCount; e++) {
                sources[e] = resolveEndpoint(mapper, edgeSources.getLong(e), e, "source");
                targets[e] = resolveEndpoint(mapper, edgeTargets.getLong(e), e, "target");
                firstEdge[sources[e] + 1]++;
            }
            for (int i = 0; i < nodeCount; i++) {
                firstEdge[i + 1] += firstEdge[i];
            }

            // Stable counting sort keeps insertion order within each node's range.
            int[] cursor = new int[nodeCount];
            System.arraycopy(firstEdge, 0, cursor, 0, nodeCount);
            int[] edgeTarget = new int[edgeCount];
            double[] edgeLengthMeters = new double[edgeCount];
            double greatCircleScale = 1.0d;
            for (int e = 0; e < edgeCount; e++) {
                int slot = cursor[sources[e]]++;
                edgeTarget[slot] = targets[e];
                edgeLengthMeters[slot] = edgeLengths.getDouble(e);

                double straightMeters = GeoMetric.distanceMeters(
                        latitudes[sources[e]], longitudes[sources[e]],
                        latitudes[targets[e]], longitudes[targets[e]]);
                if (straightMeters > 0.0d) {
                    greatCircleScale = Math.min(greatCircleScale, edgeLengthMeters[slot] / straightMeters);
                }
            }

            return new RoadGraph(
                    mapper, latitudes, longitudes, firstEdge, edgeTarget, edgeLengthMeters, greatCircleScale);
        }

        private static int resolveEndpoint(NodeIdMapper mapper, long nodeId, int edgeOrdinal, String field) {
            if (!mapper.containsExternal(nodeId)) {
                throw new IllegalArgumentException(
                        "edge[" + edgeOrdinal + "]." + field + " references unknown node " + nodeId);
            }
            return mapper.toInternal(nodeId);
        }
    }
}
