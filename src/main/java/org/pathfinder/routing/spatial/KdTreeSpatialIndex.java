package org.pathfinder.routing.spatial;

import it.unimi.dsi.fastutil.bytes.ByteArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import org.pathfinder.core.geo.GeoMetric;
import org.pathfinder.routing.graph.RoadGraph;

import java.util.Arrays;
import java.util.Objects;

/**
 * KD tree nearest-node index over unit-sphere vectors.
 * <p>
 * Node coordinates are projected to 3D unit vectors once at build time. Squared chord length
 * is a monotone function of great-circle distance, so the Euclidean nearest neighbour in this
 * space is exactly the great-circle nearest node, with no distortion near the poles or the
 * antimeridian.
 * </p>
 * <p>
 * The tree is stored as flat arrays (split axis/value, children, leaf payload spans) and queried
 * iteratively with an explicit stack. Immutable after construction and safe for concurrent reads.
 * </p>
 */
public final class KdTreeSpatialIndex implements SpatialIndex {
    static final int DEFAULT_LEAF_SIZE = 8;
    private static final int DIMENSIONS = 3;

    private final RoadGraph graph;
    private final double[] vectors;

    private final int rootIndex;
    private final double[] splitValues;
    private final int[] leftChildren;
    private final int[] rightChildren;
    private final int[] itemStartIndices;
    private final int[] itemCounts;
    private final byte[] splitAxes;
    private final byte[] leafFlags;
    private final int[] leafItems;

    public KdTreeSpatialIndex(RoadGraph graph) {
        this(graph, DEFAULT_LEAF_SIZE);
    }

    /**
     * Builds the tree.
     *
     * @param graph graph whose nodes are indexed.
     * @param leafSize maximum number of nodes per leaf.
     */
    public KdTreeSpatialIndex(RoadGraph graph, int leafSize) {
        this.graph = Objects.requireNonNull(graph, "graph");
        if (leafSize <= 0) {
            throw new IllegalArgumentException("leafSize must be positive");
        }

        int nodeCount = graph.nodeCount();
        this.vectors = new double[nodeCount * DIMENSIONS];
        for (int i = 0; i < nodeCount; i++) {
            GeoMetric.toUnitVector(graph.latitude(i), graph.longitude(i), vectors, i * DIMENSIONS);
        }

        this.leafItems = new int[nodeCount];
        for (int i = 0; i < nodeCount; i++) {
            leafItems[i] = i;
        }

        TreeAccumulator tree = new TreeAccumulator();
        this.rootIndex = nodeCount == 0 ? -1 : buildSubtree(tree, 0, nodeCount, leafSize);

        this.splitValues = tree.splitValues.toDoubleArray();
        this.leftChildren = tree.leftChildren.toIntArray();
        this.rightChildren = tree.rightChildren.toIntArray();
        this.itemStartIndices = tree.itemStartIndices.toIntArray();
        this.itemCounts = tree.itemCounts.toIntArray();
        this.splitAxes = tree.splitAxes.toByteArray();
        this.leafFlags = tree.leafFlags.toByteArray();
    }

    @Override
    public RoadGraph graph() {
        return graph;
    }

    /**
     * Number of tree nodes in the index.
     */
    public int treeNodeCount() {
        return splitValues.length;
    }

    /**
     * Finds nearest graph node index to the query position.
     * Tie-break is deterministic: lower node index (and so lower node id) wins when distances are equal.
     */
    @Override
    public int nearestNodeIndex(double latitude, double longitude) {
        validateQueryCoordinate(latitude, "latitude");
        validateQueryCoordinate(longitude, "longitude");
        if (rootIndex < 0) {
            throw SpatialIndex.emptyGraph();
        }

        double[] query = new double[DIMENSIONS];
        GeoMetric.toUnitVector(latitude, longitude, query, 0);

        int bestNode = -1;
        double bestDistanceSquared = Double.POSITIVE_INFINITY;

        int[] stack = new int[Math.max(4, Math.min(64, splitValues.length))];
        int top = 0;
        stack[top++] = rootIndex;

        while (top > 0) {
            int nodeIndex = stack[--top];

            if (leafFlags[nodeIndex] != 0) {
                int start = itemStartIndices[nodeIndex];
                int end = start + itemCounts[nodeIndex];

                for (int i = start; i < end; i++) {
                    int candidateNode = leafItems[i];
                    double distanceSquared = chordSquared(vectors, candidateNode, query);

                    if (distanceSquared < bestDistanceSquared
                            || (distanceSquared == bestDistanceSquared
                            && (bestNode < 0 || candidateNode < bestNode))) {
                        bestDistanceSquared = distanceSquared;
                        bestNode = candidateNode;
                    }
                }
                continue;
            }

            int axis = splitAxes[nodeIndex];
            double delta = query[axis] - splitValues[nodeIndex];
            double splitPlaneDistanceSquared = delta * delta;

            int nearChild = delta <= 0.0 ? leftChildren[nodeIndex] : rightChildren[nodeIndex];
            int farChild = delta <= 0.0 ? rightChildren[nodeIndex] : leftChildren[nodeIndex];

            // Equal distance still descends so lower-id ties on the far side are seen.
            if (farChild >= 0 && splitPlaneDistanceSquared <= bestDistanceSquared) {
                if (top == stack.length) {
                    stack = Arrays.copyOf(stack, stack.length << 1);
                }
                stack[top++] = farChild;
            }

            if (nearChild >= 0) {
                if (top == stack.length) {
                    stack = Arrays.copyOf(stack, stack.length << 1);
                }
                stack[top++] = nearChild;
            }
        }

        return bestNode;
    }

    @Override
    public String toString() {
        return "KdTreeSpatialIndex[treeNodes=" + splitValues.length +
                ", leafItems=" + leafItems.length + "]";
    }

    static double chordSquared(double[] vectors, int nodeIndex, double[] query) {
        int base = nodeIndex * DIMENSIONS;
        double dx = vectors[base] - query[0];
        double dy = vectors[base + 1] - query[1];
        double dz = vectors[base + 2] - query[2];
        return dx * dx + dy * dy + dz * dz;
    }

    /**
     * Builds the subtree over {@code leafItems[start, end)} and returns its tree node index.
     * Items left of the median have axis values &lt;= split, items right of it &gt;= split.
     */
    private int buildSubtree(TreeAccumulator tree, int start, int end, int leafSize) {
        int count = end - start;
        if (count <= leafSize) {
            return tree.addLeaf(start, count);
        }

        int axis = widestAxis(start, end);
        IntArrays.quickSort(leafItems, start, end, (a, b) -> {
            int cmp = Double.compare(vectors[a * DIMENSIONS + axis], vectors[b * DIMENSIONS + axis]);
            return cmp != 0 ? cmp : Integer.compare(a, b);
        });

        int mid = (start + end) >>> 1;
        double splitValue = vectors[leafItems[mid] * DIMENSIONS + axis];
        int nodeIndex = tree.addInternal(axis, splitValue);

        int left = buildSubtree(tree, start, mid, leafSize);
        int right = buildSubtree(tree, mid, end, leafSize);
        tree.leftChildren.set(nodeIndex, left);
        tree.rightChildren.set(nodeIndex, right);
        return nodeIndex;
    }

    private int widestAxis(int start, int end) {
        int bestAxis = 0;
        double bestSpread = -1.0d;
        for (int axis = 0; axis < DIMENSIONS; axis++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (int i = start; i < end; i++) {
                double value = vectors[leafItems[i] * DIMENSIONS + axis];
                min = Math.min(min, value);
                max = Math.max(max, value);
            }
            if (max - min > bestSpread) {
                bestSpread = max - min;
                bestAxis = axis;
            }
        }
        return bestAxis;
    }

    private static void validateQueryCoordinate(double value, String name) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be finite");
        }
    }

    /**
     * Growable column storage used only while building.
     */
    private static final class TreeAccumulator {
        private final DoubleArrayList splitValues = new DoubleArrayList();
        private final IntArrayList leftChildren = new IntArrayList();
        private final IntArrayList rightChildren = new IntArrayList();
        private final IntArrayList itemStartIndices = new IntArrayList();
        private final IntArrayList itemCounts = new IntArrayList();
        private final ByteArrayList splitAxes = new ByteArrayList();
        private final ByteArrayList leafFlags = new ByteArrayList();

        private int addLeaf(int itemStart, int itemCount) {
            return add(0.0d, -1, -1, itemStart, itemCount, 0, 1);
        }

        private int addInternal(int axis, double splitValue) {
            return add(splitValue, -1, -1, 0, 0, axis, 0);
        }

        private int add(double splitValue, int left, int right, int itemStart, int itemCount, int axis, int leaf) {
            splitValues.add(splitValue);
            leftChildren.add(left);
            rightChildren.add(right);
            itemStartIndices.add(itemStart);
            itemCounts.add(itemCount);
            splitAxes.add((byte) axis);
            leafFlags.add((byte) leaf);
            return splitValues.size() - 1;
        }
    }
}
