package org.pathfinder.routing.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Arrays;

/**
 * Successful A* outcome: the node sequence from start to goal and its network cost.
 */
@Getter
@Accessors(fluent = true)
public final class PathResult {
    private final long[] nodeIds;
    private final int[] nodeIndices;
    /** Sum of traversed edge lengths (the goal's g-score), in meters. */
    private final double costMeters;
    /** Number of nodes settled by the search. */
    private final int expandedNodes;

    PathResult(long[] nodeIds, int[] nodeIndices, double costMeters, int expandedNodes) {
        if (nodeIds.length == 0 || nodeIds.length != nodeIndices.length) {
            throw new IllegalArgumentException("path must be non-empty with matching id/index lengths");
        }
        this.nodeIds = nodeIds;
        this.nodeIndices = nodeIndices;
        this.costMeters = costMeters;
        this.expandedNodes = expandedNodes;
    }

    public long[] nodeIds() {
        return nodeIds.clone();
    }

    public int[] nodeIndices() {
        return nodeIndices.clone();
    }

    public int length() {
        return nodeIds.length;
    }

    public long startNodeId() {
        return nodeIds[0];
    }

    public long goalNodeId() {
        return nodeIds[nodeIds.length - 1];
    }

    @Override
    public String toString() {
        return "PathResult{nodes=" + Arrays.toString(nodeIds) +
                ", costMeters=" + costMeters +
                ", expanded=" + expandedNodes + '}';
    }
}
