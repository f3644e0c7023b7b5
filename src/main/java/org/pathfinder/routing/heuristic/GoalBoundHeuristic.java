package org.pathfinder.routing.heuristic;

/**
 * Remaining-distance estimate toward one fixed goal node.
 *
 * <p>Called once per relaxed edge, so implementations keep the goal's coordinates in fields
 * and allocate nothing per call.</p>
 */
@FunctionalInterface
public interface GoalBoundHeuristic {

    /**
     * @param nodeIndex internal index of the node being relaxed.
     * @return meters to the goal, never more than the true network distance.
     */
    double estimateFromNode(int nodeIndex);
}
