package org.pathfinder.routing.heuristic;

/**
 * Heuristic provider contract used by the path search.
 *
 * <p>Providers are immutable and thread-safe. Binding returns an immutable goal-bound
 * estimator suitable for concurrent hot-path reads.</p>
 */
public interface HeuristicProvider {

    /**
     * Binds a concrete goal node and returns a reusable estimator.
     *
     * @param goalNodeIndex internal goal node index.
     * @return immutable estimator bound to the provided goal node.
     */
    GoalBoundHeuristic bindGoal(int goalNodeIndex);
}
