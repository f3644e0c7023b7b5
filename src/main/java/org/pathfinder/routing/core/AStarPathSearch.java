package org.pathfinder.routing.core;

import org.pathfinder.routing.graph.RoadGraph;
import org.pathfinder.routing.heuristic.GoalBoundHeuristic;
import org.pathfinder.routing.heuristic.GreatCircleHeuristicProvider;
import org.pathfinder.routing.heuristic.HeuristicProvider;
import org.pathfinder.routing.search.SearchQueue;
import org.pathfinder.routing.search.SearchState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Point-to-point A* search weighted by edge length.
 *
 * <p>Search rules:</p>
 * <ul>
 * <li>g = accumulated edge length in meters, h = heuristic estimate to the goal in meters.</li>
 * <li>Open set ordered by {@code f = g + h}, then higher g, then lower node index.</li>
 * <li>A node is settled (closed) when popped and never expanded again.</li>
 * <li>Popping the goal ends the search; an empty open set means the goal is unreachable.</li>
 * </ul>
 *
 * <p>The graph and heuristic provider are shared read-only; every call allocates its own open set,
 * closed set and predecessor table, so concurrent calls need no synchronization.</p>
 */
public final class AStarPathSearch {
    private static final Logger LOG = LoggerFactory.getLogger(AStarPathSearch.class);

    private final RoadGraph graph;
    private final HeuristicProvider heuristicProvider;
    private final SearchBudget budget;

    /**
     * Creates a search with the great-circle heuristic and default budget.
     */
    public AStarPathSearch(RoadGraph graph) {
        this(graph, new GreatCircleHeuristicProvider(graph), SearchBudget.defaults());
    }

    public AStarPathSearch(RoadGraph graph, HeuristicProvider heuristicProvider, SearchBudget budget) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.heuristicProvider = Objects.requireNonNull(heuristicProvider, "heuristicProvider");
        this.budget = Objects.requireNonNull(budget, "budget");
    }

    /**
     * Finds the shortest path between two external node ids.
     *
     * @throws RoutingException {@code INVALID_NODE} for ids outside the graph,
     *                          {@code NO_PATH_FOUND} when the goal is unreachable.
     */
    public PathResult findPath(long startNodeId, long goalNodeId) {
        return findPath(startNodeId, goalNodeId, SearchCancellation.NONE);
    }

    /**
     * Finds the shortest path between two external node ids with cooperative cancellation.
     *
     * @throws RoutingException {@code INVALID_NODE}, {@code NO_PATH_FOUND},
     *                          {@code SEARCH_CANCELLED} or {@code SEARCH_BUDGET_EXCEEDED}.
     */
    public PathResult findPath(long startNodeId, long goalNodeId, SearchCancellation cancellation) {
        int start = resolveNode(startNodeId, "start");
        int goal = resolveNode(goalNodeId, "goal");
        return findPathByIndex(start, goal, cancellation);
    }

    /**
     * Same as {@link #findPath(long, long, SearchCancellation)} over internal node indices.
     */
    public PathResult findPathByIndex(int start, int goal, SearchCancellation cancellation) {
        validateIndex(start, "start");
        validateIndex(goal, "goal");
        Objects.requireNonNull(cancellation, "cancellation");

        if (start == goal) {
            return new PathResult(new long[]{graph.nodeId(start)}, new int[]{start}, 0.0d, 0);
        }

        GoalBoundHeuristic heuristic = heuristicProvider.bindGoal(goal);
        int nodeCount = graph.nodeCount();
        SearchQueue open = new SearchQueue(nodeCount);
        boolean[] closed = new boolean[nodeCount];
        int[] predecessors = new int[nodeCount];
        Arrays.fill(predecessors, -1);

        open.insert(start, 0.0d, heuristic.estimateFromNode(start), -1);
        int expanded = 0;

        while (!open.isEmpty()) {
            if (cancellation.isCancelled()) {
                throw new RoutingException(
                        RoutingException.REASON_SEARCH_CANCELLED,
                        "search cancelled after " + expanded + " expansions"
                );
            }

            SearchState state = open.extractMin();
            int node = state.nodeIndex;
            double cost = state.cost;
            int predecessor = state.predecessor;
            open.recycle(state);

            closed[node] = true;
            predecessors[node] = predecessor;
            expanded++;
            budget.checkExpandedNodes(expanded);

            if (node == goal) {
                LOG.debug("A* settled goal {} after {} expansions, cost {} m, {} left in frontier",
                        graph.nodeId(goal), expanded, cost, open.size());
                return reconstruct(predecessors, start, goal, cost, expanded);
            }

            int end = graph.lastEdge(node);
            for (int edge = graph.firstEdge(node); edge < end; edge++) {
                int target = graph.edgeTarget(edge);
                if (closed[target]) {
                    continue;
                }
                double nextCost = cost + graph.edgeLengthMeters(edge);
                open.insert(target, nextCost, nextCost + heuristic.estimateFromNode(target), node);
            }
        }

        throw new RoutingException(
                RoutingException.REASON_NO_PATH_FOUND,
                "no path from node " + graph.nodeId(start) + " to node " + graph.nodeId(goal) +
                        " (" + expanded + " nodes expanded)"
        );
    }

    private PathResult reconstruct(int[] predecessors, int start, int goal, double cost, int expanded) {
        int length = 1;
        for (int node = goal; node != start; node = predecessors[node]) {
            length++;
        }

        int[] indices = new int[length];
        long[] ids = new long[length];
        int cursor = length - 1;
        for (int node = goal; ; node = predecessors[node]) {
            indices[cursor] = node;
            ids[cursor] = graph.nodeId(node);
            if (node == start) {
                break;
            }
            cursor--;
        }
        return new PathResult(ids, indices, cost, expanded);
    }

    private int resolveNode(long nodeId, String role) {
        if (!graph.containsNode(nodeId)) {
            throw new RoutingException(
                    RoutingException.REASON_INVALID_NODE,
                    role + " node " + nodeId + " is not part of the graph"
            );
        }
        return graph.indexOf(nodeId);
    }

    private void validateIndex(int nodeIndex, String role) {
        if (!graph.containsIndex(nodeIndex)) {
            throw new RoutingException(
                    RoutingException.REASON_INVALID_NODE,
                    role + " node index " + nodeIndex + " out of bounds [0, " + graph.nodeCount() + ")"
            );
        }
    }
}
