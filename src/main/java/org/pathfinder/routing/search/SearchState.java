package org.pathfinder.routing.search;

/**
 * Mutable frontier entry of the A* search.
 * <p>
 * <strong>Design Pattern: Object Pooling</strong><br>
 * Instances are pre-allocated and reused by {@link SearchQueue}, so the search loop does not
 * allocate per relaxation.
 * </p>
 */
public class SearchState implements Comparable<SearchState> {

    /** Internal index of the graph node this entry reaches. */
    public int nodeIndex;

    /** Accumulated edge length from the start, in meters (g-score). */
    public double cost;

    /** Priority: cost plus heuristic estimate to the goal (f-score). */
    public double priority;

    /** Node index of the predecessor on the best known path, or -1 at the start. */
    public int predecessor;

    /**
     * Intended for pre-allocation within an object pool.
     */
    public SearchState() {
        // Default constructor for pooling
    }

    /**
     * Re-initializes the state with new values.
     */
    public void set(int nodeIndex, double cost, double priority, int predecessor) {
        this.nodeIndex = nodeIndex;
        this.cost = cost;
        this.priority = priority;
        this.predecessor = predecessor;
    }

    /**
     * Ordering used by the frontier.
     * <ol>
     * <li><strong>Primary:</strong> priority {@code f = g + h} (lower first).</li>
     * <li><strong>Secondary:</strong> cost {@code g} (higher first, deeper nodes are closer to the goal).</li>
     * <li><strong>Tertiary:</strong> node index (lower first, matches lowest node id).</li>
     * </ol>
     */
    @Override
    public int compareTo(SearchState other) {
        int priorityCompare = Double.compare(this.priority, other.priority);
        if (priorityCompare != 0) {
            return priorityCompare;
        }
        int costCompare = Double.compare(other.cost, this.cost);
        if (costCompare != 0) {
            return costCompare;
        }
        return Integer.compare(this.nodeIndex, other.nodeIndex);
    }

    @Override
    public String toString() {
        return "SearchState{" +
                "node=" + nodeIndex +
                ", g=" + cost +
                ", f=" + priority +
                ", pred=" + predecessor +
                '}';
    }
}
