package org.pathfinder.routing.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-query bound on A* work.
 *
 * <p>Bound values {@code <= 0} mean unbounded. Defaults come from the
 * {@code pathfinder.search.maxExpandedNodes} system property.</p>
 */
public final class SearchBudget {
    public static final int UNBOUNDED = Integer.MAX_VALUE;
    public static final String PROP_MAX_EXPANDED_NODES = "pathfinder.search.maxExpandedNodes";

    private static final Logger LOG = LoggerFactory.getLogger(SearchBudget.class);

    private final int maxExpandedNodes;

    private SearchBudget(int maxExpandedNodes) {
        this.maxExpandedNodes = maxExpandedNodes <= 0 ? UNBOUNDED : maxExpandedNodes;
    }

    /**
     * Creates a budget with an explicit expansion bound.
     */
    public static SearchBudget of(int maxExpandedNodes) {
        return new SearchBudget(maxExpandedNodes);
    }

    public static SearchBudget unbounded() {
        return new SearchBudget(UNBOUNDED);
    }

    /**
     * Loads the bound from system properties.
     */
    public static SearchBudget defaults() {
        String raw = System.getProperty(PROP_MAX_EXPANDED_NODES);
        if (raw == null || raw.isBlank()) {
            return unbounded();
        }
        try {
            return of(Integer.parseInt(raw.trim()));
        } catch (NumberFormatException ex) {
            LOG.warn("Ignoring invalid {}='{}', search is unbounded", PROP_MAX_EXPANDED_NODES, raw);
            return unbounded();
        }
    }

    public int maxExpandedNodes() {
        return maxExpandedNodes;
    }

    /**
     * Fails fast once the number of expanded nodes passes the bound.
     */
    void checkExpandedNodes(int expandedNodes) {
        if (expandedNodes > maxExpandedNodes) {
            throw new RoutingException(
                    RoutingException.REASON_SEARCH_BUDGET_EXCEEDED,
                    "expanded-node budget exceeded: " + expandedNodes + " > " + maxExpandedNodes
            );
        }
    }
}
