package org.pathfinder.routing.cache;

import org.pathfinder.routing.core.RoutingException;
import org.pathfinder.routing.graph.NetworkType;
import org.pathfinder.routing.graph.RoadGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Explicit cache of loaded road graphs keyed by place and network type.
 *
 * <p>Each key is loaded at most once while cached; concurrent callers asking for the same key
 * wait for the single load. Failed loads are not cached. Entries live until
 * {@link #invalidate(String, NetworkType)} or {@link #invalidateAll()}.</p>
 */
public final class GraphCache {
    private static final Logger LOG = LoggerFactory.getLogger(GraphCache.class);

    private final GraphLoader loader;
    private final ConcurrentMap<GraphKey, RoadGraph> graphs = new ConcurrentHashMap<>();

    public GraphCache(GraphLoader loader) {
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    /**
     * Returns the cached graph or loads it. The loader receives the place as the caller spelled
     * it (trimmed); only the cache key is case-folded.
     *
     * @throws RoutingException {@code GRAPH_LOAD_FAILED} when the loader fails.
     */
    public RoadGraph getOrLoad(String place, NetworkType networkType) {
        GraphKey key = GraphKey.of(place, networkType);
        try {
            return graphs.computeIfAbsent(key, k -> load(k, place.trim()));
        } catch (UncheckedIOException ex) {
            throw new RoutingException(
                    RoutingException.REASON_GRAPH_LOAD_FAILED,
                    "failed to load " + networkType.fileToken() + " graph for '" + place + "'",
                    ex.getCause()
            );
        }
    }

    public boolean contains(String place, NetworkType networkType) {
        return graphs.containsKey(GraphKey.of(place, networkType));
    }

    /**
     * Drops one entry.
     *
     * @return true when an entry was removed.
     */
    public boolean invalidate(String place, NetworkType networkType) {
        boolean removed = graphs.remove(GraphKey.of(place, networkType)) != null;
        if (removed) {
            LOG.info("Invalidated {} graph for '{}'", networkType.fileToken(), place);
        }
        return removed;
    }

    public void invalidateAll() {
        int size = graphs.size();
        graphs.clear();
        LOG.info("Invalidated {} cached graphs", size);
    }

    public int size() {
        return graphs.size();
    }

    private RoadGraph load(GraphKey key, String requestedPlace) {
        long startNanos = System.nanoTime();
        try {
            RoadGraph graph = Objects.requireNonNull(
                    loader.load(requestedPlace, key.networkType()),
                    "loader returned null graph");
            LOG.info("Loaded {} graph for '{}' ({} nodes, {} edges) in {} ms",
                    key.networkType().fileToken(), requestedPlace, graph.nodeCount(), graph.edgeCount(),
                    (System.nanoTime() - startNanos) / 1_000_000L);
            return graph;
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
