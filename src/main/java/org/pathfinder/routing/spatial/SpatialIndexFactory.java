package org.pathfinder.routing.spatial;

import lombok.experimental.UtilityClass;
import org.pathfinder.routing.graph.RoadGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses a spatial index implementation by graph size.
 *
 * <p>Graphs with at most {@code pathfinder.spatial.linearScanThreshold} nodes (default
 * {@value #DEFAULT_LINEAR_SCAN_THRESHOLD}) use {@link LinearScanSpatialIndex}; larger graphs use
 * {@link KdTreeSpatialIndex}.</p>
 */
@UtilityClass
public final class SpatialIndexFactory {
    public static final String PROP_LINEAR_SCAN_THRESHOLD = "pathfinder.spatial.linearScanThreshold";
    public static final int DEFAULT_LINEAR_SCAN_THRESHOLD = 64;

    private static final Logger LOG = LoggerFactory.getLogger(SpatialIndexFactory.class);

    public static SpatialIndex create(RoadGraph graph) {
        return create(graph, linearScanThreshold());
    }

    public static SpatialIndex create(RoadGraph graph, int linearScanThreshold) {
        if (graph.nodeCount() <= linearScanThreshold) {
            LOG.debug("Using linear scan spatial index for {} nodes", graph.nodeCount());
            return new LinearScanSpatialIndex(graph);
        }
        LOG.debug("Building KD tree spatial index for {} nodes", graph.nodeCount());
        return new KdTreeSpatialIndex(graph);
    }

    static int linearScanThreshold() {
        String raw = System.getProperty(PROP_LINEAR_SCAN_THRESHOLD);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_LINEAR_SCAN_THRESHOLD;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            LOG.warn("Ignoring invalid {}='{}', using {}", PROP_LINEAR_SCAN_THRESHOLD, raw, DEFAULT_LINEAR_SCAN_THRESHOLD);
            return DEFAULT_LINEAR_SCAN_THRESHOLD;
        }
    }
}
