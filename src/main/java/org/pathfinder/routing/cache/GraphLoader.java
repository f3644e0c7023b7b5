package org.pathfinder.routing.cache;

import org.pathfinder.routing.graph.NetworkType;
import org.pathfinder.routing.graph.RoadGraph;

import java.io.IOException;

/**
 * Source of road graphs for a named place, e.g. a file store or a map-data download.
 */
@FunctionalInterface
public interface GraphLoader {

    /**
     * Loads the graph of one place and network type.
     *
     * @throws IOException when the graph data cannot be read.
     */
    RoadGraph load(String place, NetworkType networkType) throws IOException;
}
