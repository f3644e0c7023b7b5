package org.pathfinder.routing.graph;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Kind of street network a graph was extracted for.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum NetworkType {
    /** Streets open to motor vehicles. */
    DRIVE("drive"),
    /** Streets and paths open to pedestrians. */
    WALK("walk");

    /** Lower-case name used in graph file names. */
    private final String fileToken;
}
