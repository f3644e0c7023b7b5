package org.pathfinder.core.id;

import lombok.experimental.StandardException;

/**
 * Bidirectional mapping contract between external node ids and internal dense integer indices.
 */
public interface NodeIdMapper {

    /**
     * Converts an external node id to an internal integer index.
     * @param externalId The client-facing node id (for example an OSM id).
     * @return The internal integer index.
     * @throws UnknownNodeException If the id is not mapped.
     */
    int toInternal(long externalId) throws UnknownNodeException;

    /**
     * Converts an internal integer index to an external node id.
     * @param internalId The internal engine index.
     * @return The client-facing node id.
     * @throws IndexOutOfBoundsException If the internal id is invalid.
     */
    long toExternal(int internalId);

    /**
     * Checks whether an external id has a mapped internal index.
     *
     * @param externalId external id to test.
     * @return true when the external id is present.
     */
    boolean containsExternal(long externalId);

    /**
     * Checks whether an internal index is within mapper bounds.
     *
     * @param internalId internal index to test.
     * @return true when the internal index is present.
     */
    boolean containsInternal(int internalId);

    /**
     * Returns number of id pairs in the mapping.
     *
     * @return total mapping size.
     */
    int size();

    /**
     * Exception thrown when an external node id cannot be found in the mapping.
     */
    @StandardException
    class UnknownNodeException extends RuntimeException {
    }

    /**
     * Creates the default immutable implementation.
     *
     * <p>Internal indices are assigned in ascending external-id order, so comparing two
     * internal indices gives the same answer as comparing their external ids.</p>
     *
     * @param externalIds distinct external ids in any order.
     * @return An immutable NodeIdMapper instance.
     */
    static NodeIdMapper createSorted(long[] externalIds) {
        return new FastUtilNodeIdMapper(externalIds);
    }
}
