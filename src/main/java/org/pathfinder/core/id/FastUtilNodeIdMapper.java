package org.pathfinder.core.id;

import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;

import java.util.Arrays;

/**
 * Node id translation layer backed by fastutil primitive maps.
 * <p>
 * Immutable and thread-safe for concurrent reads.
 * </p>
 */
public class FastUtilNodeIdMapper implements NodeIdMapper {

    // external id -> internal index
    private final Long2IntOpenHashMap forward;
    // internal index -> external id, sorted ascending
    private final long[] reverse;

    /**
     * Constructs the mapper from a set of distinct external ids.
     * Ids are sorted so internal index order matches external id order.
     */
    public FastUtilNodeIdMapper(long[] externalIds) {
        if (externalIds == null) {
            throw new IllegalArgumentException("externalIds cannot be null");
        }
        this.reverse = externalIds.clone();
        Arrays.sort(this.reverse);

        this.forward = new Long2IntOpenHashMap(reverse.length);
        this.forward.defaultReturnValue(-1); // Sentinel value

        for (int i = 0; i < reverse.length; i++) {
            if (i > 0 && reverse[i] == reverse[i - 1]) {
                throw new IllegalArgumentException("Duplicate external node id: " + reverse[i]);
            }
            forward.put(reverse[i], i);
        }
        this.forward.trim();
    }

    @Override
    public int toInternal(long externalId) throws UnknownNodeException {
        int id = forward.get(externalId);
        if (id == -1) {
            throw new UnknownNodeException("External node id not found: " + externalId);
        }
        return id;
    }

    @Override
    public long toExternal(int internalId) {
        if (!containsInternal(internalId)) {
            throw new IndexOutOfBoundsException("Internal id out of bounds: " + internalId);
        }
        return reverse[internalId];
    }

    @Override
    public boolean containsExternal(long externalId) {
        return forward.containsKey(externalId);
    }

    @Override
    public boolean containsInternal(int internalId) {
        return internalId >= 0 && internalId < reverse.length;
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
