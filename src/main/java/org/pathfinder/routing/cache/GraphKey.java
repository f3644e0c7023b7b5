package org.pathfinder.routing.cache;

import lombok.Value;
import lombok.experimental.Accessors;
import org.pathfinder.routing.graph.NetworkType;

import java.util.Locale;
import java.util.Objects;

/**
 * Cache key: place name plus network type. Place names compare trimmed and case-insensitively.
 */
@Value
@Accessors(fluent = true)
public class GraphKey {
    String place;
    NetworkType networkType;

    public static GraphKey of(String place, NetworkType networkType) {
        Objects.requireNonNull(place, "place");
        Objects.requireNonNull(networkType, "networkType");
        String normalized = place.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("place must be non-blank");
        }
        return new GraphKey(normalized, networkType);
    }
}
