package org.pathfinder.routing.core;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Cooperative cancellation signal polled once per node expansion.
 */
@FunctionalInterface
public interface SearchCancellation {

    /** Never cancels. */
    SearchCancellation NONE = () -> false;

    /**
     * @return true when the search should stop.
     */
    boolean isCancelled();

    /**
     * Cancels once the clock reaches the deadline.
     */
    static SearchCancellation deadline(Clock clock, Instant deadline) {
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(deadline, "deadline");
        return () -> !clock.instant().isBefore(deadline);
    }
}
