package org.pathfinder.routing.search;

import lombok.experimental.StandardException;

/**
 * Raised by {@link SearchQueue#extractMin()} when the frontier holds no states.
 */
@StandardException
public class EmptyQueueException extends IllegalStateException {
}
