package org.pathfinder.routing.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Routing failure with a deterministic reason code.
 *
 * <p>Messages are prefixed with the reason code, e.g. {@code [NO_PATH_FOUND] ...}.</p>
 */
@Getter
@Accessors(fluent = true)
public final class RoutingException extends RuntimeException {
    /** The graph has no nodes to snap a coordinate to. */
    public static final String REASON_EMPTY_GRAPH = "EMPTY_GRAPH";
    /** A node id outside the graph reached the search or route builder. */
    public static final String REASON_INVALID_NODE = "INVALID_NODE";
    /** The goal is unreachable from the start. Expected, recoverable outcome. */
    public static final String REASON_NO_PATH_FOUND = "NO_PATH_FOUND";
    /** The caller's cancellation signal fired between node expansions. */
    public static final String REASON_SEARCH_CANCELLED = "SEARCH_CANCELLED";
    /** The configured expansion budget was exhausted before the goal was settled. */
    public static final String REASON_SEARCH_BUDGET_EXCEEDED = "SEARCH_BUDGET_EXCEEDED";
    /** A graph loader failed while populating the graph cache. */
    public static final String REASON_GRAPH_LOAD_FAILED = "GRAPH_LOAD_FAILED";

    private final String reasonCode;

    /**
     * Creates a reason-coded routing failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public RoutingException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded routing failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public RoutingException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Returns whether this failure only means "no route available".
     */
    public boolean isNoPathFound() {
        return REASON_NO_PATH_FOUND.equals(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
