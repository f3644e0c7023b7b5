package org.pathfinder.routing.core;

/**
 * Public routing service contract.
 */
public interface RouterService {

    /**
     * Computes one point-to-point route.
     *
     * @param request route request.
     * @return route response; {@code reachable=false} when no route connects the endpoints.
     * @throws RoutingException for empty graphs, invalid nodes, cancellation or budget exhaustion.
     */
    RouteResponse route(RouteRequest request);
}
