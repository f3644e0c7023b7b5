package org.pathfinder.routing.core;

import lombok.Builder;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.pathfinder.routing.graph.RoadGraph;
import org.pathfinder.routing.heuristic.GreatCircleHeuristicProvider;
import org.pathfinder.routing.heuristic.HeuristicProvider;
import org.pathfinder.routing.spatial.SpatialIndex;
import org.pathfinder.routing.spatial.SpatialIndexFactory;
import org.pathfinder.routing.spatial.SpatialMatch;
import org.pathfinder.routing.traffic.TrafficAdjustment;
import org.pathfinder.routing.traffic.TrafficModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Main routing entry point for one loaded graph.
 *
 * <p>Execution flow per request:</p>
 * <ul>
 * <li>Snap start and goal coordinates to their nearest graph nodes.</li>
 * <li>Run A* between the snapped nodes.</li>
 * <li>Build route geometry, distance and base time for the travel mode.</li>
 * <li>Scale the rounded base time by the traffic window of the query hour.</li>
 * </ul>
 *
 * <p>An unreachable goal yields {@code reachable=false}; every other failure surfaces as a
 * {@link RoutingException}. The engine holds only immutable state and serves concurrent
 * requests.</p>
 */
public final class RouteEngine implements RouterService {
    private static final Logger LOG = LoggerFactory.getLogger(RouteEngine.class);

    public static final String REASON_ROUTE_REQUEST_REQUIRED = "ROUTE_REQUEST_REQUIRED";
    public static final String REASON_START_REQUIRED = "START_REQUIRED";
    public static final String REASON_GOAL_REQUIRED = "GOAL_REQUIRED";
    public static final String REASON_TRAVEL_MODE_REQUIRED = "TRAVEL_MODE_REQUIRED";

    @Getter
    @Accessors(fluent = true)
    private final RoadGraph graph;
    @Getter
    @Accessors(fluent = true)
    private final SpatialIndex spatialIndex;
    private final AStarPathSearch pathSearch;
    private final RouteBuilder routeBuilder;
    private final Clock clock;
    private final ZoneId zoneId;

    /**
     * Creates an engine. Only {@code graph} is required.
     *
     * @param graph road graph to route over.
     * @param spatialIndex optional snapping index; defaults to {@link SpatialIndexFactory#create(RoadGraph)}.
     * @param heuristicProvider optional heuristic; defaults to great-circle distance.
     * @param searchBudget optional search budget; defaults to {@link SearchBudget#defaults()}.
     * @param clock optional clock used when a request has no hour; defaults to the system clock.
     * @param zoneId optional zone for that hour; defaults to the clock's zone.
     */
    @Builder
    public RouteEngine(
            RoadGraph graph,
            SpatialIndex spatialIndex,
            HeuristicProvider heuristicProvider,
            SearchBudget searchBudget,
            Clock clock,
            ZoneId zoneId
    ) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.spatialIndex = spatialIndex == null ? SpatialIndexFactory.create(graph) : spatialIndex;
        if (this.spatialIndex.graph() != graph) {
            throw new IllegalArgumentException("spatialIndex must be built over the same graph");
        }
        this.pathSearch = new AStarPathSearch(
                graph,
                heuristicProvider == null ? new GreatCircleHeuristicProvider(graph) : heuristicProvider,
                searchBudget == null ? SearchBudget.defaults() : searchBudget
        );
        this.routeBuilder = new RouteBuilder(graph);
        this.clock = clock == null ? Clock.systemDefaultZone() : clock;
        this.zoneId = zoneId == null ? this.clock.getZone() : zoneId;
    }

    public static RouteEngine of(RoadGraph graph) {
        return RouteEngine.builder().graph(graph).build();
    }

    @Override
    public RouteResponse route(RouteRequest request) {
        validate(request);
        TravelMode mode = request.getTravelMode();

        SpatialMatch start = spatialIndex.nearest(request.getStart());
        SpatialMatch goal = spatialIndex.nearest(request.getGoal());
        LOG.debug("Snapped start {} -> node {} ({} km), goal {} -> node {} ({} km)",
                request.getStart(), start.nodeId(), start.distanceKm(),
                request.getGoal(), goal.nodeId(), goal.distanceKm());

        RouteResponse.RouteResponseBuilder builder = RouteResponse.builder()
                .travelMode(mode)
                .requestedStart(request.getStart())
                .requestedGoal(request.getGoal())
                .startNodeId(start.nodeId())
                .goalNodeId(goal.nodeId());

        SearchCancellation cancellation = request.getCancellation() == null
                ? SearchCancellation.NONE
                : request.getCancellation();

        PathResult path;
        try {
            path = pathSearch.findPathByIndex(start.nodeIndex(), goal.nodeIndex(), cancellation);
        } catch (RoutingException ex) {
            if (!ex.isNoPathFound()) {
                throw ex;
            }
            LOG.debug("No route between node {} and node {}", start.nodeId(), goal.nodeId());
            return builder
                    .reachable(false)
                    .failureReason(ex.reasonCode())
                    .build();
        }

        Route route = routeBuilder.build(path, mode);
        int hour = request.getHourOfDay() != null
                ? request.getHourOfDay()
                : TrafficModel.hourOfDay(clock.instant(), zoneId);
        TrafficAdjustment traffic = TrafficModel.adjust(route.roundedTimeMinutes(), hour);

        for (long nodeId : path.nodeIds()) {
            builder.pathNode(nodeId);
        }
        builder.geometry(route.getGeometry());

        return builder
                .reachable(true)
                .networkCostMeters(path.costMeters())
                .distanceKm(route.getDistanceKm())
                .displayDistanceKm(route.roundedDistanceKm())
                .baseTimeMinutes(route.getTimeMinutes())
                .displayTimeMinutes(route.roundedTimeMinutes())
                .trafficWindow(traffic.window())
                .trafficMultiplier(traffic.multiplier())
                .adjustedTimeMinutes(traffic.adjustedTimeMinutes())
                .estimatedFuelLitres(mode.hasFuelEstimate()
                        ? DisplayRounding.toHundredths(route.roundedDistanceKm() * mode.fuelLitresPerKm())
                        : null)
                .expandedNodes(path.expandedNodes())
                .build();
    }

    private static void validate(RouteRequest request) {
        if (request == null) {
            throw new RoutingException(REASON_ROUTE_REQUEST_REQUIRED, "route request must be provided");
        }
        if (request.getStart() == null) {
            throw new RoutingException(REASON_START_REQUIRED, "start coordinate must be provided");
        }
        if (request.getGoal() == null) {
            throw new RoutingException(REASON_GOAL_REQUIRED, "goal coordinate must be provided");
        }
        if (request.getTravelMode() == null) {
            throw new RoutingException(REASON_TRAVEL_MODE_REQUIRED, "travel mode must be provided");
        }
        if (request.getHourOfDay() != null && (request.getHourOfDay() < 0 || request.getHourOfDay() > 23)) {
            throw new IllegalArgumentException("hourOfDay must be within [0, 23], got " + request.getHourOfDay());
        }
    }
}
