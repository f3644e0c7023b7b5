package org.pathfinder.app;

import lombok.experimental.UtilityClass;
import org.pathfinder.routing.core.RouteResponse;

import java.util.Locale;

/**
 * Plain-text summary of a route response.
 */
@UtilityClass
final class RouteReport {

    static String format(RouteResponse response) {
        if (!response.isReachable()) {
            return "No path found between these points. (" + response.getFailureReason() + ")";
        }
        StringBuilder out = new StringBuilder();
        out.append(String.format(Locale.ROOT, "Distance: %.2f km%n", response.getDisplayDistanceKm()));
        out.append(String.format(Locale.ROOT, "Estimated Time: %d minutes%n", response.getDisplayTimeMinutes()));
        out.append("Mode: ").append(capitalize(response.getTravelMode().name())).append(System.lineSeparator());
        out.append("Start: ").append(response.getRequestedStart()).append(System.lineSeparator());
        out.append("Destination: ").append(response.getRequestedGoal()).append(System.lineSeparator());
        out.append("Current Traffic: ").append(response.getTrafficWindow().label()).append(System.lineSeparator());
        out.append(String.format(Locale.ROOT, "Adjusted Time: %d minutes%n", response.getAdjustedTimeMinutes()));
        if (response.getEstimatedFuelLitres() != null) {
            out.append(String.format(Locale.ROOT, "Est. Fuel: %.2f liters%n", response.getEstimatedFuelLitres()));
        }
        out.append("Path nodes: ").append(response.getPathNodeIds().size());
        return out.toString();
    }

    private static String capitalize(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
