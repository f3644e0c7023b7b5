package org.pathfinder.app;

import org.apache.commons.cli.ParseException;
import org.pathfinder.routing.cache.GraphCache;
import org.pathfinder.routing.core.RouteEngine;
import org.pathfinder.routing.core.RouteRequest;
import org.pathfinder.routing.core.RouteResponse;
import org.pathfinder.routing.core.RoutingException;
import org.pathfinder.routing.core.TravelMode;
import org.pathfinder.routing.graph.RoadGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.io.PrintWriter;

/**
 * Command line route finder.
 */
public class Main {
    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_NO_ROUTE = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_FAILURE = 3;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs one query and returns the process exit code.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        CommandLineOpts opts;
        try {
            opts = CommandLineOpts.parse(args);
            if (opts.helpRequested()) {
                CommandLineOpts.printHelp(new PrintWriter(out));
                return EXIT_OK;
            }

            String place = opts.place();
            TravelMode mode = opts.mode();
            RouteRequest request = RouteRequest.builder()
                    .start(opts.from())
                    .goal(opts.to())
                    .travelMode(mode)
                    .hourOfDay(opts.hour())
                    .build();
            GraphCache cache = new GraphCache(new JsonGraphLoader(opts.graphDirectory()));
            RoadGraph graph = cache.getOrLoad(place, mode.networkType());

            RouteResponse response = RouteEngine.of(graph).route(request);

            out.println(RouteReport.format(response));
            return response.isReachable() ? EXIT_OK : EXIT_NO_ROUTE;
        } catch (ParseException ex) {
            err.println(ex.getMessage());
            CommandLineOpts.printHelp(new PrintWriter(err));
            return EXIT_USAGE;
        } catch (RoutingException ex) {
            LOG.error("Routing failed: {}", ex.getMessage(), ex);
            err.println("An error occurred: " + ex.getMessage());
            return EXIT_FAILURE;
        }
    }
}
