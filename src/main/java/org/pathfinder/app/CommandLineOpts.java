package org.pathfinder.app;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.pathfinder.core.geo.Coordinate;
import org.pathfinder.routing.core.TravelMode;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line options of the route finder.
 */
final class CommandLineOpts {
    static final String GRAPH_DIR_OPT = "d";
    static final String PLACE_OPT = "p";
    static final String FROM_OPT = "f";
    static final String TO_OPT = "t";
    static final String MODE_OPT = "m";
    static final String HOUR_OPT = "H";
    static final String HELP_OPT = "h";

    private final CommandLine cmd;

    private CommandLineOpts(CommandLine cmd) {
        this.cmd = cmd;
    }

    /**
     * Parses arguments.
     *
     * @throws ParseException when options are missing, unknown or malformed.
     */
    static CommandLineOpts parse(String[] args) throws ParseException {
        CommandLineParser parser = new DefaultParser();
        CommandLine cmd = parser.parse(options(), args, false);
        if (!cmd.getArgList().isEmpty()) {
            throw new ParseException("Unexpected argument(s): " + cmd.getArgList());
        }
        CommandLineOpts opts = new CommandLineOpts(cmd);
        if (!opts.helpRequested()) {
            opts.requireOption(PLACE_OPT);
            opts.requireOption(FROM_OPT);
            opts.requireOption(TO_OPT);
        }
        return opts;
    }

    static Options options() {
        Options options = new Options();
        options.addOption(GRAPH_DIR_OPT, "graph-dir", true, "Directory holding <place>-<network>.json graph files. (Default: .)");
        options.addOption(PLACE_OPT, "place", true, "Area whose graph is loaded, e.g. 'Ba Dinh, Hanoi, Vietnam'.");
        options.addOption(FROM_OPT, "from", true, "Start coordinate as lat,lon.");
        options.addOption(TO_OPT, "to", true, "Destination coordinate as lat,lon.");
        options.addOption(MODE_OPT, "mode", true, "Travel mode: car, walk or bike. (Default: walk)");
        options.addOption(Option.builder(HOUR_OPT).longOpt("hour").hasArg()
                .desc("Hour of day 0-23 for the traffic estimate. (Default: current local hour)").build());
        options.addOption(HELP_OPT, "help", false, "Print all command line options, then exit.");
        return options;
    }

    static void printHelp(PrintWriter out) {
        new HelpFormatter().printHelp(out, 100, "pathfinder", null, options(), 2, 4, null, true);
        out.flush();
    }

    boolean helpRequested() {
        return cmd.hasOption(HELP_OPT);
    }

    Path graphDirectory() throws ParseException {
        Path dir = Paths.get(cmd.getOptionValue(GRAPH_DIR_OPT, "."));
        if (!Files.isDirectory(dir)) {
            throw new ParseException("Unable to find graph directory: " + dir.toAbsolutePath());
        }
        return dir;
    }

    /**
     * @throws ParseException when the place has no characters usable in a graph file name.
     */
    String place() throws ParseException {
        String place = cmd.getOptionValue(PLACE_OPT);
        try {
            JsonGraphLoader.slug(place);
        } catch (IllegalArgumentException ex) {
            throw new ParseException(ex.getMessage());
        }
        return place;
    }

    Coordinate from() throws ParseException {
        return coordinate(FROM_OPT);
    }

    Coordinate to() throws ParseException {
        return coordinate(TO_OPT);
    }

    TravelMode mode() throws ParseException {
        try {
            return TravelMode.parse(cmd.getOptionValue(MODE_OPT, "walk"));
        } catch (IllegalArgumentException ex) {
            throw new ParseException(ex.getMessage());
        }
    }

    /**
     * @return the requested hour, or null to use the current local hour.
     */
    Integer hour() throws ParseException {
        if (!cmd.hasOption(HOUR_OPT)) {
            return null;
        }
        String raw = cmd.getOptionValue(HOUR_OPT);
        try {
            int hour = Integer.parseInt(raw.trim());
            if (hour < 0 || hour > 23) {
                throw new ParseException("--hour must be within 0-23, got " + hour);
            }
            return hour;
        } catch (NumberFormatException ex) {
            throw new ParseException("--hour must be an integer, got '" + raw + "'");
        }
    }

    private Coordinate coordinate(String opt) throws ParseException {
        try {
            return Coordinate.parse(cmd.getOptionValue(opt));
        } catch (IllegalArgumentException ex) {
            throw new ParseException(ex.getMessage());
        }
    }

    private void requireOption(String opt) throws ParseException {
        if (!cmd.hasOption(opt)) {
            throw new ParseException("Missing required option: " + opt);
        }
    }
}
