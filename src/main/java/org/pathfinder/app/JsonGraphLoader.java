package org.pathfinder.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import org.pathfinder.core.geo.GeoMetric;
import org.pathfinder.routing.cache.GraphLoader;
import org.pathfinder.routing.graph.NetworkType;
import org.pathfinder.routing.graph.RoadGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Loads graphs from JSON files named {@code <place-slug>-<network>.json} inside one directory.
 *
 * <p>Edges are two-way unless flagged {@code oneway}.</p>
 */
public final class JsonGraphLoader implements GraphLoader {
    private static final Logger LOG = LoggerFactory.getLogger(JsonGraphLoader.class);

    private final Path directory;
    private final ObjectMapper mapper;

    public JsonGraphLoader(Path directory) {
        this(directory, new ObjectMapper());
    }

    JsonGraphLoader(Path directory, ObjectMapper mapper) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public RoadGraph load(String place, NetworkType networkType) throws IOException {
        Path file = fileFor(place, networkType);
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString(), null, "no graph file for place '" + place + "'");
        }
        LOG.debug("Reading graph file {}", file);

        GraphDocument document;
        try {
            document = mapper.readValue(file.toFile(), GraphDocument.class);
        } catch (JsonProcessingException ex) {
            throw new IOException("Malformed graph file " + file + ": " + ex.getOriginalMessage(), ex);
        }
        try {
            return toGraph(document);
        } catch (IllegalArgumentException ex) {
            throw new IOException("Invalid graph in " + file + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Resolves the file backing one place and network type.
     */
    public Path fileFor(String place, NetworkType networkType) {
        return directory.resolve(slug(place) + "-" + networkType.fileToken() + ".json");
    }

    static String slug(String place) {
        String slug = place.trim().toLowerCase(Locale.ROOT)
                .replaceAll("[^\\p{L}\\p{N}]+", "-")
                .replaceAll("(^-+|-+$)", "");
        if (slug.isEmpty()) {
            throw new IllegalArgumentException("place '" + place + "' has no usable characters");
        }
        return slug;
    }

    static RoadGraph toGraph(GraphDocument document) {
        RoadGraph.Builder builder = RoadGraph.builder();
        Long2ObjectOpenHashMap<GraphDocument.NodeEntry> nodesById = new Long2ObjectOpenHashMap<>();
        if (document.nodes == null || document.edges == null) {
            throw new IllegalArgumentException("'nodes' and 'edges' must be arrays");
        }
        for (int i = 0; i < document.nodes.size(); i++) {
            GraphDocument.NodeEntry node = document.nodes.get(i);
            if (node == null || node.id == null || node.lat == null || node.lon == null) {
                throw new IllegalArgumentException("nodes[" + i + "] must have id, lat and lon");
            }
            builder.addNode(node.id, node.lat, node.lon);
            nodesById.put(node.id.longValue(), node);
        }
        for (int i = 0; i < document.edges.size(); i++) {
            GraphDocument.EdgeEntry edge = document.edges.get(i);
            if (edge == null || edge.source == null || edge.target == null) {
                throw new IllegalArgumentException("edges[" + i + "] must have source and target");
            }
            double length = edge.length != null ? edge.length : greatCircleLength(nodesById, edge);
            if (edge.oneway) {
                builder.addEdge(edge.source, edge.target, length);
            } else {
                builder.addUndirectedEdge(edge.source, edge.target, length);
            }
        }
        return builder.build();
    }

    private static double greatCircleLength(
            Long2ObjectOpenHashMap<GraphDocument.NodeEntry> nodesById,
            GraphDocument.EdgeEntry edge
    ) {
        GraphDocument.NodeEntry source = nodesById.get(edge.source.longValue());
        GraphDocument.NodeEntry target = nodesById.get(edge.target.longValue());
        if (source == null || target == null) {
            throw new IllegalArgumentException(
                    "edge " + edge.source + "->" + edge.target + " references an unknown node");
        }
        return GeoMetric.distanceMeters(source.lat, source.lon, target.lat, target.lon);
    }
}
