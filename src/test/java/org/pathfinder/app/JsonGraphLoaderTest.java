package org.pathfinder.app;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pathfinder.core.geo.GeoMetric;
import org.pathfinder.routing.graph.NetworkType;
import org.pathfinder.routing.graph.RoadGraph;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JSON Graph Loader Tests")
class JsonGraphLoaderTest {

    static final String LINE_GRAPH_JSON = "{\n" +
            "  \"nodes\": [\n" +
            "    {\"id\": 1, \"lat\": 0.0, \"lon\": 0.0},\n" +
            "    {\"id\": 2, \"lat\": 0.0, \"lon\": 0.01},\n" +
            "    {\"id\": 3, \"lat\": 0.0, \"lon\": 0.02, \"name\": \"ignored\"}\n" +
            "  ],\n" +
            "  \"edges\": [\n" +
            "    {\"source\": 1, \"target\": 2, \"length\": 1100.0},\n" +
            "    {\"source\": 2, \"target\": 3}\n" +
            "  ]\n" +
            "}\n";

    @TempDir
    Path dir;

    @Test
    @DisplayName("File naming: slugged place plus network token")
    void testFileNaming() {
        JsonGraphLoader loader = new JsonGraphLoader(dir);

        assertEquals(dir.resolve("ba-dinh-hanoi-vietnam-drive.json"),
                loader.fileFor("Ba Dinh, Hanoi, Vietnam", NetworkType.DRIVE));
        assertEquals("test-town", JsonGraphLoader.slug("  Test   Town! "));
        assertThrows(IllegalArgumentException.class, () -> JsonGraphLoader.slug(" ,, "));
    }

    @Test
    @DisplayName("Loads nodes, explicit lengths and great-circle fallback lengths")
    void testLoad() throws IOException {
        Files.writeString(dir.resolve("test-town-walk.json"), LINE_GRAPH_JSON, StandardCharsets.UTF_8);

        RoadGraph graph = new JsonGraphLoader(dir).load("test town", NetworkType.WALK);

        assertEquals(3, graph.nodeCount());
        assertEquals(4, graph.edgeCount(), "two-way edges are stored in both directions");
        int a = graph.indexOf(1L);
        int b = graph.indexOf(2L);
        assertEquals(1, graph.outDegree(a));
        assertEquals(1_100.0, graph.edgeLengthMeters(graph.firstEdge(a)), 1e-9);

        double fallback = GeoMetric.distanceMeters(0.0, 0.01, 0.0, 0.02);
        boolean found = false;
        for (int e = graph.firstEdge(b); e < graph.lastEdge(b); e++) {
            if (graph.nodeId(graph.edgeTarget(e)) == 3L) {
                assertEquals(fallback, graph.edgeLengthMeters(e), 1e-9);
                found = true;
            }
        }
        assertTrue(found);
    }

    @Test
    @DisplayName("One-way edges are stored in one direction only")
    void testOneway() throws IOException {
        Files.writeString(dir.resolve("oneway-drive.json"),
                "{\"nodes\":[{\"id\":5,\"lat\":1,\"lon\":1},{\"id\":6,\"lat\":1,\"lon\":1.001}]," +
                        "\"edges\":[{\"source\":5,\"target\":6,\"oneway\":true}]}",
                StandardCharsets.UTF_8);

        RoadGraph graph = new JsonGraphLoader(dir).load("oneway", NetworkType.DRIVE);

        assertEquals(1, graph.edgeCount());
        assertEquals(1, graph.outDegree(graph.indexOf(5L)));
        assertEquals(0, graph.outDegree(graph.indexOf(6L)));
    }

    @Test
    @DisplayName("Missing, malformed and inconsistent files fail with IOException")
    void testFailures() throws IOException {
        JsonGraphLoader loader = new JsonGraphLoader(dir);

        assertThrows(NoSuchFileException.class, () -> loader.load("nowhere", NetworkType.WALK));

        Files.writeString(dir.resolve("broken-walk.json"), "{\"nodes\": [", StandardCharsets.UTF_8);
        assertThrows(IOException.class, () -> loader.load("broken", NetworkType.WALK));

        Files.writeString(dir.resolve("dangling-walk.json"),
                "{\"nodes\":[{\"id\":1,\"lat\":0,\"lon\":0}],\"edges\":[{\"source\":1,\"target\":9}]}",
                StandardCharsets.UTF_8);
        IOException ex = assertThrows(IOException.class, () -> loader.load("dangling", NetworkType.WALK));
        assertTrue(ex.getMessage().contains("Invalid graph"));

        Files.writeString(dir.resolve("badlat-walk.json"),
                "{\"nodes\":[{\"id\":1,\"lat\":95,\"lon\":0}],\"edges\":[]}",
                StandardCharsets.UTF_8);
        assertThrows(IOException.class, () -> loader.load("badlat", NetworkType.WALK));
    }

    @Test
    @DisplayName("Nodes or edges with missing or null mandatory fields are rejected, not defaulted to 0")
    void testMissingMandatoryFields() throws IOException {
        JsonGraphLoader loader = new JsonGraphLoader(dir);

        Files.writeString(dir.resolve("nolat-walk.json"),
                "{\"nodes\":[{\"id\":1,\"lon\":105.85},{\"id\":2,\"lat\":21.0,\"lon\":105.86}]," +
                        "\"edges\":[{\"source\":1,\"target\":2}]}",
                StandardCharsets.UTF_8);
        IOException missingLat = assertThrows(IOException.class, () -> loader.load("nolat", NetworkType.WALK));
        assertTrue(missingLat.getMessage().contains("nodes[0]"), missingLat.getMessage());

        Files.writeString(dir.resolve("nulllon-walk.json"),
                "{\"nodes\":[{\"id\":1,\"lat\":21.0,\"lon\":null}],\"edges\":[]}",
                StandardCharsets.UTF_8);
        assertThrows(IOException.class, () -> loader.load("nulllon", NetworkType.WALK));

        Files.writeString(dir.resolve("noid-walk.json"),
                "{\"nodes\":[{\"lat\":21.0,\"lon\":105.85}],\"edges\":[]}",
                StandardCharsets.UTF_8);
        assertThrows(IOException.class, () -> loader.load("noid", NetworkType.WALK));

        Files.writeString(dir.resolve("notarget-walk.json"),
                "{\"nodes\":[{\"id\":1,\"lat\":21.0,\"lon\":105.85}],\"edges\":[{\"source\":1}]}",
                StandardCharsets.UTF_8);
        IOException missingTarget = assertThrows(IOException.class, () -> loader.load("notarget", NetworkType.WALK));
        assertTrue(missingTarget.getMessage().contains("edges[0]"), missingTarget.getMessage());
    }
}
