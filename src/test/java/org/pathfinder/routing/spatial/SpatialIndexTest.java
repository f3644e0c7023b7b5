package org.pathfinder.routing.spatial;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.pathfinder.core.geo.Coordinate;
import org.pathfinder.core.geo.GeoMetric;
import org.pathfinder.routing.core.RoutingException;
import org.pathfinder.routing.graph.RoadGraph;
import org.pathfinder.routing.testutil.GraphFixtures;

import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Spatial Index Tests")
class SpatialIndexTest {

    @Nested
    @DisplayName("1. Correctness")
    class Correctness {

        @Test
        @DisplayName("Nearest lookup snaps to the closest node")
        void testNearestLookup() {
            RoadGraph graph = GraphFixtures.lineGraph();
            for (SpatialIndex index : bothIndexes(graph)) {
                SpatialMatch onA = index.nearest(Coordinate.of(0.0, 0.0));
                assertEquals(GraphFixtures.NODE_A, onA.nodeId());
                assertEquals(0.0, onA.distanceKm(), 1e-12);

                SpatialMatch nearC = index.nearest(Coordinate.of(0.001, 0.0185));
                assertEquals(GraphFixtures.NODE_C, nearC.nodeId());
                assertEquals(Coordinate.of(0.0, 0.02), nearC.nodeCoordinate());
                assertEquals(GeoMetric.distanceKm(Coordinate.of(0.001, 0.0185), Coordinate.of(0.0, 0.02)),
                        nearC.distanceKm(), 1e-12);
            }
        }

        @Test
        @DisplayName("Deterministic tie-break picks the lowest node id")
        void testDeterministicTieBreak() {
            RoadGraph graph = RoadGraph.builder()
                    .addNode(7, 10.0, 10.0)
                    .addNode(4, 10.0, 10.0)
                    .addNode(9, 10.0, 10.0)
                    .addNode(2, 40.0, 40.0)
                    .build();

            assertEquals(4L, new LinearScanSpatialIndex(graph).nearest(Coordinate.of(10.1, 10.1)).nodeId());
            assertEquals(4L, new KdTreeSpatialIndex(graph, 1).nearest(Coordinate.of(10.1, 10.1)).nodeId());
        }

        @Test
        @DisplayName("Equidistant nodes on either side of the query resolve to the lowest id")
        void testMirroredTie() {
            RoadGraph graph = RoadGraph.builder()
                    .addNode(5, 0.0, 1.0)
                    .addNode(3, 0.0, -1.0)
                    .build();

            assertEquals(3L, new LinearScanSpatialIndex(graph).nearest(Coordinate.of(0.0, 0.0)).nodeId());
            assertEquals(3L, new KdTreeSpatialIndex(graph, 1).nearest(Coordinate.of(0.0, 0.0)).nodeId());
        }

        @Test
        @DisplayName("Great-circle nearest across the antimeridian")
        void testAntimeridian() {
            RoadGraph graph = RoadGraph.builder()
                    .addNode(1, 0.0, 179.9)
                    .addNode(2, 0.0, -170.0)
                    .addNode(3, 0.0, 175.0)
                    .build();

            for (SpatialIndex index : bothIndexes(graph)) {
                assertEquals(1L, index.nearest(Coordinate.of(0.0, -179.95)).nodeId());
            }
        }

        @Test
        @DisplayName("Empty graph fails with EMPTY_GRAPH")
        void testEmptyGraph() {
            RoadGraph graph = RoadGraph.builder().build();
            for (SpatialIndex index : bothIndexes(graph)) {
                RoutingException ex = assertThrows(RoutingException.class, () -> index.nearest(Coordinate.of(0, 0)));
                assertEquals(RoutingException.REASON_EMPTY_GRAPH, ex.reasonCode());
            }
        }

        @Test
        @DisplayName("Non-finite raw query coordinates are rejected")
        void testNonFiniteQuery() {
            RoadGraph graph = GraphFixtures.lineGraph();
            for (SpatialIndex index : bothIndexes(graph)) {
                assertThrows(IllegalArgumentException.class, () -> index.nearestNodeIndex(Double.NaN, 0.0));
            }
        }
    }

    @Nested
    @DisplayName("2. Randomized cross-checks")
    class RandomizedChecks {

        @Test
        @DisplayName("KD tree agrees with linear scan and no node is strictly closer")
        void testAgainstBruteForce() {
            Random random = new Random(42L);
            RoadGraph.Builder builder = RoadGraph.builder();
            for (int i = 0; i < 2_000; i++) {
                builder.addNode(i * 2L + 1, 20.9 + random.nextDouble() * 0.2, 105.7 + random.nextDouble() * 0.2);
            }
            RoadGraph graph = builder.build();
            KdTreeSpatialIndex kd = new KdTreeSpatialIndex(graph);
            LinearScanSpatialIndex linear = new LinearScanSpatialIndex(graph);

            for (int q = 0; q < 1_000; q++) {
                Coordinate query = Coordinate.of(20.85 + random.nextDouble() * 0.3, 105.65 + random.nextDouble() * 0.3);
                SpatialMatch match = kd.nearest(query);

                assertEquals(linear.nearestNodeIndex(query.latitude(), query.longitude()), match.nodeIndex());
                assertTrue(graph.containsNode(match.nodeId()));
                for (int i = 0; i < graph.nodeCount(); i++) {
                    double other = GeoMetric.distanceKm(query, graph.coordinate(i));
                    assertTrue(match.distanceKm() <= other + 1e-9,
                            "node " + graph.nodeId(i) + " is closer than " + match.nodeId());
                }
            }
        }

        @Test
        @DisplayName("Global spread of nodes, including poles")
        void testGlobalSpread() {
            Random random = new Random(5L);
            RoadGraph.Builder builder = RoadGraph.builder()
                    .addNode(0, 90.0, 0.0)
                    .addNode(1, -90.0, 0.0);
            for (int i = 2; i < 500; i++) {
                builder.addNode(i, random.nextDouble() * 180.0 - 90.0, random.nextDouble() * 360.0 - 180.0);
            }
            RoadGraph graph = builder.build();
            KdTreeSpatialIndex kd = new KdTreeSpatialIndex(graph, 4);
            LinearScanSpatialIndex linear = new LinearScanSpatialIndex(graph);

            for (int q = 0; q < 500; q++) {
                double lat = random.nextDouble() * 180.0 - 90.0;
                double lon = random.nextDouble() * 360.0 - 180.0;
                assertEquals(linear.nearestNodeIndex(lat, lon), kd.nearestNodeIndex(lat, lon));
            }
            assertEquals(0L, graph.nodeId(kd.nearestNodeIndex(89.99, 120.0)));
        }
    }

    @Nested
    @DisplayName("3. Factory and concurrency")
    class FactoryAndConcurrency {

        @Test
        @DisplayName("Factory picks linear scan for small graphs and KD tree for large ones")
        void testFactorySelection() {
            RoadGraph small = GraphFixtures.lineGraph();
            RoadGraph large = GraphFixtures.randomGrid(10, 10, 1L, 0.0, 0.0);

            assertInstanceOf(LinearScanSpatialIndex.class, SpatialIndexFactory.create(small, 64));
            assertInstanceOf(KdTreeSpatialIndex.class, SpatialIndexFactory.create(large, 64));
            assertInstanceOf(KdTreeSpatialIndex.class, SpatialIndexFactory.create(small, 0));
        }

        @Test
        @DisplayName("Threshold system property falls back on invalid values")
        void testThresholdProperty() {
            String previous = System.getProperty(SpatialIndexFactory.PROP_LINEAR_SCAN_THRESHOLD);
            try {
                System.setProperty(SpatialIndexFactory.PROP_LINEAR_SCAN_THRESHOLD, "5");
                assertEquals(5, SpatialIndexFactory.linearScanThreshold());
                System.setProperty(SpatialIndexFactory.PROP_LINEAR_SCAN_THRESHOLD, "lots");
                assertEquals(SpatialIndexFactory.DEFAULT_LINEAR_SCAN_THRESHOLD, SpatialIndexFactory.linearScanThreshold());
            } finally {
                if (previous == null) {
                    System.clearProperty(SpatialIndexFactory.PROP_LINEAR_SCAN_THRESHOLD);
                } else {
                    System.setProperty(SpatialIndexFactory.PROP_LINEAR_SCAN_THRESHOLD, previous);
                }
            }
        }

        @Test
        @Timeout(10)
        @DisplayName("Concurrent queries on a shared index")
        void testConcurrentQueries() throws InterruptedException {
            RoadGraph graph = GraphFixtures.randomGrid(40, 40, 3L, 0.0, 0.0);
            KdTreeSpatialIndex kd = new KdTreeSpatialIndex(graph);
            LinearScanSpatialIndex linear = new LinearScanSpatialIndex(graph);
            AtomicBoolean mismatch = new AtomicBoolean(false);

            ExecutorService executor = Executors.newFixedThreadPool(6);
            for (int t = 0; t < 6; t++) {
                long seed = t;
                executor.submit(() -> {
                    Random random = new Random(seed);
                    for (int q = 0; q < 500; q++) {
                        double lat = 20.99 + random.nextDouble() * 0.05;
                        double lon = 105.79 + random.nextDouble() * 0.05;
                        if (kd.nearestNodeIndex(lat, lon) != linear.nearestNodeIndex(lat, lon)) {
                            mismatch.set(true);
                        }
                    }
                });
            }
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
            assertFalse(mismatch.get());
        }
    }

    private static SpatialIndex[] bothIndexes(RoadGraph graph) {
        return new SpatialIndex[]{new LinearScanSpatialIndex(graph), new KdTreeSpatialIndex(graph, 1)};
    }
}
