package org.pathfinder.routing.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.pathfinder.routing.core.RoutingException;
import org.pathfinder.routing.graph.NetworkType;
import org.pathfinder.routing.graph.RoadGraph;
import org.pathfinder.routing.testutil.GraphFixtures;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Graph Cache Tests")
class GraphCacheTest {

    @Test
    @DisplayName("Loads once per key; place names are case- and whitespace-insensitive")
    void testLoadOnce() {
        AtomicInteger loads = new AtomicInteger();
        GraphCache cache = new GraphCache((place, type) -> {
            loads.incrementAndGet();
            return GraphFixtures.lineGraph();
        });

        RoadGraph first = cache.getOrLoad("Test Town", NetworkType.WALK);
        RoadGraph second = cache.getOrLoad("  test town ", NetworkType.WALK);

        assertSame(first, second);
        assertEquals(1, loads.get());
        assertTrue(cache.contains("TEST TOWN", NetworkType.WALK));
        assertFalse(cache.contains("test town", NetworkType.DRIVE));
    }

    @Test
    @DisplayName("Loader receives the place as requested, not the folded cache key")
    void testLoaderSeesRequestedPlace() {
        List<String> requested = new ArrayList<>();
        GraphCache cache = new GraphCache((place, type) -> {
            requested.add(place);
            return GraphFixtures.lineGraph();
        });

        cache.getOrLoad("  Ba Dinh, Hanoi ", NetworkType.DRIVE);
        cache.getOrLoad("ba dinh, hanoi", NetworkType.DRIVE);

        assertEquals(List.of("Ba Dinh, Hanoi"), requested);
    }

    @Test
    @DisplayName("Network types are separate entries")
    void testNetworkTypesSeparate() {
        List<NetworkType> requested = new ArrayList<>();
        GraphCache cache = new GraphCache((place, type) -> {
            requested.add(type);
            return GraphFixtures.lineGraph();
        });

        RoadGraph walk = cache.getOrLoad("town", NetworkType.WALK);
        RoadGraph drive = cache.getOrLoad("town", NetworkType.DRIVE);

        assertNotSame(walk, drive);
        assertEquals(List.of(NetworkType.WALK, NetworkType.DRIVE), requested);
        assertEquals(2, cache.size());
    }

    @Test
    @DisplayName("Invalidation forces a reload")
    void testInvalidate() {
        AtomicInteger loads = new AtomicInteger();
        GraphCache cache = new GraphCache((place, type) -> {
            loads.incrementAndGet();
            return GraphFixtures.lineGraph();
        });

        cache.getOrLoad("town", NetworkType.WALK);
        assertTrue(cache.invalidate("Town", NetworkType.WALK));
        assertFalse(cache.invalidate("Town", NetworkType.WALK));
        cache.getOrLoad("town", NetworkType.WALK);
        cache.getOrLoad("city", NetworkType.DRIVE);
        assertEquals(3, loads.get());

        cache.invalidateAll();
        assertEquals(0, cache.size());
    }

    @Test
    @DisplayName("Loader failures surface as GRAPH_LOAD_FAILED and are not cached")
    void testLoadFailure() {
        AtomicInteger attempts = new AtomicInteger();
        GraphCache cache = new GraphCache((place, type) -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IOException("disk on fire");
            }
            return GraphFixtures.lineGraph();
        });

        RoutingException ex = assertThrows(RoutingException.class, () -> cache.getOrLoad("town", NetworkType.WALK));
        assertEquals(RoutingException.REASON_GRAPH_LOAD_FAILED, ex.reasonCode());
        assertTrue(ex.getCause() instanceof IOException);
        assertFalse(cache.contains("town", NetworkType.WALK));

        assertNotNull(cache.getOrLoad("town", NetworkType.WALK));
        assertEquals(2, attempts.get());
    }

    @Test
    @DisplayName("Blank places are rejected")
    void testBlankPlace() {
        GraphCache cache = new GraphCache((place, type) -> GraphFixtures.lineGraph());
        assertThrows(IllegalArgumentException.class, () -> cache.getOrLoad("  ", NetworkType.WALK));
        assertThrows(NullPointerException.class, () -> cache.getOrLoad(null, NetworkType.WALK));
    }

    @Test
    @Timeout(10)
    @DisplayName("Concurrent callers share a single load")
    void testConcurrentLoad() throws Exception {
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        GraphCache cache = new GraphCache((place, type) -> {
            loads.incrementAndGet();
            try {
                release.await();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted", ex);
            }
            return GraphFixtures.lineGraph();
        });

        ExecutorService pool = Executors.newFixedThreadPool(6);
        try {
            List<Future<RoadGraph>> futures = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                futures.add(pool.submit(() -> cache.getOrLoad("town", NetworkType.WALK)));
            }
            Thread.sleep(100);
            release.countDown();

            RoadGraph graph = futures.get(0).get();
            for (Future<RoadGraph> future : futures) {
                assertSame(graph, future.get());
            }
            assertEquals(1, loads.get());
        } finally {
            pool.shutdownNow();
        }
    }
}
