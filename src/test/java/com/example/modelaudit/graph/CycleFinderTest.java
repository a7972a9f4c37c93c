package com.example.modelaudit.graph;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CycleFinderTest {

    private final CycleFinder finder = new CycleFinder(1_000_000, Duration.ofSeconds(30));

    private static DependencyGraph graph(String... edges) {
        DependencyGraph graph = new DependencyGraph();
        for (String edge : edges) {
            String[] parts = edge.split("->");
            graph.addEdge(parts[0].trim(), parts[1].trim());
        }
        return graph;
    }

    private static DependencyGraph complete(int size) {
        DependencyGraph graph = new DependencyGraph();
        for (int i = 0; i < size; i++) {
            for (int j = 0; j < size; j++) {
                if (i != j) {
                    graph.addEdge("N" + i, "N" + j);
                }
            }
        }
        return graph;
    }

    @Test
    void whenSearching_givenTriangle_shouldFindOneCycle() {
        CycleSearchResult result = finder.find(graph("A -> B", "B -> C", "C -> A"), 10);

        assertEquals(1, result.count());
        assertFalse(result.truncated());
        assertEquals(Set.of("A", "B", "C"), new HashSet<>(result.cycles().get(0)));
        assertEquals(3, result.cycles().get(0).size());
    }

    @Test
    void whenSearching_givenAcyclicGraph_shouldFindNothing() {
        DependencyGraph graph = new DependencyGraph();
        for (int i = 0; i < 500; i++) {
            for (int j = i + 1; j < Math.min(500, i + 6); j++) {
                graph.addEdge("N" + i, "N" + j);
            }
        }

        assertEquals(0, finder.find(graph).count());
    }

    @Test
    void whenSearching_givenSelfLoop_shouldCountIt() {
        CycleSearchResult result = finder.find(graph("A -> A", "A -> B"), 10);

        assertEquals(1, result.count());
        assertEquals(List.of(List.of("A")), result.cycles());
    }

    @Test
    void whenSearching_givenCyclesSharingNode_shouldCountEach() {
        assertEquals(2, finder.find(graph("A -> B", "B -> A", "A -> C", "C -> A")).count());
    }

    @Test
    void whenSearching_givenCompleteGraph_shouldEnumerateAllElementaryCycles() {
        // 6 two-node, 8 three-node and 6 four-node cycles
        assertEquals(20, finder.find(complete(4)).count());
    }

    @Test
    void whenSearching_givenSeparateComponents_shouldCountAcrossComponents() {
        assertEquals(3, finder.find(graph(
                "A -> B", "B -> A",
                "C -> D", "D -> E", "E -> C",
                "X -> Y", "Y -> Z", "Z -> X", "P -> A")).count());
    }

    @Test
    void whenSearching_givenLongRing_shouldNotOverflowStack() {
        DependencyGraph graph = new DependencyGraph();
        int size = 50_000;
        for (int i = 0; i < size; i++) {
            graph.addEdge("N" + i, "N" + ((i + 1) % size));
        }

        assertEquals(1, finder.find(graph).count());
    }

    @Test
    void whenSearching_givenCycleLimit_shouldStopAndMarkTruncated() {
        CycleSearchResult result = new CycleFinder(5, Duration.ofSeconds(30)).find(complete(4));

        assertEquals(5, result.count());
        assertTrue(result.truncated());
    }

    @Test
    void whenSearching_givenExactlyLimitCycles_shouldNotMarkTruncated() {
        CycleSearchResult complete = new CycleFinder(20, Duration.ofSeconds(30)).find(complete(4));
        CycleSearchResult triangle = new CycleFinder(1, Duration.ofSeconds(30)).find(graph("A -> B", "B -> C", "C -> A"));

        assertEquals(20, complete.count());
        assertFalse(complete.truncated());
        assertEquals(1, triangle.count());
        assertFalse(triangle.truncated());
    }

    @Test
    void whenSearching_givenExpiredTimeBudget_shouldReturnLowerBound() {
        AtomicLong calls = new AtomicLong();
        CycleFinder slowClock = new CycleFinder(1_000_000, Duration.ofMillis(1),
                () -> calls.getAndIncrement() == 0 ? 0L : Long.MAX_VALUE / 2);

        CycleSearchResult result = slowClock.find(complete(8));

        assertTrue(result.truncated());
        assertTrue(result.count() < 16064);
    }

    @Test
    void whenSearching_givenRetainLimit_shouldCountAllButKeepOnlyLimit() {
        CycleSearchResult result = finder.find(complete(4), 3);

        assertEquals(20, result.count());
        assertEquals(3, result.cycles().size());
    }
}
