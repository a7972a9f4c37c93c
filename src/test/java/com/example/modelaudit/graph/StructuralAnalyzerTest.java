package com.example.modelaudit.graph;

import com.example.modelaudit.model.CellRole;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StructuralAnalyzerTest {

    private final StructuralAnalyzer analyzer = new StructuralAnalyzer(new CycleFinder(10_000, Duration.ofSeconds(10)));

    @Test
    void whenAnalyzing_givenTriangle_shouldReportOneCircularReference() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge("A", "B");
        graph.addEdge("B", "C");
        graph.addEdge("C", "A");

        StructureStats stats = analyzer.analyze(graph);

        assertEquals(1, stats.circularReferences());
        assertFalse(stats.cyclesTruncated());
        assertTrue(stats.orphanedCalculations().isEmpty());
    }

    @Test
    void whenAnalyzing_givenChain_shouldReportOnlyDeadEndAsOrphan() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge("Inputs!A1", "Calc!B1");
        graph.addEdge("Calc!B1", "Calc!C1");
        graph.addEdge("Inputs!A2", "Calc!B1");

        StructureStats stats = analyzer.analyze(graph);

        assertEquals(List.of("Calc!C1"), stats.orphanedCalculations());
        assertEquals(0, stats.circularReferences());
    }

    @Test
    void whenAnalyzing_givenNodeWithOutgoingEdge_shouldNeverReportItAsOrphan() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge("A", "B");
        graph.addEdge("B", "A");
        graph.addEdge("B", "C");

        List<String> orphans = analyzer.findOrphans(graph);

        assertEquals(List.of("C"), orphans);
    }

    @Test
    void whenAnalyzing_givenIsolatedNode_shouldNotReportItAsOrphan() {
        DependencyGraph graph = new DependencyGraph();
        graph.addNode("Calc!A1", CellRole.FORMULA);

        assertTrue(analyzer.findOrphans(graph).isEmpty());
    }

    @Test
    void whenAnalyzing_givenGraph_shouldComputeSmoothedDensity() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge("A", "B");
        graph.addEdge("B", "C");

        assertEquals(0.5, analyzer.analyze(graph).complexityScore(), 1e-9);
        assertEquals(0.0, analyzer.analyze(new DependencyGraph()).complexityScore(), 1e-9);
    }

    @Test
    void whenAnalyzingTwice_givenUnchangedGraph_shouldReturnEqualStats() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge("A", "B");
        graph.addEdge("B", "A");
        graph.addEdge("B", "C");

        assertEquals(analyzer.analyze(graph), analyzer.analyze(graph));
        assertEquals(3, graph.edgeCount());
    }

    @Test
    void whenAnalyzing_givenCycleSearchResult_shouldTakeCountFromIt() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge("A", "B");
        graph.addEdge("B", "A");

        StructureStats stats = analyzer.analyze(graph, new CycleSearchResult(7, true, List.of()));

        assertEquals(7, stats.circularReferences());
        assertTrue(stats.cyclesTruncated());
    }
}
