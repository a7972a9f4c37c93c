package com.example.modelaudit.graph;

import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class StructuralAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(StructuralAnalyzer.class);

    private final CycleFinder cycleFinder;

    public StructuralAnalyzer(CycleFinder cycleFinder) {
        this.cycleFinder = cycleFinder;
    }

    public StructureStats analyze(DependencyGraph graph) {
        return analyze(graph, cycleFinder.find(graph));
    }

    public StructureStats analyze(DependencyGraph graph, CycleSearchResult cycles) {
        List<String> orphans = findOrphans(graph);
        double density = graph.edgeCount() / (graph.nodeCount() + 1.0);

        LOGGER.info("Structure: {}{} circular reference(s), {} orphaned calculation(s), density {}",
                cycles.truncated() ? "at least " : "", cycles.count(), orphans.size(),
                String.format("%.3f", density));
        return new StructureStats(cycles.count(), orphans, density, cycles.truncated());
    }

    public List<String> findOrphans(DependencyGraph graph) {
        return graph.nodes().stream()
                .filter(node -> graph.outDegree(node) == 0 && graph.inDegree(node) > 0)
                .collect(Collectors.toList());
    }
}
