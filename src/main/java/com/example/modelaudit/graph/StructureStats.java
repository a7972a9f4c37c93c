package com.example.modelaudit.graph;

import java.util.List;

public record StructureStats(int circularReferences,
                             List<String> orphanedCalculations,
                             double complexityScore,
                             boolean cyclesTruncated) {

    public StructureStats {
        orphanedCalculations = List.copyOf(orphanedCalculations);
    }
}
