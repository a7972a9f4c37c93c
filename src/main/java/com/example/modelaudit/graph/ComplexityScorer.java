package com.example.modelaudit.graph;

import java.util.ArrayList;
import java.util.List;

public class ComplexityScorer {
    private static final int MAX_SCORE = 5;

    public ComplexityScore score(int sheetCount, DependencyGraph graph) {
        return score(sheetCount, graph.nodeCount(), graph.edgeCount());
    }

    public ComplexityScore score(int sheetCount, int nodeCount, int edgeCount) {
        int score = 1;
        List<String> drivers = new ArrayList<>();

        if (sheetCount > 30) {
            score += 2;
            drivers.add("High Sheet Count (>30)");
        } else if (sheetCount > 10) {
            score += 1;
            drivers.add("Moderate Sheet Count (>10)");
        }

        if (nodeCount > 10000) {
            score += 2;
            drivers.add("Massive Calculation Graph (>10k nodes)");
        } else if (nodeCount > 2000) {
            score += 1;
            drivers.add("High Calculation Density");
        }

        if (nodeCount > 0 && edgeCount > nodeCount * 1.5) {
            score += 1;
            drivers.add("High Inter-dependency Ratio");
        }

        return new ComplexityScore(Math.min(score, MAX_SCORE), String.join(", ", drivers));
    }
}
