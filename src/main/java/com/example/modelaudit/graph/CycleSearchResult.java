package com.example.modelaudit.graph;

import java.util.List;

/**
 * {@code count} is a lower bound when {@code truncated}.
 */
public record CycleSearchResult(int count, boolean truncated, List<List<String>> cycles) {

    public CycleSearchResult {
        cycles = List.copyOf(cycles);
    }
}
