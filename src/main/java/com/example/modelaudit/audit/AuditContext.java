package com.example.modelaudit.audit;

import com.example.modelaudit.graph.CycleSearchResult;
import com.example.modelaudit.graph.DependencyGraph;
import com.example.modelaudit.model.WorkbookTables;

/**
 * {@code cycles} is null when no cycle search has been run yet.
 */
public record AuditContext(WorkbookTables tables, DependencyGraph graph, CycleSearchResult cycles) {

    public AuditContext(WorkbookTables tables, DependencyGraph graph) {
        this(tables, graph, null);
    }
}
