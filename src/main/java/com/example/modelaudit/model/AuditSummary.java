package com.example.modelaudit.model;

import com.example.modelaudit.graph.ComplexityScore;
import com.example.modelaudit.graph.StructureStats;

import java.time.OffsetDateTime;
import java.util.List;

public class AuditSummary {
    private final String modelName;
    private final IngestionReport ingestionReport;
    private final int formulaCellCount;
    private final int parseErrorCount;
    private final int graphNodeCount;
    private final int graphEdgeCount;
    private final StructureStats structureStats;
    private final ComplexityScore complexityScore;
    private final List<Issue> issues;
    private final OffsetDateTime generatedAt;

    public AuditSummary(String modelName,
                        IngestionReport ingestionReport,
                        int formulaCellCount,
                        int parseErrorCount,
                        int graphNodeCount,
                        int graphEdgeCount,
                        StructureStats structureStats,
                        ComplexityScore complexityScore,
                        List<Issue> issues,
                        OffsetDateTime generatedAt) {
        this.modelName = modelName;
        this.ingestionReport = ingestionReport;
        this.formulaCellCount = formulaCellCount;
        this.parseErrorCount = parseErrorCount;
        this.graphNodeCount = graphNodeCount;
        this.graphEdgeCount = graphEdgeCount;
        this.structureStats = structureStats;
        this.complexityScore = complexityScore;
        this.issues = List.copyOf(issues);
        this.generatedAt = generatedAt;
    }

    public String getModelName() {
        return modelName;
    }

    public IngestionReport getIngestionReport() {
        return ingestionReport;
    }

    public int getFormulaCellCount() {
        return formulaCellCount;
    }

    public int getParseErrorCount() {
        return parseErrorCount;
    }

    public int getGraphNodeCount() {
        return graphNodeCount;
    }

    public int getGraphEdgeCount() {
        return graphEdgeCount;
    }

    public StructureStats getStructureStats() {
        return structureStats;
    }

    public ComplexityScore getComplexityScore() {
        return complexityScore;
    }

    public List<Issue> getIssues() {
        return issues;
    }

    public OffsetDateTime getGeneratedAt() {
        return generatedAt;
    }

    public long countBySeverity(Severity severity) {
        return issues.stream()
                .filter(issue -> issue.severity() == severity)
                .count();
    }
}
