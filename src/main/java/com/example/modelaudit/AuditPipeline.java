package com.example.modelaudit;

import com.example.modelaudit.audit.AuditCheck;
import com.example.modelaudit.audit.AuditContext;
import com.example.modelaudit.audit.BalanceSheetCheck;
import com.example.modelaudit.audit.CalculationErrorCheck;
import com.example.modelaudit.audit.CircularReferenceCheck;
import com.example.modelaudit.audit.ExternalLinkCheck;
import com.example.modelaudit.audit.HardcodedPlugCheck;
import com.example.modelaudit.audit.IssueExplanations;
import com.example.modelaudit.audit.ModelAuditor;
import com.example.modelaudit.config.AppConfig;
import com.example.modelaudit.data.ModelIngestor;
import com.example.modelaudit.graph.ComplexityScore;
import com.example.modelaudit.graph.ComplexityScorer;
import com.example.modelaudit.graph.CycleFinder;
import com.example.modelaudit.graph.CycleSearchResult;
import com.example.modelaudit.graph.DependencyGraph;
import com.example.modelaudit.graph.DependencyGraphBuilder;
import com.example.modelaudit.graph.StructuralAnalyzer;
import com.example.modelaudit.graph.StructureStats;
import com.example.modelaudit.model.AuditSummary;
import com.example.modelaudit.model.IngestedModel;
import com.example.modelaudit.model.Issue;

import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.List;

public class AuditPipeline {
    private final AppConfig config;
    private final IssueExplanations explanations;

    public AuditPipeline(AppConfig config) {
        this(config, IssueExplanations.getDefault());
    }

    public AuditPipeline(AppConfig config, IssueExplanations explanations) {
        this.config = config;
        this.explanations = explanations;
    }

    public AuditSummary run(Path modelFile) {
        IngestedModel model = new ModelIngestor().ingest(modelFile);
        return run(model);
    }

    public AuditSummary run(IngestedModel model) {
        DependencyGraphBuilder builder = new DependencyGraphBuilder(config.getGraphBuildThreads());
        DependencyGraph graph = builder.build(model.tables().getFormulaTables());

        CycleFinder cycleFinder = new CycleFinder(config.getMaxCycles(), config.getCycleSearchTimeout());
        CycleSearchResult cycles = cycleFinder.find(graph, config.getMaxReportedCircularReferences());
        StructureStats stats = new StructuralAnalyzer(cycleFinder).analyze(graph, cycles);

        ModelAuditor auditor = new ModelAuditor(new AuditContext(model.tables(), graph, cycles),
                createChecks(cycleFinder));
        List<Issue> issues = auditor.runAllChecks();

        ComplexityScore complexity = new ComplexityScorer().score(model.tables().getSheetCount(), graph);

        return new AuditSummary(
                model.modelName(),
                model.report(),
                builder.getNodeCount(),
                builder.getParseErrorCount(),
                graph.nodeCount(),
                graph.edgeCount(),
                stats,
                complexity,
                issues,
                OffsetDateTime.now());
    }

    List<AuditCheck> createChecks(CycleFinder cycleFinder) {
        return List.of(
                new ExternalLinkCheck(explanations),
                new CalculationErrorCheck(explanations),
                new HardcodedPlugCheck(explanations,
                        config.getPlugSkipColumns(),
                        config.getPlugMinCells(),
                        config.getPlugFormulaRatio(),
                        config.getPlugExcludedSheetKeywords()),
                new BalanceSheetCheck(explanations, config.getBalanceTolerance()),
                new CircularReferenceCheck(explanations, cycleFinder, config.getMaxReportedCircularReferences()));
    }
}
