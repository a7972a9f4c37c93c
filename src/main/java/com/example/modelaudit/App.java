package com.example.modelaudit;

import com.example.modelaudit.config.AppConfig;
import com.example.modelaudit.file.ModelFileLocator;
import com.example.modelaudit.model.AuditSummary;
import com.example.modelaudit.model.Issue;
import com.example.modelaudit.model.ModelFile;
import com.example.modelaudit.model.Severity;

import java.nio.file.Path;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        App app = new App();
        try {
            app.run(args);
        } catch (Exception e) {
            LOGGER.error("Failed to audit model", e);
            System.exit(1);
        }
    }

    private void run(String[] args) {
        AppConfig config = new AppConfig();
        Path modelFile = args.length > 0 ? Paths.get(args[0]) : locateModel(config);

        LOGGER.info("Auditing model file: {}", modelFile);
        AuditSummary summary = new AuditPipeline(config).run(modelFile);
        logSummary(summary);
    }

    private Path locateModel(AppConfig config) {
        ModelFileLocator locator = new ModelFileLocator(config.getModelDirectory(), config.getModelFilePattern());
        return locator.findLatestModelFile()
                .map(ModelFile::path)
                .orElseThrow(() -> new IllegalStateException("No model files were found in " + config.getModelDirectory()));
    }

    private void logSummary(AuditSummary summary) {
        LOGGER.info("Model: {} ({} sheet(s), ingestion {})", summary.getModelName(),
                summary.getIngestionReport().totalSheets(), summary.getIngestionReport().status());
        summary.getIngestionReport().errors().forEach(error -> LOGGER.warn("Ingestion: {}", error));
        LOGGER.info("Formula cells: {}, graph nodes: {}, dependencies: {}, unparsed formulas: {}",
                summary.getFormulaCellCount(), summary.getGraphNodeCount(), summary.getGraphEdgeCount(),
                summary.getParseErrorCount());
        LOGGER.info("Circular references: {}{}, orphaned calculations: {}, density: {}",
                summary.getStructureStats().cyclesTruncated() ? ">= " : "",
                summary.getStructureStats().circularReferences(),
                summary.getStructureStats().orphanedCalculations().size(),
                String.format("%.3f", summary.getStructureStats().complexityScore()));
        LOGGER.info("Complexity score: {}/5 {}", summary.getComplexityScore().score(),
                summary.getComplexityScore().rationale().isEmpty()
                        ? "" : "(" + summary.getComplexityScore().rationale() + ")");
        LOGGER.info("Issues: {} critical, {} high, {} medium",
                summary.countBySeverity(Severity.CRITICAL),
                summary.countBySeverity(Severity.HIGH),
                summary.countBySeverity(Severity.MEDIUM));
        for (Issue issue : summary.getIssues()) {
            LOGGER.info("[{}] {} at {}: {}", issue.severity().getLabel(), issue.type().getLabel(),
                    issue.location(), issue.detail());
        }
    }
}
