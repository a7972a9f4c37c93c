package com.example.modelaudit.audit;

import com.example.modelaudit.graph.DependencyGraph;
import com.example.modelaudit.model.Issue;
import com.example.modelaudit.model.WorkbookTables;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A check that throws contributes no findings and does not stop the others.
 */
public class ModelAuditor {
    private static final Logger LOGGER = LoggerFactory.getLogger(ModelAuditor.class);

    private final AuditContext context;
    private final List<AuditCheck> checks;
    private final List<Issue> issues = new ArrayList<>();

    public ModelAuditor(WorkbookTables tables, DependencyGraph graph, List<AuditCheck> checks) {
        this(new AuditContext(tables, graph), checks);
    }

    public ModelAuditor(AuditContext context, List<AuditCheck> checks) {
        this.context = context;
        this.checks = List.copyOf(checks);
    }

    public List<Issue> runAllChecks() {
        LOGGER.info("Running {} audit check(s)", checks.size());
        issues.clear();
        for (AuditCheck check : checks) {
            try {
                List<Issue> found = check.run(context);
                issues.addAll(found);
                LOGGER.info("  {}: {} issue(s)", check.getName(), found.size());
            } catch (RuntimeException e) {
                LOGGER.warn("Check '{}' failed and was skipped", check.getName(), e);
            }
        }
        LOGGER.info("Audit complete. Found {} issue(s)", issues.size());
        return getIssues();
    }

    public List<Issue> getIssues() {
        return List.copyOf(issues);
    }
}
