package com.example.modelaudit.audit;

import com.example.modelaudit.graph.CycleFinder;
import com.example.modelaudit.graph.CycleSearchResult;
import com.example.modelaudit.model.Issue;
import com.example.modelaudit.model.IssueType;
import com.example.modelaudit.model.Severity;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CircularReferenceCheck implements AuditCheck {
    private static final Logger LOGGER = LoggerFactory.getLogger(CircularReferenceCheck.class);
    public static final int DEFAULT_MAX_REPORTED = 25;

    private final IssueExplanations explanations;
    private final CycleFinder cycleFinder;
    private final int maxReported;

    public CircularReferenceCheck(IssueExplanations explanations, CycleFinder cycleFinder, int maxReported) {
        this.explanations = explanations;
        this.cycleFinder = cycleFinder;
        this.maxReported = maxReported;
    }

    @Override
    public String getName() {
        return "Circular references";
    }

    @Override
    public List<Issue> run(AuditContext context) {
        List<Issue> issues = new ArrayList<>();
        if (context.graph() == null || maxReported <= 0) {
            return issues;
        }
        CycleSearchResult result = context.cycles() != null
                ? context.cycles()
                : cycleFinder.find(context.graph(), maxReported);
        for (List<String> cycle : result.cycles().subList(0, Math.min(maxReported, result.cycles().size()))) {
            List<String> chain = new ArrayList<>(cycle);
            chain.add(cycle.get(0));
            issues.add(explanations.issue(Severity.HIGH, IssueType.CIRCULAR_REFERENCE, cycle.get(0),
                    "Circular dependency chain: " + String.join(" -> ", chain)));
        }
        if (result.count() > issues.size()) {
            LOGGER.info("{}{} circular reference(s) found, {} reported",
                    result.truncated() ? "At least " : "", result.count(), issues.size());
        }
        return issues;
    }
}
