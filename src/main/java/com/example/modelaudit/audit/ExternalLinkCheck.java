package com.example.modelaudit.audit;

import com.example.modelaudit.formula.ReferenceResolver;
import com.example.modelaudit.model.Issue;
import com.example.modelaudit.model.IssueType;
import com.example.modelaudit.model.Severity;

import java.util.ArrayList;
import java.util.List;

public class ExternalLinkCheck implements AuditCheck {
    private final IssueExplanations explanations;

    public ExternalLinkCheck(IssueExplanations explanations) {
        this.explanations = explanations;
    }

    @Override
    public String getName() {
        return "External links";
    }

    @Override
    public List<Issue> run(AuditContext context) {
        List<Issue> issues = new ArrayList<>();
        if (context.graph() == null) {
            return issues;
        }
        for (String node : context.graph().nodes()) {
            if (ReferenceResolver.isExternalNode(node)) {
                issues.add(explanations.issue(Severity.MEDIUM, IssueType.EXTERNAL_LINK, node,
                        "Dependency on external workbook/source detected."));
            }
        }
        return issues;
    }
}
