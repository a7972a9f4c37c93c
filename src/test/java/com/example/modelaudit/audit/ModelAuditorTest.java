package com.example.modelaudit.audit;

import com.example.modelaudit.model.Issue;
import com.example.modelaudit.model.IssueType;
import com.example.modelaudit.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ModelAuditorTest {

    private static AuditCheck fixed(String name, Issue... issues) {
        return new AuditCheck() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public List<Issue> run(AuditContext context) {
                return List.of(issues);
            }
        };
    }

    private static AuditCheck failing() {
        return new AuditCheck() {
            @Override
            public String getName() {
                return "broken";
            }

            @Override
            public List<Issue> run(AuditContext context) {
                throw new IllegalStateException("boom");
            }
        };
    }

    @Test
    void whenRunAllChecks_givenFailingCheck_shouldKeepOtherFindingsInOrder() {
        Issue first = new Issue(Severity.MEDIUM, IssueType.EXTERNAL_LINK, "EXT_LINK:[a.xlsx]S!A1", "d", "", "", "");
        Issue second = new Issue(Severity.CRITICAL, IssueType.ACCOUNTING_MISMATCH, "BS", "d", "", "", "");

        ModelAuditor auditor = new ModelAuditor(null, null,
                List.of(fixed("first", first), failing(), fixed("second", second)));

        assertEquals(List.of(first, second), auditor.runAllChecks());
        assertEquals(List.of(first, second), auditor.getIssues());
    }

    @Test
    void whenRunAllChecks_givenNoChecks_shouldReturnEmptyList() {
        assertEquals(List.of(), new ModelAuditor(null, null, List.of()).runAllChecks());
    }

    @Test
    void whenRunAllChecks_givenSecondRun_shouldNotRepeatFindings() {
        Issue issue = new Issue(Severity.HIGH, IssueType.CALCULATION_ERROR, "Calc!Row1:Col1", "d", "", "", "");
        ModelAuditor auditor = new ModelAuditor(null, null, List.of(fixed("only", issue)));

        auditor.runAllChecks();

        assertEquals(List.of(issue), auditor.runAllChecks());
        assertEquals(List.of(issue), auditor.getIssues());
    }
}
