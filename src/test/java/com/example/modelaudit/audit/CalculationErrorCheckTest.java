package com.example.modelaudit.audit;

import com.example.modelaudit.model.CellTable;
import com.example.modelaudit.model.ErrorCode;
import com.example.modelaudit.model.Issue;
import com.example.modelaudit.model.IssueType;
import com.example.modelaudit.model.Severity;
import com.example.modelaudit.model.TestWorkbooks;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CalculationErrorCheckTest {

    private final CalculationErrorCheck check = new CalculationErrorCheck(IssueExplanations.getDefault());

    @Test
    void whenRun_givenErrorCells_shouldReportFlaggedCodesOnly() {
        CellTable calc = CellTable.ofObjects("Calc",
                new Object[] {"Margin", ErrorCode.REF, 10},
                new Object[] {"Growth", "#DIV/0!", ErrorCode.NA},
                new Object[] {"Note", "see #VALUE! above", ErrorCode.NUM});

        List<Issue> issues = check.run(new AuditContext(TestWorkbooks.fromValueTables(calc), null));

        assertEquals(3, issues.size());
        Issue first = issues.get(0);
        assertEquals(Severity.HIGH, first.severity());
        assertEquals(IssueType.CALCULATION_ERROR, first.type());
        assertEquals("Calc!Row1:Col2", first.location());
        assertEquals("Cell contains error value: #REF!", first.detail());
        assertTrue(first.cause().contains("deleted"), first.cause());

        assertEquals("Calc!Row2:Col2", issues.get(1).location());
        assertTrue(issues.get(1).cause().contains("dividing by zero"), issues.get(1).cause());
        assertEquals("Calc!Row3:Col2", issues.get(2).location());
        assertEquals("Cell contains error value: see #VALUE! above", issues.get(2).detail());
    }

    @Test
    void whenRun_givenCleanSheets_shouldReportNothing() {
        CellTable calc = CellTable.ofObjects("Calc", new Object[] {"Revenue", 1, 2, 3});

        assertTrue(check.run(new AuditContext(TestWorkbooks.fromValueTables(calc), null)).isEmpty());
    }
}
