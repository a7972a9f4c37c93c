package com.example.modelaudit.audit;

import com.example.modelaudit.model.CellTable;
import com.example.modelaudit.model.CellValue;
import com.example.modelaudit.model.ErrorCode;
import com.example.modelaudit.model.Issue;
import com.example.modelaudit.model.IssueType;
import com.example.modelaudit.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class CalculationErrorCheck implements AuditCheck {
    static final List<ErrorCode> FLAGGED_ERRORS = List.of(
            ErrorCode.REF, ErrorCode.NAME, ErrorCode.VALUE, ErrorCode.DIV_ZERO);

    private final IssueExplanations explanations;

    public CalculationErrorCheck(IssueExplanations explanations) {
        this.explanations = explanations;
    }

    @Override
    public String getName() {
        return "Calculation errors";
    }

    @Override
    public List<Issue> run(AuditContext context) {
        List<Issue> issues = new ArrayList<>();
        if (context.tables() == null) {
            return issues;
        }
        for (Map.Entry<String, CellTable> entry : context.tables().getValueTables().entrySet()) {
            CellTable table = entry.getValue();
            for (int row = 0; row < table.getRowCount(); row++) {
                for (int col = 0; col < table.getColumnCount(); col++) {
                    ErrorCode errorCode = flaggedError(table.get(row, col));
                    if (errorCode == null) {
                        continue;
                    }
                    String location = String.format("%s!Row%d:Col%d", entry.getKey(), row + 1, col + 1);
                    issues.add(explanations.issue(Severity.HIGH, IssueType.CALCULATION_ERROR, location,
                            "Cell contains error value: " + table.get(row, col).displayText(), errorCode));
                }
            }
        }
        return issues;
    }

    private ErrorCode flaggedError(CellValue value) {
        if (value.isError()) {
            return FLAGGED_ERRORS.contains(value.getErrorCode()) ? value.getErrorCode() : null;
        }
        if (value.getKind() == CellValue.Kind.TEXT) {
            for (ErrorCode errorCode : FLAGGED_ERRORS) {
                if (value.getText().contains(errorCode.getCode())) {
                    return errorCode;
                }
            }
        }
        return null;
    }
}
