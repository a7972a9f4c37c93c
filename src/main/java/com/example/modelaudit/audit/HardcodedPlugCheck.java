package com.example.modelaudit.audit;

import com.example.modelaudit.model.CellRole;
import com.example.modelaudit.model.CellTable;
import com.example.modelaudit.model.CellValue;
import com.example.modelaudit.model.Issue;
import com.example.modelaudit.model.IssueType;
import com.example.modelaudit.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class HardcodedPlugCheck implements AuditCheck {
    public static final int DEFAULT_SKIP_COLUMNS = 3;
    public static final int DEFAULT_MIN_CELLS = 5;
    public static final double DEFAULT_FORMULA_RATIO = 0.7;
    public static final List<String> DEFAULT_EXCLUDED_SHEET_KEYWORDS = List.of("raw", "cache");

    private final IssueExplanations explanations;
    private final int skipColumns;
    private final int minCells;
    private final double formulaRatio;
    private final List<String> excludedSheetKeywords;

    public HardcodedPlugCheck(IssueExplanations explanations) {
        this(explanations, DEFAULT_SKIP_COLUMNS, DEFAULT_MIN_CELLS, DEFAULT_FORMULA_RATIO,
                DEFAULT_EXCLUDED_SHEET_KEYWORDS);
    }

    public HardcodedPlugCheck(IssueExplanations explanations,
                              int skipColumns,
                              int minCells,
                              double formulaRatio,
                              List<String> excludedSheetKeywords) {
        this.explanations = explanations;
        this.skipColumns = Math.max(0, skipColumns);
        this.minCells = minCells;
        this.formulaRatio = formulaRatio;
        this.excludedSheetKeywords = List.copyOf(excludedSheetKeywords);
    }

    @Override
    public String getName() {
        return "Hard-coded plugs";
    }

    @Override
    public List<Issue> run(AuditContext context) {
        List<Issue> issues = new ArrayList<>();
        if (context.tables() == null) {
            return issues;
        }
        for (Map.Entry<String, CellTable> entry : context.tables().getFormulaTables().entrySet()) {
            if (isExcluded(entry.getKey())) {
                continue;
            }
            CellTable table = entry.getValue();
            for (int row = 0; row < table.getRowCount(); row++) {
                checkRow(entry.getKey(), table, row, issues);
            }
        }
        return issues;
    }

    private void checkRow(String sheetName, CellTable table, int row, List<Issue> issues) {
        int formulaCount = 0;
        int totalCount = 0;
        List<Integer> plugColumns = new ArrayList<>();

        for (int col = skipColumns; col < table.getColumnCount(); col++) {
            CellValue value = table.get(row, col);
            if (value.isBlank()) {
                continue;
            }
            totalCount++;
            if (CellRole.of(value) == CellRole.FORMULA) {
                formulaCount++;
            } else {
                plugColumns.add(col + 1);
            }
        }

        if (totalCount <= minCells || plugColumns.isEmpty()) {
            return;
        }
        if ((double) formulaCount / totalCount <= formulaRatio) {
            return;
        }

        int hardcodeCount = totalCount - formulaCount;
        issues.add(explanations.issue(Severity.HIGH, IssueType.HARDCODED_PLUG,
                String.format("%s!Row%d", sheetName, row + 1),
                String.format("Row has %d formulas and %d hardcodes in projection columns. Plug at col(s): %s",
                        formulaCount, hardcodeCount, plugColumns)));
    }

    private boolean isExcluded(String sheetName) {
        String lower = sheetName.toLowerCase(Locale.ROOT);
        return excludedSheetKeywords.stream().anyMatch(lower::contains);
    }
}
