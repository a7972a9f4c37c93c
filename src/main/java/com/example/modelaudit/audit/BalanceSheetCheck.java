package com.example.modelaudit.audit;

import com.example.modelaudit.model.CellTable;
import com.example.modelaudit.model.CellValue;
import com.example.modelaudit.model.Issue;
import com.example.modelaudit.model.IssueType;
import com.example.modelaudit.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public class BalanceSheetCheck implements AuditCheck {
    public static final double DEFAULT_TOLERANCE = 1.0;

    private static final int LABEL_COLUMNS = 2;
    private static final double PERIOD_TOLERANCE = 0.01;
    private static final int MAX_LISTED_PERIODS = 5;

    private final IssueExplanations explanations;
    private final double tolerance;

    public BalanceSheetCheck(IssueExplanations explanations) {
        this(explanations, DEFAULT_TOLERANCE);
    }

    public BalanceSheetCheck(IssueExplanations explanations, double tolerance) {
        this.explanations = explanations;
        this.tolerance = tolerance;
    }

    @Override
    public String getName() {
        return "Balance sheet integrity";
    }

    @Override
    public List<Issue> run(AuditContext context) {
        if (context.tables() == null) {
            return List.of();
        }
        Optional<String> sheetName = findBalanceSheet(context.tables().getSheetNames());
        if (sheetName.isEmpty()) {
            return List.of();
        }
        CellTable table = context.tables().getValueTables().get(sheetName.get());

        int assetsRow = -1;
        int liabilitiesEquityRow = -1;
        for (int col = 0; col < LABEL_COLUMNS; col++) {
            for (int row = 0; row < table.getRowCount(); row++) {
                String label = table.get(row, col).displayText().toLowerCase(Locale.ROOT);
                if (label.contains("total assets")) {
                    assetsRow = row;
                }
                if (label.contains("total liabilities") && label.contains("equity")) {
                    liabilitiesEquityRow = row;
                }
            }
        }
        if (assetsRow < 0 || liabilitiesEquityRow < 0) {
            return List.of();
        }

        double totalVariance = 0;
        List<Integer> problemPeriods = new ArrayList<>();
        for (int col = LABEL_COLUMNS; col < table.getColumnCount(); col++) {
            CellValue assets = table.get(assetsRow, col);
            CellValue liabilitiesEquity = table.get(liabilitiesEquityRow, col);
            double variance = Math.abs(assets.numericValue() - liabilitiesEquity.numericValue());
            totalVariance += variance;
            if (variance > PERIOD_TOLERANCE) {
                problemPeriods.add(col);
            }
        }
        if (totalVariance <= tolerance) {
            return List.of();
        }

        List<Integer> listed = problemPeriods.subList(0, Math.min(MAX_LISTED_PERIODS, problemPeriods.size()));
        String detail = String.format(Locale.US,
                "Balance Sheet does not balance. Total Variance: $%,.2f. Out-of-balance periods: %s%s",
                totalVariance, listed, problemPeriods.size() > MAX_LISTED_PERIODS ? "..." : "");
        return List.of(explanations.issue(Severity.CRITICAL, IssueType.ACCOUNTING_MISMATCH, sheetName.get(), detail));
    }

    static Optional<String> findBalanceSheet(List<String> sheetNames) {
        return sheetNames.stream()
                .filter(name -> {
                    String lower = name.toLowerCase(Locale.ROOT);
                    return lower.contains("balance") || lower.contains("bs");
                })
                .findFirst();
    }
}
