package com.example.modelaudit;

import com.example.modelaudit.config.AppConfig;
import com.example.modelaudit.model.AuditSummary;
import com.example.modelaudit.model.CellTable;
import com.example.modelaudit.model.ErrorCode;
import com.example.modelaudit.model.IngestedModel;
import com.example.modelaudit.model.IngestionReport;
import com.example.modelaudit.model.Issue;
import com.example.modelaudit.model.IssueType;
import com.example.modelaudit.model.Severity;
import com.example.modelaudit.model.TestWorkbooks;
import com.example.modelaudit.model.WorkbookTables;
import org.apache.poi.xssf.usermodel.XSSFRow;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AuditPipelineTest {

    @TempDir
    Path directory;

    private final AuditPipeline pipeline = new AuditPipeline(new AppConfig(new Properties()));

    @Test
    void whenRun_givenTablesWithEveryProblem_shouldReportEachCheckInOrder() {
        WorkbookTables tables = TestWorkbooks.fromFormulaTables(
                CellTable.ofObjects("Inputs",
                        new Object[] {"Price", 10, "=[Feed.xlsx]Prices!B2"},
                        new Object[] {"Margin", ErrorCode.REF, null}),
                CellTable.ofObjects("Model",
                        new Object[] {"Revenue", 1, 2, "=C1*1.1", "=D1*1.1", 50, "=F1*1.1", "=G1*1.1", "=H1*1.1"},
                        new Object[] {"Interest", "=B3", null},
                        new Object[] {"Debt", "=B2", null}),
                CellTable.ofObjects("Balance Sheet",
                        new Object[] {"Total Assets", null, 100, 200},
                        new Object[] {"Total Liabilities & Equity", null, 100, 150}));
        IngestedModel model = new IngestedModel("deal.xlsx", tables,
                new IngestionReport(3, tables.getSheetNames(), List.of()));

        AuditSummary summary = pipeline.run(model);

        List<IssueType> types = summary.getIssues().stream().map(Issue::type).toList();
        assertEquals(List.of(
                IssueType.EXTERNAL_LINK,
                IssueType.CALCULATION_ERROR,
                IssueType.HARDCODED_PLUG,
                IssueType.ACCOUNTING_MISMATCH,
                IssueType.CIRCULAR_REFERENCE), types);
        assertEquals(1, summary.countBySeverity(Severity.CRITICAL));
        assertEquals(3, summary.countBySeverity(Severity.HIGH));
        assertEquals(1, summary.countBySeverity(Severity.MEDIUM));

        assertEquals(1, summary.getStructureStats().circularReferences());
        assertFalse(summary.getStructureStats().cyclesTruncated());
        assertEquals(summary.getStructureStats().circularReferences(),
                summary.getIssues().stream().filter(issue -> issue.type() == IssueType.CIRCULAR_REFERENCE).count());
        assertEquals(0, summary.getParseErrorCount());
        assertEquals("deal.xlsx", summary.getModelName());
        assertTrue(summary.getComplexityScore().score() >= 1);
    }

    @Test
    void whenRun_givenWorkbookFile_shouldIngestAndAudit() throws IOException {
        Path file = directory.resolve("plan.xlsx");
        try (XSSFWorkbook workbook = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(file)) {
            XSSFSheet inputs = workbook.createSheet("Inputs");
            XSSFSheet calc = workbook.createSheet("Calc");
            inputs.createRow(0).createCell(0).setCellValue(5);
            XSSFRow row = calc.createRow(0);
            row.createCell(0).setCellFormula("B1+Inputs!A1");
            row.createCell(1).setCellFormula("A1*2");
            workbook.write(out);
        }

        AuditSummary summary = pipeline.run(file);

        assertEquals("plan.xlsx", summary.getModelName());
        assertEquals("Success", summary.getIngestionReport().status());
        assertEquals(2, summary.getFormulaCellCount());
        assertEquals(3, summary.getGraphNodeCount());
        assertEquals(3, summary.getGraphEdgeCount());
        assertEquals(1, summary.getStructureStats().circularReferences());
        assertEquals(List.of(IssueType.CIRCULAR_REFERENCE),
                summary.getIssues().stream().map(Issue::type).toList());
    }
}
