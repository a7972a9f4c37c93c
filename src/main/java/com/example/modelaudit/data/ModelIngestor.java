package com.example.modelaudit.data;

import com.example.modelaudit.model.CellTable;
import com.example.modelaudit.model.CellValue;
import com.example.modelaudit.model.ErrorCode;
import com.example.modelaudit.model.IngestedModel;
import com.example.modelaudit.model.IngestionReport;
import com.example.modelaudit.model.WorkbookTables;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.FormulaError;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ModelIngestor {
    private static final Logger LOGGER = LoggerFactory.getLogger(ModelIngestor.class);

    public IngestedModel ingest(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ModelIngestionException("Model file not found: " + path);
        }
        String modelName = path.getFileName().toString();
        LOGGER.info("Starting ingestion for: {}", modelName);

        try (Workbook workbook = WorkbookFactory.create(path.toFile(), null, true)) {
            return read(workbook, modelName);
        } catch (IOException | RuntimeException e) {
            throw new ModelIngestionException("Failed to read workbook: " + path, e);
        }
    }

    IngestedModel read(Workbook workbook, String modelName) {
        Map<String, CellTable> valueTables = new LinkedHashMap<>();
        Map<String, CellTable> formulaTables = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();

        LOGGER.info("Processing {} sheet(s)", workbook.getNumberOfSheets());
        for (Sheet sheet : workbook) {
            String sheetName = sheet.getSheetName();
            try {
                SheetTables tables = convertSheet(sheet);
                valueTables.put(sheetName, tables.values());
                formulaTables.put(sheetName, tables.formulas());
            } catch (RuntimeException e) {
                String message = String.format("Failed to parse sheet '%s': %s", sheetName, e.getMessage());
                errors.add(message);
                LOGGER.warn(message, e);
            }
        }

        IngestionReport report = new IngestionReport(valueTables.size(), List.copyOf(valueTables.keySet()), errors);
        LOGGER.info("Ingestion finished with status {} ({} sheet(s) loaded)", report.status(), report.totalSheets());
        return new IngestedModel(modelName, new WorkbookTables(valueTables, formulaTables), report);
    }

    SheetTables convertSheet(Sheet sheet) {
        List<List<CellValue>> valueRows = new ArrayList<>();
        List<List<CellValue>> formulaRows = new ArrayList<>();

        int lastRow = sheet.getPhysicalNumberOfRows() == 0 ? -1 : sheet.getLastRowNum();
        for (int rowIndex = 0; rowIndex <= lastRow; rowIndex++) {
            Row row = sheet.getRow(rowIndex);
            List<CellValue> values = new ArrayList<>();
            List<CellValue> formulas = new ArrayList<>();
            int lastCell = row == null ? 0 : Math.max(0, row.getLastCellNum());
            for (int cellIndex = 0; cellIndex < lastCell; cellIndex++) {
                Cell cell = row.getCell(cellIndex);
                values.add(toValue(cell));
                formulas.add(toFormula(cell));
            }
            valueRows.add(values);
            formulaRows.add(formulas);
        }

        String sheetName = sheet.getSheetName();
        return new SheetTables(CellTable.of(sheetName, valueRows), CellTable.of(sheetName, formulaRows));
    }

    private CellValue toFormula(Cell cell) {
        if (cell == null) {
            return CellValue.blank();
        }
        if (cell.getCellType() == CellType.FORMULA) {
            return CellValue.formula(cell.getCellFormula());
        }
        return toLiteral(cell, cell.getCellType());
    }

    private CellValue toValue(Cell cell) {
        if (cell == null) {
            return CellValue.blank();
        }
        CellType type = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();
        return toLiteral(cell, type);
    }

    private CellValue toLiteral(Cell cell, CellType type) {
        switch (type) {
            case NUMERIC:
                return CellValue.number(cell.getNumericCellValue());
            case STRING:
                return CellValue.text(cell.getStringCellValue());
            case BOOLEAN:
                return CellValue.text(cell.getBooleanCellValue() ? "TRUE" : "FALSE");
            case ERROR:
                return toError(cell.getErrorCellValue());
            default:
                return CellValue.blank();
        }
    }

    private CellValue toError(byte code) {
        try {
            String text = FormulaError.forInt(code).getString();
            return ErrorCode.fromCode(text)
                    .map(CellValue::error)
                    .orElseGet(() -> CellValue.text(text));
        } catch (IllegalArgumentException e) {
            LOGGER.debug("Unknown error code {} treated as text", code);
            return CellValue.text("#ERROR(" + code + ")");
        }
    }

    record SheetTables(CellTable values, CellTable formulas) {
    }
}
