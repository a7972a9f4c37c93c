package com.example.modelaudit.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class CellTable {
    private final String sheetName;
    private final int rowCount;
    private final int columnCount;
    private final CellValue[][] cells;

    private CellTable(String sheetName, CellValue[][] cells, int columnCount) {
        this.sheetName = sheetName;
        this.rowCount = cells.length;
        this.columnCount = columnCount;
        this.cells = cells;
    }

    public static CellTable of(String sheetName, List<? extends List<CellValue>> rows) {
        Objects.requireNonNull(sheetName, "sheetName");
        int width = 0;
        for (List<CellValue> row : rows) {
            if (row != null) {
                width = Math.max(width, row.size());
            }
        }
        CellValue[][] grid = new CellValue[rows.size()][width];
        for (int r = 0; r < rows.size(); r++) {
            List<CellValue> row = rows.get(r);
            for (int c = 0; c < width; c++) {
                CellValue value = row != null && c < row.size() ? row.get(c) : null;
                grid[r][c] = value == null ? CellValue.blank() : value;
            }
        }
        return new CellTable(sheetName, grid, width);
    }

    public static CellTable ofObjects(String sheetName, Object[]... rows) {
        List<List<CellValue>> converted = new ArrayList<>(rows.length);
        for (Object[] row : rows) {
            List<CellValue> values = new ArrayList<>(row.length);
            for (Object item : row) {
                values.add(toCellValue(item));
            }
            converted.add(values);
        }
        return of(sheetName, converted);
    }

    private static CellValue toCellValue(Object item) {
        if (item == null) {
            return CellValue.blank();
        }
        if (item instanceof CellValue) {
            return (CellValue) item;
        }
        if (item instanceof Number) {
            return CellValue.number(((Number) item).doubleValue());
        }
        if (item instanceof ErrorCode) {
            return CellValue.error((ErrorCode) item);
        }
        String text = item.toString();
        if (text.startsWith("=")) {
            return CellValue.formula(text);
        }
        return ErrorCode.fromCode(text)
                .map(CellValue::error)
                .orElseGet(() -> CellValue.text(text));
    }

    public String getSheetName() {
        return sheetName;
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columnCount;
    }

    public CellValue get(int row, int column) {
        if (row < 0 || row >= rowCount || column < 0 || column >= columnCount) {
            return CellValue.blank();
        }
        return cells[row][column];
    }

    public boolean hasSameShape(CellTable other) {
        return other != null && rowCount == other.rowCount && columnCount == other.columnCount;
    }
}
