package com.example.modelaudit.model;

public enum CellRole {
    LITERAL,
    FORMULA,
    PARSE_ERROR;

    public static CellRole of(CellValue value) {
        if (value == null) {
            return LITERAL;
        }
        if (value.isFormula()) {
            return FORMULA;
        }
        if (value.getKind() == CellValue.Kind.TEXT && value.getText().startsWith("=")) {
            return FORMULA;
        }
        return LITERAL;
    }
}
