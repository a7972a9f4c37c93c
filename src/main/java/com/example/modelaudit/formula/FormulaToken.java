package com.example.modelaudit.formula;

public record FormulaToken(String value, TokenType type, ReferenceKind referenceKind, int position) {

    public static FormulaToken of(String value, TokenType type, int position) {
        return new FormulaToken(value, type, null, position);
    }

    public static FormulaToken reference(String value, ReferenceKind kind, int position) {
        return new FormulaToken(value, TokenType.OPERAND_REFERENCE, kind, position);
    }

    public boolean isCellReference() {
        return type == TokenType.OPERAND_REFERENCE && referenceKind == ReferenceKind.CELL_RANGE;
    }
}
