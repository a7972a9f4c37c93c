package com.example.modelaudit.formula;

public enum TokenType {
    OPERAND_LITERAL,
    OPERAND_REFERENCE,
    OPERATOR,
    FUNCTION,
    PAREN_OPEN,
    PAREN_CLOSE,
    ARRAY_OPEN,
    ARRAY_CLOSE,
    SEPARATOR
}
