package com.example.modelaudit.formula;

public enum ReferenceKind {
    CELL_RANGE,
    NAMED,
    STRUCTURED,
    INVALID
}
