package com.example.modelaudit.formula;

public class FormulaParseException extends Exception {
    private final String formula;
    private final int position;

    public FormulaParseException(String formula, int position, String reason) {
        super("Invalid formula at position " + position + " (" + reason + "): " + formula);
        this.formula = formula;
        this.position = position;
    }

    public String getFormula() {
        return formula;
    }

    public int getPosition() {
        return position;
    }
}
