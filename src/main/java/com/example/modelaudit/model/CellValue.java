package com.example.modelaudit.model;

import java.util.Objects;

public final class CellValue {

    public enum Kind {
        NUMBER,
        TEXT,
        ERROR,
        BLANK,
        FORMULA
    }

    private static final CellValue BLANK = new CellValue(Kind.BLANK, 0d, null, null);

    private final Kind kind;
    private final double number;
    private final String text;
    private final ErrorCode errorCode;

    private CellValue(Kind kind, double number, String text, ErrorCode errorCode) {
        this.kind = kind;
        this.number = number;
        this.text = text;
        this.errorCode = errorCode;
    }

    public static CellValue number(double value) {
        return new CellValue(Kind.NUMBER, value, null, null);
    }

    public static CellValue text(String value) {
        if (value == null) {
            return BLANK;
        }
        return new CellValue(Kind.TEXT, 0d, value, null);
    }

    public static CellValue error(ErrorCode errorCode) {
        return new CellValue(Kind.ERROR, 0d, null, Objects.requireNonNull(errorCode, "errorCode"));
    }

    public static CellValue blank() {
        return BLANK;
    }

    public static CellValue formula(String source) {
        Objects.requireNonNull(source, "source");
        String text = source.startsWith("=") ? source : "=" + source;
        return new CellValue(Kind.FORMULA, 0d, text, null);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isBlank() {
        return kind == Kind.BLANK;
    }

    public boolean isFormula() {
        return kind == Kind.FORMULA;
    }

    public boolean isError() {
        return kind == Kind.ERROR;
    }

    public double getNumber() {
        return number;
    }

    public String getText() {
        return text;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Numbers as-is, numeric text parsed, everything else 0.
     */
    public double numericValue() {
        switch (kind) {
            case NUMBER:
                return number;
            case TEXT:
                try {
                    double parsed = Double.parseDouble(text.trim().replace(",", ""));
                    return Double.isFinite(parsed) ? parsed : 0d;
                } catch (NumberFormatException e) {
                    return 0d;
                }
            default:
                return 0d;
        }
    }

    public String displayText() {
        switch (kind) {
            case NUMBER:
                if (number == Math.rint(number) && !Double.isInfinite(number)) {
                    return String.valueOf((long) number);
                }
                return String.valueOf(number);
            case TEXT:
            case FORMULA:
                return text;
            case ERROR:
                return errorCode.getCode();
            default:
                return "";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellValue)) {
            return false;
        }
        CellValue other = (CellValue) o;
        return kind == other.kind
                && Double.compare(number, other.number) == 0
                && Objects.equals(text, other.text)
                && errorCode == other.errorCode;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, number, text, errorCode);
    }

    @Override
    public String toString() {
        return kind + "(" + displayText() + ")";
    }
}
