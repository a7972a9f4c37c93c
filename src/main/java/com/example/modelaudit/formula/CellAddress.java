package com.example.modelaudit.formula;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class CellAddress {
    public static final int MAX_COLUMNS = 16384;
    public static final int MAX_ROWS = 1048576;

    private static final Pattern CELL = Pattern.compile("\\$?([A-Za-z]{1,3})\\$?([0-9]{1,7})");
    private static final Pattern COLUMN = Pattern.compile("\\$?([A-Za-z]{1,3})");
    private static final Pattern ROW = Pattern.compile("\\$?([0-9]{1,7})");

    private CellAddress() {
    }

    public static String columnLetters(int columnIndex) {
        if (columnIndex < 0) {
            throw new IllegalArgumentException("Column index must not be negative: " + columnIndex);
        }
        StringBuilder letters = new StringBuilder();
        int remaining = columnIndex + 1;
        while (remaining > 0) {
            int digit = (remaining - 1) % 26;
            letters.insert(0, (char) ('A' + digit));
            remaining = (remaining - 1) / 26;
        }
        return letters.toString();
    }

    public static int columnIndex(String letters) {
        if (letters == null || letters.isEmpty()) {
            throw new IllegalArgumentException("Column letters are required");
        }
        int result = 0;
        for (int i = 0; i < letters.length(); i++) {
            char c = Character.toUpperCase(letters.charAt(i));
            if (c < 'A' || c > 'Z') {
                throw new IllegalArgumentException("Invalid column letters: " + letters);
            }
            result = result * 26 + (c - 'A' + 1);
        }
        return result - 1;
    }

    public static String toAddress(int row, int column) {
        if (row < 0) {
            throw new IllegalArgumentException("Row index must not be negative: " + row);
        }
        return columnLetters(column) + (row + 1);
    }

    public static boolean isCellOrRange(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        int colon = text.indexOf(':');
        if (colon < 0) {
            return isCell(text);
        }
        if (text.indexOf(':', colon + 1) >= 0) {
            return false;
        }
        String start = text.substring(0, colon);
        String end = text.substring(colon + 1);
        return (isCell(start) && isCell(end))
                || (isColumn(start) && isColumn(end))
                || (isRow(start) && isRow(end));
    }

    public static String normalize(String text) {
        if (!isCellOrRange(text)) {
            return text;
        }
        return text.replace("$", "").toUpperCase(Locale.ROOT);
    }

    private static boolean isCell(String text) {
        Matcher matcher = CELL.matcher(text);
        return matcher.matches() && validColumn(matcher.group(1)) && validRow(matcher.group(2));
    }

    private static boolean isColumn(String text) {
        Matcher matcher = COLUMN.matcher(text);
        return matcher.matches() && validColumn(matcher.group(1));
    }

    private static boolean isRow(String text) {
        Matcher matcher = ROW.matcher(text);
        return matcher.matches() && validRow(matcher.group(1));
    }

    private static boolean validColumn(String letters) {
        return columnIndex(letters) < MAX_COLUMNS;
    }

    private static boolean validRow(String digits) {
        long row = Long.parseLong(digits);
        return row >= 1 && row <= MAX_ROWS;
    }
}
