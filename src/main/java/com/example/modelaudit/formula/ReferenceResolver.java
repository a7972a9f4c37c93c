package com.example.modelaudit.formula;

/**
 * Node identities are {@code Sheet!ADDRESS} or {@code EXT_LINK:<raw text>}. Ranges stay a
 * single identity.
 */
public class ReferenceResolver {
    public static final String EXTERNAL_PREFIX = "EXT_LINK:";
    public static final char SHEET_SEPARATOR = '!';

    public String resolve(String reference, String currentSheet) {
        if (reference == null || reference.isEmpty()) {
            throw new IllegalArgumentException("Reference text is required");
        }
        if (isExternal(reference)) {
            return EXTERNAL_PREFIX + reference;
        }

        int bang = FormulaTokenizer.lastBangOutsideQuotes(reference);
        String sheet = currentSheet;
        String address = reference;
        if (bang >= 0) {
            String qualifier = unquoteSheetName(reference.substring(0, bang));
            if (!qualifier.isEmpty()) {
                sheet = qualifier;
            }
            address = reference.substring(bang + 1);
        }
        return sheet + SHEET_SEPARATOR + CellAddress.normalize(address);
    }

    public String nodeId(String sheet, int row, int column) {
        return sheet + SHEET_SEPARATOR + CellAddress.toAddress(row, column);
    }

    public static boolean isExternal(String reference) {
        int open = reference.indexOf('[');
        return open >= 0 && reference.indexOf(']', open) > open;
    }

    public static boolean isExternalNode(String nodeId) {
        return nodeId != null && nodeId.startsWith(EXTERNAL_PREFIX);
    }

    static String unquoteSheetName(String qualifier) {
        if (qualifier.length() >= 2 && qualifier.startsWith("'") && qualifier.endsWith("'")) {
            return qualifier.substring(1, qualifier.length() - 1).replace("''", "'");
        }
        return qualifier;
    }
}
