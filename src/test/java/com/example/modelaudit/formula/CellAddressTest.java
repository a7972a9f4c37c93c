package com.example.modelaudit.formula;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CellAddressTest {

    @Test
    void whenColumnLetters_givenIndex_shouldFollowSpreadsheetOrder() {
        assertEquals("A", CellAddress.columnLetters(0));
        assertEquals("Z", CellAddress.columnLetters(25));
        assertEquals("AA", CellAddress.columnLetters(26));
        assertEquals("AZ", CellAddress.columnLetters(51));
        assertEquals("XFD", CellAddress.columnLetters(16383));
    }

    @Test
    void whenColumnIndex_givenLetters_shouldInvertColumnLetters() {
        for (int col : new int[] {0, 1, 25, 26, 701, 702, 16383}) {
            assertEquals(col, CellAddress.columnIndex(CellAddress.columnLetters(col)));
        }
    }

    @Test
    void whenIsCellOrRange_givenAddresses_shouldRecogniseCellsAndRanges() {
        assertTrue(CellAddress.isCellOrRange("B7"));
        assertTrue(CellAddress.isCellOrRange("$B$7"));
        assertTrue(CellAddress.isCellOrRange("A1:C3"));
        assertTrue(CellAddress.isCellOrRange("A:A"));
        assertTrue(CellAddress.isCellOrRange("3:5"));
        assertFalse(CellAddress.isCellOrRange("Revenue"));
        assertFalse(CellAddress.isCellOrRange("A1:B"));
        assertFalse(CellAddress.isCellOrRange("A0"));
        assertFalse(CellAddress.isCellOrRange("A1:B2:C3"));
    }
}
