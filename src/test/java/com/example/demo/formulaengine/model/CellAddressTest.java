package com.example.demo.formulaengine.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Value semantics and validation of cell addresses.
 */
public class CellAddressTest {

    @Test
    public void testStructuralEquality() {
        CellAddress a = CellAddress.of("Sheet1", "D", 7);
        CellAddress b = new CellAddress("Sheet1", 4, 7);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());

        Set<CellAddress> set = new HashSet<>(Arrays.asList(a, b, CellAddress.of("Sheet2", 4, 7)));
        assertEquals(2, set.size());
    }

    @Test
    public void testNaturalOrderIsSheetThenRowThenColumn() {
        List<CellAddress> cells = new ArrayList<>(Arrays.asList(
                CellAddress.of("B", 1, 1),
                CellAddress.of("A", 2, 2),
                CellAddress.of("A", 1, 2),
                CellAddress.of("A", 5, 1)));
        Collections.sort(cells);
        assertEquals(Arrays.asList(
                CellAddress.of("A", 5, 1),
                CellAddress.of("A", 1, 2),
                CellAddress.of("A", 2, 2),
                CellAddress.of("B", 1, 1)), cells);
    }

    @Test
    public void testInvalidCoordinatesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> CellAddress.of("Sheet1", 0, 1));
        assertThrows(IllegalArgumentException.class, () -> CellAddress.of("Sheet1", 1, 0));
        assertThrows(IllegalArgumentException.class, () -> CellAddress.of(null, 1, 1));
    }

    @Test
    public void testRendering() {
        CellAddress cell = CellAddress.of("Data", 28, 10);
        assertEquals("AB", cell.getColumnLetters());
        assertEquals("AB10", cell.toA1());
        assertEquals("Data!AB10", cell.toString());
        assertEquals(CellAddress.of("Other", 28, 10), cell.withSheet("Other"));
    }
}
