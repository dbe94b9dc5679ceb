package com.example.demo.formulaengine.model;

import com.example.demo.formulaengine.util.ColumnLetters;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Comparator;

/**
 * Immutable (sheet, column, row) coordinate of a cell. Column and row are 1-based.
 *
 * Natural order is sheet name, then row, then column. This is the order used whenever
 * the engine needs a deterministic tie-break (scheduler seeds, cycle fallback).
 */
@Getter
@EqualsAndHashCode
public final class CellAddress implements Comparable<CellAddress> {

    private static final Comparator<CellAddress> ORDER = Comparator
            .comparing(CellAddress::getSheet)
            .thenComparingInt(CellAddress::getRow)
            .thenComparingInt(CellAddress::getColumn);

    private final String sheet;
    private final int column;
    private final int row;

    public CellAddress(String sheet, int column, int row) {
        if (sheet == null) {
            throw new IllegalArgumentException("Sheet must not be null");
        }
        if (column < 1) {
            throw new IllegalArgumentException("Column must be >= 1, got " + column);
        }
        if (row < 1) {
            throw new IllegalArgumentException("Row must be >= 1, got " + row);
        }
        this.sheet = sheet;
        this.column = column;
        this.row = row;
    }

    public static CellAddress of(String sheet, int column, int row) {
        return new CellAddress(sheet, column, row);
    }

    public static CellAddress of(String sheet, String columnLetters, int row) {
        return new CellAddress(sheet, ColumnLetters.toIndex(columnLetters), row);
    }

    public String getColumnLetters() {
        return ColumnLetters.toLetters(column);
    }

    /** A1-style reference without the sheet, e.g. "D7". */
    public String toA1() {
        return getColumnLetters() + row;
    }

    public CellAddress withSheet(String otherSheet) {
        return new CellAddress(otherSheet, column, row);
    }

    @Override
    public int compareTo(CellAddress other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return sheet + "!" + toA1();
    }
}
