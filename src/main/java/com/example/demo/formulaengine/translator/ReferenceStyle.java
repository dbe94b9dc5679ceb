package com.example.demo.formulaengine.translator;

import com.example.demo.formulaengine.model.CellAddress;

/**
 * Decides how cell coordinates appear in generated code: as literals for a single cell, or as
 * expressions over a loop variable when one expression serves a whole group of cells.
 */
public interface ReferenceStyle {

    /** Expression yielding the column letters of a referenced column */
    String column(int column, boolean absolute);

    /** Expression yielding the 1-based index of a referenced column */
    String columnIndex(int column, boolean absolute);

    /** Expression yielding a referenced row number */
    String row(int row, boolean absolute);

    /** Row of the cell being evaluated */
    String currentRow();

    /** Column index of the cell being evaluated */
    String currentColumnIndex();

    /** Concrete cell this rendering is anchored at */
    CellAddress anchor();
}
