package com.example.demo.formulaengine.translator;

import com.example.demo.formulaengine.model.CellAddress;
import com.example.demo.formulaengine.util.ColumnLetters;
import com.example.demo.formulaengine.util.PythonLiterals;

/**
 * Renders every coordinate as a literal. Used for cells evaluated on their own.
 */
public class AbsoluteReferenceStyle implements ReferenceStyle {

    private final CellAddress cell;

    public AbsoluteReferenceStyle(CellAddress cell) {
        this.cell = cell;
    }

    @Override
    public String column(int column, boolean absolute) {
        return PythonLiterals.string(ColumnLetters.toLetters(column));
    }

    @Override
    public String columnIndex(int column, boolean absolute) {
        return Integer.toString(column);
    }

    @Override
    public String row(int row, boolean absolute) {
        return Integer.toString(row);
    }

    @Override
    public String currentRow() {
        return Integer.toString(cell.getRow());
    }

    @Override
    public String currentColumnIndex() {
        return Integer.toString(cell.getColumn());
    }

    @Override
    public CellAddress anchor() {
        return cell;
    }
}
