package com.example.demo.formulaengine.translator;

import com.example.demo.formulaengine.model.CellAddress;
import com.example.demo.formulaengine.model.GroupDirection;
import com.example.demo.formulaengine.util.ColumnLetters;
import com.example.demo.formulaengine.util.PythonLiterals;

/**
 * Renders relative coordinates along the loop axis as offsets from the loop variable.
 *
 * Vertical groups iterate {@code _r} over rows, horizontal groups iterate {@code _ci} over
 * column indexes. Offsets are measured from the anchor cell, which must be the group member
 * whose formula is being rendered. Absolute axes and the axis the group does not move along
 * stay literal.
 */
public class LoopReferenceStyle implements ReferenceStyle {

    public static final String ROW_VARIABLE = "_r";
    public static final String COLUMN_VARIABLE = "_ci";

    private final GroupDirection direction;
    private final CellAddress anchor;

    public LoopReferenceStyle(GroupDirection direction, CellAddress anchor) {
        this.direction = direction;
        this.anchor = anchor;
    }

    @Override
    public String column(int column, boolean absolute) {
        if (absolute || direction == GroupDirection.VERTICAL) {
            return PythonLiterals.string(ColumnLetters.toLetters(column));
        }
        return "_cl(" + offset(COLUMN_VARIABLE, column - anchor.getColumn()) + ")";
    }

    @Override
    public String columnIndex(int column, boolean absolute) {
        if (absolute || direction == GroupDirection.VERTICAL) {
            return Integer.toString(column);
        }
        String expr = offset(COLUMN_VARIABLE, column - anchor.getColumn());
        return column == anchor.getColumn() ? expr : "(" + expr + ")";
    }

    @Override
    public String row(int row, boolean absolute) {
        if (absolute || direction == GroupDirection.HORIZONTAL) {
            return Integer.toString(row);
        }
        return offset(ROW_VARIABLE, row - anchor.getRow());
    }

    @Override
    public String currentRow() {
        return direction == GroupDirection.VERTICAL ? ROW_VARIABLE : Integer.toString(anchor.getRow());
    }

    @Override
    public String currentColumnIndex() {
        return direction == GroupDirection.HORIZONTAL ? COLUMN_VARIABLE : Integer.toString(anchor.getColumn());
    }

    @Override
    public CellAddress anchor() {
        return anchor;
    }

    static String offset(String variable, int delta) {
        if (delta == 0) {
            return variable;
        }
        return delta > 0 ? variable + " + " + delta : variable + " - " + (-delta);
    }
}
