package com.example.demo.formulaengine.model;

import lombok.Value;

/**
 * One coordinate of a reference as seen from the cell holding the formula: a fixed value for
 * '$'-anchored axes, otherwise a signed offset from the cell.
 */
@Value
public class AxisPosition {

    boolean absolute;

    int value;

    public static AxisPosition absolute(int value) {
        return new AxisPosition(true, value);
    }

    public static AxisPosition relative(int offset) {
        return new AxisPosition(false, offset);
    }

    @Override
    public String toString() {
        return (absolute ? "abs:" : "rel:") + value;
    }
}
