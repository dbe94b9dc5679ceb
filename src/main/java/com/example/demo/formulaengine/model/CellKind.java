package com.example.demo.formulaengine.model;

/**
 * Classification of a cell's content.
 */
public enum CellKind {
    /** Content starts with "=" */
    FORMULA,
    /** Numeric, boolean or date literal that formulas may read as an input */
    HARDCODED_NUMBER,
    /** Text literal */
    LABEL,
    EMPTY
}
