package com.example.demo.formulaengine.model;

/**
 * Part of a structured table selected by a table reference.
 */
public enum TableArea {
    /** Data rows of the selected column(s), or of the whole table when no column is named */
    DATA,
    /** Headers, data and totals */
    ALL,
    HEADERS,
    /** Same row as the evaluating cell ("@" / "[#This Row]") */
    THIS_ROW
}
