package com.example.demo.formulaengine.model;

public enum GroupDirection {
    /** Same column, consecutive rows; the loop runs over rows */
    VERTICAL,
    /** Same row, consecutive columns; the loop runs over columns */
    HORIZONTAL
}
