package com.example.demo.formulaengine.model;

import lombok.Value;

/**
 * A formula reading another sheet of the same workbook.
 */
@Value
public class CrossSheetReference {

    String sheet;

    /** A1 address of the formula cell */
    String cell;

    String formula;

    String targetSheet;

    /** "cell" or "range" */
    String refType;
}
