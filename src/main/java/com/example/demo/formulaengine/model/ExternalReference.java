package com.example.demo.formulaengine.model;

import lombok.Value;

/**
 * A formula reading a sheet of another workbook.
 */
@Value
public class ExternalReference {

    String sheet;

    String cell;

    String formula;

    String externalFile;

    String externalSheet;

    /** "cell" or "range" */
    String refType;
}
