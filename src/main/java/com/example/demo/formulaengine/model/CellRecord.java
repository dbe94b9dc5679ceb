package com.example.demo.formulaengine.model;

import lombok.Builder;
import lombok.Value;

/**
 * One cell of a loaded workbook. Immutable once the snapshot is built.
 */
@Value
@Builder
public class CellRecord {

    CellAddress address;

    /** Formula text starting with "=" for formula cells, otherwise the literal value */
    Object content;

    CellKind kind;

    /** Last value computed by Excel, null when the workbook was never calculated */
    Object cachedValue;

    CellFormat format;

    public static CellRecord formula(CellAddress address, String formula, Object cachedValue) {
        return CellRecord.builder()
                .address(address)
                .content(formula.startsWith("=") ? formula : "=" + formula)
                .kind(CellKind.FORMULA)
                .cachedValue(cachedValue)
                .build();
    }

    public static CellRecord value(CellAddress address, Object value) {
        CellKind kind;
        if (value == null) {
            kind = CellKind.EMPTY;
        } else if (value instanceof String) {
            kind = CellKind.LABEL;
        } else {
            kind = CellKind.HARDCODED_NUMBER;
        }
        return CellRecord.builder()
                .address(address)
                .content(value)
                .kind(kind)
                .cachedValue(value)
                .build();
    }

    public boolean isFormula() {
        return kind == CellKind.FORMULA;
    }

    /** Formula text for formula cells, null otherwise */
    public String getFormula() {
        return isFormula() ? (String) content : null;
    }
}
