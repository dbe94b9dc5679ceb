package com.example.demo.formulaengine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Formatting snapshot of a cell, carried through so the generated script can reproduce it.
 * Colours are ARGB hex strings (e.g. "FFFF0000") or null when unset.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CellFormat {

    /** Excel number format string, e.g. "0.00%" */
    private String numberFormat;

    private boolean bold;

    private boolean italic;

    /** Font size in points, null when default */
    private Double fontSize;

    private String fontColor;

    private String fillColor;

    /** POI HorizontalAlignment name in lower case, e.g. "center" */
    private String horizontalAlignment;

    private String verticalAlignment;

    private boolean wrapText;

    public boolean isDefault() {
        return (numberFormat == null || "General".equals(numberFormat))
                && !bold && !italic && fontSize == null
                && fontColor == null && fillColor == null
                && horizontalAlignment == null && verticalAlignment == null
                && !wrapText;
    }
}
