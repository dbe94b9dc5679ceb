package com.example.demo.formulaengine.service;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CompilationSummary {

    int sheetCount;

    int formulaCellCount;

    int hardcodedCellCount;

    /** Hardcoded cells emitted as calculator inputs */
    int inputCellCount;

    int groupCount;

    int groupedCellCount;

    int singleCellCount;

    int cycleCount;

    int diagnosticCount;

    int crossSheetReferenceCount;

    int externalReferenceCount;
}
