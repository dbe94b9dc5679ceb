package com.example.demo.formulaengine.model;

import lombok.Builder;
import lombok.Value;

/**
 * Position-independent description of one reference inside a {@link PatternKey}.
 */
@Value
@Builder
public class ReferenceDescriptor {

    ReferenceKind kind;

    String externalFile;

    /** Target sheet when it differs from the formula's sheet or is external, else null */
    String sheet;

    AxisPosition startColumn;

    AxisPosition startRow;

    /** Null for cell and table references */
    AxisPosition endColumn;

    AxisPosition endRow;

    String tableName;

    String tableColumn;

    String tableEndColumn;

    TableArea tableArea;
}
