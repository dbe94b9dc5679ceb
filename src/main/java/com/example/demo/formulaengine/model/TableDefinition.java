package com.example.demo.formulaengine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A structured table (Excel "ListObject") declared on a sheet.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableDefinition {

    private String name;

    private String sheet;

    private int headerRow;

    private int firstDataRow;

    /** Last data row, excluding any totals row */
    private int lastDataRow;

    private int firstColumn;

    private int lastColumn;

    /** Column names in sheet order; index 0 is firstColumn */
    @Builder.Default
    private List<String> columnNames = new ArrayList<>();

    /**
     * Sheet column index of the named column (case-insensitive), or -1 when the table has no
     * such column.
     */
    public int columnIndexOf(String columnName) {
        for (int i = 0; i < columnNames.size(); i++) {
            if (columnNames.get(i).equalsIgnoreCase(columnName.trim())) {
                return firstColumn + i;
            }
        }
        return -1;
    }
}
