package com.example.demo.formulaengine.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Cells and layout of one worksheet.
 */
@Getter
public class SheetSnapshot {

    private final String name;

    /** Ordered by row then column */
    private final Map<CellAddress, CellRecord> cells;

    /** 1-based column index to width in characters */
    private final Map<Integer, Double> columnWidths;

    /** 1-based row number to height in points */
    private final Map<Integer, Double> rowHeights;

    /** Merged regions as A1 ranges, e.g. "A1:C1" */
    private final List<String> mergedRegions;

    public SheetSnapshot(String name, List<CellRecord> records,
                         Map<Integer, Double> columnWidths,
                         Map<Integer, Double> rowHeights,
                         List<String> mergedRegions) {
        this.name = name;
        Map<CellAddress, CellRecord> ordered = new TreeMap<>();
        for (CellRecord record : records) {
            if (!name.equals(record.getAddress().getSheet())) {
                throw new IllegalArgumentException(
                        "Cell " + record.getAddress() + " does not belong to sheet " + name);
            }
            ordered.put(record.getAddress(), record);
        }
        this.cells = Collections.unmodifiableMap(ordered);
        this.columnWidths = Collections.unmodifiableMap(new TreeMap<>(columnWidths));
        this.rowHeights = Collections.unmodifiableMap(new TreeMap<>(rowHeights));
        this.mergedRegions = Collections.unmodifiableList(new ArrayList<>(mergedRegions));
    }

    public SheetSnapshot(String name, List<CellRecord> records) {
        this(name, records, Map.of(), Map.of(), List.of());
    }

    public CellRecord getCell(CellAddress address) {
        return cells.get(address);
    }

    public List<CellRecord> cellsOfKind(CellKind kind) {
        return cells.values().stream()
                .filter(c -> c.getKind() == kind)
                .collect(Collectors.toList());
    }
}
