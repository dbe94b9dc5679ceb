package com.example.demo.formulaengine.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, in-memory view of a workbook: sheets in workbook order, structured tables and
 * defined names. Built once per load and shared read-only by every compilation phase.
 */
@Getter
public class WorkbookSnapshot {

    private final Map<String, SheetSnapshot> sheets;

    /** Table name (as declared) to definition */
    private final Map<String, TableDefinition> tables;

    /** Defined name to its refers-to formula, e.g. "TaxRate" -> "Inputs!$B$2" */
    private final Map<String, String> definedNames;

    public WorkbookSnapshot(List<SheetSnapshot> sheets,
                            Map<String, TableDefinition> tables,
                            Map<String, String> definedNames) {
        Map<String, SheetSnapshot> ordered = new LinkedHashMap<>();
        for (SheetSnapshot sheet : sheets) {
            ordered.put(sheet.getName(), sheet);
        }
        this.sheets = Collections.unmodifiableMap(ordered);
        this.tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
        this.definedNames = Collections.unmodifiableMap(new LinkedHashMap<>(definedNames));
    }

    public WorkbookSnapshot(List<SheetSnapshot> sheets) {
        this(sheets, Map.of(), Map.of());
    }

    public List<String> getSheetNames() {
        return new ArrayList<>(sheets.keySet());
    }

    public CellRecord getCell(CellAddress address) {
        SheetSnapshot sheet = sheets.get(address.getSheet());
        return sheet == null ? null : sheet.getCell(address);
    }

    /** Every formula cell in workbook order (sheet order, then row, then column) */
    public List<CellRecord> getFormulaCells() {
        return cellsOfKind(CellKind.FORMULA);
    }

    public List<CellRecord> getHardcodedCells() {
        return cellsOfKind(CellKind.HARDCODED_NUMBER);
    }

    public List<CellRecord> cellsOfKind(CellKind kind) {
        List<CellRecord> result = new ArrayList<>();
        for (SheetSnapshot sheet : sheets.values()) {
            result.addAll(sheet.cellsOfKind(kind));
        }
        return result;
    }

    /** Lookup by table name, case-insensitive like Excel */
    public TableDefinition findTable(String name) {
        return findIgnoreCase(tables, name);
    }

    public String findDefinedName(String name) {
        return findIgnoreCase(definedNames, name);
    }

    private static <T> T findIgnoreCase(Map<String, T> map, String key) {
        T exact = map.get(key);
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<String, T> entry : map.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(key)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
