package com.example.demo.formulaengine.model;

import com.example.demo.formulaengine.util.ColumnLetters;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * A cell, range or structured-table reference found in a formula.
 *
 * Equality is positional: two references are equal when they point at the same target,
 * regardless of where they appear in the formula or how their axes are anchored with '$'.
 * Table references keep start/end coordinates at 0 until resolved against a
 * {@link TableDefinition}.
 */
@Getter
@Builder(toBuilder = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Reference {

    @EqualsAndHashCode.Include
    private final ReferenceKind kind;

    /** Workbook name for external references such as [Book.xlsx]Sheet1!A1, else null */
    @EqualsAndHashCode.Include
    private final String externalFile;

    /** Target sheet; the formula's own sheet when the reference is unqualified */
    @EqualsAndHashCode.Include
    private final String sheet;

    @EqualsAndHashCode.Include
    private final int startColumn;

    @EqualsAndHashCode.Include
    private final int startRow;

    /** Equal to startColumn for cell references */
    @EqualsAndHashCode.Include
    private final int endColumn;

    @EqualsAndHashCode.Include
    private final int endRow;

    private final boolean startColumnAbsolute;
    private final boolean startRowAbsolute;
    private final boolean endColumnAbsolute;
    private final boolean endRowAbsolute;

    @EqualsAndHashCode.Include
    private final String tableName;

    /** First selected column of a table reference, null for the whole table */
    @EqualsAndHashCode.Include
    private final String tableColumn;

    /** Last selected column for [[A]:[B]] selectors, else equal to tableColumn */
    @EqualsAndHashCode.Include
    private final String tableEndColumn;

    @EqualsAndHashCode.Include
    private final TableArea tableArea;

    /** Offset of the first character in the formula (leading "=" stripped) */
    private final int spanStart;

    /** Offset one past the last character */
    private final int spanEnd;

    /** Source text of the reference */
    private final String text;

    public static Reference cell(String sheet, int column, int row) {
        return Reference.builder()
                .kind(ReferenceKind.CELL)
                .sheet(sheet)
                .startColumn(column).startRow(row)
                .endColumn(column).endRow(row)
                .build();
    }

    public static Reference range(String sheet, int startColumn, int startRow, int endColumn, int endRow) {
        return Reference.builder()
                .kind(ReferenceKind.RANGE)
                .sheet(sheet)
                .startColumn(Math.min(startColumn, endColumn)).startRow(Math.min(startRow, endRow))
                .endColumn(Math.max(startColumn, endColumn)).endRow(Math.max(startRow, endRow))
                .build();
    }

    public boolean isExternal() {
        return externalFile != null;
    }

    public boolean isTable() {
        return kind == ReferenceKind.TABLE;
    }

    public boolean isCrossSheet(String currentSheet) {
        return !isExternal() && !sheet.equals(currentSheet);
    }

    /**
     * Sheet key used in the generated cell store: the sheet name, or "file|sheet" for
     * external references.
     */
    public String getStoreSheet() {
        return isExternal() ? externalFile + "|" + sheet : sheet;
    }

    public long area() {
        if (isTable()) {
            return 0;
        }
        return (long) (endColumn - startColumn + 1) * (endRow - startRow + 1);
    }

    public boolean contains(CellAddress address) {
        return !isTable()
                && address.getSheet().equals(getStoreSheet())
                && address.getColumn() >= startColumn && address.getColumn() <= endColumn
                && address.getRow() >= startRow && address.getRow() <= endRow;
    }

    /** Every address covered by a cell or range reference, row by row */
    public List<CellAddress> expand() {
        List<CellAddress> result = new ArrayList<>();
        if (isTable()) {
            return result;
        }
        String storeSheet = getStoreSheet();
        for (int r = startRow; r <= endRow; r++) {
            for (int c = startColumn; c <= endColumn; c++) {
                result.add(new CellAddress(storeSheet, c, r));
            }
        }
        return result;
    }

    /**
     * Reference displaced by whole rows/columns and resized, as OFFSET does. Height and width
     * below 1 keep the current size. Returns null when the result falls off the grid.
     */
    public Reference offset(int rows, int columns, int height, int width) {
        int newHeight = height >= 1 ? height : endRow - startRow + 1;
        int newWidth = width >= 1 ? width : endColumn - startColumn + 1;
        int c1 = startColumn + columns;
        int r1 = startRow + rows;
        int c2 = c1 + newWidth - 1;
        int r2 = r1 + newHeight - 1;
        if (!ColumnLetters.isValidColumn(c1) || !ColumnLetters.isValidColumn(c2)
                || !ColumnLetters.isValidRow(r1) || !ColumnLetters.isValidRow(r2)) {
            return null;
        }
        return toBuilder()
                .kind(newWidth == 1 && newHeight == 1 ? ReferenceKind.CELL : ReferenceKind.RANGE)
                .startColumn(c1).startRow(r1)
                .endColumn(c2).endRow(r2)
                .endColumnAbsolute(startColumnAbsolute)
                .endRowAbsolute(startRowAbsolute)
                .build();
    }

    @Override
    public String toString() {
        if (isTable()) {
            return tableName + "[" + (tableColumn == null ? "#" + tableArea : tableColumn) + "]";
        }
        String prefix = (isExternal() ? "[" + externalFile + "]" : "") + sheet + "!";
        String start = ColumnLetters.toLetters(startColumn) + startRow;
        if (kind == ReferenceKind.CELL) {
            return prefix + start;
        }
        return prefix + start + ":" + ColumnLetters.toLetters(endColumn) + endRow;
    }
}
