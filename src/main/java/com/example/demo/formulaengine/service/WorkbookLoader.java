package com.example.demo.formulaengine.service;

import com.example.demo.formulaengine.aspect.LogExecutionTime;
import com.example.demo.formulaengine.exception.WorkbookLoadingException;
import com.example.demo.formulaengine.model.CellAddress;
import com.example.demo.formulaengine.model.CellFormat;
import com.example.demo.formulaengine.model.CellKind;
import com.example.demo.formulaengine.model.CellRecord;
import com.example.demo.formulaengine.model.SheetSnapshot;
import com.example.demo.formulaengine.model.TableDefinition;
import com.example.demo.formulaengine.model.WorkbookSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaError;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.Name;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xssf.model.ExternalLinksTable;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFFont;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFTable;
import org.apache.poi.xssf.usermodel.XSSFTableColumn;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads an .xlsx workbook into an immutable {@link WorkbookSnapshot}.
 *
 * Formulas are read as written, cached results as Excel last computed them. Nothing is
 * recalculated here.
 */
@Slf4j
@Component
public class WorkbookLoader {

    /** POI writes external workbook references as "[1]Sheet!A1" or "'[1]My Sheet'!A1" */
    private static final Pattern EXTERNAL_INDEX = Pattern.compile("\\[(\\d+)\\]");
    private static final Pattern BARE_PREFIX = Pattern.compile("\\[(\\d+)\\]([\\p{L}\\p{N}_.]*)!");

    @LogExecutionTime("Workbook Loading")
    public WorkbookSnapshot load(InputStream in) {
        XSSFWorkbook workbook;
        try {
            workbook = new XSSFWorkbook(in);
        } catch (IOException | RuntimeException e) {
            throw new WorkbookLoadingException("WORKBOOK_UNREADABLE",
                    "File is not a readable .xlsx workbook: " + e.getMessage(), e);
        }
        try {
            return toSnapshot(workbook);
        } finally {
            try {
                workbook.close();
            } catch (IOException e) {
                log.warn("Failed to close workbook: {}", e.getMessage());
            }
        }
    }

    /**
     * Snapshot an already opened workbook. The workbook is left open.
     */
    public WorkbookSnapshot toSnapshot(XSSFWorkbook workbook) {
        if (workbook.getNumberOfSheets() == 0) {
            throw new WorkbookLoadingException("NO_SHEETS", "Workbook contains no worksheets");
        }
        Map<Integer, String> externalFiles = externalFiles(workbook);
        List<SheetSnapshot> sheets = new ArrayList<>();
        Map<String, TableDefinition> tables = new LinkedHashMap<>();
        for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
            XSSFSheet sheet = workbook.getSheetAt(i);
            sheets.add(readSheet(sheet, externalFiles));
            for (XSSFTable table : sheet.getTables()) {
                TableDefinition definition = readTable(sheet, table);
                tables.put(definition.getName(), definition);
            }
        }
        Map<String, String> names = definedNames(workbook, externalFiles);

        WorkbookSnapshot snapshot = new WorkbookSnapshot(sheets, tables, names);
        log.info("Loaded workbook: {} sheets, {} formula cells, {} hardcoded values, {} tables, {} defined names",
                sheets.size(), snapshot.getFormulaCells().size(), snapshot.getHardcodedCells().size(),
                tables.size(), names.size());
        return snapshot;
    }

    private SheetSnapshot readSheet(XSSFSheet sheet, Map<Integer, String> externalFiles) {
        String name = sheet.getSheetName();
        List<CellRecord> records = new ArrayList<>();
        Map<Integer, Double> rowHeights = new TreeMap<>();
        int maxColumn = 0;
        for (Row row : sheet) {
            if (row.isFormatted() || row.getHeightInPoints() != sheet.getDefaultRowHeightInPoints()) {
                rowHeights.put(row.getRowNum() + 1, (double) row.getHeightInPoints());
            }
            for (Cell cell : row) {
                CellRecord record = readCell(name, cell, externalFiles);
                if (record != null) {
                    records.add(record);
                    maxColumn = Math.max(maxColumn, cell.getColumnIndex() + 1);
                }
            }
        }

        Map<Integer, Double> columnWidths = new TreeMap<>();
        int defaultWidth = sheet.getDefaultColumnWidth() * 256;
        for (int col = 0; col < maxColumn; col++) {
            int width = sheet.getColumnWidth(col);
            if (width != defaultWidth) {
                columnWidths.put(col + 1, width / 256.0);
            }
        }

        List<String> merged = new ArrayList<>();
        for (CellRangeAddress region : sheet.getMergedRegions()) {
            merged.add(region.formatAsString());
        }
        log.debug("Sheet {}: {} cells, {} merged regions", name, records.size(), merged.size());
        return new SheetSnapshot(name, records, columnWidths, rowHeights, merged);
    }

    private CellRecord readCell(String sheet, Cell cell, Map<Integer, String> externalFiles) {
        CellAddress address = CellAddress.of(sheet, cell.getColumnIndex() + 1, cell.getRowIndex() + 1);
        CellFormat format = readFormat(cell);
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            String formula = "=" + resolveExternalIndexes(cell.getCellFormula(), externalFiles);
            return CellRecord.builder()
                    .address(address)
                    .content(formula)
                    .kind(CellKind.FORMULA)
                    .cachedValue(cachedResult(cell))
                    .format(format)
                    .build();
        }
        Object value = literal(cell, type);
        if (value == null && format.isDefault()) {
            return null;
        }
        CellKind kind = value == null ? CellKind.EMPTY
                : value instanceof String ? CellKind.LABEL : CellKind.HARDCODED_NUMBER;
        return CellRecord.builder()
                .address(address)
                .content(value)
                .kind(kind)
                .cachedValue(value)
                .format(format)
                .build();
    }

    private static Object literal(Cell cell, CellType type) {
        switch (type) {
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue();
                }
                return cell.getNumericCellValue();
            case STRING:
                String text = cell.getStringCellValue();
                return text.isEmpty() ? null : text;
            case BOOLEAN:
                return cell.getBooleanCellValue();
            case ERROR:
                return FormulaError.forInt(cell.getErrorCellValue()).getString();
            default:
                return null;
        }
    }

    private static Object cachedResult(Cell cell) {
        try {
            switch (cell.getCachedFormulaResultType()) {
                case NUMERIC:
                    if (DateUtil.isCellDateFormatted(cell)) {
                        return cell.getLocalDateTimeCellValue();
                    }
                    return cell.getNumericCellValue();
                case STRING:
                    return cell.getStringCellValue();
                case BOOLEAN:
                    return cell.getBooleanCellValue();
                case ERROR:
                    return FormulaError.forInt(cell.getErrorCellValue()).getString();
                default:
                    return null;
            }
        } catch (IllegalStateException | IllegalArgumentException e) {
            log.debug("No cached result for {}: {}", cell.getAddress(), e.getMessage());
            return null;
        }
    }

    private static CellFormat readFormat(Cell cell) {
        XSSFCellStyle style = (XSSFCellStyle) cell.getCellStyle();
        if (style == null) {
            return CellFormat.builder().build();
        }
        XSSFFont font = style.getFont();
        String numberFormat = style.getDataFormatString();
        Double fontSize = null;
        if (font != null && font.getFontHeightInPoints() != XSSFFont.DEFAULT_FONT_SIZE) {
            fontSize = (double) font.getFontHeightInPoints();
        }
        return CellFormat.builder()
                .numberFormat("General".equals(numberFormat) ? null : numberFormat)
                .bold(font != null && font.getBold())
                .italic(font != null && font.getItalic())
                .fontSize(fontSize)
                .fontColor(font == null ? null : argb(font.getXSSFColor()))
                .fillColor(argb(style.getFillForegroundColorColor()))
                .horizontalAlignment(style.getAlignment() == HorizontalAlignment.GENERAL
                        ? null : style.getAlignment().name().toLowerCase())
                .verticalAlignment(style.getVerticalAlignment() == VerticalAlignment.BOTTOM
                        ? null : style.getVerticalAlignment().name().toLowerCase())
                .wrapText(style.getWrapText())
                .build();
    }

    private static String argb(XSSFColor color) {
        if (color == null || color.isAuto()) {
            return null;
        }
        String hex = color.getARGBHex();
        return hex == null || "FF000000".equals(hex) ? null : hex;
    }

    private static TableDefinition readTable(XSSFSheet sheet, XSSFTable table) {
        int headerRows = table.getHeaderRowCount();
        int totalsRows = table.getTotalsRowCount();
        int firstRow = table.getStartRowIndex() + 1;
        int lastRow = table.getEndRowIndex() + 1;
        List<String> columns = new ArrayList<>();
        for (XSSFTableColumn column : table.getColumns()) {
            columns.add(column.getName());
        }
        return TableDefinition.builder()
                .name(table.getName())
                .sheet(sheet.getSheetName())
                .headerRow(headerRows > 0 ? firstRow : 0)
                .firstDataRow(firstRow + headerRows)
                .lastDataRow(lastRow - totalsRows)
                .firstColumn(table.getStartColIndex() + 1)
                .lastColumn(table.getEndColIndex() + 1)
                .columnNames(columns)
                .build();
    }

    private static Map<String, String> definedNames(XSSFWorkbook workbook, Map<Integer, String> externalFiles) {
        Map<String, String> names = new LinkedHashMap<>();
        for (Name name : workbook.getAllNames()) {
            if (name.isFunctionName() || name.getNameName().startsWith("_xlnm.")) {
                continue;
            }
            String refersTo = name.getRefersToFormula();
            if (refersTo == null || refersTo.isEmpty()) {
                continue;
            }
            names.putIfAbsent(name.getNameName(), resolveExternalIndexes(refersTo, externalFiles));
        }
        return names;
    }

    /** 1-based external link index to linked file name */
    private static Map<Integer, String> externalFiles(XSSFWorkbook workbook) {
        Map<Integer, String> files = new LinkedHashMap<>();
        List<ExternalLinksTable> links = workbook.getExternalLinksTable();
        if (links == null) {
            return files;
        }
        for (int i = 0; i < links.size(); i++) {
            String target = links.get(i).getLinkedFileName();
            if (target != null) {
                int slash = Math.max(target.lastIndexOf('/'), target.lastIndexOf('\\'));
                files.put(i + 1, slash >= 0 ? target.substring(slash + 1) : target);
            }
        }
        return files;
    }

    /**
     * Replace external link indexes with file names where they start a sheet prefix. String
     * literals and structured reference selectors are copied unchanged.
     */
    static String resolveExternalIndexes(String formula, Map<Integer, String> externalFiles) {
        if (externalFiles.isEmpty() || formula.indexOf('[') < 0) {
            return formula;
        }
        StringBuilder sb = new StringBuilder(formula.length() + 16);
        int i = 0;
        while (i < formula.length()) {
            char ch = formula.charAt(i);
            if (ch == '"') {
                int end = closingQuote(formula, i, '"');
                sb.append(formula, i, end);
                i = end;
            } else if (ch == '\'') {
                int end = closingQuote(formula, i, '\'');
                String quoted = formula.substring(i, end);
                if (end < formula.length() && formula.charAt(end) == '!') {
                    Matcher m = EXTERNAL_INDEX.matcher(quoted);
                    if (m.find()) {
                        quoted = quoted.substring(0, m.start())
                                + "[" + fileName(externalFiles, m.group(1)) + "]"
                                + quoted.substring(m.end());
                    }
                }
                sb.append(quoted);
                i = end;
            } else if (ch == '[') {
                Matcher m = BARE_PREFIX.matcher(formula).region(i, formula.length());
                if (m.lookingAt()) {
                    sb.append('[').append(fileName(externalFiles, m.group(1))).append(']');
                    i = m.end(1) + 1;
                } else {
                    sb.append(ch);
                    i++;
                }
            } else {
                sb.append(ch);
                i++;
            }
        }
        return sb.toString();
    }

    /** Index just past the quote closing the one at {@code start}; doubled quotes are escapes */
    private static int closingQuote(String text, int start, char quote) {
        int i = start + 1;
        while (i < text.length()) {
            if (text.charAt(i) == quote) {
                if (i + 1 < text.length() && text.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return text.length();
    }

    private static String fileName(Map<Integer, String> externalFiles, String index) {
        String file = externalFiles.get(Integer.parseInt(index));
        return file == null ? index : file;
    }
}
