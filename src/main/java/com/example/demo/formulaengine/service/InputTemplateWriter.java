package com.example.demo.formulaengine.service;

import com.example.demo.formulaengine.model.CellAddress;
import com.example.demo.formulaengine.model.CellKind;
import com.example.demo.formulaengine.model.CellRecord;
import com.example.demo.formulaengine.model.SheetSnapshot;
import com.example.demo.formulaengine.model.WorkbookSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFFont;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the input template that users of the generated calculator fill in.
 *
 * The template has the workbook's sheets in order. Labels keep their positions for context;
 * input cells carry the workbook values as defaults and are highlighted. Formula cells are left
 * out because the calculator computes them.
 */
@Slf4j
@Component
public class InputTemplateWriter {

    public static final String TEMPLATE_FILE = "input_template.xlsx";

    private static final byte[] INPUT_FILL = {(byte) 0xFF, (byte) 0xFF, (byte) 0xCC};
    private static final byte[] INPUT_COLOR = {0x00, 0x00, (byte) 0xFF};
    private static final byte[] LABEL_COLOR = {0x33, 0x33, 0x33};

    /**
     * @param inputCells the hardcoded cells the calculator reads; other hardcoded values are omitted
     */
    public XSSFWorkbook write(WorkbookSnapshot snapshot, List<CellRecord> inputCells) {
        Set<CellAddress> inputs = new HashSet<>();
        for (CellRecord cell : inputCells) {
            inputs.add(cell.getAddress());
        }
        XSSFWorkbook workbook = new XSSFWorkbook();
        Styles styles = new Styles(workbook);
        for (SheetSnapshot sheetSnapshot : snapshot.getSheets().values()) {
            XSSFSheet sheet = workbook.createSheet(sheetSnapshot.getName());
            int written = 0;
            for (CellRecord record : sheetSnapshot.getCells().values()) {
                if (record.getKind() == CellKind.LABEL) {
                    Cell cell = cellAt(sheet, record);
                    cell.setCellValue((String) record.getContent());
                    boolean bold = record.getFormat() != null && record.getFormat().isBold();
                    cell.setCellStyle(bold ? styles.boldLabel : styles.label);
                } else if (record.getKind() == CellKind.HARDCODED_NUMBER && inputs.contains(record.getAddress())) {
                    Cell cell = cellAt(sheet, record);
                    setValue(cell, record.getContent());
                    String numberFormat = record.getFormat() == null ? null : record.getFormat().getNumberFormat();
                    if (numberFormat == null && record.getContent() instanceof LocalDateTime) {
                        numberFormat = "yyyy-mm-dd";
                    }
                    cell.setCellStyle(styles.input(numberFormat));
                    written++;
                }
            }
            for (Map.Entry<Integer, Double> width : sheetSnapshot.getColumnWidths().entrySet()) {
                sheet.setColumnWidth(width.getKey() - 1, (int) Math.round(width.getValue() * 256));
            }
            for (Map.Entry<Integer, Double> height : sheetSnapshot.getRowHeights().entrySet()) {
                Row row = sheet.getRow(height.getKey() - 1);
                if (row == null) {
                    row = sheet.createRow(height.getKey() - 1);
                }
                row.setHeightInPoints(height.getValue().floatValue());
            }
            log.info("Sheet '{}': {} input cells in template", sheetSnapshot.getName(), written);
        }
        return workbook;
    }

    private static Cell cellAt(XSSFSheet sheet, CellRecord record) {
        int rowIndex = record.getAddress().getRow() - 1;
        Row row = sheet.getRow(rowIndex);
        if (row == null) {
            row = sheet.createRow(rowIndex);
        }
        return row.createCell(record.getAddress().getColumn() - 1);
    }

    private static void setValue(Cell cell, Object value) {
        if (value instanceof Number) {
            cell.setCellValue(((Number) value).doubleValue());
        } else if (value instanceof Boolean) {
            cell.setCellValue((Boolean) value);
        } else if (value instanceof LocalDateTime) {
            cell.setCellValue((LocalDateTime) value);
        } else if (value != null) {
            cell.setCellValue(value.toString());
        }
    }

    /** Shared cell styles; input styles are cached per number format */
    private static final class Styles {
        private final XSSFWorkbook workbook;
        private final XSSFCellStyle label;
        private final XSSFCellStyle boldLabel;
        private final XSSFFont inputFont;
        private final Map<String, XSSFCellStyle> inputs = new HashMap<>();

        Styles(XSSFWorkbook workbook) {
            this.workbook = workbook;
            this.label = labelStyle(false);
            this.boldLabel = labelStyle(true);
            this.inputFont = workbook.createFont();
            inputFont.setBold(true);
            inputFont.setFontHeightInPoints((short) 10);
            inputFont.setColor(new XSSFColor(INPUT_COLOR, null));
        }

        private XSSFCellStyle labelStyle(boolean bold) {
            XSSFFont font = workbook.createFont();
            font.setBold(bold);
            font.setFontHeightInPoints((short) 10);
            font.setColor(new XSSFColor(LABEL_COLOR, null));
            XSSFCellStyle style = workbook.createCellStyle();
            style.setFont(font);
            return style;
        }

        XSSFCellStyle input(String numberFormat) {
            String key = numberFormat == null ? "General" : numberFormat;
            return inputs.computeIfAbsent(key, format -> {
                XSSFCellStyle style = workbook.createCellStyle();
                style.setFont(inputFont);
                style.setFillForegroundColor(new XSSFColor(INPUT_FILL, null));
                style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
                style.setDataFormat(workbook.createDataFormat().getFormat(format));
                return style;
            });
        }
    }
}
