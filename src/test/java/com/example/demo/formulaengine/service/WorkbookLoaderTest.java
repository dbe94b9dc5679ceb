package com.example.demo.formulaengine.service;

import com.example.demo.formulaengine.TestWorkbooks;
import com.example.demo.formulaengine.exception.WorkbookLoadingException;
import com.example.demo.formulaengine.model.CellAddress;
import com.example.demo.formulaengine.model.CellKind;
import com.example.demo.formulaengine.model.CellRecord;
import com.example.demo.formulaengine.model.SheetSnapshot;
import com.example.demo.formulaengine.model.TableDefinition;
import com.example.demo.formulaengine.model.WorkbookSnapshot;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.FormulaError;
import org.apache.poi.ss.usermodel.Name;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.util.AreaReference;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFTable;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link WorkbookLoader} against workbooks written and read back through POI.
 */
public class WorkbookLoaderTest {

    private final WorkbookLoader loader = new WorkbookLoader();

    private WorkbookSnapshot roundTrip(XSSFWorkbook workbook) {
        return loader.load(new ByteArrayInputStream(TestWorkbooks.toBytes(workbook)));
    }

    /**
     * Test that formulas, cached results, labels and numbers are classified.
     */
    @Test
    public void testCellsAreClassified() {
        WorkbookSnapshot snapshot = roundTrip(TestWorkbooks.orders());

        assertEquals(1, snapshot.getSheets().size());
        assertEquals(6, snapshot.getFormulaCells().size());
        assertEquals(10, snapshot.getHardcodedCells().size());

        CellRecord d2 = snapshot.getCell(CellAddress.of("Orders", "D", 2));
        assertEquals(CellKind.FORMULA, d2.getKind());
        assertEquals("=B2*C2", d2.getFormula());
        assertEquals(5.0, (Double) d2.getCachedValue(), 1e-9);

        CellRecord total = snapshot.getCell(CellAddress.of("Orders", "D", 7));
        assertEquals("=SUM(D2:D6)", total.getFormula());
        assertEquals(50.0, (Double) total.getCachedValue(), 1e-9);
        assertTrue(total.getFormat().isBold());

        assertEquals(CellKind.LABEL, snapshot.getCell(CellAddress.of("Orders", "A", 1)).getKind());
        assertEquals(2.5, snapshot.getCell(CellAddress.of("Orders", "C", 3)).getContent());
    }

    @Test
    public void testValueTypesAndLayout() {
        XSSFWorkbook workbook = new XSSFWorkbook();
        XSSFSheet sheet = workbook.createSheet("Inputs");
        Row row = sheet.createRow(0);
        row.createCell(0).setCellValue(true);
        row.createCell(1).setCellErrorValue(FormulaError.DIV0.getCode());
        row.createCell(2).setCellValue("");
        row.createCell(3);

        XSSFCellStyle dateStyle = workbook.createCellStyle();
        dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd"));
        Cell date = sheet.createRow(1).createCell(0);
        date.setCellValue(LocalDateTime.of(2024, 3, 5, 0, 0));
        date.setCellStyle(dateStyle);

        XSSFCellStyle filled = workbook.createCellStyle();
        filled.setFillForegroundColor(new XSSFColor(new byte[]{(byte) 0xFF, (byte) 0xFF, 0x00}, null));
        filled.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        sheet.createRow(2).createCell(1).setCellStyle(filled);

        sheet.setColumnWidth(0, 20 * 256);
        sheet.addMergedRegion(new CellRangeAddress(4, 4, 0, 2));

        SheetSnapshot inputs = roundTrip(workbook).getSheets().get("Inputs");

        assertEquals(Boolean.TRUE, inputs.getCell(CellAddress.of("Inputs", "A", 1)).getContent());
        assertEquals("#DIV/0!", inputs.getCell(CellAddress.of("Inputs", "B", 1)).getContent());
        assertNull(inputs.getCell(CellAddress.of("Inputs", "C", 1)));
        assertNull(inputs.getCell(CellAddress.of("Inputs", "D", 1)));
        assertEquals(LocalDateTime.of(2024, 3, 5, 0, 0), inputs.getCell(CellAddress.of("Inputs", "A", 2)).getContent());

        CellRecord styledBlank = inputs.getCell(CellAddress.of("Inputs", "B", 3));
        assertEquals(CellKind.EMPTY, styledBlank.getKind());
        assertEquals("FFFFFF00", styledBlank.getFormat().getFillColor());

        assertEquals(20.0, inputs.getColumnWidths().get(1), 1e-9);
        assertTrue(inputs.getMergedRegions().contains("A5:C5"));
    }

    @Test
    public void testTablesAndDefinedNames() {
        XSSFWorkbook workbook = new XSSFWorkbook();
        XSSFSheet sheet = workbook.createSheet("Data");
        String[][] rows = {{"Region", "Amount"}, {"North", "10"}, {"South", "20"}, {"East", "30"}};
        for (int r = 0; r < rows.length; r++) {
            Row row = sheet.createRow(r);
            row.createCell(0).setCellValue(rows[r][0]);
            if (r == 0) {
                row.createCell(1).setCellValue(rows[r][1]);
            } else {
                row.createCell(1).setCellValue(Double.parseDouble(rows[r][1]));
            }
        }
        XSSFTable table = sheet.createTable(new AreaReference("A1:B4", SpreadsheetVersion.EXCEL2007));
        table.setName("Sales");
        table.setDisplayName("Sales");
        Name name = workbook.createName();
        name.setNameName("TopAmount");
        name.setRefersToFormula("Data!$B$2");

        WorkbookSnapshot snapshot = roundTrip(workbook);

        TableDefinition sales = snapshot.findTable("sales");
        assertNotNull(sales);
        assertEquals("Data", sales.getSheet());
        assertEquals(1, sales.getHeaderRow());
        assertEquals(2, sales.getFirstDataRow());
        assertEquals(4, sales.getLastDataRow());
        assertEquals(1, sales.getFirstColumn());
        assertEquals(2, sales.getLastColumn());
        assertEquals("Data!$B$2", snapshot.findDefinedName("TopAmount"));
    }

    @Test
    public void testExternalLinkIndexesBecomeFileNames() {
        assertEquals("[Rates.xlsx]FX!B2*2",
                WorkbookLoader.resolveExternalIndexes("[1]FX!B2*2", Map.of(1, "Rates.xlsx")));
        assertEquals("[2]FX!B2", WorkbookLoader.resolveExternalIndexes("[2]FX!B2", Map.of(1, "Rates.xlsx")));
        assertEquals("SUM(A1:A3)", WorkbookLoader.resolveExternalIndexes("SUM(A1:A3)", Map.of()));
    }

    /**
     * Test that only sheet prefixes are rewritten: brackets in strings and table selectors stay.
     */
    @Test
    public void testExternalIndexesOutsideSheetPrefixesAreKept() {
        Map<Integer, String> files = Map.of(1, "Book.xlsx");
        assertEquals("\"Note [1]\"&[Book.xlsx]Rates!A1",
                WorkbookLoader.resolveExternalIndexes("\"Note [1]\"&[1]Rates!A1", files));
        assertEquals("'[Book.xlsx]My Sheet'!A1+Sales[[#This Row],[1]]",
                WorkbookLoader.resolveExternalIndexes("'[1]My Sheet'!A1+Sales[[#This Row],[1]]", files));
        assertEquals("\"say \"\"[1]\"\"\"&[Book.xlsx]!Rate",
                WorkbookLoader.resolveExternalIndexes("\"say \"\"[1]\"\"\"&[1]!Rate", files));
        assertEquals("'It''s [1]'&\"x\"",
                WorkbookLoader.resolveExternalIndexes("'It''s [1]'&\"x\"", files));
    }

    @Test
    public void testUnreadableBytesAreRejected() {
        WorkbookLoadingException e = assertThrows(WorkbookLoadingException.class,
                () -> loader.load(new ByteArrayInputStream("not a workbook".getBytes(StandardCharsets.UTF_8))));
        assertEquals("WORKBOOK_UNREADABLE", e.getCode());
    }

    @Test
    public void testWorkbookWithoutSheetsIsRejected() throws Exception {
        try (XSSFWorkbook empty = new XSSFWorkbook()) {
            WorkbookLoadingException e = assertThrows(WorkbookLoadingException.class, () -> loader.toSnapshot(empty));
            assertEquals("NO_SHEETS", e.getCode());
        }
    }
}
