package com.example.demo.formulaengine.parser;

import com.example.demo.formulaengine.model.Reference;
import com.example.demo.formulaengine.model.TableArea;
import com.example.demo.formulaengine.model.TableDefinition;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Token classification, with emphasis on the reference forms.
 */
public class FormulaTokenizerTest {

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::getType).collect(Collectors.toList());
    }

    @Test
    public void testSimpleArithmetic() {
        List<Token> tokens = FormulaTokenizer.tokenize("=A1+B1*2", "Sheet1");
        assertEquals(Arrays.asList(TokenType.CELL, TokenType.OPERATOR, TokenType.CELL, TokenType.OPERATOR,
                TokenType.NUMBER), types(tokens));
        assertEquals(0, tokens.get(0).getStart());
        assertEquals("Sheet1", tokens.get(0).getReference().getSheet());
    }

    @Test
    public void testRangeAndFunction() {
        List<Token> tokens = FormulaTokenizer.tokenize("=SUM($A$1:B10)", "Data");
        assertEquals(Arrays.asList(TokenType.FUNCTION, TokenType.LPAREN, TokenType.RANGE, TokenType.RPAREN),
                types(tokens));
        Reference range = tokens.get(2).getReference();
        assertEquals(1, range.getStartColumn());
        assertEquals(2, range.getEndColumn());
        assertEquals(10, range.getEndRow());
        assertTrue(range.isStartColumnAbsolute());
        assertTrue(range.isStartRowAbsolute());
        assertFalse(range.isEndColumnAbsolute());
    }

    @Test
    public void testFunctionNamesThatLookLikeCells() {
        List<Token> tokens = FormulaTokenizer.tokenize("=LOG10(A1)", "Sheet1");
        assertEquals(TokenType.FUNCTION, tokens.get(0).getType());
        assertEquals("LOG10", tokens.get(0).getText());
        assertEquals(TokenType.CELL, tokens.get(2).getType());
    }

    @Test
    public void testSheetQualifiedReferences() {
        List<Token> tokens = FormulaTokenizer.tokenize("=Inputs!B2+'My Sheet'!C3:D4+'O''Brien'!A1", "Calc");
        assertEquals(TokenType.SHEET_CELL, tokens.get(0).getType());
        assertEquals("Inputs", tokens.get(0).getReference().getSheet());
        assertEquals(TokenType.SHEET_RANGE, tokens.get(2).getType());
        assertEquals("My Sheet", tokens.get(2).getReference().getSheet());
        assertEquals("O'Brien", tokens.get(4).getReference().getSheet());
    }

    @Test
    public void testExternalReferences() {
        List<Token> tokens = FormulaTokenizer.tokenize("=[Rates.xlsx]FX!B2*'C:\\data\\[Book 2.xlsx]Sheet 1'!A1:A3",
                "Calc");
        assertEquals(TokenType.EXTERNAL_CELL, tokens.get(0).getType());
        assertEquals("Rates.xlsx", tokens.get(0).getReference().getExternalFile());
        assertEquals("FX", tokens.get(0).getReference().getSheet());
        assertEquals(TokenType.EXTERNAL_RANGE, tokens.get(2).getType());
        assertEquals("Book 2.xlsx", tokens.get(2).getReference().getExternalFile());
        assertEquals("Sheet 1", tokens.get(2).getReference().getSheet());
    }

    @Test
    public void testStringContentIsNeverAReference() {
        List<Token> tokens = FormulaTokenizer.tokenize("=\"A1 and \"\"B2\"\"\"&C3", "Sheet1");
        assertEquals(Arrays.asList(TokenType.STRING, TokenType.OPERATOR, TokenType.CELL), types(tokens));
        assertEquals("A1 and \"B2\"", tokens.get(0).getValue());
    }

    @Test
    public void testLiteralsAndErrors() {
        List<Token> tokens = FormulaTokenizer.tokenize("=IF(TRUE,1.5E3,#N/A)", "Sheet1");
        assertEquals(Arrays.asList(TokenType.FUNCTION, TokenType.LPAREN, TokenType.BOOLEAN, TokenType.COMMA,
                TokenType.NUMBER, TokenType.COMMA, TokenType.ERROR, TokenType.RPAREN), types(tokens));
        assertEquals("1.5E3", tokens.get(4).getText());
        assertEquals("#N/A", tokens.get(6).getText());
    }

    @Test
    public void testOutOfGridCoordinatesAreNotReferences() {
        List<Token> tokens = FormulaTokenizer.tokenize("=XFE1+A1", "Sheet1");
        assertEquals(TokenType.NAME, tokens.get(0).getType());
        assertEquals(TokenType.CELL, tokens.get(2).getType());
    }

    @Test
    public void testTableReferences() {
        TableDefinition table = TableDefinition.builder()
                .name("Sales")
                .sheet("Data")
                .headerRow(1)
                .firstDataRow(2)
                .lastDataRow(10)
                .firstColumn(1)
                .lastColumn(3)
                .columnNames(Arrays.asList("Region", "Amount", "Tax"))
                .build();
        Map<String, TableDefinition> tables = Map.of("Sales", table);

        List<Token> tokens = FormulaTokenizer.tokenize("=SUM(Sales[Amount])+Sales[@Tax]", "Summary", tables);
        Token column = tokens.get(2);
        assertEquals(TokenType.TABLE_REF, column.getType());
        assertEquals("Data", column.getReference().getSheet());
        assertEquals("Amount", column.getReference().getTableColumn());

        Token thisRow = tokens.get(5);
        assertEquals(TokenType.TABLE_REF, thisRow.getType());
        assertEquals(TableArea.THIS_ROW, thisRow.getReference().getTableArea());
        assertEquals("Tax", thisRow.getReference().getTableColumn());
    }

    @Test
    public void testNeverThrows() {
        List<Token> tokens = FormulaTokenizer.tokenize("=A1 ~ {1,2}", "Sheet1");
        assertTrue(types(tokens).contains(TokenType.UNKNOWN));
    }
}
