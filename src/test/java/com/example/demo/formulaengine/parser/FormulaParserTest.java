package com.example.demo.formulaengine.parser;

import com.example.demo.formulaengine.exception.FormulaParseException;
import com.example.demo.formulaengine.parser.ast.BinaryNode;
import com.example.demo.formulaengine.parser.ast.EmptyNode;
import com.example.demo.formulaengine.parser.ast.FormulaNode;
import com.example.demo.formulaengine.parser.ast.FunctionNode;
import com.example.demo.formulaengine.parser.ast.NumberNode;
import com.example.demo.formulaengine.parser.ast.PercentNode;
import com.example.demo.formulaengine.parser.ast.RawNode;
import com.example.demo.formulaengine.parser.ast.ReferenceNode;
import com.example.demo.formulaengine.parser.ast.UnaryNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Operator precedence and error handling of the formula parser.
 */
public class FormulaParserTest {

    private static FormulaNode parse(String formula) {
        return FormulaParser.parse(FormulaTokenizer.tokenize(formula, "Sheet1"));
    }

    @Test
    public void testMultiplicationBindsTighterThanAddition() {
        BinaryNode root = (BinaryNode) parse("=A1+B1*2");
        assertEquals("+", root.getOperator());
        assertTrue(root.getLeft() instanceof ReferenceNode);
        BinaryNode right = (BinaryNode) root.getRight();
        assertEquals("*", right.getOperator());
    }

    @Test
    public void testSubtractionIsLeftAssociative() {
        BinaryNode root = (BinaryNode) parse("=10-4-3");
        assertEquals("-", root.getOperator());
        assertTrue(root.getLeft() instanceof BinaryNode);
        assertEquals("3", ((NumberNode) root.getRight()).getText());
    }

    @Test
    public void testPowerIsLeftAssociative() {
        BinaryNode root = (BinaryNode) parse("=2^3^2");
        assertTrue(root.getLeft() instanceof BinaryNode);
        assertEquals("^", ((BinaryNode) root.getLeft()).getOperator());
    }

    @Test
    public void testUnaryMinusBindsTighterThanPower() {
        BinaryNode root = (BinaryNode) parse("=-2^2");
        assertEquals("^", root.getOperator());
        assertTrue(root.getLeft() instanceof UnaryNode);
    }

    @Test
    public void testComparisonIsLowestAndConcatAboveIt() {
        BinaryNode root = (BinaryNode) parse("=A1&\"x\"=B1+1");
        assertEquals("=", root.getOperator());
        assertEquals("&", ((BinaryNode) root.getLeft()).getOperator());
        assertEquals("+", ((BinaryNode) root.getRight()).getOperator());
    }

    @Test
    public void testPercentIsPostfix() {
        BinaryNode root = (BinaryNode) parse("=A1*50%");
        assertTrue(root.getRight() instanceof PercentNode);
    }

    @Test
    public void testFunctionArguments() {
        FunctionNode root = (FunctionNode) parse("=IF(A1>0,,SUM(B1:B3))");
        assertEquals("IF", root.getName());
        assertEquals(3, root.getArguments().size());
        assertTrue(root.getArguments().get(0) instanceof BinaryNode);
        assertSame(EmptyNode.INSTANCE, root.getArguments().get(1));
        assertEquals("SUM", ((FunctionNode) root.getArguments().get(2)).getName());

        FunctionNode noArgs = (FunctionNode) parse("=TODAY()");
        assertTrue(noArgs.getArguments().isEmpty());
    }

    @Test
    public void testParenthesesOverridePrecedence() {
        BinaryNode root = (BinaryNode) parse("=(A1+B1)*2");
        assertEquals("*", root.getOperator());
        assertEquals("+", ((BinaryNode) root.getLeft()).getOperator());
    }

    @Test
    public void testSyntaxErrors() {
        assertThrows(FormulaParseException.class, () -> parse("=SUM(A1,"));
        assertThrows(FormulaParseException.class, () -> parse("=(A1+B1"));
        assertThrows(FormulaParseException.class, () -> parse("=A1 B1"));
        assertThrows(FormulaParseException.class, () -> parse("="));
        FormulaParseException e = assertThrows(FormulaParseException.class, () -> parse("=1+*2"));
        assertEquals(2, e.getOffset());
    }

    @Test
    public void testLenientParseKeepsTheTextOnError() {
        List<FormulaParseException> errors = new ArrayList<>();
        FormulaNode node = FormulaParser.parseLenient(FormulaTokenizer.tokenize("=1+", "Sheet1"), "1+", errors);
        assertTrue(node instanceof RawNode);
        assertEquals(1, errors.size());
    }
}
