package com.example.demo.formulaengine.parser;

import com.example.demo.formulaengine.exception.FormulaParseException;
import com.example.demo.formulaengine.parser.ast.BinaryNode;
import com.example.demo.formulaengine.parser.ast.BooleanNode;
import com.example.demo.formulaengine.parser.ast.EmptyNode;
import com.example.demo.formulaengine.parser.ast.ErrorNode;
import com.example.demo.formulaengine.parser.ast.FormulaNode;
import com.example.demo.formulaengine.parser.ast.FunctionNode;
import com.example.demo.formulaengine.parser.ast.NameNode;
import com.example.demo.formulaengine.parser.ast.NumberNode;
import com.example.demo.formulaengine.parser.ast.PercentNode;
import com.example.demo.formulaengine.parser.ast.RawNode;
import com.example.demo.formulaengine.parser.ast.ReferenceNode;
import com.example.demo.formulaengine.parser.ast.StringNode;
import com.example.demo.formulaengine.parser.ast.UnaryNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Pratt parser turning a token stream into a {@link FormulaNode} tree.
 *
 * Binding powers, lowest first: comparison, &amp;, + -, * /, ^ (left-associative as in Excel),
 * prefix + -, postfix %. Prefix minus binds tighter than ^, so -2^2 is 4.
 */
public final class FormulaParser {

    private static final int COMPARISON = 10;
    private static final int CONCAT = 20;
    private static final int ADDITIVE = 30;
    private static final int MULTIPLICATIVE = 40;
    private static final int POWER = 50;
    private static final int PREFIX = 60;
    private static final int POSTFIX = 70;

    private final List<Token> tokens;
    private int index;

    private FormulaParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parse a whole formula.
     *
     * @throws FormulaParseException on any syntax error, including trailing tokens
     */
    public static FormulaNode parse(List<Token> tokens) {
        if (tokens.isEmpty()) {
            throw new FormulaParseException("Empty formula", 0);
        }
        FormulaParser parser = new FormulaParser(tokens);
        FormulaNode root = parser.expression(0);
        if (parser.index < tokens.size()) {
            Token extra = tokens.get(parser.index);
            throw new FormulaParseException("Unexpected '" + extra.getText() + "'", extra.getStart());
        }
        return root;
    }

    /**
     * Parse, degrading to a raw node holding the whole text on a syntax error.
     */
    public static FormulaNode parseLenient(List<Token> tokens, String text, List<FormulaParseException> errors) {
        try {
            return parse(tokens);
        } catch (FormulaParseException e) {
            errors.add(e);
            return new RawNode(text);
        }
    }

    private FormulaNode expression(int minPower) {
        FormulaNode left = prefix();
        while (index < tokens.size()) {
            Token token = tokens.get(index);
            if (token.getType() != TokenType.OPERATOR) {
                break;
            }
            String op = token.getText();
            if (op.equals("%")) {
                if (POSTFIX < minPower) {
                    break;
                }
                index++;
                left = new PercentNode(left);
                continue;
            }
            int power = infixPower(op);
            if (power < 0 || power <= minPower) {
                break;
            }
            index++;
            FormulaNode right = expression(power);
            left = new BinaryNode(op, left, right);
        }
        return left;
    }

    private static int infixPower(String op) {
        switch (op) {
            case "=":
            case "<>":
            case "<":
            case ">":
            case "<=":
            case ">=":
                return COMPARISON;
            case "&":
                return CONCAT;
            case "+":
            case "-":
                return ADDITIVE;
            case "*":
            case "/":
                return MULTIPLICATIVE;
            case "^":
                return POWER;
            default:
                return -1;
        }
    }

    private FormulaNode prefix() {
        if (index >= tokens.size()) {
            int offset = tokens.isEmpty() ? 0 : tokens.get(tokens.size() - 1).getEnd();
            throw new FormulaParseException("Unexpected end of formula", offset);
        }
        Token token = tokens.get(index++);
        switch (token.getType()) {
            case NUMBER:
                return new NumberNode(token.getText());
            case STRING:
                return new StringNode(token.getValue());
            case BOOLEAN:
                return new BooleanNode(token.getText().equalsIgnoreCase("TRUE"));
            case ERROR:
                return new ErrorNode(token.getText());
            case EXTERNAL_RANGE:
            case EXTERNAL_CELL:
            case SHEET_RANGE:
            case SHEET_CELL:
            case TABLE_REF:
            case RANGE:
            case CELL:
                return new ReferenceNode(token.getReference());
            case NAME:
                return new NameNode(token.getText());
            case FUNCTION:
                return functionCall(token);
            case LPAREN: {
                FormulaNode inner = expression(0);
                expect(TokenType.RPAREN, "')'");
                return inner;
            }
            case OPERATOR:
                if (token.getText().equals("-") || token.getText().equals("+")) {
                    return new UnaryNode(token.getText(), expression(PREFIX));
                }
                throw new FormulaParseException("Unexpected operator '" + token.getText() + "'", token.getStart());
            default:
                throw new FormulaParseException("Unexpected '" + token.getText() + "'", token.getStart());
        }
    }

    private FormulaNode functionCall(Token name) {
        expect(TokenType.LPAREN, "'(' after " + name.getText());
        List<FormulaNode> arguments = new ArrayList<>();
        if (peek(TokenType.RPAREN)) {
            index++;
            return new FunctionNode(name.getText(), arguments);
        }
        while (true) {
            if (peek(TokenType.COMMA) || peek(TokenType.RPAREN)) {
                arguments.add(EmptyNode.INSTANCE);
            } else {
                arguments.add(expression(0));
            }
            if (peek(TokenType.COMMA)) {
                index++;
                continue;
            }
            expect(TokenType.RPAREN, "',' or ')' in " + name.getText());
            return new FunctionNode(name.getText(), arguments);
        }
    }

    private boolean peek(TokenType type) {
        return index < tokens.size() && tokens.get(index).getType() == type;
    }

    private void expect(TokenType type, String what) {
        if (!peek(type)) {
            int offset = index < tokens.size() ? tokens.get(index).getStart()
                    : tokens.get(tokens.size() - 1).getEnd();
            throw new FormulaParseException("Expected " + what, offset);
        }
        index++;
    }
}
