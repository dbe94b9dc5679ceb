package com.example.demo.formulaengine.translator;

import com.example.demo.formulaengine.exception.FormulaParseException;
import com.example.demo.formulaengine.model.CellAddress;
import com.example.demo.formulaengine.model.Diagnostic;
import com.example.demo.formulaengine.model.IssueKind;
import com.example.demo.formulaengine.model.Reference;
import com.example.demo.formulaengine.model.ReferenceKind;
import com.example.demo.formulaengine.model.TableArea;
import com.example.demo.formulaengine.model.TableDefinition;
import com.example.demo.formulaengine.model.WorkbookSnapshot;
import com.example.demo.formulaengine.parser.FormulaParser;
import com.example.demo.formulaengine.parser.FormulaTokenizer;
import com.example.demo.formulaengine.parser.ast.BinaryNode;
import com.example.demo.formulaengine.parser.ast.BooleanNode;
import com.example.demo.formulaengine.parser.ast.EmptyNode;
import com.example.demo.formulaengine.parser.ast.ErrorNode;
import com.example.demo.formulaengine.parser.ast.FormulaNode;
import com.example.demo.formulaengine.parser.ast.FormulaVisitor;
import com.example.demo.formulaengine.parser.ast.FunctionNode;
import com.example.demo.formulaengine.parser.ast.NameNode;
import com.example.demo.formulaengine.parser.ast.NumberNode;
import com.example.demo.formulaengine.parser.ast.PercentNode;
import com.example.demo.formulaengine.parser.ast.RawNode;
import com.example.demo.formulaengine.parser.ast.ReferenceNode;
import com.example.demo.formulaengine.parser.ast.StringNode;
import com.example.demo.formulaengine.parser.ast.UnaryNode;
import com.example.demo.formulaengine.util.PythonLiterals;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders a formula tree as a Python expression over the cell store {@code c}.
 *
 * Cells render as {@code c.get((sheet, column, row))} and ranges as
 * {@code _rng(c, sheet, column1, row1, column2, row2)}; how coordinates appear is decided by the
 * {@link ReferenceStyle}. While rendering, every reference read by the formula is collected in
 * {@link #getConsumed()} and problems are collected in {@link #getDiagnostics()}.
 *
 * Not thread-safe; create one per rendering.
 */
public class ExpressionRenderer implements FormulaVisitor<String> {

    private static final int MAX_NAME_DEPTH = 16;

    private final ReferenceStyle style;
    private final CellAddress cell;
    private final WorkbookSnapshot workbook;

    @Getter
    private final List<Reference> consumed = new ArrayList<>();

    @Getter
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    private final Set<String> expandingNames = new HashSet<>();

    /**
     * @param style    coordinate rendering
     * @param workbook source of tables and defined names, may be null
     */
    public ExpressionRenderer(ReferenceStyle style, WorkbookSnapshot workbook) {
        this.style = style;
        this.cell = style.anchor();
        this.workbook = workbook;
    }

    public String render(FormulaNode node) {
        return node.accept(this);
    }

    @Override
    public String visitNumber(NumberNode node) {
        return normalizeNumber(node.getText());
    }

    @Override
    public String visitString(StringNode node) {
        return PythonLiterals.string(node.getValue());
    }

    @Override
    public String visitBoolean(BooleanNode node) {
        return node.isValue() ? "True" : "False";
    }

    @Override
    public String visitError(ErrorNode node) {
        return "xl_error(" + PythonLiterals.string(node.getCode()) + ")";
    }

    @Override
    public String visitReference(ReferenceNode node) {
        Reference reference = node.getReference();
        if (reference.isTable()) {
            return renderTable(reference);
        }
        consumed.add(reference);
        return renderCellOrRange(reference);
    }

    @Override
    public String visitName(NameNode node) {
        String name = node.getName();
        String refersTo = workbook == null ? null : workbook.findDefinedName(name);
        if (refersTo == null) {
            report(IssueKind.PARSE_ERROR, "Unknown name '" + name + "'");
            return PythonLiterals.string(name);
        }
        String key = name.toUpperCase();
        if (expandingNames.contains(key) || expandingNames.size() >= MAX_NAME_DEPTH) {
            report(IssueKind.PARSE_ERROR, "Defined name '" + name + "' refers to itself");
            return PythonLiterals.string(name);
        }
        Map<String, TableDefinition> tables = workbook.getTables();
        FormulaNode definition;
        try {
            definition = FormulaParser.parse(FormulaTokenizer.tokenize(refersTo, cell.getSheet(), tables));
        } catch (FormulaParseException e) {
            report(IssueKind.PARSE_ERROR, "Cannot parse defined name '" + name + "': " + e.getMessage());
            return PythonLiterals.string(name);
        }
        expandingNames.add(key);
        try {
            return "(" + definition.accept(this) + ")";
        } finally {
            expandingNames.remove(key);
        }
    }

    @Override
    public String visitFunction(FunctionNode node) {
        String name = FunctionCatalog.normalize(node.getName());
        List<FormulaNode> args = node.getArguments();
        switch (name) {
            case "IF":
                return renderIf(args);
            case "IFERROR":
            case "IFNA":
                return renderLazyFallback(FunctionCatalog.targetNameFor(name), args);
            case "TRUE":
                return "True";
            case "FALSE":
                return "False";
            case "ROW":
                return renderPosition(args, true);
            case "COLUMN":
                return renderPosition(args, false);
            case "OFFSET":
                return renderOffset(args);
            case "INDIRECT":
                return renderIndirect(args);
            default:
                return call(resolveTarget(node.getName(), name), renderAll(args));
        }
    }

    @Override
    public String visitBinary(BinaryNode node) {
        if (chainClass(node.getOperator()) != 0) {
            return "(" + renderChain(node) + ")";
        }
        String left = node.getLeft().accept(this);
        String right = node.getRight().accept(this);
        switch (node.getOperator()) {
            case "&":
                return "xl_concat(" + left + ", " + right + ")";
            case "^":
                return "(" + left + " ** " + right + ")";
            case "=":
                return "(" + left + " == " + right + ")";
            case "<>":
                return "(" + left + " != " + right + ")";
            default:
                return "(" + left + " " + node.getOperator() + " " + right + ")";
        }
    }

    /**
     * Left-nested runs of + and - (or of * and /) render flat inside one pair of parentheses.
     * Python groups these left to right as Excel does, and deep chains stay within the nesting
     * limit of the Python compiler.
     */
    private String renderChain(BinaryNode node) {
        FormulaNode left = node.getLeft();
        String leftText;
        if (left instanceof BinaryNode
                && chainClass(((BinaryNode) left).getOperator()) == chainClass(node.getOperator())) {
            leftText = renderChain((BinaryNode) left);
        } else {
            leftText = left.accept(this);
        }
        return leftText + " " + node.getOperator() + " " + node.getRight().accept(this);
    }

    /** 1 for additive, 2 for multiplicative, 0 for operators that always get their own parentheses */
    private static int chainClass(String operator) {
        switch (operator) {
            case "+":
            case "-":
                return 1;
            case "*":
            case "/":
                return 2;
            default:
                return 0;
        }
    }

    @Override
    public String visitUnary(UnaryNode node) {
        return "(" + node.getOperator() + node.getOperand().accept(this) + ")";
    }

    @Override
    public String visitPercent(PercentNode node) {
        if (node.getOperand() instanceof NumberNode) {
            BigDecimal value = new BigDecimal(((NumberNode) node.getOperand()).getText());
            return value.movePointLeft(2).stripTrailingZeros().toPlainString();
        }
        return "(" + node.getOperand().accept(this) + " / 100)";
    }

    @Override
    public String visitEmpty(EmptyNode node) {
        return "None";
    }

    @Override
    public String visitRaw(RawNode node) {
        return PythonLiterals.string(node.getText());
    }

    private String renderCellOrRange(Reference ref) {
        String sheet = PythonLiterals.string(ref.getStoreSheet());
        if (ref.getKind() == ReferenceKind.CELL) {
            return "c.get((" + sheet + ", "
                    + style.column(ref.getStartColumn(), ref.isStartColumnAbsolute()) + ", "
                    + style.row(ref.getStartRow(), ref.isStartRowAbsolute()) + "))";
        }
        return "_rng(c, " + sheet + ", "
                + style.column(ref.getStartColumn(), ref.isStartColumnAbsolute()) + ", "
                + style.row(ref.getStartRow(), ref.isStartRowAbsolute()) + ", "
                + style.column(ref.getEndColumn(), ref.isEndColumnAbsolute()) + ", "
                + style.row(ref.getEndRow(), ref.isEndRowAbsolute()) + ")";
    }

    private String renderTable(Reference ref) {
        Reference resolved = resolveTable(ref);
        if (resolved == null) {
            return PythonLiterals.string(ref.getText());
        }
        consumed.add(resolved);
        if (ref.getTableArea() != TableArea.THIS_ROW) {
            return renderCellOrRange(resolved);
        }
        String sheet = PythonLiterals.string(resolved.getSheet());
        String row = style.currentRow();
        if (resolved.getKind() == ReferenceKind.CELL) {
            return "c.get((" + sheet + ", " + style.column(resolved.getStartColumn(), true) + ", " + row + "))";
        }
        return "_rng(c, " + sheet + ", " + style.column(resolved.getStartColumn(), true) + ", " + row + ", "
                + style.column(resolved.getEndColumn(), true) + ", " + row + ")";
    }

    /**
     * Concrete cell/range a table reference stands for when evaluated in the anchor cell, or
     * null (with a diagnostic) when the table or column is unknown.
     */
    Reference resolveTable(Reference ref) {
        TableDefinition table = workbook == null ? null : workbook.findTable(ref.getTableName());
        if (table == null) {
            report(IssueKind.PARSE_ERROR, "Unknown table '" + ref.getTableName() + "'");
            return null;
        }
        int firstColumn = table.getFirstColumn();
        int lastColumn = table.getLastColumn();
        if (ref.getTableColumn() != null) {
            firstColumn = table.columnIndexOf(ref.getTableColumn());
            lastColumn = table.columnIndexOf(ref.getTableEndColumn());
            if (firstColumn < 0 || lastColumn < 0) {
                report(IssueKind.PARSE_ERROR, "Unknown column in table reference " + ref.getText());
                return null;
            }
        }
        int firstRow;
        int lastRow;
        switch (ref.getTableArea()) {
            case ALL:
                firstRow = table.getHeaderRow();
                lastRow = table.getLastDataRow();
                break;
            case HEADERS:
                firstRow = table.getHeaderRow();
                lastRow = table.getHeaderRow();
                break;
            case THIS_ROW:
                firstRow = cell.getRow();
                lastRow = cell.getRow();
                break;
            default:
                firstRow = table.getFirstDataRow();
                lastRow = table.getLastDataRow();
        }
        Reference resolved = firstColumn == lastColumn && firstRow == lastRow
                ? Reference.cell(table.getSheet(), firstColumn, firstRow)
                : Reference.range(table.getSheet(), firstColumn, firstRow, lastColumn, lastRow);
        return resolved.toBuilder()
                .startColumnAbsolute(true).endColumnAbsolute(true)
                .startRowAbsolute(true).endRowAbsolute(true)
                .text(ref.getText())
                .build();
    }

    private String renderIf(List<FormulaNode> args) {
        if (args.isEmpty()) {
            report(IssueKind.PARSE_ERROR, "IF without arguments");
            return "None";
        }
        String condition = args.get(0).accept(this);
        String whenTrue = args.size() > 1 ? renderOrZero(args.get(1)) : "True";
        String whenFalse = args.size() > 2 ? renderOrZero(args.get(2)) : "False";
        return "(" + whenTrue + " if xl_bool(" + condition + ") else " + whenFalse + ")";
    }

    private String renderOrZero(FormulaNode node) {
        return node instanceof EmptyNode ? "0" : node.accept(this);
    }

    /** IFERROR/IFNA receive thunks so only the branch taken is evaluated */
    private String renderLazyFallback(String target, List<FormulaNode> args) {
        if (args.size() != 2) {
            report(IssueKind.PARSE_ERROR, target + " expects 2 arguments, got " + args.size());
        }
        String value = args.isEmpty() ? "None" : args.get(0).accept(this);
        String fallback = args.size() > 1 ? renderOrZero(args.get(1)) : "0";
        return target + "(lambda: " + value + ", lambda: " + fallback + ")";
    }

    /** ROW()/COLUMN() and ROW(ref)/COLUMN(ref) resolve to positions, not values */
    private String renderPosition(List<FormulaNode> args, boolean row) {
        if (args.isEmpty() || args.get(0) instanceof EmptyNode) {
            return row ? style.currentRow() : style.currentColumnIndex();
        }
        if (args.size() == 1 && args.get(0) instanceof ReferenceNode) {
            Reference ref = ((ReferenceNode) args.get(0)).getReference();
            if (ref.isTable()) {
                if (ref.getTableArea() == TableArea.THIS_ROW && row) {
                    return style.currentRow();
                }
                Reference resolved = resolveTable(ref);
                if (resolved == null) {
                    return PythonLiterals.string(ref.getText());
                }
                return row ? Integer.toString(resolved.getStartRow()) : Integer.toString(resolved.getStartColumn());
            }
            return row
                    ? style.row(ref.getStartRow(), ref.isStartRowAbsolute())
                    : style.columnIndex(ref.getStartColumn(), ref.isStartColumnAbsolute());
        }
        return call(row ? "xl_row" : "xl_column", renderAll(args));
    }

    private String renderOffset(List<FormulaNode> args) {
        if (args.size() < 3 || !(args.get(0) instanceof ReferenceNode)
                || ((ReferenceNode) args.get(0)).getReference().isTable()) {
            report(IssueKind.DYNAMIC_REFERENCE, "OFFSET needs a cell or range anchor and at least 3 arguments");
            return "xl_error('#REF!')";
        }
        Reference base = ((ReferenceNode) args.get(0)).getReference();
        Integer rows = staticInt(args, 1, 0);
        Integer columns = staticInt(args, 2, 0);
        Integer height = staticInt(args, 3, 0);
        Integer width = staticInt(args, 4, 0);
        if (rows != null && columns != null && height != null && width != null) {
            Reference shifted = base.offset(rows, columns, height, width);
            if (shifted != null) {
                consumed.add(shifted);
                return renderCellOrRange(shifted);
            }
            report(IssueKind.PARSE_ERROR, "OFFSET moves " + base.getText() + " off the sheet");
            return "xl_error('#REF!')";
        }
        report(IssueKind.DYNAMIC_REFERENCE, "OFFSET with computed arguments is evaluated at run time");
        consumed.add(base);
        List<String> parts = new ArrayList<>();
        parts.add("c");
        parts.add(PythonLiterals.string(base.getStoreSheet()));
        parts.add(style.row(base.getStartRow(), base.isStartRowAbsolute()));
        parts.add(style.columnIndex(base.getStartColumn(), base.isStartColumnAbsolute()));
        for (int i = 1; i < 5; i++) {
            parts.add(i < args.size() ? args.get(i).accept(this) : "None");
        }
        return "xl_offset(" + String.join(", ", parts) + ")";
    }

    private String renderIndirect(List<FormulaNode> args) {
        report(IssueKind.DYNAMIC_REFERENCE, "INDIRECT is evaluated at run time; its dependencies are not tracked");
        return call("xl_indirect", "c", PythonLiterals.string(cell.getSheet()), renderAll(args));
    }

    /** Integer value of a literal argument, the default when omitted, null when computed */
    private static Integer staticInt(List<FormulaNode> args, int index, int defaultValue) {
        if (index >= args.size() || args.get(index) instanceof EmptyNode) {
            return defaultValue;
        }
        FormulaNode node = args.get(index);
        int sign = 1;
        if (node instanceof UnaryNode) {
            sign = "-".equals(((UnaryNode) node).getOperator()) ? -1 : 1;
            node = ((UnaryNode) node).getOperand();
        }
        if (!(node instanceof NumberNode)) {
            return null;
        }
        try {
            return sign * new BigDecimal(((NumberNode) node).getText()).intValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }

    private String resolveTarget(String written, String normalized) {
        FunctionSpec spec = FunctionCatalog.lookup(normalized);
        if (spec != null) {
            return spec.getTargetName();
        }
        String target = FunctionCatalog.targetNameFor(normalized);
        report(IssueKind.UNKNOWN_FUNCTION, "Function " + written + " is not supported; emitted as " + target);
        return target;
    }

    private String renderAll(List<FormulaNode> args) {
        return args.stream().map(a -> a.accept(this)).collect(Collectors.joining(", "));
    }

    private static String call(String target, String... parts) {
        StringBuilder sb = new StringBuilder(target).append('(');
        boolean first = true;
        for (String part : parts) {
            if (part.isEmpty()) {
                continue;
            }
            if (!first) {
                sb.append(", ");
            }
            sb.append(part);
            first = false;
        }
        return sb.append(')').toString();
    }

    private void report(IssueKind kind, String message) {
        diagnostics.add(Diagnostic.of(cell, kind, message));
    }

    /** Python rejects integers with leading zeros, so literals are re-rendered */
    static String normalizeNumber(String text) {
        BigDecimal value = new BigDecimal(text);
        boolean integral = text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0;
        if (integral) {
            return value.toBigInteger().toString();
        }
        if (text.indexOf('e') >= 0 || text.indexOf('E') >= 0) {
            return value.toString();
        }
        return value.toPlainString();
    }
}
