package com.example.demo.formulaengine.parser;

import com.example.demo.formulaengine.model.Reference;
import com.example.demo.formulaengine.model.ReferenceKind;
import com.example.demo.formulaengine.model.TableArea;
import com.example.demo.formulaengine.model.TableDefinition;
import com.example.demo.formulaengine.util.ColumnLetters;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single-pass tokenizer for Excel formulas.
 *
 * References are recognised while scanning, so every span is claimed at most once. At a given
 * position the forms are tried in this order: external workbook, quoted sheet, bare sheet,
 * structured table, then local range/cell. Text inside string literals never yields a
 * reference. The tokenizer never throws; anything it cannot classify becomes an UNKNOWN token.
 */
public final class FormulaTokenizer {

    private static final String CELL = "(\\$?)([A-Z]{1,3})(\\$?)([0-9]+)";
    private static final Pattern CELL_OR_RANGE = Pattern.compile(CELL + "(?::" + CELL + ")?");

    /** 'C:\dir\[Book.xlsx]My Sheet'! (directory part optional) */
    private static final Pattern EXTERNAL_QUOTED = Pattern.compile("'([^'\\[\\]]*)\\[([^\\]]+)\\]((?:[^']|'')+)'!");
    /** [Book.xlsx]Sheet1! */
    private static final Pattern EXTERNAL_BARE = Pattern.compile("\\[([^\\]]+)\\]([^'!\\[\\]\\s(),;]+)!");
    private static final Pattern QUOTED_SHEET = Pattern.compile("'((?:[^'\\[\\]]|'')+)'!");
    private static final Pattern BARE_SHEET = Pattern.compile("([A-Za-z_][A-Za-z0-9_.]*)!");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_\\\\][A-Za-z0-9_.]*");
    private static final Pattern NUMBER = Pattern.compile("(?:[0-9]+(?:\\.[0-9]*)?|\\.[0-9]+)(?:[eE][+-]?[0-9]+)?");
    private static final Pattern ERROR = Pattern.compile(
            "#(?:NULL!|DIV/0!|VALUE!|REF!|NAME\\?|NUM!|N/A|GETTING_DATA|SPILL!|CALC!)", Pattern.CASE_INSENSITIVE);

    private final String text;
    private final String currentSheet;
    private final Map<String, TableDefinition> tables;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;

    private FormulaTokenizer(String text, String currentSheet, Map<String, TableDefinition> tables) {
        this.text = text;
        this.currentSheet = currentSheet;
        this.tables = tables == null ? Collections.emptyMap() : tables;
    }

    public static List<Token> tokenize(String formula, String currentSheet) {
        return tokenize(formula, currentSheet, Collections.emptyMap());
    }

    /**
     * Tokenize a formula. A leading "=" is stripped and token offsets are relative to the
     * remaining text.
     *
     * @param tables table definitions used to resolve the owning sheet of table references
     */
    public static List<Token> tokenize(String formula, String currentSheet, Map<String, TableDefinition> tables) {
        FormulaTokenizer tokenizer = new FormulaTokenizer(stripEquals(formula), currentSheet, tables);
        tokenizer.run();
        return tokenizer.tokens;
    }

    public static String stripEquals(String formula) {
        if (formula == null) {
            return "";
        }
        return formula.startsWith("=") ? formula.substring(1) : formula;
    }

    private void run() {
        while (pos < text.length()) {
            char ch = text.charAt(pos);
            if (Character.isWhitespace(ch)) {
                pos++;
            } else if (ch == '"') {
                readString();
            } else if (ch == '#') {
                readError();
            } else if (ch == '\'' || ch == '[') {
                if (!readQualifiedReference()) {
                    single(TokenType.UNKNOWN);
                }
            } else if (Character.isLetter(ch) || ch == '_' || ch == '$' || ch == '\\') {
                readWord();
            } else if (Character.isDigit(ch) || (ch == '.' && pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1)))) {
                readNumber();
            } else if (ch == '(') {
                single(TokenType.LPAREN);
            } else if (ch == ')') {
                single(TokenType.RPAREN);
            } else if (ch == ',' || ch == ';') {
                single(TokenType.COMMA);
            } else {
                readOperator();
            }
        }
    }

    private void single(TokenType type) {
        tokens.add(Token.of(type, text.substring(pos, pos + 1), pos, pos + 1));
        pos++;
    }

    private void readString() {
        int start = pos;
        StringBuilder value = new StringBuilder();
        int i = pos + 1;
        while (i < text.length()) {
            char ch = text.charAt(i);
            if (ch == '"') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '"') {
                    value.append('"');
                    i += 2;
                    continue;
                }
                i++;
                break;
            }
            value.append(ch);
            i++;
        }
        pos = Math.min(i, text.length());
        tokens.add(Token.string(text.substring(start, pos), value.toString(), start, pos));
    }

    private void readError() {
        Matcher m = ERROR.matcher(text).region(pos, text.length());
        if (m.lookingAt()) {
            tokens.add(Token.of(TokenType.ERROR, m.group().toUpperCase(), pos, m.end()));
            pos = m.end();
        } else {
            single(TokenType.UNKNOWN);
        }
    }

    private void readNumber() {
        Matcher m = NUMBER.matcher(text).region(pos, text.length());
        if (m.lookingAt()) {
            tokens.add(Token.of(TokenType.NUMBER, m.group(), pos, m.end()));
            pos = m.end();
        } else {
            single(TokenType.UNKNOWN);
        }
    }

    private void readOperator() {
        if (pos + 1 < text.length()) {
            String two = text.substring(pos, pos + 2);
            if (two.equals("<>") || two.equals("<=") || two.equals(">=")) {
                tokens.add(Token.of(TokenType.OPERATOR, two, pos, pos + 2));
                pos += 2;
                return;
            }
        }
        char ch = text.charAt(pos);
        if ("+-*/^&=<>%:".indexOf(ch) >= 0) {
            single(TokenType.OPERATOR);
        } else {
            single(TokenType.UNKNOWN);
        }
    }

    /** External references and quoted sheet names */
    private boolean readQualifiedReference() {
        int start = pos;
        Matcher m = EXTERNAL_QUOTED.matcher(text).region(pos, text.length());
        if (m.lookingAt()) {
            return readReferenceAfterPrefix(start, m.end(), m.group(2), unquote(m.group(3)));
        }
        m = EXTERNAL_BARE.matcher(text).region(pos, text.length());
        if (m.lookingAt()) {
            return readReferenceAfterPrefix(start, m.end(), m.group(1), m.group(2));
        }
        m = QUOTED_SHEET.matcher(text).region(pos, text.length());
        if (m.lookingAt()) {
            return readReferenceAfterPrefix(start, m.end(), null, unquote(m.group(1)));
        }
        return false;
    }

    private void readWord() {
        int start = pos;
        Matcher sheet = BARE_SHEET.matcher(text).region(pos, text.length());
        if (sheet.lookingAt() && readReferenceAfterPrefix(start, sheet.end(), null, sheet.group(1))) {
            return;
        }
        Matcher ident = IDENTIFIER.matcher(text).region(pos, text.length());
        boolean isIdentifier = text.charAt(pos) != '$' && ident.lookingAt();
        if (isIdentifier && ident.end() < text.length() && text.charAt(ident.end()) == '[') {
            if (readTableReference(start, ident.group(), ident.end())) {
                return;
            }
        }
        if (readLocalReference(start)) {
            return;
        }
        if (!isIdentifier) {
            single(TokenType.UNKNOWN);
            return;
        }
        String word = ident.group();
        int end = ident.end();
        int next = skipSpaces(end);
        if (next < text.length() && text.charAt(next) == '(') {
            tokens.add(Token.of(TokenType.FUNCTION, word, start, end));
        } else if (word.equalsIgnoreCase("TRUE") || word.equalsIgnoreCase("FALSE")) {
            tokens.add(Token.of(TokenType.BOOLEAN, word.toUpperCase(), start, end));
        } else {
            tokens.add(Token.of(TokenType.NAME, word, start, end));
        }
        pos = end;
    }

    private boolean readLocalReference(int start) {
        if (start > 0) {
            char prev = text.charAt(start - 1);
            if (Character.isLetter(prev) || prev == '_') {
                return false;
            }
        }
        Matcher m = CELL_OR_RANGE.matcher(text).region(start, text.length());
        if (!m.lookingAt() || !isReferenceBoundary(m.end())) {
            return false;
        }
        Reference reference = buildReference(m, null, currentSheet, start, m.end());
        if (reference == null) {
            return false;
        }
        TokenType type = reference.getKind() == ReferenceKind.RANGE ? TokenType.RANGE : TokenType.CELL;
        tokens.add(Token.reference(type, text.substring(start, m.end()), start, m.end(), reference));
        pos = m.end();
        return true;
    }

    private boolean readReferenceAfterPrefix(int start, int refStart, String externalFile, String sheet) {
        Matcher m = CELL_OR_RANGE.matcher(text).region(refStart, text.length());
        if (!m.lookingAt() || !isReferenceBoundary(m.end())) {
            return false;
        }
        Reference reference = buildReference(m, externalFile, sheet, start, m.end());
        if (reference == null) {
            return false;
        }
        boolean range = reference.getKind() == ReferenceKind.RANGE;
        TokenType type;
        if (externalFile != null) {
            type = range ? TokenType.EXTERNAL_RANGE : TokenType.EXTERNAL_CELL;
        } else {
            type = range ? TokenType.SHEET_RANGE : TokenType.SHEET_CELL;
        }
        tokens.add(Token.reference(type, text.substring(start, m.end()), start, m.end(), reference));
        pos = m.end();
        return true;
    }

    /** A reference must not run into an identifier, a function call or a sheet separator. */
    private boolean isReferenceBoundary(int end) {
        if (end >= text.length()) {
            return true;
        }
        char next = text.charAt(end);
        return !(Character.isLetterOrDigit(next) || next == '_' || next == '.' || next == '(' || next == '!');
    }

    private Reference buildReference(Matcher m, String externalFile, String sheet, int start, int end) {
        int col1 = ColumnLetters.toIndex(m.group(2));
        int row1 = parseRow(m.group(4));
        if (!ColumnLetters.isValidColumn(col1) || !ColumnLetters.isValidRow(row1)) {
            return null;
        }
        Reference.ReferenceBuilder builder = Reference.builder()
                .externalFile(externalFile)
                .sheet(sheet)
                .spanStart(start)
                .spanEnd(end)
                .text(text.substring(start, end));
        if (m.group(5) == null) {
            boolean colAbs = !m.group(1).isEmpty();
            boolean rowAbs = !m.group(3).isEmpty();
            return builder.kind(ReferenceKind.CELL)
                    .startColumn(col1).startRow(row1).endColumn(col1).endRow(row1)
                    .startColumnAbsolute(colAbs).startRowAbsolute(rowAbs)
                    .endColumnAbsolute(colAbs).endRowAbsolute(rowAbs)
                    .build();
        }
        int col2 = ColumnLetters.toIndex(m.group(6));
        int row2 = parseRow(m.group(8));
        if (!ColumnLetters.isValidColumn(col2) || !ColumnLetters.isValidRow(row2)) {
            return null;
        }
        // A range written bottom-up (B5:A1) covers the same block as A1:B5
        boolean swapCols = col2 < col1;
        boolean swapRows = row2 < row1;
        return builder.kind(ReferenceKind.RANGE)
                .startColumn(Math.min(col1, col2)).endColumn(Math.max(col1, col2))
                .startRow(Math.min(row1, row2)).endRow(Math.max(row1, row2))
                .startColumnAbsolute(!(swapCols ? m.group(5) : m.group(1)).isEmpty())
                .endColumnAbsolute(!(swapCols ? m.group(1) : m.group(5)).isEmpty())
                .startRowAbsolute(!(swapRows ? m.group(7) : m.group(3)).isEmpty())
                .endRowAbsolute(!(swapRows ? m.group(3) : m.group(7)).isEmpty())
                .build();
    }

    private static int parseRow(String digits) {
        if (digits.length() > 7) {
            return -1;
        }
        return Integer.parseInt(digits);
    }

    private boolean readTableReference(int start, String tableName, int bracketStart) {
        int depth = 0;
        int i = bracketStart;
        while (i < text.length()) {
            char ch = text.charAt(i);
            if (ch == '\'' && i + 1 < text.length()) {
                // escaped special character inside a column name
                i += 2;
                continue;
            }
            if (ch == '[') {
                depth++;
            } else if (ch == ']') {
                depth--;
                if (depth == 0) {
                    break;
                }
            }
            i++;
        }
        if (depth != 0) {
            return false;
        }
        int end = i + 1;
        String inner = text.substring(bracketStart + 1, i);
        Reference.ReferenceBuilder builder = TableSelector.parse(inner);
        if (builder == null) {
            return false;
        }
        TableDefinition table = findTable(tableName);
        Reference reference = builder
                .kind(ReferenceKind.TABLE)
                .tableName(table != null ? table.getName() : tableName)
                .sheet(table != null ? table.getSheet() : currentSheet)
                .spanStart(start)
                .spanEnd(end)
                .text(text.substring(start, end))
                .build();
        tokens.add(Token.reference(TokenType.TABLE_REF, reference.getText(), start, end, reference));
        pos = end;
        return true;
    }

    private TableDefinition findTable(String name) {
        for (Map.Entry<String, TableDefinition> entry : tables.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }

    private int skipSpaces(int from) {
        int i = from;
        while (i < text.length() && text.charAt(i) == ' ') {
            i++;
        }
        return i;
    }

    private static String unquote(String sheet) {
        return sheet.replace("''", "'");
    }

    /**
     * Parser for the bracketed selector of a structured reference, e.g. "[#This Row],[Amount]".
     */
    static final class TableSelector {

        private TableSelector() {
        }

        static Reference.ReferenceBuilder parse(String inner) {
            String body = inner.trim();
            Reference.ReferenceBuilder builder = Reference.builder();
            if (body.isEmpty()) {
                return builder.tableArea(TableArea.DATA);
            }
            if (!body.startsWith("[")) {
                if (body.startsWith("@")) {
                    String column = stripBrackets(body.substring(1).trim());
                    if (column.isEmpty()) {
                        return null;
                    }
                    return builder.tableArea(TableArea.THIS_ROW).tableColumn(column).tableEndColumn(column);
                }
                if (body.startsWith("#")) {
                    TableArea area = specialArea(body);
                    return area == null ? null : builder.tableArea(area);
                }
                return builder.tableArea(TableArea.DATA).tableColumn(body).tableEndColumn(body);
            }
            List<String> items = new ArrayList<>();
            List<Character> separators = new ArrayList<>();
            int i = 0;
            while (i < body.length()) {
                char ch = body.charAt(i);
                if (ch == '[') {
                    int close = body.indexOf(']', i);
                    if (close < 0) {
                        return null;
                    }
                    items.add(body.substring(i + 1, close).trim());
                    i = close + 1;
                } else if (ch == ',' || ch == ':') {
                    separators.add(ch);
                    i++;
                } else if (Character.isWhitespace(ch)) {
                    i++;
                } else {
                    return null;
                }
            }
            TableArea area = TableArea.DATA;
            List<String> columns = new ArrayList<>();
            boolean columnRange = separators.contains(':');
            for (String item : items) {
                if (item.startsWith("#")) {
                    TableArea special = specialArea(item);
                    if (special == null) {
                        return null;
                    }
                    area = special;
                } else {
                    columns.add(item);
                }
            }
            if (columns.size() > 2 || (columns.size() == 2 && !columnRange)) {
                return null;
            }
            builder.tableArea(area);
            if (!columns.isEmpty()) {
                builder.tableColumn(columns.get(0)).tableEndColumn(columns.get(columns.size() - 1));
            }
            return builder;
        }

        private static TableArea specialArea(String item) {
            String key = item.toLowerCase();
            switch (key) {
                case "#data":
                    return TableArea.DATA;
                case "#all":
                    return TableArea.ALL;
                case "#headers":
                    return TableArea.HEADERS;
                case "#this row":
                    return TableArea.THIS_ROW;
                default:
                    return null;
            }
        }

        private static String stripBrackets(String s) {
            if (s.startsWith("[") && s.endsWith("]")) {
                return s.substring(1, s.length() - 1).trim();
            }
            return s;
        }
    }
}
