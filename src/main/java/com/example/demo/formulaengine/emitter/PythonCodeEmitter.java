package com.example.demo.formulaengine.emitter;

import com.example.demo.formulaengine.aspect.LogExecutionTime;
import com.example.demo.formulaengine.model.CellAddress;
import com.example.demo.formulaengine.model.CellFormat;
import com.example.demo.formulaengine.model.CellKind;
import com.example.demo.formulaengine.model.CellRecord;
import com.example.demo.formulaengine.model.Diagnostic;
import com.example.demo.formulaengine.model.FormulaGroup;
import com.example.demo.formulaengine.model.GroupDirection;
import com.example.demo.formulaengine.model.IssueKind;
import com.example.demo.formulaengine.model.PlanItem;
import com.example.demo.formulaengine.model.SheetSnapshot;
import com.example.demo.formulaengine.model.SingleCellItem;
import com.example.demo.formulaengine.model.WorkbookSnapshot;
import com.example.demo.formulaengine.parser.ast.RawNode;
import com.example.demo.formulaengine.translator.FormulaTranslator;
import com.example.demo.formulaengine.translator.LoopReferenceStyle;
import com.example.demo.formulaengine.translator.TranslatedFormula;
import com.example.demo.formulaengine.util.PythonLiterals;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Emits a standalone Python calculator ("calculate.py") backed by the "xl_runtime.py" module.
 *
 * Cell values live in a dict {@code c} keyed by (sheet, column letters, row). Single cells
 * become one guarded assignment each; a vectorized group becomes one loop whose body is the
 * representative formula rendered against the loop variable. When an assignment raises at run
 * time the cell falls back to the value Excel cached for it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PythonCodeEmitter implements CodeEmitter {

    public static final String SCRIPT_FILE = "calculate.py";
    public static final String RUNTIME_FILE = "xl_runtime.py";
    private static final String RUNTIME_RESOURCE = "python/xl_runtime.py";

    /** Deepest bracket nesting emitted; CPython refuses to compile beyond 200 */
    static final int MAX_NESTING = 100;

    private final FormulaTranslator formulaTranslator;

    private volatile String runtimeSource;

    @Override
    public String getLanguage() {
        return "python";
    }

    @Override
    @LogExecutionTime("Python Code Emission")
    public EmittedScript emit(EmitRequest request) {
        WorkbookSnapshot workbook = request.getWorkbook();
        List<Diagnostic> diagnostics = new ArrayList<>();
        PythonWriter out = new PythonWriter();
        int[] counts = new int[2];

        writeHeader(out, request);
        writeInputs(out, request);
        writeLabels(out, workbook);
        writeExternal(out, request.getExternalFiles());
        writeCompute(out, request, diagnostics, counts);
        writeLayout(out, workbook);
        writeMain(out, request);

        log.info("Emitted {} loops and {} single assignments, {} translation failures",
                counts[0], counts[1], diagnostics.size());
        return EmittedScript.builder()
                .fileName(SCRIPT_FILE)
                .source(out.toString())
                .runtimeFileName(RUNTIME_FILE)
                .runtimeSource(getRuntimeSource())
                .diagnostics(diagnostics)
                .loopCount(counts[0])
                .assignmentCount(counts[1])
                .build();
    }

    /** Contents of the runtime module shipped next to every script */
    public String getRuntimeSource() {
        String source = runtimeSource;
        if (source == null) {
            try (InputStream in = new ClassPathResource(RUNTIME_RESOURCE).getInputStream()) {
                source = StreamUtils.copyToString(in, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to load runtime module " + RUNTIME_RESOURCE, e);
            }
            runtimeSource = source;
        }
        return source;
    }

    private void writeHeader(PythonWriter out, EmitRequest request) {
        WorkbookSnapshot workbook = request.getWorkbook();
        out.line("#!/usr/bin/env python3");
        out.line("# -*- coding: utf-8 -*-");
        out.line("\"\"\"");
        out.line("Calculator generated from workbook formulas.");
        out.line();
        out.line("Sheets: " + String.join(", ", workbook.getSheetNames()).replace("\"\"\"", "'''"));
        out.line("Formula cells: " + request.getPlan().cellCount()
                + " (" + request.getPlan().getGroups().size() + " vectorized groups, "
                + request.getPlan().getSingles().size() + " single cells)");
        out.line();
        out.line("Usage: python " + SCRIPT_FILE + " [input.xlsx] [output.xlsx]");
        out.line("\"\"\"");
        out.line("import datetime");
        out.line("import sys");
        out.line();
        out.line("from xl_runtime import *");
        out.line();
        out.line();
        out.line("SHEETS = [" + workbook.getSheetNames().stream()
                .map(PythonLiterals::string).collect(Collectors.joining(", ")) + "]");
        out.line();
    }

    private void writeInputs(PythonWriter out, EmitRequest request) {
        out.line();
        out.line("# Hardcoded inputs with the workbook values as defaults");
        out.line("INPUTS = {");
        out.indent();
        for (CellRecord cell : request.getInputCells()) {
            out.line(key(cell.getAddress()) + ": " + PythonLiterals.value(cell.getContent()) + ",");
        }
        out.dedent();
        out.line("}");
        out.line();
    }

    private void writeLabels(PythonWriter out, WorkbookSnapshot workbook) {
        out.line();
        out.line("LABELS = {");
        out.indent();
        for (CellRecord cell : workbook.cellsOfKind(CellKind.LABEL)) {
            out.line(key(cell.getAddress()) + ": " + PythonLiterals.value(cell.getContent()) + ",");
        }
        out.dedent();
        out.line("}");
        out.line();
    }

    private void writeExternal(PythonWriter out, Map<String, Set<String>> externalFiles) {
        out.line();
        out.line("# External workbooks: file name -> referenced sheets");
        out.line("EXTERNAL_FILES = {");
        out.indent();
        if (externalFiles != null) {
            for (Map.Entry<String, Set<String>> entry : externalFiles.entrySet()) {
                out.line(PythonLiterals.string(entry.getKey()) + ": ["
                        + entry.getValue().stream().map(PythonLiterals::string).collect(Collectors.joining(", "))
                        + "],");
            }
        }
        out.dedent();
        out.line("}");
        out.line();
    }

    private void writeCompute(PythonWriter out, EmitRequest request, List<Diagnostic> diagnostics, int[] counts) {
        WorkbookSnapshot workbook = request.getWorkbook();
        Map<CellAddress, TranslatedFormula> translations = request.getTranslations();
        Set<CellAddress> cyclic = request.getPlan().getCyclicCells();

        List<String> groupCache = new ArrayList<>();
        for (FormulaGroup group : request.getPlan().getGroups()) {
            for (CellAddress member : group.getMembers()) {
                Object cached = cachedValue(workbook, member);
                if (cached != null) {
                    groupCache.add(key(member) + ": " + PythonLiterals.value(cached) + ",");
                }
            }
        }
        out.line();
        out.line("# Values cached by Excel, used when a vectorized cell fails");
        out.line("CACHED = {");
        out.indent();
        groupCache.forEach(out::line);
        out.dedent();
        out.line("}");
        out.line();
        out.line();
        out.line("def compute(c):");
        out.indent();
        out.line("\"\"\"Evaluate every formula cell in dependency order.\"\"\"");
        if (!cyclic.isEmpty()) {
            out.line("# circular references start from their cached values");
            for (CellAddress cell : new TreeSet<>(cyclic)) {
                out.line("c[" + key(cell) + "] = " + PythonLiterals.value(cachedValue(workbook, cell)));
            }
        }
        for (PlanItem item : request.getPlan().getItems()) {
            if (item instanceof FormulaGroup) {
                FormulaGroup group = (FormulaGroup) item;
                CellOutcome outcome = renderGroup(group, translations, workbook);
                if (outcome.isOk()) {
                    writeLoop(out, group, outcome.getCode());
                    counts[0]++;
                    continue;
                }
                log.debug("Group {}!{} emitted cell by cell: {}", group.getSheet(), group.getRangeLabel(), outcome.getReason());
                diagnostics.add(Diagnostic.of(group.getAnchor(), IssueKind.TRANSLATION_FAILURE,
                        "Group " + group.getRangeLabel() + " emitted cell by cell: " + outcome.getReason()));
                for (CellAddress member : group.getCells()) {
                    writeSingle(out, member, translations.get(member), workbook, cyclic, diagnostics);
                    counts[1]++;
                }
            } else {
                CellAddress cell = ((SingleCellItem) item).getAddress();
                writeSingle(out, cell, translations.get(cell), workbook, cyclic, diagnostics);
                counts[1]++;
            }
        }
        out.line("return c");
        out.dedent();
        out.line();
    }

    private CellOutcome renderGroup(FormulaGroup group, Map<CellAddress, TranslatedFormula> translations,
                                    WorkbookSnapshot workbook) {
        TranslatedFormula representative = translations.get(group.getAnchor());
        if (representative == null || representative.getAst() instanceof RawNode) {
            return CellOutcome.fallback("None", "representative formula did not parse");
        }
        String expression;
        try {
            LoopReferenceStyle style = new LoopReferenceStyle(group.getDirection(), group.getAnchor());
            expression = formulaTranslator.render(representative.getAst(), style, workbook);
        } catch (RuntimeException e) {
            return CellOutcome.fallback("None", e.getMessage());
        }
        return checkNesting(expression, "None");
    }

    private void writeLoop(PythonWriter out, FormulaGroup group, String expression) {
        boolean vertical = group.getDirection() == GroupDirection.VERTICAL;
        String variable = vertical ? LoopReferenceStyle.ROW_VARIABLE : LoopReferenceStyle.COLUMN_VARIABLE;
        CellAddress anchor = group.getAnchor();
        String target = vertical
                ? "(" + PythonLiterals.string(anchor.getSheet()) + ", " + PythonLiterals.string(anchor.getColumnLetters()) + ", _r)"
                : "(" + PythonLiterals.string(anchor.getSheet()) + ", _cl(_ci), " + anchor.getRow() + ")";
        out.line("# " + anchor.getSheet() + "!" + group.getRangeLabel() + ": "
                + oneLine(group.getRepresentativeFormula()));
        out.line("for " + variable + " in " + loopBounds(group) + ":");
        out.indent();
        out.line("try:");
        out.indent();
        out.line("c[" + target + "] = " + expression);
        out.dedent();
        out.line("except Exception:");
        out.indent();
        out.line("c[" + target + "] = CACHED.get(" + target + ")");
        out.dedent();
        out.dedent();
    }

    /**
     * range(...) when the loop indexes are consecutive in iteration order, else an explicit list.
     */
    static String loopBounds(FormulaGroup group) {
        List<Integer> indexes = group.getCells().stream().map(group::indexOf).collect(Collectors.toList());
        int step = group.isDescending() ? -1 : 1;
        boolean consecutive = true;
        for (int i = 1; i < indexes.size(); i++) {
            if (indexes.get(i) != indexes.get(i - 1) + step) {
                consecutive = false;
                break;
            }
        }
        if (!consecutive) {
            return "[" + indexes.stream().map(String::valueOf).collect(Collectors.joining(", ")) + "]";
        }
        int first = indexes.get(0);
        int last = indexes.get(indexes.size() - 1);
        if (step > 0) {
            return "range(" + first + ", " + (last + 1) + ")";
        }
        return "range(" + first + ", " + (last - 1) + ", -1)";
    }

    private void writeSingle(PythonWriter out, CellAddress cell, TranslatedFormula translation,
                             WorkbookSnapshot workbook, Set<CellAddress> cyclic, List<Diagnostic> diagnostics) {
        String cached = PythonLiterals.value(cachedValue(workbook, cell));
        CellOutcome outcome = renderSingle(translation, cached);
        String target = "c[" + key(cell) + "]";
        String formula = translation == null ? "" : oneLine(translation.getFormula());
        out.line("# " + cell + ": " + formula + (cyclic.contains(cell) ? "  (circular)" : ""));
        if (!outcome.isOk()) {
            diagnostics.add(Diagnostic.of(cell, IssueKind.TRANSLATION_FAILURE, outcome.getReason()));
            out.line(target + " = " + outcome.getCode() + "  # not translated: " + oneLine(outcome.getReason()));
            return;
        }
        out.line("try:");
        out.indent();
        out.line(target + " = " + outcome.getCode());
        out.dedent();
        out.line("except Exception:");
        out.indent();
        out.line(target + " = " + cached);
        out.dedent();
    }

    private static CellOutcome renderSingle(TranslatedFormula translation, String cached) {
        if (translation == null) {
            return CellOutcome.fallback(cached, "no translation for cell");
        }
        if (translation.getAst() instanceof RawNode) {
            return CellOutcome.fallback(cached, "formula could not be parsed");
        }
        return checkNesting(translation.getExpression(), cached);
    }

    private static CellOutcome checkNesting(String expression, String sentinel) {
        int depth = nestingDepth(expression);
        if (depth > MAX_NESTING) {
            return CellOutcome.fallback(sentinel, "expression nests " + depth + " levels deep");
        }
        return CellOutcome.ok(expression);
    }

    /**
     * Deepest bracket nesting of a Python expression, ignoring brackets inside string literals.
     */
    static int nestingDepth(String expression) {
        int depth = 0;
        int max = 0;
        char quote = 0;
        for (int i = 0; i < expression.length(); i++) {
            char ch = expression.charAt(i);
            if (quote != 0) {
                if (ch == '\\') {
                    i++;
                } else if (ch == quote) {
                    quote = 0;
                }
                continue;
            }
            switch (ch) {
                case '\'':
                case '"':
                    quote = ch;
                    break;
                case '(':
                case '[':
                case '{':
                    max = Math.max(max, ++depth);
                    break;
                case ')':
                case ']':
                case '}':
                    depth--;
                    break;
                default:
                    break;
            }
        }
        return max;
    }

    /** Text safe for a "#" comment: any line break would end the comment */
    private static String oneLine(String text) {
        return text.replaceAll("[\\r\\n]", " ");
    }

    private void writeLayout(PythonWriter out, WorkbookSnapshot workbook) {
        Map<CellFormat, Integer> formats = new LinkedHashMap<>();
        out.line();
        out.line("# sheet -> cells (column, row, format index), widths, heights, merged ranges");
        out.line("LAYOUT = {");
        out.indent();
        for (SheetSnapshot sheet : workbook.getSheets().values()) {
            out.line(PythonLiterals.string(sheet.getName()) + ": {");
            out.indent();
            List<String> cells = new ArrayList<>();
            for (CellRecord cell : sheet.getCells().values()) {
                if (cell.getKind() == CellKind.EMPTY && (cell.getFormat() == null || cell.getFormat().isDefault())) {
                    continue;
                }
                Integer formatIndex = null;
                if (cell.getFormat() != null && !cell.getFormat().isDefault()) {
                    formatIndex = formats.computeIfAbsent(cell.getFormat(), f -> formats.size());
                }
                cells.add("(" + PythonLiterals.string(cell.getAddress().getColumnLetters()) + ", "
                        + cell.getAddress().getRow() + ", " + (formatIndex == null ? "None" : formatIndex) + ")");
            }
            out.line("'cells': [");
            out.indent();
            for (String cell : cells) {
                out.line(cell + ",");
            }
            out.dedent();
            out.line("],");
            out.line("'widths': {" + sheet.getColumnWidths().entrySet().stream()
                    .map(e -> e.getKey() + ": " + e.getValue()).collect(Collectors.joining(", ")) + "},");
            out.line("'heights': {" + sheet.getRowHeights().entrySet().stream()
                    .map(e -> e.getKey() + ": " + e.getValue()).collect(Collectors.joining(", ")) + "},");
            out.line("'merged': [" + sheet.getMergedRegions().stream()
                    .map(PythonLiterals::string).collect(Collectors.joining(", ")) + "],");
            out.dedent();
            out.line("},");
        }
        out.dedent();
        out.line("}");
        out.line();
        out.line("FORMATS = [");
        out.indent();
        for (CellFormat format : formats.keySet()) {
            out.line(formatLiteral(format) + ",");
        }
        out.dedent();
        out.line("]");
        out.line();
    }

    private static String formatLiteral(CellFormat format) {
        return "{'number_format': " + PythonLiterals.value(format.getNumberFormat())
                + ", 'bold': " + PythonLiterals.value(format.isBold())
                + ", 'italic': " + PythonLiterals.value(format.isItalic())
                + ", 'size': " + PythonLiterals.value(format.getFontSize())
                + ", 'color': " + PythonLiterals.value(format.getFontColor())
                + ", 'fill': " + PythonLiterals.value(format.getFillColor())
                + ", 'horizontal': " + PythonLiterals.value(format.getHorizontalAlignment())
                + ", 'vertical': " + PythonLiterals.value(format.getVerticalAlignment())
                + ", 'wrap': " + PythonLiterals.value(format.isWrapText()) + "}";
    }

    private void writeMain(PythonWriter out, EmitRequest request) {
        out.line();
        out.line("def main(input_file=None, output_file='output.xlsx', config_file='input_files_config.json'):");
        out.indent();
        out.line("c = CellStore()");
        out.line("c.update(LABELS)");
        out.line("xl_load_inputs(c, INPUTS, input_file)");
        out.line("xl_load_external(c, EXTERNAL_FILES, config_file)");
        out.line("compute(c)");
        out.line("if output_file:");
        out.indent();
        out.line("xl_write_workbook(c, SHEETS, LAYOUT, FORMATS, output_file)");
        out.dedent();
        out.line("return c");
        out.dedent();
        out.line();
        out.line();
        out.line("if __name__ == '__main__':");
        out.indent();
        out.line("main(sys.argv[1] if len(sys.argv) > 1 else None,");
        out.line("     sys.argv[2] if len(sys.argv) > 2 else 'output.xlsx')");
        out.dedent();
    }

    private static Object cachedValue(WorkbookSnapshot workbook, CellAddress cell) {
        CellRecord record = workbook.getCell(cell);
        return record == null ? null : record.getCachedValue();
    }

    static String key(CellAddress cell) {
        return "(" + PythonLiterals.string(cell.getSheet()) + ", "
                + PythonLiterals.string(cell.getColumnLetters()) + ", " + cell.getRow() + ")";
    }

    /** Line writer with four-space indentation */
    private static final class PythonWriter {
        private final StringBuilder sb = new StringBuilder();
        private int depth;

        void line(String text) {
            for (int i = 0; i < depth; i++) {
                sb.append("    ");
            }
            sb.append(text).append('\n');
        }

        void line() {
            sb.append('\n');
        }

        void indent() {
            depth++;
        }

        void dedent() {
            depth--;
        }

        @Override
        public String toString() {
            return sb.toString();
        }
    }
}
