package com.example.demo.formulaengine.emitter;

import com.example.demo.formulaengine.config.CompilerProperties;
import com.example.demo.formulaengine.graph.DependencyGraph;
import com.example.demo.formulaengine.graph.DependencyGraphBuilder;
import com.example.demo.formulaengine.graph.EvaluationPlanner;
import com.example.demo.formulaengine.graph.EvaluationScheduler;
import com.example.demo.formulaengine.graph.ScheduleResult;
import com.example.demo.formulaengine.model.CellAddress;
import com.example.demo.formulaengine.model.CellRecord;
import com.example.demo.formulaengine.model.EvaluationPlan;
import com.example.demo.formulaengine.model.FormulaGroup;
import com.example.demo.formulaengine.model.GroupDirection;
import com.example.demo.formulaengine.model.IssueKind;
import com.example.demo.formulaengine.model.SheetSnapshot;
import com.example.demo.formulaengine.model.WorkbookSnapshot;
import com.example.demo.formulaengine.parser.ReferenceResolver;
import com.example.demo.formulaengine.pattern.FormulaGrouper;
import com.example.demo.formulaengine.pattern.PatternNormalizer;
import com.example.demo.formulaengine.translator.FormulaTranslator;
import com.example.demo.formulaengine.translator.TranslatedFormula;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link PythonCodeEmitter}: the shape of the generated calculator script.
 */
public class PythonCodeEmitterTest {

    private final FormulaTranslator translator = new FormulaTranslator();
    private final PythonCodeEmitter emitter = new PythonCodeEmitter(translator);

    private EmittedScript emit(WorkbookSnapshot workbook) {
        List<CellRecord> formulaCells = workbook.getFormulaCells();
        Map<CellAddress, TranslatedFormula> translations = new LinkedHashMap<>();
        Map<CellAddress, String> formulas = new LinkedHashMap<>();
        for (CellRecord cell : formulaCells) {
            translations.put(cell.getAddress(), translator.translate(cell.getFormula(), cell.getAddress(), workbook));
            formulas.put(cell.getAddress(), cell.getFormula());
        }
        DependencyGraph graph = new DependencyGraphBuilder(new CompilerProperties()).build(translations);
        ScheduleResult schedule = new EvaluationScheduler().schedule(graph);
        FormulaGrouper grouper = new FormulaGrouper(new PatternNormalizer(new ReferenceResolver()));
        EvaluationPlan plan = new EvaluationPlanner().plan(grouper.group(formulaCells), formulas, graph, schedule);
        return emitter.emit(EmitRequest.builder()
                .workbook(workbook)
                .plan(plan)
                .translations(translations)
                .inputCells(workbook.getHardcodedCells())
                .externalFiles(Map.of())
                .build());
    }

    private static WorkbookSnapshot orderSheet() {
        List<CellRecord> cells = new ArrayList<>();
        cells.add(CellRecord.value(CellAddress.of("Orders", "B", 1), "Qty"));
        for (int row = 2; row <= 6; row++) {
            cells.add(CellRecord.value(CellAddress.of("Orders", "B", row), (double) row));
            cells.add(CellRecord.value(CellAddress.of("Orders", "C", row), 1.5));
            cells.add(CellRecord.formula(CellAddress.of("Orders", "D", row), "=B" + row + "*C" + row, row * 1.5));
        }
        cells.add(CellRecord.formula(CellAddress.of("Orders", "D", 7), "=SUM(D2:D6)", 30.0));
        return new WorkbookSnapshot(List.of(new SheetSnapshot("Orders", cells)));
    }

    /**
     * Test that a dragged column becomes one loop and the total one guarded assignment after it.
     */
    @Test
    public void testGroupBecomesOneLoop() {
        EmittedScript script = emit(orderSheet());
        String source = script.getSource();

        assertEquals(1, script.getLoopCount());
        assertEquals(1, script.getAssignmentCount());
        assertTrue(source.contains("for _r in range(2, 7):"));
        assertTrue(source.contains(
                "c[('Orders', 'D', _r)] = (c.get(('Orders', 'B', _r)) * c.get(('Orders', 'C', _r)))"));
        assertTrue(source.contains("c[('Orders', 'D', _r)] = CACHED.get(('Orders', 'D', _r))"));
        assertTrue(source.contains("c[('Orders', 'D', 7)] = xl_sum(_rng(c, 'Orders', 'D', 2, 'D', 6))"));
        assertTrue(source.indexOf("for _r in range(2, 7):") < source.indexOf("c[('Orders', 'D', 7)] = xl_sum"));
        assertTrue(script.getDiagnostics().isEmpty());
    }

    @Test
    public void testScriptSections() {
        String source = emit(orderSheet()).getSource();

        assertTrue(source.startsWith("#!/usr/bin/env python3"));
        assertTrue(source.contains("from xl_runtime import *"));
        assertTrue(source.contains("SHEETS = ['Orders']"));
        assertTrue(source.contains("('Orders', 'B', 2): 2.0,"));
        assertTrue(source.contains("('Orders', 'B', 1): 'Qty',"));
        assertTrue(source.contains("def compute(c):"));
        assertTrue(source.contains("c = CellStore()"));
        assertTrue(source.contains("if __name__ == '__main__':"));
    }

    @Test
    public void testRuntimeModuleIsShipped() {
        EmittedScript script = emit(orderSheet());
        assertEquals("calculate.py", script.getFileName());
        assertEquals("xl_runtime.py", script.getRuntimeFileName());
        assertTrue(script.getRuntimeSource().contains("def xl_sum("));
        assertTrue(script.getRuntimeSource().contains("class CellStore"));
        assertEquals("python", emitter.getLanguage());
    }

    /**
     * Test that a formula which does not parse keeps its cached value and is reported.
     */
    @Test
    public void testUnparsableFormulaFallsBackToCachedValue() {
        CellAddress broken = CellAddress.of("S", "A", 1);
        WorkbookSnapshot workbook = new WorkbookSnapshot(List.of(new SheetSnapshot("S", List.of(
                CellRecord.formula(broken, "=SUM(1,", 42.0)))));

        EmittedScript script = emit(workbook);

        assertTrue(script.getSource().contains("c[('S', 'A', 1)] = 42.0  # not translated: formula could not be parsed"));
        assertEquals(1, script.getDiagnostics().size());
        assertEquals(IssueKind.TRANSLATION_FAILURE, script.getDiagnostics().get(0).getKind());
        assertEquals(broken, script.getDiagnostics().get(0).getCell());
    }

    @Test
    public void testCircularCellsStartFromCachedValues() {
        WorkbookSnapshot workbook = new WorkbookSnapshot(List.of(new SheetSnapshot("S", List.of(
                CellRecord.formula(CellAddress.of("S", "A", 1), "=B1+1", 3.0),
                CellRecord.formula(CellAddress.of("S", "B", 1), "=A1*2", 6.0)))));

        String source = emit(workbook).getSource();

        assertTrue(source.contains("# circular references start from their cached values"));
        assertTrue(source.contains("c[('S', 'A', 1)] = 3.0"));
        assertTrue(source.contains("(circular)"));
    }

    @Test
    public void testLoopBounds() {
        List<CellAddress> rows = List.of(CellAddress.of("S", 3, 2), CellAddress.of("S", 3, 3),
                CellAddress.of("S", 3, 4), CellAddress.of("S", 3, 5));
        FormulaGroup ascending = FormulaGroup.builder()
                .direction(GroupDirection.VERTICAL)
                .members(rows)
                .representativeFormula("=C3+1")
                .build();
        assertEquals("range(2, 6)", PythonCodeEmitter.loopBounds(ascending));
        assertEquals("range(5, 1, -1)", PythonCodeEmitter.loopBounds(ascending.toBuilder().descending(true).build()));

        FormulaGroup horizontal = FormulaGroup.builder()
                .direction(GroupDirection.HORIZONTAL)
                .members(List.of(CellAddress.of("S", 2, 4), CellAddress.of("S", 3, 4)))
                .representativeFormula("=B1")
                .build();
        assertEquals("range(2, 4)", PythonCodeEmitter.loopBounds(horizontal));
    }

    @Test
    public void testExternalFilesAreListed() {
        WorkbookSnapshot workbook = orderSheet();
        EmittedScript script = emitter.emit(EmitRequest.builder()
                .workbook(workbook)
                .plan(new EvaluationPlan(List.of(), Set.of()))
                .translations(Map.of())
                .inputCells(List.of())
                .externalFiles(Map.of("Rates.xlsx", Set.of("FX")))
                .build());
        assertTrue(script.getSource().contains("'Rates.xlsx': ['FX'],"));
    }

    private static String concatChain(int row, int terms) {
        StringBuilder formula = new StringBuilder("=A" + row);
        for (int i = 1; i < terms; i++) {
            formula.append("&A").append(row);
        }
        return formula.toString();
    }

    /**
     * Test that expressions nested too deeply for Python fall back to cached values, and that the
     * group they came from is reported as emitted cell by cell.
     */
    @Test
    public void testDeeplyNestedExpressionsFallBack() {
        WorkbookSnapshot workbook = new WorkbookSnapshot(List.of(new SheetSnapshot("S", List.of(
                CellRecord.value(CellAddress.of("S", "A", 1), "x"),
                CellRecord.value(CellAddress.of("S", "A", 2), "y"),
                CellRecord.formula(CellAddress.of("S", "B", 1), concatChain(1, 150), "xxx"),
                CellRecord.formula(CellAddress.of("S", "B", 2), concatChain(2, 150), "yyy")))));

        EmittedScript script = emit(workbook);
        String source = script.getSource();

        assertEquals(0, script.getLoopCount());
        assertEquals(2, script.getAssignmentCount());
        assertTrue(source.contains("c[('S', 'B', 1)] = 'xxx'  # not translated: expression nests"));
        assertTrue(source.contains("c[('S', 'B', 2)] = 'yyy'  # not translated: expression nests"));
        assertEquals(3, script.getDiagnostics().size());
        assertTrue(script.getDiagnostics().stream().allMatch(d -> d.getKind() == IssueKind.TRANSLATION_FAILURE));
        assertTrue(script.getDiagnostics().get(0).getMessage().startsWith("Group B1:B2 emitted cell by cell"));
    }

    @Test
    public void testNestingDepthIgnoresStringLiterals() {
        assertEquals(0, PythonCodeEmitter.nestingDepth("1"));
        assertEquals(3, PythonCodeEmitter.nestingDepth("(c.get(('S', 'A', 1)) + 1)"));
        assertEquals(1, PythonCodeEmitter.nestingDepth("xl_concat('((', \"[\\\"\")"));
    }

    @Test
    public void testLineBreaksInFormulasStayInComments() {
        WorkbookSnapshot workbook = new WorkbookSnapshot(List.of(new SheetSnapshot("S", List.of(
                CellRecord.formula(CellAddress.of("S", "A", 1), "=\"a\r\nb\"", "a\r\nb")))));

        String source = emit(workbook).getSource();

        assertFalse(source.contains("\r"));
        assertTrue(source.contains("# S!A1: =\"a  b\""));
    }
}
