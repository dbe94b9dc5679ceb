package com.example.demo.formulaengine.service;

import com.example.demo.formulaengine.TestWorkbooks;
import com.example.demo.formulaengine.config.CompilerProperties;
import com.example.demo.formulaengine.emitter.PythonCodeEmitter;
import com.example.demo.formulaengine.graph.DependencyGraphBuilder;
import com.example.demo.formulaengine.graph.EvaluationPlanner;
import com.example.demo.formulaengine.graph.EvaluationScheduler;
import com.example.demo.formulaengine.model.CellAddress;
import com.example.demo.formulaengine.model.CellRecord;
import com.example.demo.formulaengine.model.SheetSnapshot;
import com.example.demo.formulaengine.model.WorkbookSnapshot;
import com.example.demo.formulaengine.parser.ReferenceResolver;
import com.example.demo.formulaengine.pattern.FormulaGrouper;
import com.example.demo.formulaengine.pattern.PatternNormalizer;
import com.example.demo.formulaengine.translator.FormulaTranslator;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.junit.jupiter.api.Assertions.*;

public class BundleWriterTest {

    private FormulaCompilationService compiler;
    private BundleWriter bundleWriter;

    @BeforeEach
    public void setUp() {
        FormulaTranslator translator = new FormulaTranslator();
        ReferenceResolver resolver = new ReferenceResolver();
        CompilerProperties properties = new CompilerProperties();
        ReferenceAnalyzer analyzer = new ReferenceAnalyzer(resolver);
        compiler = new FormulaCompilationService(translator, new FormulaGrouper(new PatternNormalizer(resolver)),
                new DependencyGraphBuilder(properties), new EvaluationScheduler(), new EvaluationPlanner(),
                analyzer, new PythonCodeEmitter(translator), properties);
        bundleWriter = new BundleWriter(analyzer, new InputTemplateWriter(), new WorkbookOutputService());
    }

    private static Map<String, byte[]> unzip(byte[] bundle) throws IOException {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(bundle))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                entries.put(entry.getName(), zip.readAllBytes());
            }
        }
        return entries;
    }

    /**
     * Test the bundle of a self-contained workbook: script, runtime and template only.
     */
    @Test
    public void testBundleEntries() throws Exception {
        WorkbookSnapshot snapshot = new WorkbookLoader().toSnapshot(TestWorkbooks.orders());
        CompilationResult result = compiler.compile(snapshot);

        Map<String, byte[]> entries = unzip(bundleWriter.write(snapshot, result));

        assertEquals(List.of("calculate.py", "xl_runtime.py", "input_template.xlsx"), List.copyOf(entries.keySet()));
        assertEquals(result.getScript().getSource(), new String(entries.get("calculate.py"), StandardCharsets.UTF_8));
        assertTrue(new String(entries.get("xl_runtime.py"), StandardCharsets.UTF_8).contains("def xl_sum("));
        try (XSSFWorkbook template = new XSSFWorkbook(new ByteArrayInputStream(entries.get("input_template.xlsx")))) {
            assertEquals("Orders", template.getSheetName(0));
        }
    }

    @Test
    public void testExternalFilesConfigIsAddedWhenLinked() throws Exception {
        WorkbookSnapshot snapshot = new WorkbookSnapshot(List.of(new SheetSnapshot("S", List.of(
                CellRecord.value(CellAddress.of("S", "A", 1), 2.0),
                CellRecord.formula(CellAddress.of("S", "B", 1), "=A1*[Rates.xlsx]FX!B2", 3.0)))));
        CompilationResult result = compiler.compile(snapshot);

        Map<String, byte[]> entries = unzip(bundleWriter.write(snapshot, result));

        assertTrue(entries.containsKey(BundleWriter.EXTERNAL_CONFIG_FILE));
        String config = new String(entries.get(BundleWriter.EXTERNAL_CONFIG_FILE), StandardCharsets.UTF_8);
        assertTrue(config.contains("\"Rates.xlsx\" : \"\""), config);
    }
}
