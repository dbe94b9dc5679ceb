package com.example.demo.formulaengine.service;

import com.example.demo.formulaengine.aspect.LogExecutionTime;
import com.example.demo.formulaengine.config.CompilerProperties;
import com.example.demo.formulaengine.emitter.CodeEmitter;
import com.example.demo.formulaengine.emitter.EmitRequest;
import com.example.demo.formulaengine.emitter.EmittedScript;
import com.example.demo.formulaengine.exception.FormulaCompilationException;
import com.example.demo.formulaengine.graph.DependencyGraph;
import com.example.demo.formulaengine.graph.DependencyGraphBuilder;
import com.example.demo.formulaengine.graph.EvaluationPlanner;
import com.example.demo.formulaengine.graph.EvaluationScheduler;
import com.example.demo.formulaengine.graph.ScheduleResult;
import com.example.demo.formulaengine.model.CellAddress;
import com.example.demo.formulaengine.model.CellRecord;
import com.example.demo.formulaengine.model.Diagnostic;
import com.example.demo.formulaengine.model.EvaluationPlan;
import com.example.demo.formulaengine.model.GroupDescriptor;
import com.example.demo.formulaengine.model.Reference;
import com.example.demo.formulaengine.model.ReferenceAnalysis;
import com.example.demo.formulaengine.model.WorkbookSnapshot;
import com.example.demo.formulaengine.pattern.FormulaGrouper;
import com.example.demo.formulaengine.pattern.GroupingResult;
import com.example.demo.formulaengine.translator.FormulaTranslator;
import com.example.demo.formulaengine.translator.TranslatedFormula;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;

/**
 * Main orchestrator for compiling a workbook into a calculator script.
 *
 * Phases run in a fixed order: reference analysis, translation, dependency graph, scheduling,
 * grouping, planning and emission. Translation is per cell and may run on a bounded pool; all
 * other phases work on merged, ordered structures on the calling thread. Non-fatal problems are
 * collected as diagnostics; only structural failures throw.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FormulaCompilationService {

    private final FormulaTranslator formulaTranslator;
    private final FormulaGrouper formulaGrouper;
    private final DependencyGraphBuilder dependencyGraphBuilder;
    private final EvaluationScheduler evaluationScheduler;
    private final EvaluationPlanner evaluationPlanner;
    private final ReferenceAnalyzer referenceAnalyzer;
    private final CodeEmitter codeEmitter;
    private final CompilerProperties properties;

    public CompilationResult compile(WorkbookSnapshot workbook) {
        return compile(workbook, properties, CompilationCheckpoint.NONE);
    }

    /**
     * @param options    settings for this run, overriding the application defaults
     * @param checkpoint called before every phase; may throw to cancel the run
     * @throws FormulaCompilationException if the workbook has no sheets or the run is cancelled
     */
    @LogExecutionTime("Total Workbook Compilation")
    public CompilationResult compile(WorkbookSnapshot workbook, CompilerProperties options,
                                     CompilationCheckpoint checkpoint) {
        if (workbook == null || workbook.getSheets().isEmpty()) {
            throw new FormulaCompilationException("Workbook has no sheets to compile");
        }
        List<CellRecord> formulaCells = workbook.getFormulaCells();
        log.info("Compiling workbook: {} sheets, {} formula cells (vectorize={}, parallelism={})",
                workbook.getSheets().size(), formulaCells.size(), options.isVectorize(), options.getParallelism());

        enter(checkpoint, CompilationPhase.RESOLVE);
        ReferenceAnalysis references = referenceAnalyzer.analyse(workbook);

        enter(checkpoint, CompilationPhase.TRANSLATE);
        Map<CellAddress, TranslatedFormula> translations = translateAll(formulaCells, workbook, options.getParallelism());
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (TranslatedFormula translation : translations.values()) {
            diagnostics.addAll(translation.getDiagnostics());
        }

        enter(checkpoint, CompilationPhase.GRAPH);
        DependencyGraph graph = dependencyGraphBuilder.build(translations, options.getRangeExpansionLimit());

        enter(checkpoint, CompilationPhase.SCHEDULE);
        ScheduleResult schedule = evaluationScheduler.schedule(graph);
        diagnostics.addAll(schedule.getDiagnostics());

        Map<CellAddress, String> formulas = new LinkedHashMap<>();
        for (CellRecord cell : formulaCells) {
            formulas.put(cell.getAddress(), cell.getFormula());
        }
        EvaluationPlan plan;
        if (options.isVectorize()) {
            enter(checkpoint, CompilationPhase.GROUP);
            GroupingResult grouping = formulaGrouper.group(formulaCells, workbook.getTables());
            log.info("Found {} vectorizable groups covering {} cells", grouping.getGroups().size(),
                    grouping.groupedCellCount());

            enter(checkpoint, CompilationPhase.PLAN);
            plan = evaluationPlanner.plan(grouping, formulas, graph, schedule);
        } else {
            enter(checkpoint, CompilationPhase.PLAN);
            plan = evaluationPlanner.planWithoutGroups(formulas, schedule);
        }

        List<CellRecord> inputCells = selectInputCells(workbook, translations, options);

        enter(checkpoint, CompilationPhase.EMIT);
        EmittedScript script = codeEmitter.emit(EmitRequest.builder()
                .workbook(workbook)
                .plan(plan)
                .translations(translations)
                .inputCells(inputCells)
                .externalFiles(references.getExternalFiles())
                .build());
        diagnostics.addAll(script.getDiagnostics());

        List<GroupDescriptor> groups = plan.getGroups().stream()
                .map(GroupDescriptor::of)
                .collect(Collectors.toList());
        CompilationSummary summary = CompilationSummary.builder()
                .sheetCount(workbook.getSheets().size())
                .formulaCellCount(formulaCells.size())
                .hardcodedCellCount(workbook.getHardcodedCells().size())
                .inputCellCount(inputCells.size())
                .groupCount(groups.size())
                .groupedCellCount(groups.stream().mapToInt(GroupDescriptor::getMemberCount).sum())
                .singleCellCount(plan.getSingles().size())
                .cycleCount(schedule.getCycles().size())
                .diagnosticCount(diagnostics.size())
                .crossSheetReferenceCount(references.getCrossSheetReferences().size())
                .externalReferenceCount(references.getExternalReferences().size())
                .build();
        log.info("Compilation finished: {} groups, {} single cells, {} diagnostics",
                summary.getGroupCount(), summary.getSingleCellCount(), summary.getDiagnosticCount());

        return CompilationResult.builder()
                .plan(plan)
                .script(script)
                .diagnostics(Collections.unmodifiableList(diagnostics))
                .groups(Collections.unmodifiableList(groups))
                .references(references)
                .inputCells(Collections.unmodifiableList(inputCells))
                .summary(summary)
                .build();
    }

    private static void enter(CompilationCheckpoint checkpoint, CompilationPhase phase) {
        log.debug("Entering phase {}", phase);
        try {
            checkpoint.beforePhase(phase);
        } catch (RuntimeException e) {
            throw new FormulaCompilationException("Compilation cancelled before phase " + phase, e);
        }
    }

    /**
     * Translate every formula cell. Results keep the input order whether or not they were
     * computed in parallel.
     */
    private Map<CellAddress, TranslatedFormula> translateAll(List<CellRecord> cells, WorkbookSnapshot workbook,
                                                             int parallelism) {
        List<TranslatedFormula> translated;
        if (parallelism <= 1 || cells.size() < 2) {
            translated = cells.stream()
                    .map(cell -> formulaTranslator.translate(cell.getFormula(), cell.getAddress(), workbook))
                    .collect(Collectors.toList());
        } else {
            ForkJoinPool pool = new ForkJoinPool(parallelism);
            try {
                translated = pool.submit(() -> cells.parallelStream()
                        .map(cell -> formulaTranslator.translate(cell.getFormula(), cell.getAddress(), workbook))
                        .collect(Collectors.toList())).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FormulaCompilationException("Translation interrupted", e);
            } catch (ExecutionException e) {
                throw new FormulaCompilationException("Translation failed", e.getCause());
            } finally {
                pool.shutdown();
            }
        }
        Map<CellAddress, TranslatedFormula> result = new LinkedHashMap<>();
        for (TranslatedFormula translation : translated) {
            result.put(translation.getCell(), translation);
        }
        log.debug("Translated {} formulas", result.size());
        return result;
    }

    /**
     * Hardcoded cells the calculator loads. With delete-unreferenced-hardcoded-values only the
     * cells some formula reads are kept.
     */
    private List<CellRecord> selectInputCells(WorkbookSnapshot workbook,
                                              Map<CellAddress, TranslatedFormula> translations,
                                              CompilerProperties options) {
        List<CellRecord> hardcoded = workbook.getHardcodedCells();
        if (!options.isDeleteUnreferencedHardcodedValues()) {
            return hardcoded;
        }
        Set<CellAddress> inputs = new HashSet<>();
        for (CellRecord cell : hardcoded) {
            inputs.add(cell.getAddress());
        }
        Set<CellAddress> referenced = new HashSet<>();
        for (TranslatedFormula translation : translations.values()) {
            for (Reference reference : translation.getReferences()) {
                if (reference.isExternal() || reference.isTable()) {
                    continue;
                }
                if (reference.area() <= options.getRangeExpansionLimit()) {
                    for (CellAddress address : reference.expand()) {
                        if (inputs.contains(address)) {
                            referenced.add(address);
                        }
                    }
                } else {
                    for (CellAddress address : inputs) {
                        if (reference.contains(address)) {
                            referenced.add(address);
                        }
                    }
                }
            }
        }
        List<CellRecord> kept = hardcoded.stream()
                .filter(cell -> referenced.contains(cell.getAddress()))
                .collect(Collectors.toList());
        log.info("Keeping {} of {} hardcoded values that formulas read", kept.size(), hardcoded.size());
        return kept;
    }
}
