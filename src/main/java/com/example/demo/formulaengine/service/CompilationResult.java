package com.example.demo.formulaengine.service;

import com.example.demo.formulaengine.emitter.EmittedScript;
import com.example.demo.formulaengine.model.CellRecord;
import com.example.demo.formulaengine.model.Diagnostic;
import com.example.demo.formulaengine.model.EvaluationPlan;
import com.example.demo.formulaengine.model.GroupDescriptor;
import com.example.demo.formulaengine.model.ReferenceAnalysis;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything one compilation run produces.
 */
@Value
@Builder
public class CompilationResult {

    EvaluationPlan plan;

    EmittedScript script;

    List<Diagnostic> diagnostics;

    List<GroupDescriptor> groups;

    ReferenceAnalysis references;

    /** Hardcoded cells the calculator reads from its input workbook */
    List<CellRecord> inputCells;

    CompilationSummary summary;
}
