package com.example.demo.formulaengine.emitter;

import com.example.demo.formulaengine.model.CellAddress;
import com.example.demo.formulaengine.model.CellRecord;
import com.example.demo.formulaengine.model.EvaluationPlan;
import com.example.demo.formulaengine.model.WorkbookSnapshot;
import com.example.demo.formulaengine.translator.TranslatedFormula;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything an emitter needs to write a calculator script.
 */
@Value
@Builder
public class EmitRequest {

    WorkbookSnapshot workbook;

    EvaluationPlan plan;

    Map<CellAddress, TranslatedFormula> translations;

    /** Hardcoded cells loaded from the input workbook */
    List<CellRecord> inputCells;

    /** External workbook name to the sheets referenced in it */
    Map<String, Set<String>> externalFiles;
}
