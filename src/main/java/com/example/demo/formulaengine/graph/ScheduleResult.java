package com.example.demo.formulaengine.graph;

import com.example.demo.formulaengine.model.CellAddress;
import com.example.demo.formulaengine.model.Diagnostic;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Evaluation order of formula cells.
 */
@Value
public class ScheduleResult {

    /** Every node exactly once; acyclic part first, then the fallback order */
    List<CellAddress> order;

    /** Members of circular references */
    Set<CellAddress> cyclicCells;

    /** One entry per circular reference, members sorted */
    List<List<CellAddress>> cycles;

    List<Diagnostic> diagnostics;

    public boolean hasCycles() {
        return !cycles.isEmpty();
    }
}
