package com.example.demo.formulaengine.model;

import java.util.List;

/**
 * Unit of the evaluation plan: a vectorized group or a single cell.
 */
public interface PlanItem {

    /** Cells computed by this item, in evaluation order */
    List<CellAddress> getCells();

    String getSheet();
}
