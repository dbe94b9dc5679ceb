package com.example.demo.formulaengine.model;

import lombok.Value;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ordered list of groups and single cells, consistent with the dependency order of the cells
 * they compute. Members of circular references come last.
 */
@Value
public class EvaluationPlan {

    List<PlanItem> items;

    Set<CellAddress> cyclicCells;

    public List<FormulaGroup> getGroups() {
        return items.stream()
                .filter(FormulaGroup.class::isInstance)
                .map(FormulaGroup.class::cast)
                .collect(Collectors.toList());
    }

    public List<SingleCellItem> getSingles() {
        return items.stream()
                .filter(SingleCellItem.class::isInstance)
                .map(SingleCellItem.class::cast)
                .collect(Collectors.toList());
    }

    public int cellCount() {
        return items.stream().mapToInt(i -> i.getCells().size()).sum();
    }
}
