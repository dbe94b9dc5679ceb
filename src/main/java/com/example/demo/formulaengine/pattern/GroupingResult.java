package com.example.demo.formulaengine.pattern;

import com.example.demo.formulaengine.model.FormulaGroup;
import com.example.demo.formulaengine.model.SingleCellItem;
import lombok.Value;

import java.util.List;

/**
 * Partition of formula cells into vectorized groups and single cells.
 */
@Value
public class GroupingResult {

    List<FormulaGroup> groups;

    List<SingleCellItem> singles;

    public int groupedCellCount() {
        return groups.stream().mapToInt(FormulaGroup::size).sum();
    }
}
