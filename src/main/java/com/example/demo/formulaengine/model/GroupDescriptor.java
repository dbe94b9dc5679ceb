package com.example.demo.formulaengine.model;

import lombok.Builder;
import lombok.Value;

/**
 * Human-readable summary of one vectorized group.
 */
@Value
@Builder
public class GroupDescriptor {

    String sheet;

    /** e.g. "D2:D6" */
    String anchorRange;

    GroupDirection direction;

    int memberCount;

    String representativeFormula;

    public static GroupDescriptor of(FormulaGroup group) {
        return GroupDescriptor.builder()
                .sheet(group.getSheet())
                .anchorRange(group.getRangeLabel())
                .direction(group.getDirection())
                .memberCount(group.size())
                .representativeFormula(group.getRepresentativeFormula())
                .build();
    }
}
