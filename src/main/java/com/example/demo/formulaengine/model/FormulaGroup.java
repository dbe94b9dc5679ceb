package com.example.demo.formulaengine.model;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A maximal run of adjacent cells sharing one {@link PatternKey}, evaluated by a single loop.
 * Members are kept in ascending row (vertical) or column (horizontal) order; the first member
 * is the representative whose formula is rendered for the whole group.
 */
@Value
@Builder(toBuilder = true)
public class FormulaGroup implements PlanItem {

    GroupDirection direction;

    List<CellAddress> members;

    String representativeFormula;

    PatternKey pattern;

    /** Iterate from the last member to the first */
    boolean descending;

    public CellAddress getAnchor() {
        return members.get(0);
    }

    public CellAddress getLast() {
        return members.get(members.size() - 1);
    }

    public int size() {
        return members.size();
    }

    @Override
    public String getSheet() {
        return getAnchor().getSheet();
    }

    @Override
    public List<CellAddress> getCells() {
        if (!descending) {
            return members;
        }
        List<CellAddress> reversed = new ArrayList<>(members);
        Collections.reverse(reversed);
        return reversed;
    }

    /** A1 range covered by the group, e.g. "D2:D6" */
    public String getRangeLabel() {
        return getAnchor().toA1() + ":" + getLast().toA1();
    }

    /** Loop index of a member: its row for vertical groups, its column for horizontal ones */
    public int indexOf(CellAddress member) {
        return direction == GroupDirection.VERTICAL ? member.getRow() : member.getColumn();
    }
}
