package com.example.demo.formulaengine.model;

import lombok.Value;

import java.util.List;

@Value
public class SingleCellItem implements PlanItem {

    CellAddress address;

    String formula;

    @Override
    public List<CellAddress> getCells() {
        return List.of(address);
    }

    @Override
    public String getSheet() {
        return address.getSheet();
    }
}
