package com.example.demo.formulaengine.model;

import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

@Value
public class ReferenceAnalysis {

    List<CrossSheetReference> crossSheetReferences;

    List<ExternalReference> externalReferences;

    /** External workbook name to the sheets read from it, both sorted */
    Map<String, Set<String>> externalFiles;
}
