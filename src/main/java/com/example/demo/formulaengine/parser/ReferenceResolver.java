package com.example.demo.formulaengine.parser;

import com.example.demo.formulaengine.model.Reference;
import com.example.demo.formulaengine.model.TableDefinition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Finds every cell, range and table reference in a formula.
 *
 * Results are ordered by their position in the formula and identical input always gives
 * identical output. Unrecognised text is ignored rather than reported; the translator is
 * the component that surfaces parse problems.
 */
@Component
public class ReferenceResolver {

    public List<Reference> extractReferences(String formula, String currentSheet) {
        return extractReferences(formula, currentSheet, Collections.emptyMap());
    }

    /**
     * @param formula      formula text, with or without the leading "="
     * @param currentSheet sheet holding the formula; unqualified references resolve to it
     * @param tables       table definitions used to find the owning sheet of table references
     */
    public List<Reference> extractReferences(String formula, String currentSheet, Map<String, TableDefinition> tables) {
        List<Reference> references = new ArrayList<>();
        for (Token token : FormulaTokenizer.tokenize(formula, currentSheet, tables)) {
            if (token.getType().isReference()) {
                references.add(token.getReference());
            }
        }
        references.sort(Comparator.comparingInt(Reference::getSpanStart));
        return references;
    }
}
