package com.example.demo.formulaengine.translator;

import com.example.demo.formulaengine.model.CellAddress;
import com.example.demo.formulaengine.model.Diagnostic;
import com.example.demo.formulaengine.model.IssueKind;
import com.example.demo.formulaengine.model.Reference;
import com.example.demo.formulaengine.parser.ast.FormulaNode;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of translating one formula cell.
 */
@Value
@Builder
public class TranslatedFormula {

    CellAddress cell;

    /** Source formula including "=" */
    String formula;

    /** Parsed tree; a single raw node when the formula could not be parsed */
    FormulaNode ast;

    /** Python expression with every coordinate rendered literally */
    String expression;

    /** References the formula reads, with table references resolved to cells/ranges */
    List<Reference> references;

    List<Diagnostic> diagnostics;

    public boolean hasParseError() {
        return diagnostics.stream().anyMatch(d -> d.getKind() == IssueKind.PARSE_ERROR);
    }
}
