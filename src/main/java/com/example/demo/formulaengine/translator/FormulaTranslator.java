package com.example.demo.formulaengine.translator;

import com.example.demo.formulaengine.exception.FormulaParseException;
import com.example.demo.formulaengine.model.CellAddress;
import com.example.demo.formulaengine.model.Diagnostic;
import com.example.demo.formulaengine.model.IssueKind;
import com.example.demo.formulaengine.model.TableDefinition;
import com.example.demo.formulaengine.model.WorkbookSnapshot;
import com.example.demo.formulaengine.parser.FormulaParser;
import com.example.demo.formulaengine.parser.FormulaTokenizer;
import com.example.demo.formulaengine.parser.Token;
import com.example.demo.formulaengine.parser.ast.FormulaNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Translates Excel formulas into Python expressions.
 *
 * Each call tokenizes and parses the formula once, then renders the tree with literal
 * coordinates. A formula that does not parse is carried through as a string literal with a
 * PARSE_ERROR diagnostic; translation itself never fails.
 */
@Slf4j
@Component
public class FormulaTranslator {

    /**
     * Translate a formula evaluated in an unspecified cell of the given sheet. Position
     * dependent constructs (ROW(), this-row table references) resolve against A1.
     */
    public TranslatedFormula translate(String formula, String currentSheet) {
        return translate(formula, CellAddress.of(currentSheet, 1, 1), null);
    }

    /**
     * @param formula  formula text with or without "="
     * @param cell     cell holding the formula
     * @param workbook source of tables and defined names, may be null
     */
    public TranslatedFormula translate(String formula, CellAddress cell, WorkbookSnapshot workbook) {
        Map<String, TableDefinition> tables = workbook == null ? Collections.emptyMap() : workbook.getTables();
        List<Token> tokens = FormulaTokenizer.tokenize(formula, cell.getSheet(), tables);
        List<FormulaParseException> errors = new ArrayList<>();
        FormulaNode ast = FormulaParser.parseLenient(tokens, FormulaTokenizer.stripEquals(formula), errors);

        List<Diagnostic> diagnostics = new ArrayList<>();
        for (FormulaParseException e : errors) {
            diagnostics.add(Diagnostic.of(cell, IssueKind.PARSE_ERROR,
                    e.getMessage() + " at offset " + e.getOffset() + " in " + formula));
        }
        ExpressionRenderer renderer = new ExpressionRenderer(new AbsoluteReferenceStyle(cell), workbook);
        String expression = renderer.render(ast);
        diagnostics.addAll(renderer.getDiagnostics());
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.getKind() == IssueKind.UNKNOWN_FUNCTION) {
                log.warn("{}", diagnostic);
            } else {
                log.debug("{}", diagnostic);
            }
        }
        return TranslatedFormula.builder()
                .cell(cell)
                .formula(formula.startsWith("=") ? formula : "=" + formula)
                .ast(ast)
                .expression(expression)
                .references(Collections.unmodifiableList(renderer.getConsumed()))
                .diagnostics(Collections.unmodifiableList(diagnostics))
                .build();
    }

    /**
     * Render an already parsed formula with a different coordinate style, e.g. once per
     * vectorized group with loop-relative coordinates.
     */
    public String render(FormulaNode ast, ReferenceStyle style, WorkbookSnapshot workbook) {
        return new ExpressionRenderer(style, workbook).render(ast);
    }
}
