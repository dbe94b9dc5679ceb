package com.example.demo.formulaengine.parser.ast;

import lombok.Value;

/** Numeric literal as written, e.g. "1.5E3" */
@Value
public class NumberNode implements FormulaNode {

    String text;

    @Override
    public <T> T accept(FormulaVisitor<T> visitor) {
        return visitor.visitNumber(this);
    }
}
