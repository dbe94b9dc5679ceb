package com.example.demo.formulaengine.parser.ast;

import lombok.Value;

/** Prefix + or - */
@Value
public class UnaryNode implements FormulaNode {

    String operator;

    FormulaNode operand;

    @Override
    public <T> T accept(FormulaVisitor<T> visitor) {
        return visitor.visitUnary(this);
    }
}
