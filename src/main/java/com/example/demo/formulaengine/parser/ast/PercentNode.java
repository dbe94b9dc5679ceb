package com.example.demo.formulaengine.parser.ast;

import lombok.Value;

/** Postfix %: operand divided by 100 */
@Value
public class PercentNode implements FormulaNode {

    FormulaNode operand;

    @Override
    public <T> T accept(FormulaVisitor<T> visitor) {
        return visitor.visitPercent(this);
    }
}
