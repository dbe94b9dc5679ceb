package com.example.demo.formulaengine.parser.ast;

import lombok.Value;

@Value
public class BooleanNode implements FormulaNode {

    boolean value;

    @Override
    public <T> T accept(FormulaVisitor<T> visitor) {
        return visitor.visitBoolean(this);
    }
}
