package com.example.demo.formulaengine.parser.ast;

import lombok.Value;

/** Identifier that is neither a reference nor a function, usually a defined name */
@Value
public class NameNode implements FormulaNode {

    String name;

    @Override
    public <T> T accept(FormulaVisitor<T> visitor) {
        return visitor.visitName(this);
    }
}
