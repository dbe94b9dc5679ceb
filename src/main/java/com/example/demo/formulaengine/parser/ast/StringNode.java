package com.example.demo.formulaengine.parser.ast;

import lombok.Value;

/** String literal with quote escapes resolved */
@Value
public class StringNode implements FormulaNode {

    String value;

    @Override
    public <T> T accept(FormulaVisitor<T> visitor) {
        return visitor.visitString(this);
    }
}
