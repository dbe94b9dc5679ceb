package com.example.demo.formulaengine.parser.ast;

import lombok.Value;

/** Error literal such as #N/A */
@Value
public class ErrorNode implements FormulaNode {

    String code;

    @Override
    public <T> T accept(FormulaVisitor<T> visitor) {
        return visitor.visitError(this);
    }
}
