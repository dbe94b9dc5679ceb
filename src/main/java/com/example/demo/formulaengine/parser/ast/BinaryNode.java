package com.example.demo.formulaengine.parser.ast;

import lombok.Value;

@Value
public class BinaryNode implements FormulaNode {

    /** Excel operator: + - * / ^ & = <> < > <= >= */
    String operator;

    FormulaNode left;

    FormulaNode right;

    @Override
    public <T> T accept(FormulaVisitor<T> visitor) {
        return visitor.visitBinary(this);
    }
}
