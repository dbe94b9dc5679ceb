package com.example.demo.formulaengine.parser.ast;

/** Omitted function argument, as in IF(A1,,1) */
public final class EmptyNode implements FormulaNode {

    public static final EmptyNode INSTANCE = new EmptyNode();

    private EmptyNode() {
    }

    @Override
    public <T> T accept(FormulaVisitor<T> visitor) {
        return visitor.visitEmpty(this);
    }

    @Override
    public String toString() {
        return "EmptyNode";
    }
}
