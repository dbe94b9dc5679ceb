package com.example.demo.formulaengine.parser.ast;

import lombok.Value;

/** Unparseable fragment carried through verbatim */
@Value
public class RawNode implements FormulaNode {

    String text;

    @Override
    public <T> T accept(FormulaVisitor<T> visitor) {
        return visitor.visitRaw(this);
    }
}
