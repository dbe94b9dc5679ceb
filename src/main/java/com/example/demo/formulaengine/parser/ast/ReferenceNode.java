package com.example.demo.formulaengine.parser.ast;

import com.example.demo.formulaengine.model.Reference;
import lombok.Value;

@Value
public class ReferenceNode implements FormulaNode {

    Reference reference;

    @Override
    public <T> T accept(FormulaVisitor<T> visitor) {
        return visitor.visitReference(this);
    }
}
