package com.example.demo.formulaengine.parser.ast;

import lombok.Value;

import java.util.List;

/** Function call; arguments left out between commas are {@link EmptyNode}s */
@Value
public class FunctionNode implements FormulaNode {

    /** Name as written in the formula */
    String name;

    List<FormulaNode> arguments;

    @Override
    public <T> T accept(FormulaVisitor<T> visitor) {
        return visitor.visitFunction(this);
    }
}
