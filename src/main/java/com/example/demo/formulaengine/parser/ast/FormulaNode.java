package com.example.demo.formulaengine.parser.ast;

/**
 * Node of a parsed formula.
 */
public interface FormulaNode {

    <T> T accept(FormulaVisitor<T> visitor);
}
