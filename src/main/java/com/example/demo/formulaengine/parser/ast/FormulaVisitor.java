package com.example.demo.formulaengine.parser.ast;

public interface FormulaVisitor<T> {

    T visitNumber(NumberNode node);

    T visitString(StringNode node);

    T visitBoolean(BooleanNode node);

    T visitError(ErrorNode node);

    T visitReference(ReferenceNode node);

    T visitName(NameNode node);

    T visitFunction(FunctionNode node);

    T visitBinary(BinaryNode node);

    T visitUnary(UnaryNode node);

    T visitPercent(PercentNode node);

    T visitEmpty(EmptyNode node);

    T visitRaw(RawNode node);
}
