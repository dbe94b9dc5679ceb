package com.example.demo.formulaengine.parser;

public enum TokenType {
    EXTERNAL_RANGE,
    EXTERNAL_CELL,
    SHEET_RANGE,
    SHEET_CELL,
    TABLE_REF,
    RANGE,
    CELL,
    FUNCTION,
    NAME,
    NUMBER,
    STRING,
    BOOLEAN,
    ERROR,
    OPERATOR,
    COMMA,
    LPAREN,
    RPAREN,
    UNKNOWN;

    public boolean isReference() {
        switch (this) {
            case EXTERNAL_RANGE:
            case EXTERNAL_CELL:
            case SHEET_RANGE:
            case SHEET_CELL:
            case TABLE_REF:
            case RANGE:
            case CELL:
                return true;
            default:
                return false;
        }
    }
}
