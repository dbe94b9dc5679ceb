package com.example.demo.formulaengine.parser;

import com.example.demo.formulaengine.model.Reference;
import lombok.Value;

/**
 * One lexical token of a formula. Offsets are relative to the formula without its leading "=".
 */
@Value
public class Token {

    TokenType type;

    /** Source text of the token */
    String text;

    int start;

    int end;

    /** Parsed reference for reference tokens, null otherwise */
    Reference reference;

    /** Unescaped value for STRING tokens, text otherwise */
    String value;

    public static Token of(TokenType type, String text, int start, int end) {
        return new Token(type, text, start, end, null, text);
    }

    public static Token string(String text, String value, int start, int end) {
        return new Token(TokenType.STRING, text, start, end, null, value);
    }

    public static Token reference(TokenType type, String text, int start, int end, Reference reference) {
        return new Token(type, text, start, end, reference, text);
    }

    public boolean isOperator(String op) {
        return type == TokenType.OPERATOR && text.equals(op);
    }
}
