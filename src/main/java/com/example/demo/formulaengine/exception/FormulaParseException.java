package com.example.demo.formulaengine.exception;

/**
 * Syntax error in a formula. Raised inside the parser and turned into a diagnostic by the
 * translator, so it never escapes a compilation run.
 */
public class FormulaParseException extends RuntimeException {

    private final int offset;

    public FormulaParseException(String message, int offset) {
        super(message);
        this.offset = offset;
    }

    /** Offset in the formula (without "=") where parsing stopped */
    public int getOffset() {
        return offset;
    }
}
