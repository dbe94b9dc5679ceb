package com.example.demo.formulaengine.exception;

/**
 * Fatal failure of a compilation run. No partial result is produced.
 */
public class FormulaCompilationException extends RuntimeException {

    public FormulaCompilationException(String message) {
        super(message);
    }

    public FormulaCompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
