package com.example.demo.formulaengine.model;

import lombok.Value;

/**
 * A non-fatal issue tied to one cell.
 */
@Value
public class Diagnostic {

    CellAddress cell;

    IssueKind kind;

    String message;

    public static Diagnostic of(CellAddress cell, IssueKind kind, String message) {
        return new Diagnostic(cell, kind, message);
    }

    @Override
    public String toString() {
        return kind + " at " + cell + ": " + message;
    }
}
