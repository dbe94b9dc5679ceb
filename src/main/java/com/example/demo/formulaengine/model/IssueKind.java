package com.example.demo.formulaengine.model;

/**
 * Kinds of non-fatal problems reported while compiling a workbook.
 */
public enum IssueKind {
    /** Formula text could not be parsed; the fragment was passed through as a literal */
    PARSE_ERROR,
    /** Function has no entry in the function table; a default target name was used */
    UNKNOWN_FUNCTION,
    /** Cell is part of a circular reference */
    CYCLE_DETECTED,
    /** Expression could not be produced; the cached value is used instead */
    TRANSLATION_FAILURE,
    /** INDIRECT/OFFSET resolved at run time; dependencies are best-effort */
    DYNAMIC_REFERENCE
}
