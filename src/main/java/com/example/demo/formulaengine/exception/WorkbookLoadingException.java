package com.example.demo.formulaengine.exception;

/**
 * Thrown when an uploaded workbook cannot be turned into a snapshot.
 *
 * Codes:
 * - WORKBOOK_UNREADABLE: the bytes are not a readable .xlsx file
 * - NO_SHEETS: the workbook holds no worksheet
 * - INVALID_OPTIONS: the uploaded options document cannot be parsed
 */
public class WorkbookLoadingException extends RuntimeException {

    private final String code;
    private final String description;

    public WorkbookLoadingException(String code, String description) {
        super(code + ": " + description);
        this.code = code;
        this.description = description;
    }

    public WorkbookLoadingException(String code, String description, Throwable cause) {
        super(code + ": " + description, cause);
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }
}
