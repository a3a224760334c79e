package com.formulasheet.app.exceptions;

/**
 * Thrown when a spreadsheet document cannot be saved or loaded:
 * I/O failures, malformed JSON, a version mismatch, or stored
 * contents that no longer pass validation.
 */
public class SpreadsheetReadWriteException extends RuntimeException {
    public SpreadsheetReadWriteException(String message) {
        super(message);
    }

    public SpreadsheetReadWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
