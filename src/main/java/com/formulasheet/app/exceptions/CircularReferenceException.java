package com.formulasheet.app.exceptions;

/**
 * Thrown when a new formula would make a cell depend on itself,
 * either directly ("=A1+1" stored in A1) or through a chain of other cells.
 * The spreadsheet is left exactly as it was before the attempted change.
 */
public class CircularReferenceException extends RuntimeException {
    public CircularReferenceException(String message) {
        super(message);
    }
}
