package com.formulasheet.app.exceptions;

/**
 * Thrown when a request names a sheet ID
 * that is not currently open in the service.
 */
public class SheetNotFoundException extends RuntimeException {
    public SheetNotFoundException(String message) {
        super(message);
    }
}
