package com.formulasheet.app.exceptions;

/**
 * Thrown when a cell name is not a legal variable
 * or is rejected by the document's validity predicate.
 * For example, "Cell name 1A is not valid".
 */
public class InvalidNameException extends RuntimeException {
    public InvalidNameException(String message) {
        super(message);
    }
}
