package com.formulasheet.app.exceptions;

/**
 * Thrown when the text handed to a Formula is syntactically invalid.
 * The message names the rule that was broken.
 */
public class FormulaFormatException extends RuntimeException {
    public FormulaFormatException(String message) {
        super(message);
    }
}
