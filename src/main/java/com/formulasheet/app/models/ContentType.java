package com.formulasheet.app.models;

/**
 * Enumerates what a cell can hold as its contents:
 * plain TEXT, a NUMBER, or a FORMULA.
 */
public enum ContentType {
    TEXT,
    NUMBER,
    FORMULA
}
