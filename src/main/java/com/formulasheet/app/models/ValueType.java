package com.formulasheet.app.models;

/**
 * Enumerates what a cell can show as its value:
 * TEXT, a NUMBER, or an evaluation ERROR.
 */
public enum ValueType {
    TEXT,
    NUMBER,
    ERROR
}
