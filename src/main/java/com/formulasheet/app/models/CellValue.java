package com.formulasheet.app.models;

import com.formulasheet.app.formula.Formula;
import com.formulasheet.app.formula.FormulaError;

import java.util.Objects;

/**
 * The displayed result of a cell: TEXT, NUMBER or ERROR.
 * Text and number cells mirror their contents; formula cells hold
 * whatever their last evaluation produced.
 */
public final class CellValue {

    private static final CellValue EMPTY = new CellValue(ValueType.TEXT, "", 0, null);

    private final ValueType type;
    private final String text;
    private final double number;
    private final FormulaError error;

    private CellValue(ValueType type, String text, double number, FormulaError error) {
        this.type = type;
        this.text = text;
        this.number = number;
        this.error = error;
    }

    public static CellValue empty() {
        return EMPTY;
    }

    public static CellValue text(String text) {
        return text.isEmpty() ? EMPTY : new CellValue(ValueType.TEXT, text, 0, null);
    }

    public static CellValue number(double number) {
        return new CellValue(ValueType.NUMBER, null, number, null);
    }

    public static CellValue error(FormulaError error) {
        return new CellValue(ValueType.ERROR, null, 0, error);
    }

    public static CellValue error(String reason) {
        return error(new FormulaError(reason));
    }

    public ValueType getType() {
        return type;
    }

    public boolean isNumber() {
        return type == ValueType.NUMBER;
    }

    public boolean isError() {
        return type == ValueType.ERROR;
    }

    public String getText() {
        requireType(ValueType.TEXT);
        return text;
    }

    public double getNumber() {
        requireType(ValueType.NUMBER);
        return number;
    }

    public FormulaError getError() {
        requireType(ValueType.ERROR);
        return error;
    }

    /**
     * What a listing shows for this value: the number, the text, or "#ERROR".
     */
    public Object toDisplayObject() {
        switch (type) {
            case NUMBER:
                return number;
            case ERROR:
                return "#ERROR";
            case TEXT:
            default:
                return text;
        }
    }

    private void requireType(ValueType expected) {
        if (type != expected) {
            throw new IllegalStateException("Expected " + expected + " value, got " + type);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellValue)) {
            return false;
        }
        CellValue other = (CellValue) o;
        return type == other.type
                && Double.compare(number, other.number) == 0
                && Objects.equals(text, other.text)
                && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, number, error);
    }

    @Override
    public String toString() {
        switch (type) {
            case NUMBER:
                return Formula.formatNumber(number);
            case ERROR:
                return error.toString();
            case TEXT:
            default:
                return text;
        }
    }
}
