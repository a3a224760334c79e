package com.formulasheet.app.models;

import com.formulasheet.app.formula.Formula;

import java.util.Objects;

/**
 * What the user put into a cell: TEXT, a NUMBER, or a FORMULA.
 * The empty text is the contents of every cell that was never written.
 */
public final class CellContents {

    private static final CellContents EMPTY = new CellContents(ContentType.TEXT, "", 0, null);

    private final ContentType type;
    private final String text;
    private final double number;
    private final Formula formula;

    private CellContents(ContentType type, String text, double number, Formula formula) {
        this.type = type;
        this.text = text;
        this.number = number;
        this.formula = formula;
    }

    public static CellContents empty() {
        return EMPTY;
    }

    public static CellContents text(String text) {
        return text.isEmpty() ? EMPTY : new CellContents(ContentType.TEXT, text, 0, null);
    }

    public static CellContents number(double number) {
        return new CellContents(ContentType.NUMBER, null, number, null);
    }

    public static CellContents formula(Formula formula) {
        return new CellContents(ContentType.FORMULA, null, 0, Objects.requireNonNull(formula));
    }

    public ContentType getType() {
        return type;
    }

    public boolean isEmpty() {
        return type == ContentType.TEXT && text.isEmpty();
    }

    public String getText() {
        requireType(ContentType.TEXT);
        return text;
    }

    public double getNumber() {
        requireType(ContentType.NUMBER);
        return number;
    }

    public Formula getFormula() {
        requireType(ContentType.FORMULA);
        return formula;
    }

    /**
     * The canonical text used when the cell is saved:
     * the number, the raw text, or "=" followed by the formula.
     */
    public String getStringForm() {
        switch (type) {
            case NUMBER:
                return Formula.formatNumber(number);
            case FORMULA:
                return "=" + formula;
            case TEXT:
            default:
                return text;
        }
    }

    /**
     * The value a cell shows before any formula is evaluated.
     * Only TEXT and NUMBER contents have one.
     */
    CellValue toLiteralValue() {
        switch (type) {
            case NUMBER:
                return CellValue.number(number);
            case TEXT:
                return CellValue.text(text);
            case FORMULA:
            default:
                throw new IllegalStateException("Formula contents have to be evaluated");
        }
    }

    private void requireType(ContentType expected) {
        if (type != expected) {
            throw new IllegalStateException("Expected " + expected + " contents, got " + type);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellContents)) {
            return false;
        }
        CellContents other = (CellContents) o;
        return type == other.type
                && Double.compare(number, other.number) == 0
                && Objects.equals(text, other.text)
                && Objects.equals(formula, other.formula);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, number, formula);
    }

    @Override
    public String toString() {
        return getStringForm();
    }
}
