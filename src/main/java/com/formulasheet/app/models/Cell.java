package com.formulasheet.app.models;

/**
 * Represents a single spreadsheet cell.
 * Stores:
 * - its normalized name (e.g. "A1")
 * - contents (text, number or formula, as entered)
 * - value (the last computed result)
 */
public class Cell {
    private final String name;
    private CellContents contents;
    private CellValue value;

    public Cell(String name, CellContents contents) {
        this.name = name;
        this.contents = contents;
        this.value = CellValue.empty();
    }

    public String getName() {
        return name;
    }

    public CellContents getContents() {
        return contents;
    }

    public void setContents(CellContents contents) {
        this.contents = contents;
    }

    public CellValue getValue() {
        return value;
    }

    public void setValue(CellValue value) {
        this.value = value;
    }

    public boolean isEmpty() {
        return contents.isEmpty();
    }
}
