package com.formulasheet.app.persistence;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The on-disk shape of a spreadsheet (a ".sprd" file):
 * <pre>
 * {
 *   "Cells": { "A1": { "StringForm": "5" }, "B1": { "StringForm": "=A1*2" } },
 *   "Version": "ps6"
 * }
 * </pre>
 * Only strings are stored; formulas, values and dependencies are rebuilt on load.
 */
public class SpreadsheetDocument {

    @JsonProperty("Cells")
    private Map<String, StoredCell> cells = new LinkedHashMap<>();

    @JsonProperty("Version")
    private String version;

    // Default constructor needed for JSON (de)serialization
    public SpreadsheetDocument() {
    }

    public SpreadsheetDocument(Map<String, StoredCell> cells, String version) {
        this.cells = cells;
        this.version = version;
    }

    public Map<String, StoredCell> getCells() {
        return cells;
    }

    public void setCells(Map<String, StoredCell> cells) {
        this.cells = cells;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    /**
     * One saved cell: its canonical text.
     */
    public static class StoredCell {

        @JsonProperty("StringForm")
        private String stringForm;

        public StoredCell() {
        }

        public StoredCell(String stringForm) {
            this.stringForm = stringForm;
        }

        public String getStringForm() {
            return stringForm;
        }

        public void setStringForm(String stringForm) {
            this.stringForm = stringForm;
        }
    }
}
