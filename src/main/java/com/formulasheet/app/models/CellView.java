package com.formulasheet.app.models;

/**
 * What a client sees of one cell.
 * For example:
 * {
 *   "name": "B1",
 *   "contents": "=A1*2",
 *   "contentType": "FORMULA",
 *   "value": 10.0,
 *   "valueType": "NUMBER",
 *   "error": null
 * }
 * {@code error} carries the reason when the value is an evaluation error.
 */
public class CellView {
    private final String name;
    private final String contents;
    private final ContentType contentType;
    private final Object value;
    private final ValueType valueType;
    private final String error;

    public CellView(String name, CellContents contents, CellValue value) {
        this.name = name;
        this.contents = contents.getStringForm();
        this.contentType = contents.getType();
        this.value = value.toDisplayObject();
        this.valueType = value.getType();
        this.error = value.isError() ? value.getError().getReason() : null;
    }

    public String getName() {
        return name;
    }

    public String getContents() {
        return contents;
    }

    public ContentType getContentType() {
        return contentType;
    }

    public Object getValue() {
        return value;
    }

    public ValueType getValueType() {
        return valueType;
    }

    public String getError() {
        return error;
    }
}
