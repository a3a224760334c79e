package com.formulasheet.app.exceptions;

/**
 * Error body returned for every rejected request.
 * For example:
 * {
 *   "code": "CIRCULAR_REFERENCE",
 *   "message": "Setting A1 would create a circular dependency",
 *   "path": "/sheet/1/cell/A1"
 * }
 */
public class ErrorResponse {
    private final String code;
    private final String message;
    private final String path;

    public ErrorResponse(String code, String message, String path) {
        this.code = code;
        this.message = message;
        this.path = path;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public String getPath() {
        return path;
    }
}
