package com.formulasheet.app.exceptions;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Turns the spreadsheet exceptions thrown below the controllers into
 * {@link ErrorResponse} JSON with a 4xx status. Evaluation errors never get here:
 * they are stored as cell values.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(CircularReferenceException.class)
    public ResponseEntity<ErrorResponse> handleCircularRef(CircularReferenceException ex, HttpServletRequest request) {
        return respond("CIRCULAR_REFERENCE", ex, request, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(FormulaFormatException.class)
    public ResponseEntity<ErrorResponse> handleFormulaFormat(FormulaFormatException ex, HttpServletRequest request) {
        return respond("FORMULA_FORMAT", ex, request, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(InvalidNameException.class)
    public ResponseEntity<ErrorResponse> handleInvalidName(InvalidNameException ex, HttpServletRequest request) {
        return respond("INVALID_NAME", ex, request, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(SpreadsheetReadWriteException.class)
    public ResponseEntity<ErrorResponse> handleReadWrite(SpreadsheetReadWriteException ex, HttpServletRequest request) {
        return respond("READ_WRITE", ex, request, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(SheetNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSheetNotFound(SheetNotFoundException ex, HttpServletRequest request) {
        return respond("SHEET_NOT_FOUND", ex, request, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex, HttpServletRequest request) {
        log.error("Unhandled error on {}", request.getRequestURI(), ex);
        return respond("SERVER_ERROR", ex, request, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<ErrorResponse> respond(String code, RuntimeException ex,
                                                  HttpServletRequest request, HttpStatus status) {
        ErrorResponse error = new ErrorResponse(code, ex.getMessage(), request.getRequestURI());
        return new ResponseEntity<>(error, status);
    }
}
