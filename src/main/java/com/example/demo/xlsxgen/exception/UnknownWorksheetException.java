package com.example.demo.xlsxgen.exception;

/**
 * Thrown when a worksheet is looked up by a name or index that doesn't
 * exist in the workbook.
 */
public class UnknownWorksheetException extends XlsxException {
    public UnknownWorksheetException(String message) {
        super("UNKNOWN_WORKSHEET", message);
    }
}
