package com.example.demo.xlsxgen.exception;

/**
 * Thrown for invalid user input such as a malformed defined name, or a
 * local defined name whose sheet does not exist at save time.
 */
public class ParameterException extends XlsxException {
    public ParameterException(String message) {
        super("PARAMETER_ERROR", message);
    }
}
