package com.example.demo.xlsxgen.exception;

import lombok.Getter;

/**
 * Base type for every failure raised while building or saving a workbook.
 * The code is a short stable identifier that callers can switch on.
 */
@Getter
public class XlsxException extends RuntimeException {
    private final String code;

    public XlsxException(String code, String message) {
        super(message);
        this.code = code;
    }

    public XlsxException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
