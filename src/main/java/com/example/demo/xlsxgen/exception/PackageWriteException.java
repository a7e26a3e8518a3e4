package com.example.demo.xlsxgen.exception;

/**
 * Wraps I/O failures while writing the zip container. The target file may
 * be left truncated.
 */
public class PackageWriteException extends XlsxException {
    public PackageWriteException(String message, Throwable cause) {
        super("PACKAGE_WRITE_ERROR", message, cause);
    }
}
