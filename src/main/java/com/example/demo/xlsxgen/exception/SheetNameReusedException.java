package com.example.demo.xlsxgen.exception;

import lombok.Getter;

@Getter
public class SheetNameReusedException extends XlsxException {
    private final String sheetName;

    public SheetNameReusedException(String sheetName) {
        super("SHEET_NAME_REUSED", "Worksheet name '" + sheetName + "' has already been used");
        this.sheetName = sheetName;
    }
}
