package com.example.demo.xlsxgen.exception;

import lombok.Getter;

/**
 * Table names share one workbook-wide namespace and are compared
 * case-insensitively.
 */
@Getter
public class TableNameReusedException extends XlsxException {
    private final String tableName;

    public TableNameReusedException(String tableName) {
        super("TABLE_NAME_REUSED", "Table name '" + tableName + "' has already been used");
        this.tableName = tableName;
    }
}
