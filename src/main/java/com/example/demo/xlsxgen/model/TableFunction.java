package com.example.demo.xlsxgen.model;

/**
 * Aggregate shown in a table's total row. Each function is written as a
 * {@code SUBTOTAL} formula so filtered-out rows are ignored.
 */
public enum TableFunction {
    NONE("", 0),
    AVERAGE("average", 101),
    COUNT_NUMBERS("countNums", 102),
    COUNT("count", 103),
    MAX("max", 104),
    MIN("min", 105),
    STD_DEV("stdDev", 107),
    SUM("sum", 109),
    VAR("var", 110);

    private final String xmlName;
    private final int subtotalNumber;

    TableFunction(String xmlName, int subtotalNumber) {
        this.xmlName = xmlName;
        this.subtotalNumber = subtotalNumber;
    }

    public String xmlName() {
        return xmlName;
    }

    public int subtotalNumber() {
        return subtotalNumber;
    }
}
