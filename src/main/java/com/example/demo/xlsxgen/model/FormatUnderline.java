package com.example.demo.xlsxgen.model;

public enum FormatUnderline {
    NONE(null),
    SINGLE("single"),
    DOUBLE("double"),
    SINGLE_ACCOUNTING("singleAccounting"),
    DOUBLE_ACCOUNTING("doubleAccounting");

    private final String xmlName;

    FormatUnderline(String xmlName) {
        this.xmlName = xmlName;
    }

    public String xmlName() {
        return xmlName;
    }
}
