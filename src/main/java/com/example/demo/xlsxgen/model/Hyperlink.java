package com.example.demo.xlsxgen.model;

import lombok.Value;

/**
 * A cell link. External targets become worksheet relationships; links
 * prefixed with {@code internal:} point at a location in the workbook.
 */
@Value
public class Hyperlink {
    public static final String INTERNAL_PREFIX = "internal:";

    int row;
    int col;
    String url;
    String tooltip;

    public boolean isInternal() {
        return url.startsWith(INTERNAL_PREFIX);
    }

    public String location() {
        return url.substring(INTERNAL_PREFIX.length());
    }
}
